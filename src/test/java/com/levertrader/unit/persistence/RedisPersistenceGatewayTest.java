package com.levertrader.unit.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.levertrader.config.RedisConfig;
import com.levertrader.domain.enums.PositionSide;
import com.levertrader.domain.enums.PositionStatus;
import com.levertrader.exception.PersistenceException;
import com.levertrader.persistence.AccountDocument;
import com.levertrader.persistence.PositionDocument;
import com.levertrader.persistence.RedisPersistenceGateway;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.SetOperations;
import org.springframework.data.redis.core.ValueOperations;

/**
 * Unit tests for RedisPersistenceGateway covering the key schema, write stamping, untyped
 * reads converted back to documents, status filtering, and the failure contract (writes
 * return false, reads throw).
 */
class RedisPersistenceGatewayTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private RedisTemplate<String, Object> redisTemplate;
    private ValueOperations<String, Object> valueOperations;
    private SetOperations<String, Object> setOperations;
    private ObjectMapper documentObjectMapper;
    private RedisPersistenceGateway gateway;

    @SuppressWarnings("unchecked")
    @BeforeEach
    void setUp() {
        redisTemplate = mock(RedisTemplate.class);
        valueOperations = mock(ValueOperations.class);
        setOperations = mock(SetOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(redisTemplate.opsForSet()).thenReturn(setOperations);

        documentObjectMapper = new RedisConfig().documentObjectMapper();
        gateway = new RedisPersistenceGateway(redisTemplate, documentObjectMapper, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private PositionDocument positionDocument(String id, PositionStatus status) {
        return PositionDocument.builder()
                .id(id)
                .symbol("BTCUSD")
                .side(PositionSide.LONG)
                .status(status)
                .entryPrice(new BigDecimal("50000.12345678"))
                .quantity(new BigDecimal("0.01"))
                .leverage(new BigDecimal("10"))
                .marginUsed(new BigDecimal("50"))
                .entryTime(LocalDateTime.of(2026, 3, 2, 9, 30))
                .build();
    }

    /** What an untyped JSON read returns: a map with snake_case keys. */
    @SuppressWarnings("unchecked")
    private Map<String, Object> asStoredValue(Object document) {
        return documentObjectMapper.convertValue(document, LinkedHashMap.class);
    }

    // ==============================
    // WRITES
    // ==============================

    @Nested
    @DisplayName("Writes")
    class Writes {

        @Test
        @DisplayName("savePosition stores the document under its key and indexes its id")
        void savePosition() {
            PositionDocument document = positionDocument("pos-1", PositionStatus.OPEN);

            boolean saved = gateway.savePosition(document);

            assertThat(saved).isTrue();
            assertThat(document.getLastUpdated()).isEqualTo(LocalDateTime.of(2026, 3, 2, 10, 0));
            verify(valueOperations).set("levertrader:position:pos-1", document);
            verify(setOperations).add("levertrader:positions:all", "pos-1");
        }

        @Test
        @DisplayName("saveAccount uses the account key schema")
        void saveAccount() {
            AccountDocument document = AccountDocument.builder()
                    .id("default")
                    .currentBalance(new BigDecimal("10000"))
                    .build();

            assertThat(gateway.saveAccount(document)).isTrue();

            verify(valueOperations).set("levertrader:account:default", document);
            verify(setOperations).add("levertrader:accounts:all", "default");
        }

        @Test
        @DisplayName("A store failure on write returns false instead of throwing")
        void writeFailure() {
            doThrow(new RedisConnectionFailureException("connection refused"))
                    .when(valueOperations)
                    .set(anyString(), any());

            boolean saved = gateway.savePosition(positionDocument("pos-1", PositionStatus.OPEN));

            assertThat(saved).isFalse();
            verify(setOperations, never()).add(anyString(), any());
        }
    }

    // ==============================
    // READS
    // ==============================

    @Nested
    @DisplayName("Reads")
    class Reads {

        @Test
        @DisplayName("loadAccount converts the untyped value back to a document")
        void loadAccount() {
            AccountDocument stored = AccountDocument.builder()
                    .id("default")
                    .currentBalance(new BigDecimal("9949.95"))
                    .dailyTradesCount(3)
                    .build();
            when(valueOperations.get("levertrader:account:default")).thenReturn(asStoredValue(stored));

            Optional<AccountDocument> loaded = gateway.loadAccount("default");

            assertThat(loaded).isPresent();
            assertThat(loaded.get().getCurrentBalance()).isEqualByComparingTo("9949.95");
            assertThat(loaded.get().getDailyTradesCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("loadAccount is empty when nothing is stored")
        void loadAccount_missing() {
            when(valueOperations.get(anyString())).thenReturn(null);

            assertThat(gateway.loadAccount("default")).isEmpty();
        }

        @Test
        @DisplayName("loadPositions fetches indexed ids and filters by status")
        void loadPositions_filtered() {
            Set<Object> ids = new LinkedHashSet<>(List.of("pos-1", "pos-2"));
            when(setOperations.members("levertrader:positions:all")).thenReturn(ids);
            when(valueOperations.multiGet(anyList())).thenReturn(Arrays.asList(
                    asStoredValue(positionDocument("pos-1", PositionStatus.OPEN)),
                    asStoredValue(positionDocument("pos-2", PositionStatus.CLOSED)),
                    null));

            List<PositionDocument> open = gateway.loadPositions(PositionStatus.OPEN);

            assertThat(open).hasSize(1);
            assertThat(open.get(0).getId()).isEqualTo("pos-1");
            assertThat(open.get(0).getEntryPrice()).isEqualByComparingTo("50000.12345678");
            assertThat(open.get(0).getEntryTime()).isEqualTo(LocalDateTime.of(2026, 3, 2, 9, 30));
            verify(valueOperations)
                    .multiGet(eq(List.of("levertrader:position:pos-1", "levertrader:position:pos-2")));
        }

        @Test
        @DisplayName("loadPositions with no filter returns every status")
        void loadPositions_all() {
            when(setOperations.members(anyString())).thenReturn(new LinkedHashSet<>(List.of("pos-1", "pos-2")));
            when(valueOperations.multiGet(anyList())).thenReturn(List.of(
                    asStoredValue(positionDocument("pos-1", PositionStatus.OPEN)),
                    asStoredValue(positionDocument("pos-2", PositionStatus.CLOSED))));

            assertThat(gateway.loadPositions(null)).hasSize(2);
        }

        @Test
        @DisplayName("An empty index returns no positions without a multi-get")
        void loadPositions_empty() {
            when(setOperations.members(anyString())).thenReturn(Set.of());

            assertThat(gateway.loadPositions(null)).isEmpty();
            verify(valueOperations, never()).multiGet(anyList());
        }

        @Test
        @DisplayName("A store failure on read throws PersistenceException")
        void readFailure() {
            when(setOperations.members(anyString())).thenThrow(new RedisConnectionFailureException("timeout"));

            assertThatThrownBy(() -> gateway.loadPositions(PositionStatus.OPEN))
                    .isInstanceOf(PersistenceException.class)
                    .hasMessage("Failed to load positions");
        }
    }

    // ==============================
    // WIPE
    // ==============================

    @Nested
    @DisplayName("Delete All")
    class DeleteAll {

        @Test
        @DisplayName("deleteAll removes every indexed document and the indexes")
        void deleteAll() {
            when(setOperations.members("levertrader:positions:all")).thenReturn(Set.of("pos-1"));
            when(setOperations.members("levertrader:accounts:all")).thenReturn(Set.of("default"));
            when(setOperations.members("levertrader:orders:all")).thenReturn(null);

            assertThat(gateway.deleteAll()).isTrue();

            verify(redisTemplate).delete(List.of("levertrader:position:pos-1"));
            verify(redisTemplate).delete(List.of("levertrader:account:default"));
            verify(redisTemplate).delete("levertrader:positions:all");
            verify(redisTemplate).delete("levertrader:accounts:all");
            verify(redisTemplate).delete("levertrader:orders:all");
        }

        @Test
        @DisplayName("deleteAll reports failure when the store is unreachable")
        void deleteAll_failure() {
            when(setOperations.members(anyString())).thenThrow(new RedisConnectionFailureException("down"));

            assertThat(gateway.deleteAll()).isFalse();
        }
    }
}
