package com.levertrader.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.levertrader.config.RedisConfig;
import com.levertrader.domain.enums.PositionStatus;
import com.levertrader.exception.PersistenceException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Repository;

/**
 * {@link PersistenceGateway} over Redis.
 *
 * <p>Each document is a JSON value under its own key, and the ids of each kind are kept in a
 * set so that {@link #loadPositions} can fetch them with one {@code MGET}. Documents never
 * expire: closed positions are trade history.
 */
@Repository
public class RedisPersistenceGateway implements PersistenceGateway {

    private static final Logger log = LoggerFactory.getLogger(RedisPersistenceGateway.class);

    private final RedisTemplate<String, Object> redisTemplate;
    private final ObjectMapper documentObjectMapper;
    private final Clock clock;

    public RedisPersistenceGateway(
            RedisTemplate<String, Object> redisTemplate, ObjectMapper documentObjectMapper, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.documentObjectMapper = documentObjectMapper;
        this.clock = clock;
    }

    @Override
    public boolean saveAccount(AccountDocument document) {
        document.setLastUpdated(LocalDateTime.now(clock));
        return write(
                RedisConfig.KEY_PREFIX_ACCOUNT, RedisConfig.KEY_SET_ACCOUNTS_ALL, document.getId(), document);
    }

    @Override
    public Optional<AccountDocument> loadAccount(String accountId) {
        try {
            Object value = redisTemplate.opsForValue().get(RedisConfig.KEY_PREFIX_ACCOUNT + accountId);
            return Optional.ofNullable(value).map(v -> convert(v, AccountDocument.class));
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to load account " + accountId, e);
        }
    }

    @Override
    public boolean savePosition(PositionDocument document) {
        document.setLastUpdated(LocalDateTime.now(clock));
        return write(
                RedisConfig.KEY_PREFIX_POSITION, RedisConfig.KEY_SET_POSITIONS_ALL, document.getId(), document);
    }

    @Override
    public List<PositionDocument> loadPositions(PositionStatus statusFilter) {
        try {
            Set<Object> ids = redisTemplate.opsForSet().members(RedisConfig.KEY_SET_POSITIONS_ALL);
            if (ids == null || ids.isEmpty()) {
                return Collections.emptyList();
            }

            List<String> keys =
                    ids.stream().map(id -> RedisConfig.KEY_PREFIX_POSITION + id).toList();
            List<Object> values = redisTemplate.opsForValue().multiGet(keys);
            if (values == null) {
                return Collections.emptyList();
            }

            List<PositionDocument> documents = new ArrayList<>();
            for (Object value : values) {
                if (value == null) {
                    continue;
                }
                PositionDocument document = convert(value, PositionDocument.class);
                if (statusFilter == null || statusFilter == document.getStatus()) {
                    documents.add(document);
                }
            }
            return documents;
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to load positions", e);
        }
    }

    @Override
    public boolean saveOrder(OrderDocument document) {
        document.setLastUpdated(LocalDateTime.now(clock));
        return write(RedisConfig.KEY_PREFIX_ORDER, RedisConfig.KEY_SET_ORDERS_ALL, document.getId(), document);
    }

    @Override
    public boolean deleteAll() {
        try {
            deleteKind(RedisConfig.KEY_PREFIX_ACCOUNT, RedisConfig.KEY_SET_ACCOUNTS_ALL);
            deleteKind(RedisConfig.KEY_PREFIX_POSITION, RedisConfig.KEY_SET_POSITIONS_ALL);
            deleteKind(RedisConfig.KEY_PREFIX_ORDER, RedisConfig.KEY_SET_ORDERS_ALL);
            log.warn("All stored documents deleted");
            return true;
        } catch (DataAccessException e) {
            log.error("Failed to delete stored documents: {}", e.getMessage(), e);
            return false;
        }
    }

    // ---- internals ----

    private boolean write(String keyPrefix, String indexKey, String id, Object document) {
        try {
            redisTemplate.opsForValue().set(keyPrefix + id, document);
            redisTemplate.opsForSet().add(indexKey, id);
            return true;
        } catch (DataAccessException e) {
            log.warn("Failed to save {}{}: {}", keyPrefix, id, e.getMessage());
            return false;
        }
    }

    private void deleteKind(String keyPrefix, String indexKey) {
        Set<Object> ids = redisTemplate.opsForSet().members(indexKey);
        if (ids != null && !ids.isEmpty()) {
            List<String> keys = ids.stream()
                    .filter(Objects::nonNull)
                    .map(id -> keyPrefix + id)
                    .toList();
            redisTemplate.delete(keys);
        }
        redisTemplate.delete(indexKey);
    }

    /** Values come back as maps since no type hints are stored. */
    private <T> T convert(Object value, Class<T> type) {
        if (type.isInstance(value)) {
            return type.cast(value);
        }
        try {
            return documentObjectMapper.convertValue(value, type);
        } catch (IllegalArgumentException e) {
            throw new PersistenceException("Malformed " + type.getSimpleName() + " in store", e);
        }
    }
}
