package com.levertrader.unit.execution;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.levertrader.config.TradingProperties;
import com.levertrader.domain.enums.OrderSide;
import com.levertrader.domain.enums.PositionSide;
import com.levertrader.domain.enums.PositionStatus;
import com.levertrader.domain.model.Account;
import com.levertrader.domain.model.Position;
import com.levertrader.domain.model.TradeRequest;
import com.levertrader.exception.ErrorCode;
import com.levertrader.exception.TradeRejectedException;
import com.levertrader.execution.TradeValidator;
import com.levertrader.ledger.AccountLedger;
import com.levertrader.position.PositionStore;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TradeValidatorTest {

    private static final BigDecimal LEVERAGE = new BigDecimal("10");

    private TradingProperties tradingProperties;
    private TradeValidator tradeValidator;
    private AccountLedger accountLedger;
    private PositionStore positionStore;

    @BeforeEach
    void setUp() {
        tradingProperties = new TradingProperties();
        tradeValidator = new TradeValidator(tradingProperties);
        accountLedger = new AccountLedger(Account.open(
                "acc", new BigDecimal("10000"), 2, new BigDecimal("50"), LocalDateTime.of(2026, 3, 2, 9, 0)));
        positionStore = new PositionStore();
    }

    @Test
    @DisplayName("A well-formed request passes")
    void validRequest_passes() {
        assertThatCode(() -> tradeValidator.validate(request(), LEVERAGE, accountLedger, positionStore))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Missing side is rejected first")
    void missingSide_rejected() {
        TradeRequest request = request();
        request.setSide(null);
        request.setPrice(BigDecimal.ZERO);

        assertThatThrownBy(() -> tradeValidator.validate(request, LEVERAGE, accountLedger, positionStore))
                .isInstanceOf(TradeRejectedException.class)
                .hasMessageContaining("side must be BUY or SELL");
    }

    @Test
    @DisplayName("Non-positive price is rejected")
    void zeroPrice_rejected() {
        TradeRequest request = request();
        request.setPrice(BigDecimal.ZERO);

        assertThatThrownBy(() -> tradeValidator.validate(request, LEVERAGE, accountLedger, positionStore))
                .hasMessageContaining("Invalid price");
    }

    @Test
    @DisplayName("Non-positive quantity is rejected")
    void negativeQuantity_rejected() {
        TradeRequest request = request();
        request.setQuantity(new BigDecimal("-1"));

        assertThatThrownBy(() -> tradeValidator.validate(request, LEVERAGE, accountLedger, positionStore))
                .hasMessageContaining("Invalid quantity");
    }

    @Test
    @DisplayName("Leverage above the account maximum is rejected")
    void leverageAboveMax_rejected() {
        assertThatThrownBy(() -> tradeValidator.validate(request(), new BigDecimal("75"), accountLedger, positionStore))
                .hasMessageContaining("Invalid leverage: 75 (max 50)");
    }

    @Test
    @DisplayName("Confidence below the minimum is rejected")
    void lowConfidence_rejected() {
        TradeRequest request = request();
        request.setConfidence(40);

        assertThatThrownBy(() -> tradeValidator.validate(request, LEVERAGE, accountLedger, positionStore))
                .hasMessage("Confidence too low: 40 < 50");
    }

    @Test
    @DisplayName("Daily limit reached is rejected with its own error code")
    void dailyLimit_rejected() {
        accountLedger.recordTrade(LocalDate.of(2026, 3, 2));
        accountLedger.recordTrade(LocalDate.of(2026, 3, 2));

        assertThatThrownBy(() -> tradeValidator.validate(request(), LEVERAGE, accountLedger, positionStore))
                .isInstanceOf(TradeRejectedException.class)
                .extracting(e -> ((TradeRejectedException) e).getErrorCode())
                .isEqualTo(ErrorCode.DAILY_LIMIT_REACHED);
    }

    @Test
    @DisplayName("Existing OPEN position for the symbol is rejected as a duplicate")
    void duplicateSymbol_rejected() {
        positionStore.add(Position.builder()
                .id("existing")
                .symbol("BTCUSD")
                .side(PositionSide.LONG)
                .status(PositionStatus.OPEN)
                .build());

        assertThatThrownBy(() -> tradeValidator.validate(request(), LEVERAGE, accountLedger, positionStore))
                .hasMessage("Position already open for BTCUSD")
                .extracting(e -> ((TradeRejectedException) e).getErrorCode())
                .isEqualTo(ErrorCode.DUPLICATE_POSITION);
    }

    private static TradeRequest request() {
        return TradeRequest.builder()
                .symbol("BTCUSD")
                .side(OrderSide.BUY)
                .price(new BigDecimal("50000"))
                .quantity(new BigDecimal("0.01"))
                .confidence(80)
                .build();
    }
}
