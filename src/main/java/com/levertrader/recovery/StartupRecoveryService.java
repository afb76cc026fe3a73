package com.levertrader.recovery;

import com.levertrader.config.TradingProperties;
import com.levertrader.domain.enums.PositionStatus;
import com.levertrader.domain.model.Account;
import com.levertrader.domain.model.Position;
import com.levertrader.exception.PersistenceException;
import com.levertrader.execution.TradeExecutor;
import com.levertrader.persistence.AccountDocument;
import com.levertrader.persistence.DocumentMapper;
import com.levertrader.persistence.PersistenceGateway;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Restores engine state from the document store once the application is ready.
 *
 * <ol>
 *   <li>Load the configured account, or create it at the initial balance if none is stored</li>
 *   <li>Load every OPEN position</li>
 *   <li>Hand both to {@link TradeExecutor#restore}, which rebuilds the symbol index and
 *       reconciles margin in use</li>
 * </ol>
 *
 * <p>If the store cannot be read the engine keeps its fresh in-memory account and the failure
 * is logged; trading is not blocked.
 */
@Service
public class StartupRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(StartupRecoveryService.class);

    private final PersistenceGateway persistenceGateway;
    private final DocumentMapper documentMapper;
    private final TradeExecutor tradeExecutor;
    private final TradingProperties tradingProperties;
    private final Clock clock;

    public StartupRecoveryService(
            PersistenceGateway persistenceGateway,
            DocumentMapper documentMapper,
            TradeExecutor tradeExecutor,
            TradingProperties tradingProperties,
            Clock clock) {
        this.persistenceGateway = persistenceGateway;
        this.documentMapper = documentMapper;
        this.tradeExecutor = tradeExecutor;
        this.tradingProperties = tradingProperties;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Order(10)
    public void onApplicationReady() {
        recover();
    }

    public RecoveryResult recover() {
        log.info("Restoring account {} from store...", tradingProperties.getAccountId());

        RecoveryResult recoveryResult =
                RecoveryResult.builder().startedAt(clock.millis()).build();

        try {
            Account account = loadOrCreateAccount(recoveryResult);
            List<Position> positions =
                    documentMapper.toDomainList(persistenceGateway.loadPositions(PositionStatus.OPEN));

            tradeExecutor.restore(account, positions);
            recoveryResult.setPositionsRestored(positions.size());
            recoveryResult.setSuccess(true);
        } catch (PersistenceException e) {
            recoveryResult.setSuccess(false);
            recoveryResult.setError(e.getMessage());
            log.error("State recovery failed, continuing with a fresh account: {}", e.getMessage(), e);
        }

        recoveryResult.setDurationMs(clock.millis() - recoveryResult.getStartedAt());
        log.info(
                "Startup recovery {}: duration={}ms, accountRestored={}, positionsRestored={}",
                recoveryResult.isSuccess() ? "completed" : "failed",
                recoveryResult.getDurationMs(),
                recoveryResult.isAccountRestored(),
                recoveryResult.getPositionsRestored());
        return recoveryResult;
    }

    private Account loadOrCreateAccount(RecoveryResult recoveryResult) {
        Optional<AccountDocument> stored = persistenceGateway.loadAccount(tradingProperties.getAccountId());
        if (stored.isPresent()) {
            recoveryResult.setAccountRestored(true);
            return documentMapper.toDomain(stored.get());
        }

        log.info(
                "No stored account {}, creating one with balance {}",
                tradingProperties.getAccountId(),
                tradingProperties.getInitialBalance().toPlainString());
        Account account = Account.open(
                tradingProperties.getAccountId(),
                tradingProperties.getInitialBalance(),
                tradingProperties.getDailyTradesLimit(),
                tradingProperties.getMaxLeverage(),
                LocalDateTime.now(clock));
        if (!persistenceGateway.saveAccount(documentMapper.toDocument(account))) {
            log.warn("New account {} not persisted", account.getId());
        }
        return account;
    }
}
