package com.levertrader.execution;

import com.levertrader.config.TradingProperties;
import com.levertrader.domain.enums.ExecutionStatus;
import com.levertrader.domain.enums.PositionSide;
import com.levertrader.domain.enums.PositionStatus;
import com.levertrader.domain.model.Account;
import com.levertrader.domain.model.Position;
import com.levertrader.domain.model.TradeRequest;
import com.levertrader.domain.model.TradeResult;
import com.levertrader.domain.model.TradingSummary;
import com.levertrader.event.EventPublisherHelper;
import com.levertrader.exception.BaseException;
import com.levertrader.exception.ErrorCode;
import com.levertrader.exception.PositionNotFoundException;
import com.levertrader.exception.TradeRejectedException;
import com.levertrader.ledger.AccountLedger;
import com.levertrader.persistence.DocumentMapper;
import com.levertrader.persistence.PersistenceGateway;
import com.levertrader.pnl.PnLCalculator;
import com.levertrader.position.PositionStore;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Single writer of the account and its positions.
 *
 * <p>Every operation that reads or mutates monetary or position state runs under one
 * account-scoped {@link ReentrantLock}. That makes compound sequences such as "validate, reserve
 * margin, create position" atomic, so two concurrent requests cannot double-spend the balance or
 * open two positions for one symbol. The lock is reentrant because {@link #pyramid} and
 * {@link #executeTrailing} delegate to {@link #addToPosition} and {@link #partialClose}.
 *
 * <p>Public operations never throw: validation and admission failures surface as
 * {@link TradeResult#failure} with the reason string. Readers outside the executor only ever see
 * {@link Position#snapshot()} copies.
 *
 * <p>Persistence writes happen after the in-memory mutation. A failed write is logged and the
 * in-memory state stays authoritative; nothing is rolled back.
 */
@Service
public class TradeExecutor {

    private static final Logger log = LoggerFactory.getLogger(TradeExecutor.class);

    private static final int SCALE = PnLCalculator.PRICE_SCALE;

    private final TradingProperties tradingProperties;
    private final TradeValidator tradeValidator;
    private final PnLCalculator pnLCalculator;
    private final PersistenceGateway persistenceGateway;
    private final DocumentMapper documentMapper;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    private final ReentrantLock accountLock = new ReentrantLock();
    private final PositionStore positionStore = new PositionStore();
    private final Map<String, BigDecimal> lastPrices = new ConcurrentHashMap<>();

    /** Guarded by {@link #accountLock}. Replaced on restore and data wipe. */
    private AccountLedger accountLedger;

    public TradeExecutor(
            TradingProperties tradingProperties,
            TradeValidator tradeValidator,
            PnLCalculator pnLCalculator,
            PersistenceGateway persistenceGateway,
            DocumentMapper documentMapper,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.tradingProperties = tradingProperties;
        this.tradeValidator = tradeValidator;
        this.pnLCalculator = pnLCalculator;
        this.persistenceGateway = persistenceGateway;
        this.documentMapper = documentMapper;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
        this.accountLedger = new AccountLedger(freshAccount());
    }

    // ========================
    // OPEN
    // ========================

    /**
     * Validates and executes a trade request, opening a new position.
     *
     * <p>Margin is {@code price * quantity / leverage}; the entry fee is a fraction of the margin.
     * Both are taken from the free balance atomically with the position's creation. Stop loss and
     * target are fixed offsets from the entry price, mirrored for SHORT.
     */
    public TradeResult openTrade(TradeRequest request) {
        prepare(request);
        accountLock.lock();
        try {
            LocalDate today = LocalDate.now(clock);
            accountLedger.resetDailyCounterIfNeeded(today);

            BigDecimal leverage =
                    request.getLeverage() != null ? request.getLeverage() : tradingProperties.getDefaultLeverage();
            tradeValidator.validate(request, leverage, accountLedger, positionStore);

            BigDecimal price = request.getPrice();
            BigDecimal quantity = request.getQuantity();
            BigDecimal notional = price.multiply(quantity);
            BigDecimal margin = notional.divide(leverage, SCALE, RoundingMode.HALF_UP);
            BigDecimal fee = margin.multiply(tradingProperties.getTradingFeePct());

            if (!accountLedger.reserve(margin, fee)) {
                throw new TradeRejectedException(
                        ErrorCode.INSUFFICIENT_BALANCE,
                        String.format(
                                "Insufficient balance: need %s, have %s",
                                margin.add(fee).setScale(2, RoundingMode.HALF_UP).toPlainString(),
                                accountLedger.getCurrentBalance().setScale(2, RoundingMode.HALF_UP).toPlainString()));
            }

            PositionSide side = request.getSide().toPositionSide();
            Position position = Position.builder()
                    .id(UUID.randomUUID().toString())
                    .symbol(request.getSymbol())
                    .side(side)
                    .status(PositionStatus.OPEN)
                    .entryPrice(price)
                    .quantity(quantity)
                    .leverage(leverage)
                    .marginUsed(margin)
                    .tradingFee(fee)
                    .stopLoss(offset(price, side, tradingProperties.getStopLossPct().negate()))
                    .target(offset(price, side, tradingProperties.getTargetPct()))
                    .investedAmount(notional)
                    .entryTime(LocalDateTime.now(clock))
                    .strategy(request.getStrategy())
                    .pnl(BigDecimal.ZERO)
                    .pnlPercentage(BigDecimal.ZERO)
                    .originalQuantity(quantity)
                    .totalQuantity(quantity)
                    .averageEntryPrice(price)
                    .remainingQuantity(quantity)
                    .realizedPnl(BigDecimal.ZERO)
                    .unrealizedPnl(BigDecimal.ZERO)
                    .closedQuantity(BigDecimal.ZERO)
                    .build();

            positionStore.add(position);
            accountLedger.recordTrade(today);

            request.setStatus(ExecutionStatus.COMPLETED);
            request.setPositionId(position.getId());
            request.setCompletedAt(LocalDateTime.now(clock));

            persistPosition(position);
            persistAccount();
            persistOrder(request);

            log.info(
                    "Opened {} {} qty={} @ {} leverage={}x margin={} fee={} SL={} TP={}",
                    side,
                    position.getSymbol(),
                    quantity.toPlainString(),
                    price.toPlainString(),
                    leverage.toPlainString(),
                    margin.toPlainString(),
                    fee.toPlainString(),
                    position.getStopLoss().toPlainString(),
                    position.getTarget().toPlainString());
            eventPublisherHelper.publishPositionOpened(this, position.snapshot());

            return TradeResult.success(
                    position.getId(),
                    String.format(
                            "Opened %s %s qty=%s @ %s",
                            side, position.getSymbol(), quantity.toPlainString(), price.toPlainString()));
        } catch (TradeRejectedException e) {
            return failRequest(request, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Trade execution failed for {}: {}", request.getSymbol(), e.getMessage(), e);
            return failRequest(request, "Trade execution failed: " + e.getMessage());
        } finally {
            accountLock.unlock();
        }
    }

    // ========================
    // CLOSE
    // ========================

    /**
     * Closes whatever quantity remains open at {@code exitPrice}.
     *
     * <p>The exit fee is the entry fee times the exit fee multiplier, pro-rated to the quantity
     * still open. Margin, PnL on the remaining quantity and the exit fee are settled through the
     * ledger; the position becomes CLOSED and is kept as history.
     */
    public TradeResult closePosition(String positionId, BigDecimal exitPrice, String reason) {
        return guarded("close " + positionId, () -> {
            Position position = requireOpen(positionId);
            requirePositive(exitPrice, "exit price");
            return closeRemaining(position, exitPrice, reason);
        });
    }

    /** Closes a position at the last price seen for its symbol. */
    public TradeResult forceClosePosition(String positionId, String reason) {
        return guarded("force close " + positionId, () -> {
            Position position = requireOpen(positionId);
            BigDecimal price = lastPrices.get(position.getSymbol());
            if (price == null) {
                throw new TradeRejectedException(
                        ErrorCode.VALIDATION_ERROR, "No price available for " + position.getSymbol());
            }
            return closeRemaining(position, price, reason);
        });
    }

    // ========================
    // PRICE UPDATES
    // ========================

    /**
     * Marks every OPEN position whose symbol is in {@code prices} to market and records the
     * prices as the latest known. Non-positive prices are ignored.
     *
     * <p>Recomputation completes, under the lock, before this method returns, so a risk pass
     * started afterwards always reads PnL consistent with this batch.
     */
    public void updatePrices(Map<String, BigDecimal> prices) {
        if (prices == null || prices.isEmpty()) {
            return;
        }
        accountLock.lock();
        try {
            prices.forEach((symbol, price) -> {
                if (price != null && price.signum() > 0) {
                    lastPrices.put(symbol, price);
                }
            });
            for (Position position : positionStore.findOpen()) {
                BigDecimal price = prices.get(position.getSymbol());
                if (price != null && price.signum() > 0) {
                    markToMarket(position, price);
                }
            }
        } finally {
            accountLock.unlock();
        }
    }

    // ========================
    // PYRAMIDING
    // ========================

    /**
     * Whether {@code position} may be added to at {@code price} for a signal of
     * {@code confidence}: pyramiding enabled, position OPEN, confidence and profit thresholds met,
     * and fewer adds than the configured maximum.
     */
    public boolean checkPyramidingOpportunity(Position position, BigDecimal price, int confidence) {
        return pyramidingBlocker(position, price, confidence).isEmpty();
    }

    /**
     * Adds to an OPEN position when {@link #checkPyramidingOpportunity} allows it. The add is
     * the configured fraction of the original quantity, at the position's leverage.
     */
    public TradeResult pyramid(String positionId, BigDecimal price, int confidence) {
        return guarded("pyramid " + positionId, () -> {
            Position position = requireOpen(positionId);
            requirePositive(price, "price");
            Optional<String> blocker = pyramidingBlocker(position, price, confidence);
            if (blocker.isPresent()) {
                throw new TradeRejectedException(ErrorCode.VALIDATION_ERROR, blocker.get());
            }

            BigDecimal baseQuantity = position.getOriginalQuantity() != null
                    ? position.getOriginalQuantity()
                    : position.getQuantity();
            BigDecimal addQuantity =
                    baseQuantity.multiply(tradingProperties.getPyramiding().getAddPercentage());
            BigDecimal margin =
                    addQuantity.multiply(price).divide(position.getLeverage(), SCALE, RoundingMode.HALF_UP);
            return addToPosition(positionId, addQuantity, price, margin);
        });
    }

    /**
     * Adds {@code quantity} at {@code price} to an OPEN position, reserving {@code margin} plus
     * the entry fee on it.
     *
     * <p>The average entry becomes {@code (oldTotal*oldAvg + quantity*price)/(oldTotal+quantity)};
     * {@code entryPrice} mirrors it. Stop loss and target are left where they are.
     */
    public TradeResult addToPosition(String positionId, BigDecimal quantity, BigDecimal price, BigDecimal margin) {
        return guarded("add to " + positionId, () -> {
            Position position = requireOpen(positionId);
            requirePositive(quantity, "quantity");
            requirePositive(price, "price");
            if (margin == null || margin.signum() < 0) {
                throw new TradeRejectedException(ErrorCode.VALIDATION_ERROR, "Invalid margin: " + margin);
            }

            BigDecimal fee = margin.multiply(tradingProperties.getTradingFeePct());
            if (!accountLedger.reserve(margin, fee)) {
                throw new TradeRejectedException(
                        ErrorCode.INSUFFICIENT_BALANCE,
                        String.format(
                                "Insufficient balance to pyramid: need %s, have %s",
                                margin.add(fee).setScale(2, RoundingMode.HALF_UP).toPlainString(),
                                accountLedger.getCurrentBalance().setScale(2, RoundingMode.HALF_UP).toPlainString()));
            }

            if (position.getOriginalQuantity() == null) {
                position.setOriginalQuantity(position.getQuantity());
            }
            if (position.getTotalQuantity() == null) {
                position.setTotalQuantity(position.getQuantity());
            }
            if (position.getAverageEntryPrice() == null) {
                position.setAverageEntryPrice(position.getEntryPrice());
            }

            BigDecimal oldTotal = position.getTotalQuantity();
            BigDecimal averageEntry = pnLCalculator.weightedAverage(
                    oldTotal, position.getAverageEntryPrice(), quantity, price);
            BigDecimal newTotal = oldTotal.add(quantity);

            position.setTotalQuantity(newTotal);
            position.setQuantity(newTotal);
            position.setRemainingQuantity(position.getEffectiveQuantity().add(quantity));
            position.setAverageEntryPrice(averageEntry);
            position.setEntryPrice(averageEntry);
            position.setPyramidCount(position.getPyramidCount() + 1);
            position.setMarginUsed(position.getMarginUsed().add(margin));
            position.setInvestedAmount(position.getInvestedAmount().add(quantity.multiply(price)));
            position.setTradingFee(position.getTradingFee().add(fee));
            markToMarket(position, price);

            persistPosition(position);
            persistAccount();

            log.info(
                    "Pyramided {} {} +{} @ {} (add #{}): total={} avgEntry={}",
                    position.getSide(),
                    position.getSymbol(),
                    quantity.toPlainString(),
                    price.toPlainString(),
                    position.getPyramidCount(),
                    newTotal.toPlainString(),
                    averageEntry.toPlainString());
            eventPublisherHelper.publishPositionIncreased(this, position.snapshot());

            return TradeResult.success(
                    positionId,
                    String.format(
                            "Added %s @ %s, average entry %s",
                            quantity.toPlainString(), price.toPlainString(), averageEntry.toPlainString()));
        });
    }

    // ========================
    // TRAILING (PARTIAL CLOSE)
    // ========================

    /**
     * Whether {@code position} may take a trailing partial close at {@code price}: trailing
     * enabled, position OPEN with quantity left, profit at or above the trailing threshold, and
     * fewer trailing steps than the configured maximum.
     */
    public boolean checkTrailingOpportunity(Position position, BigDecimal price) {
        return trailingBlocker(position, price).isEmpty();
    }

    /**
     * Takes one trailing step: closes the configured fraction of the remaining quantity at
     * {@code price}, then re-anchors stop loss and target around {@code price}.
     */
    public TradeResult executeTrailing(String positionId, BigDecimal price) {
        return guarded("trail " + positionId, () -> {
            Position position = requireOpen(positionId);
            requirePositive(price, "price");
            Optional<String> blocker = trailingBlocker(position, price);
            if (blocker.isPresent()) {
                throw new TradeRejectedException(ErrorCode.VALIDATION_ERROR, blocker.get());
            }

            TradingProperties.Trailing trailing = tradingProperties.getTrailing();
            BigDecimal exitQuantity = position.getEffectiveQuantity()
                    .multiply(trailing.getExitPercentage())
                    .setScale(SCALE, RoundingMode.HALF_UP);
            TradeResult result =
                    partialClose(positionId, exitQuantity, price, "Trailing Exit " + (position.getTrailingCount() + 1));

            if (result.isSuccess() && position.isOpen()) {
                position.setStopLoss(offset(price, position.getSide(), trailing.getStopLossPct().negate()));
                position.setTarget(offset(price, position.getSide(), trailing.getTargetPct()));
                persistPosition(position);
                log.info(
                        "Re-anchored {} after trailing step: SL={} TP={}",
                        position.getSymbol(),
                        position.getStopLoss().toPlainString(),
                        position.getTarget().toPlainString());
                eventPublisherHelper.publishPositionUpdated(this, position.snapshot());
            }
            return result;
        });
    }

    /**
     * Realizes PnL on {@code quantity} at {@code exitPrice} against the average entry.
     *
     * <p>Margin is released in proportion to the quantity closed. When nothing (or less than the
     * minimum trade size) would remain, the position is closed outright instead.
     */
    public TradeResult partialClose(String positionId, BigDecimal quantity, BigDecimal exitPrice, String reason) {
        return guarded("partial close " + positionId, () -> {
            Position position = requireOpen(positionId);
            requirePositive(quantity, "quantity");
            requirePositive(exitPrice, "exit price");

            BigDecimal remaining = position.getEffectiveQuantity();
            position.setTrailingCount(position.getTrailingCount() + 1);
            if (remaining.subtract(quantity).compareTo(tradingProperties.getMinTradeSize()) < 0) {
                return closeRemaining(position, exitPrice, reason);
            }

            BigDecimal realized = pnLCalculator.realizedPnlOnClose(position, quantity, exitPrice);
            BigDecimal marginReleased =
                    position.getMarginUsed().multiply(quantity).divide(remaining, SCALE, RoundingMode.HALF_UP);
            BigDecimal exitFee = exitFeeFor(position, quantity);

            recordExit(position, quantity, exitPrice);
            position.setRealizedPnl(position.getRealizedPnl().add(realized));
            position.setRemainingQuantity(remaining.subtract(quantity));
            position.setMarginUsed(position.getMarginUsed().subtract(marginReleased));
            markToMarket(position, exitPrice);

            accountLedger.settlePartial(marginReleased, realized, exitFee);

            persistPosition(position);
            persistAccount();

            log.info(
                    "Partial close {} {} qty={} @ {} realized={} remaining={} ({})",
                    position.getSide(),
                    position.getSymbol(),
                    quantity.toPlainString(),
                    exitPrice.toPlainString(),
                    realized.toPlainString(),
                    position.getRemainingQuantity().toPlainString(),
                    reason);
            eventPublisherHelper.publishPositionReduced(this, position.snapshot(), realized);

            return TradeResult.success(
                    positionId,
                    String.format(
                            "%s: closed %s @ %s, realized %s",
                            reason, quantity.toPlainString(), exitPrice.toPlainString(), realized.toPlainString()));
        });
    }

    // ========================
    // STOP / TARGET
    // ========================

    /**
     * Moves the stop loss only if the new level is tighter: higher for LONG, lower for SHORT.
     *
     * @return true if the stop moved
     */
    public boolean tightenStopLoss(String positionId, BigDecimal newStopLoss) {
        accountLock.lock();
        try {
            Position position = positionStore.findById(positionId).orElse(null);
            if (position == null || !position.isOpen() || newStopLoss == null || newStopLoss.signum() <= 0) {
                return false;
            }
            BigDecimal current = position.getStopLoss();
            boolean tighter = current == null
                    || (position.getSide() == PositionSide.LONG
                            ? newStopLoss.compareTo(current) > 0
                            : newStopLoss.compareTo(current) < 0);
            if (!tighter) {
                return false;
            }
            position.setStopLoss(newStopLoss);
            persistPosition(position);
            log.info(
                    "Tightened stop loss on {} {}: {} -> {}",
                    position.getSide(),
                    position.getSymbol(),
                    current != null ? current.toPlainString() : "-",
                    newStopLoss.toPlainString());
            eventPublisherHelper.publishPositionUpdated(this, position.snapshot());
            return true;
        } finally {
            accountLock.unlock();
        }
    }

    /** Sets the stop loss to any positive level, looser or tighter. */
    public TradeResult updateStopLoss(String positionId, BigDecimal stopLoss) {
        return guarded("update stop loss " + positionId, () -> {
            Position position = requireOpen(positionId);
            requirePositive(stopLoss, "stop loss");
            position.setStopLoss(stopLoss);
            persistPosition(position);
            eventPublisherHelper.publishPositionUpdated(this, position.snapshot());
            return TradeResult.success(positionId, "Stop loss set to " + stopLoss.toPlainString());
        });
    }

    public TradeResult updateTarget(String positionId, BigDecimal target) {
        return guarded("update target " + positionId, () -> {
            Position position = requireOpen(positionId);
            requirePositive(target, "target");
            position.setTarget(target);
            persistPosition(position);
            eventPublisherHelper.publishPositionUpdated(this, position.snapshot());
            return TradeResult.success(positionId, "Target set to " + target.toPlainString());
        });
    }

    // ========================
    // READS
    // ========================

    public List<Position> getOpenPositions() {
        accountLock.lock();
        try {
            return positionStore.findOpen().stream().map(Position::snapshot).toList();
        } finally {
            accountLock.unlock();
        }
    }

    public List<Position> getClosedPositions(int limit) {
        accountLock.lock();
        try {
            return positionStore.findClosed(limit).stream().map(Position::snapshot).toList();
        } finally {
            accountLock.unlock();
        }
    }

    public Optional<Position> getPosition(String positionId) {
        accountLock.lock();
        try {
            return positionStore.findById(positionId).map(Position::snapshot);
        } finally {
            accountLock.unlock();
        }
    }

    public Optional<Position> getOpenPosition(String symbol) {
        accountLock.lock();
        try {
            return positionStore.findOpenBySymbol(symbol).map(Position::snapshot);
        } finally {
            accountLock.unlock();
        }
    }

    public Account getAccountSnapshot() {
        accountLock.lock();
        try {
            return accountLedger.snapshot();
        } finally {
            accountLock.unlock();
        }
    }

    public Optional<BigDecimal> getLastPrice(String symbol) {
        return Optional.ofNullable(lastPrices.get(symbol));
    }

    public Map<String, BigDecimal> getLastPrices() {
        return new HashMap<>(lastPrices);
    }

    public TradingSummary getTradingSummary() {
        accountLock.lock();
        try {
            Account account = accountLedger.snapshot();
            List<Position> open = positionStore.findOpen();
            BigDecimal unrealized = open.stream()
                    .map(position -> position.getUnrealizedPnl() != null ? position.getUnrealizedPnl() : BigDecimal.ZERO)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
            return TradingSummary.builder()
                    .account(account)
                    .openPositions(open.size())
                    .closedPositions((int) positionStore.findAll().stream()
                            .filter(position -> position.getStatus() == PositionStatus.CLOSED)
                            .count())
                    .tradesRemainingToday(accountLedger.getTradesRemainingToday())
                    .totalUnrealizedPnl(unrealized)
                    .equity(account.getCurrentBalance().add(account.getTotalMarginUsed()).add(unrealized))
                    .build();
        } finally {
            accountLock.unlock();
        }
    }

    // ========================
    // LIFECYCLE
    // ========================

    /**
     * Replaces in-memory state with a stored account and positions. The account's margin in use
     * is reconciled to the sum over the restored OPEN positions.
     */
    public void restore(Account account, List<Position> positions) {
        accountLock.lock();
        try {
            positionStore.clear();
            BigDecimal openMargin = BigDecimal.ZERO;
            for (Position position : positions) {
                try {
                    positionStore.add(position);
                    if (position.isOpen()) {
                        openMargin = openMargin.add(position.getMarginUsed());
                    }
                } catch (TradeRejectedException e) {
                    log.warn("Skipping stored position {}: {}", position.getId(), e.getMessage());
                }
            }
            if (account.getTotalMarginUsed() == null || account.getTotalMarginUsed().compareTo(openMargin) != 0) {
                log.warn(
                        "Reconciling margin in use for account {}: stored {} vs open positions {}",
                        account.getId(),
                        account.getTotalMarginUsed(),
                        openMargin.toPlainString());
                account.setTotalMarginUsed(openMargin);
            }
            accountLedger = new AccountLedger(account);
            log.info(
                    "Restored account {} (balance {}) with {} open position(s)",
                    account.getId(),
                    account.getCurrentBalance().toPlainString(),
                    positionStore.countOpen());
        } finally {
            accountLock.unlock();
        }
    }

    /** Explicit data wipe: drops every position, re-creates the account and clears the store. */
    public void resetAll() {
        accountLock.lock();
        try {
            positionStore.clear();
            lastPrices.clear();
            accountLedger = new AccountLedger(freshAccount());
            if (!persistenceGateway.deleteAll()) {
                log.warn("Stored documents could not be deleted during reset");
            }
            persistAccount();
            log.warn("All positions and account state reset to initial balance");
        } finally {
            accountLock.unlock();
        }
    }

    // ========================
    // INTERNALS (caller holds accountLock)
    // ========================

    private TradeResult closeRemaining(Position position, BigDecimal exitPrice, String reason) {
        BigDecimal remaining = position.getEffectiveQuantity();
        BigDecimal realized = pnLCalculator.realizedPnlOnClose(position, remaining, exitPrice);
        BigDecimal exitFee = exitFeeFor(position, remaining);
        BigDecimal margin = position.getMarginUsed();

        recordExit(position, remaining, exitPrice);
        position.setRealizedPnl(position.getRealizedPnl().add(realized));
        position.setUnrealizedPnl(BigDecimal.ZERO);
        position.setRemainingQuantity(BigDecimal.ZERO);
        position.setPnl(position.getRealizedPnl());
        position.setPnlPercentage(pnLCalculator.percentOfInvested(position, position.getRealizedPnl()));
        position.setExitPrice(exitPrice);
        position.setExitTime(LocalDateTime.now(clock));
        position.setStatus(PositionStatus.CLOSED);
        position.setNotes(reason);

        accountLedger.release(margin, realized, exitFee, position.getRealizedPnl());
        positionStore.markClosed(position);

        persistPosition(position);
        persistAccount();

        log.info(
                "Closed {} {} @ {} pnl={} ({}%) reason={}",
                position.getSide(),
                position.getSymbol(),
                exitPrice.toPlainString(),
                position.getPnl().toPlainString(),
                position.getPnlPercentage().toPlainString(),
                reason);
        eventPublisherHelper.publishPositionClosed(this, position.snapshot(), realized);

        return TradeResult.success(position.getId(), reason);
    }

    private void markToMarket(Position position, BigDecimal price) {
        BigDecimal unrealized = pnLCalculator.unrealizedPnl(position, price);
        position.setUnrealizedPnl(unrealized);
        position.setPnl(position.getRealizedPnl().add(unrealized));
        position.setPnlPercentage(pnLCalculator.percentOfInvested(position, position.getPnl()));
    }

    private void recordExit(Position position, BigDecimal quantity, BigDecimal exitPrice) {
        BigDecimal closed = position.getClosedQuantity() != null ? position.getClosedQuantity() : BigDecimal.ZERO;
        position.setAverageExitPrice(
                pnLCalculator.weightedAverage(closed, position.getAverageExitPrice(), quantity, exitPrice));
        position.setClosedQuantity(closed.add(quantity));
    }

    /** Exit fee on {@code quantity}: entry fee × multiplier, pro-rated over the total quantity. */
    private BigDecimal exitFeeFor(Position position, BigDecimal quantity) {
        BigDecimal fullExitFee = position.getTradingFee().multiply(tradingProperties.getExitFeeMultiplier());
        BigDecimal total = position.getTotalQuantity();
        if (total == null || total.signum() <= 0 || quantity.compareTo(total) >= 0) {
            return fullExitFee;
        }
        return fullExitFee.multiply(quantity).divide(total, SCALE, RoundingMode.HALF_UP);
    }

    private Optional<String> pyramidingBlocker(Position position, BigDecimal price, int confidence) {
        TradingProperties.Pyramiding pyramiding = tradingProperties.getPyramiding();
        if (!pyramiding.isEnabled()) {
            return Optional.of("Pyramiding disabled");
        }
        if (!position.isOpen()) {
            return Optional.of("Position " + position.getId() + " is not open");
        }
        if (confidence < pyramiding.getMinConfidence()) {
            return Optional.of(String.format(
                    "Confidence %d below pyramiding minimum %d", confidence, pyramiding.getMinConfidence()));
        }
        if (position.getPyramidCount() >= pyramiding.getMaxAdds()) {
            return Optional.of(String.format(
                    "Maximum pyramid adds reached (%d/%d)", position.getPyramidCount(), pyramiding.getMaxAdds()));
        }
        BigDecimal pnlPercentage = pnLCalculator.pnlPercentage(position, price);
        if (pnlPercentage.compareTo(pyramiding.getMinProfitPct()) < 0) {
            return Optional.of(String.format(
                    "Position not profitable enough to pyramid: %s%% < %s%%",
                    pnlPercentage.toPlainString(), pyramiding.getMinProfitPct().toPlainString()));
        }
        return Optional.empty();
    }

    private Optional<String> trailingBlocker(Position position, BigDecimal price) {
        TradingProperties.Trailing trailing = tradingProperties.getTrailing();
        if (!trailing.isEnabled()) {
            return Optional.of("Trailing disabled");
        }
        if (!position.isOpen()) {
            return Optional.of("Position " + position.getId() + " is not open");
        }
        if (position.getTrailingCount() >= trailing.getMaxCount()) {
            return Optional.of(String.format(
                    "Maximum trailing steps reached (%d/%d)", position.getTrailingCount(), trailing.getMaxCount()));
        }
        BigDecimal remaining = position.getEffectiveQuantity();
        if (remaining == null || remaining.signum() <= 0) {
            return Optional.of("No quantity left to trail");
        }
        BigDecimal pnlPercentage = pnLCalculator.pnlPercentage(position, price);
        if (pnlPercentage.compareTo(trailing.getMinProfitPct()) < 0) {
            return Optional.of(String.format(
                    "Position not profitable enough to trail: %s%% < %s%%",
                    pnlPercentage.toPlainString(), trailing.getMinProfitPct().toPlainString()));
        }
        return Optional.empty();
    }

    /** {@code price * (1 + fraction)} for LONG, {@code price * (1 - fraction)} for SHORT. */
    private static BigDecimal offset(BigDecimal price, PositionSide side, BigDecimal fraction) {
        BigDecimal signed = side == PositionSide.LONG ? fraction : fraction.negate();
        return price.multiply(BigDecimal.ONE.add(signed));
    }

    private Position requireOpen(String positionId) {
        Position position =
                positionStore.findById(positionId).orElseThrow(() -> new PositionNotFoundException(positionId));
        if (!position.isOpen()) {
            throw new TradeRejectedException(
                    ErrorCode.INVALID_POSITION_STATE,
                    String.format("Position %s is not open (%s)", positionId, position.getStatus()));
        }
        return position;
    }

    private static void requirePositive(BigDecimal value, String name) {
        if (value == null || value.signum() <= 0) {
            throw new TradeRejectedException(ErrorCode.VALIDATION_ERROR, "Invalid " + name + ": " + value);
        }
    }

    /** Runs a position operation under the lock and turns every failure into a TradeResult. */
    private TradeResult guarded(String operation, Supplier<TradeResult> body) {
        accountLock.lock();
        try {
            return body.get();
        } catch (BaseException e) {
            if (e.getErrorCode().isSystemFault()) {
                log.error("Failed to {} [{}]: {}", operation, e.getErrorCode().getCode(), e.getMessage(), e);
                return TradeResult.failure("Failed to " + operation + ": " + e.getMessage());
            }
            log.warn("Cannot {} [{}]: {}", operation, e.getErrorCode().getCode(), e.getMessage());
            return TradeResult.failure(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Failed to {}: {}", operation, e.getMessage(), e);
            return TradeResult.failure("Failed to " + operation + ": " + e.getMessage());
        } finally {
            accountLock.unlock();
        }
    }

    private void prepare(TradeRequest request) {
        if (request.getId() == null) {
            request.setId(UUID.randomUUID().toString());
        }
        if (request.getCreatedAt() == null) {
            request.setCreatedAt(LocalDateTime.now(clock));
        }
        request.setStatus(ExecutionStatus.EXECUTING);
    }

    private TradeResult failRequest(TradeRequest request, String reason) {
        log.warn("Trade rejected for {} {}: {}", request.getSide(), request.getSymbol(), reason);
        request.setStatus(ExecutionStatus.FAILED);
        request.setErrorReason(reason);
        request.setCompletedAt(LocalDateTime.now(clock));
        persistOrder(request);
        return TradeResult.failure(reason);
    }

    private Account freshAccount() {
        return Account.open(
                tradingProperties.getAccountId(),
                tradingProperties.getInitialBalance(),
                tradingProperties.getDailyTradesLimit(),
                tradingProperties.getMaxLeverage(),
                LocalDateTime.now(clock));
    }

    // ---- persistence: failures are logged, in-memory state stays authoritative ----

    private void persistPosition(Position position) {
        try {
            if (!persistenceGateway.savePosition(documentMapper.toDocument(position))) {
                log.warn("Position {} ({}) not persisted; continuing with in-memory state",
                        position.getId(), position.getSymbol());
            }
        } catch (RuntimeException e) {
            log.warn("Position {} not persisted: {}", position.getId(), e.getMessage());
        }
    }

    private void persistAccount() {
        try {
            if (!persistenceGateway.saveAccount(documentMapper.toDocument(accountLedger.snapshot()))) {
                log.warn("Account state not persisted; continuing with in-memory state");
            }
        } catch (RuntimeException e) {
            log.warn("Account state not persisted: {}", e.getMessage());
        }
    }

    private void persistOrder(TradeRequest request) {
        try {
            if (!persistenceGateway.saveOrder(documentMapper.toDocument(request))) {
                log.warn("Order {} not persisted", request.getId());
            }
        } catch (RuntimeException e) {
            log.warn("Order {} not persisted: {}", request.getId(), e.getMessage());
        }
    }
}
