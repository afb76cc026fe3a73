package com.levertrader.ledger;

import com.levertrader.domain.model.Account;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owner of the account's monetary state: free balance, reserved margin, fees, realized PnL
 * and trade statistics.
 *
 * <p>Not thread-safe. The ledger is embedded in {@link com.levertrader.execution.TradeExecutor}
 * and every call happens under the executor's account lock, which is what makes
 * "check balance, then reserve" atomic.
 *
 * <p>Money flow per position:
 * <pre>
 *   open      balance -= margin + fee          marginUsed += margin
 *   partial   balance += margin' + pnl' - fee' marginUsed -= margin'
 *   close     balance += margin + pnl - fee    marginUsed -= margin   (floored at 0)
 * </pre>
 */
public class AccountLedger {

    private static final Logger log = LoggerFactory.getLogger(AccountLedger.class);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final Account account;

    public AccountLedger(Account account) {
        this.account = account;
    }

    /**
     * Reserves margin and charges the entry fee.
     *
     * @return false, leaving the account untouched, if {@code margin + fee} exceeds the free balance
     */
    public boolean reserve(BigDecimal margin, BigDecimal fee) {
        BigDecimal required = margin.add(fee);
        if (required.compareTo(account.getCurrentBalance()) > 0) {
            log.debug(
                    "Reserve refused: need {} have {}",
                    required.toPlainString(),
                    account.getCurrentBalance().toPlainString());
            return false;
        }
        account.setCurrentBalance(account.getCurrentBalance().subtract(required));
        account.setTotalMarginUsed(account.getTotalMarginUsed().add(margin));
        account.setBrokerageCharges(account.getBrokerageCharges().add(fee));
        return true;
    }

    /**
     * Settles a full close: credits {@code margin + pnl - exitFee}, frees the margin and
     * records the trade outcome in the win/loss statistics.
     *
     * @param margin  margin still reserved by the position
     * @param pnl     PnL realized by this final settlement
     * @param exitFee fee charged on the closing quantity
     * @param positionPnl the position's total PnL over its life, which decides win or loss
     */
    public void release(BigDecimal margin, BigDecimal pnl, BigDecimal exitFee, BigDecimal positionPnl) {
        credit(margin, pnl, exitFee);

        if (positionPnl.signum() > 0) {
            account.setProfitableTrades(account.getProfitableTrades() + 1);
            account.setTotalProfit(account.getTotalProfit().add(positionPnl));
        } else {
            account.setLosingTrades(account.getLosingTrades() + 1);
            account.setTotalLoss(account.getTotalLoss().add(positionPnl.abs()));
        }
        account.setWinRate(calculateWinRate());
    }

    /** Settles a partial close. Same money flow as {@link #release}, without touching statistics. */
    public void settlePartial(BigDecimal margin, BigDecimal pnl, BigDecimal exitFee) {
        credit(margin, pnl, exitFee);
    }

    /** Zeroes the daily trade counter when the last trade happened on an earlier day. */
    public void resetDailyCounterIfNeeded(LocalDate today) {
        LocalDate lastTradeDate = account.getLastTradeDate();
        if (lastTradeDate != null && !lastTradeDate.equals(today) && account.getDailyTradesCount() > 0) {
            log.info("New trading day {}: resetting daily trade count (was {})", today, account.getDailyTradesCount());
            account.setDailyTradesCount(0);
        }
    }

    public boolean hasDailyCapacity() {
        return account.getDailyTradesCount() < account.getDailyTradesLimit();
    }

    /** Counts an executed entry against the daily and lifetime counters. */
    public void recordTrade(LocalDate today) {
        account.setDailyTradesCount(account.getDailyTradesCount() + 1);
        account.setTotalTrades(account.getTotalTrades() + 1);
        account.setLastTradeDate(today);
        account.setWinRate(calculateWinRate());
    }

    public BigDecimal getCurrentBalance() {
        return account.getCurrentBalance();
    }

    public BigDecimal getTotalMarginUsed() {
        return account.getTotalMarginUsed();
    }

    public int getTradesRemainingToday() {
        return Math.max(0, account.getDailyTradesLimit() - account.getDailyTradesCount());
    }

    /** Detached copy of the account. */
    public Account snapshot() {
        return account.toBuilder().build();
    }

    // ---- internals ----

    private void credit(BigDecimal margin, BigDecimal pnl, BigDecimal exitFee) {
        BigDecimal credited = margin.add(pnl).subtract(exitFee);
        BigDecimal balance = account.getCurrentBalance().add(credited);
        if (balance.signum() < 0) {
            // Losses beyond the reserved margin are absorbed as if the position had been liquidated.
            log.warn("Settlement would overdraw account {} by {}: flooring balance at 0",
                    account.getId(), balance.negate().toPlainString());
            balance = BigDecimal.ZERO;
        }
        account.setCurrentBalance(balance);

        BigDecimal marginUsed = account.getTotalMarginUsed().subtract(margin);
        account.setTotalMarginUsed(marginUsed.signum() < 0 ? BigDecimal.ZERO : marginUsed);

        account.setBrokerageCharges(account.getBrokerageCharges().add(exitFee));
        account.setRealizedPnl(account.getRealizedPnl().add(pnl));
    }

    private BigDecimal calculateWinRate() {
        if (account.getTotalTrades() == 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(account.getProfitableTrades())
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(account.getTotalTrades()), 2, RoundingMode.HALF_UP);
    }
}
