package com.levertrader.domain.model;

import java.math.BigDecimal;
import lombok.Getter;

/**
 * Result of admission control: the quantity that may be traded and the constraint that
 * determined it. A zero quantity means the trade is not admitted; the reason says why.
 */
@Getter
public class SafeQuantityResult {

    private final BigDecimal quantity;
    private final String reason;

    /** Set when the trade was refused because portfolio margin usage is already at the cap. */
    private final boolean antiOvertrade;

    private SafeQuantityResult(BigDecimal quantity, String reason, boolean antiOvertrade) {
        this.quantity = quantity;
        this.reason = reason;
        this.antiOvertrade = antiOvertrade;
    }

    public static SafeQuantityResult approved(BigDecimal quantity, String reason) {
        return new SafeQuantityResult(quantity, reason, false);
    }

    public static SafeQuantityResult rejected(String reason) {
        return new SafeQuantityResult(BigDecimal.ZERO, reason, false);
    }

    public static SafeQuantityResult antiOvertrade(String reason) {
        return new SafeQuantityResult(BigDecimal.ZERO, reason, true);
    }

    public boolean isApproved() {
        return quantity.signum() > 0;
    }

    @Override
    public String toString() {
        return quantity.toPlainString() + " (" + reason + ")";
    }
}
