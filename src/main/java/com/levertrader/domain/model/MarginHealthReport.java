package com.levertrader.domain.model;

import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/** Margin ratio and liquidation distance of every OPEN position with a known price. */
@Data
@Builder
public class MarginHealthReport {

    private BigDecimal totalMarginUsed;
    private BigDecimal accountBalance;
    private List<Entry> entries;

    /** Human-readable warnings for positions inside the liquidation warning distance. */
    private List<String> warnings;

    public boolean isHealthy() {
        return warnings == null || warnings.isEmpty();
    }

    @Data
    @Builder
    public static class Entry {

        private String positionId;
        private String symbol;
        private BigDecimal price;

        /** Margin over notional at entry, percent. */
        private BigDecimal marginRatio;

        private BigDecimal liquidationDistance;
    }
}
