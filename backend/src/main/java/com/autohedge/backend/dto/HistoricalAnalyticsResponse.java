package com.autohedge.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HistoricalAnalyticsResponse {
    private int periodDays;
    private long totalTrades;
    private long completedTrades;
    private long failedTrades;
    private long inFlightTrades;
    /** Percentage of trades that completed, 0..100. */
    private double successRate;
    private BigDecimal totalAllocation;
    private long stocksAnalyzed;
    private long approved;
    private long rejectedExhausted;
    private long failed;
    /** approved / (approved + rejected_exhausted), as a percentage. */
    private double approvalRate;
    private long ordersGenerated;
    private double averageThesisAttempts;
    private List<StockCount> topStocks;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StockCount {
        private String stock;
        private long approvals;
    }
}
