package com.autohedge.backend.trading.fund;

import com.autohedge.backend.trading.pipeline.StockResult;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Aggregate of one fund run. {@code results} follows the order of {@code stocks}.
 */
public record AutoHedgeOutput(
        String id,
        String name,
        String description,
        List<String> stocks,
        String task,
        BigDecimal allocation,
        Instant timestamp,
        List<StockResult> results
) {
    public AutoHedgeOutput {
        stocks = stocks == null ? List.of() : List.copyOf(stocks);
        results = results == null ? List.of() : List.copyOf(results);
    }
}
