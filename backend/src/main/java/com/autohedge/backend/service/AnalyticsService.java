package com.autohedge.backend.service;

import com.autohedge.backend.config.AnalyticsProperties;
import com.autohedge.backend.dto.HistoricalAnalyticsResponse;
import com.autohedge.backend.exception.ValidationException;
import com.autohedge.backend.model.Trade;
import com.autohedge.backend.model.TradeStatus;
import com.autohedge.backend.repository.TradeRepository;
import com.autohedge.backend.trading.fund.AutoHedgeOutput;
import com.autohedge.backend.trading.pipeline.StockResult;
import com.autohedge.backend.trading.pipeline.StockStatus;
import com.autohedge.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Historical statistics over a caller's trades, computed on demand from the stored results.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalyticsService {

    private final TradeRepository tradeRepository;
    private final TradeService tradeService;
    private final AnalyticsProperties analyticsProperties;

    @Transactional(readOnly = true)
    public HistoricalAnalyticsResponse history(String userId, Integer days) {
        int period = days != null ? days : analyticsProperties.getLookbackDays();
        if (period < 1 || period > 365) {
            throw new ValidationException("days must be between 1 and 365");
        }
        Instant since = Instant.now().minus(period, ChronoUnit.DAYS);
        List<Trade> trades = tradeRepository.findByUserIdAndCreatedAtGreaterThanEqual(userId, since);

        long completed = count(trades, TradeStatus.COMPLETED);
        long failedTrades = count(trades, TradeStatus.FAILED);
        BigDecimal totalAllocation = trades.stream()
                .map(Trade::getAllocation)
                .reduce(MoneyUtils.ZERO, MoneyUtils::add);

        List<StockResult> results = new ArrayList<>();
        for (Trade trade : trades) {
            if (trade.getStatus() != TradeStatus.COMPLETED) {
                continue;
            }
            try {
                AutoHedgeOutput output = tradeService.readResult(trade);
                if (output != null) {
                    results.addAll(output.results());
                }
            } catch (IllegalStateException e) {
                log.warn("Skipping stock results of trade {}: {}", trade.getId(), e.getMessage());
            }
        }
        long approved = results.stream().filter(r -> r.status() == StockStatus.COMPLETED).count();
        long exhausted = results.stream().filter(r -> r.status() == StockStatus.REJECTED_EXHAUSTED).count();
        long failedStocks = results.stream().filter(r -> r.status() == StockStatus.FAILED).count();
        long orders = results.stream().filter(r -> r.order() != null).count();
        double averageAttempts = results.stream().mapToInt(StockResult::thesisAttempts).average().orElse(0.0);

        return HistoricalAnalyticsResponse.builder()
                .periodDays(period)
                .totalTrades(trades.size())
                .completedTrades(completed)
                .failedTrades(failedTrades)
                .inFlightTrades(trades.size() - completed - failedTrades)
                .successRate(percent(completed, trades.size()))
                .totalAllocation(totalAllocation)
                .stocksAnalyzed(results.size())
                .approved(approved)
                .rejectedExhausted(exhausted)
                .failed(failedStocks)
                .approvalRate(percent(approved, approved + exhausted))
                .ordersGenerated(orders)
                .averageThesisAttempts(round(averageAttempts))
                .topStocks(topStocks(results))
                .build();
    }

    private List<HistoricalAnalyticsResponse.StockCount> topStocks(List<StockResult> results) {
        Map<String, Long> approvals = new LinkedHashMap<>();
        for (StockResult result : results) {
            if (result.status() == StockStatus.COMPLETED) {
                approvals.merge(result.stock(), 1L, Long::sum);
            }
        }
        return approvals.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(analyticsProperties.getTopStocks())
                .map(entry -> new HistoricalAnalyticsResponse.StockCount(entry.getKey(), entry.getValue()))
                .toList();
    }

    private static long count(List<Trade> trades, TradeStatus status) {
        return trades.stream().filter(t -> t.getStatus() == status).count();
    }

    private static double percent(long part, long total) {
        if (total == 0) {
            return 0.0;
        }
        return round(part * 100.0 / total);
    }

    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
