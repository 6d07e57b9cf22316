package com.autohedge.backend.service;

import com.autohedge.backend.model.TradeStatus;
import com.autohedge.backend.trading.pipeline.PipelineStageName;
import com.autohedge.backend.trading.pipeline.StockStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;

@Service
@Slf4j
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;

    private Counter tradesSubmittedCounter;
    private Counter casConflictsCounter;

    @jakarta.annotation.PostConstruct
    void init() {
        tradesSubmittedCounter = Counter.builder("trades_submitted_total").register(meterRegistry);
        casConflictsCounter = Counter.builder("trade_cas_conflicts_total").register(meterRegistry);
    }

    /** outcome is one of success, parse_error, unavailable, error. */
    public void recordStageOutcome(PipelineStageName stage, String outcome) {
        Counter.builder("pipeline_stage_outcomes_total")
                .tag("stage", stage.wireName())
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }

    public void recordStockResult(StockStatus status, int thesisAttempts) {
        Counter.builder("pipeline_stock_results_total")
                .tag("status", status.wireName())
                .tag("thesis_attempts", String.valueOf(thesisAttempts))
                .register(meterRegistry)
                .increment();
    }

    public void recordTradeSubmitted() {
        if (tradesSubmittedCounter != null) {
            tradesSubmittedCounter.increment();
        }
    }

    public void recordTradeFinished(TradeStatus status, Duration elapsed) {
        Counter.builder("trades_finished_total")
                .tag("status", status.wireName())
                .register(meterRegistry)
                .increment();
        if (elapsed != null) {
            Timer.builder("trade_run_duration")
                    .tag("status", status.wireName())
                    .register(meterRegistry)
                    .record(elapsed);
        }
    }

    public void recordCasConflict() {
        if (casConflictsCounter != null) {
            casConflictsCounter.increment();
        }
    }
}
