package com.autohedge.backend.trading.pipeline;

import com.autohedge.backend.config.PipelineProperties;
import com.autohedge.backend.exception.StageParseException;
import com.autohedge.backend.exception.StageUnavailableException;
import com.autohedge.backend.service.MetricsService;
import com.autohedge.backend.trading.marketdata.MarketDataProvider;
import com.autohedge.backend.trading.marketdata.MarketDataUnavailableException;
import com.autohedge.backend.trading.marketdata.MarketSnapshot;
import com.autohedge.backend.trading.marketdata.SymbolNotFoundException;
import com.autohedge.backend.trading.pipeline.stage.OrderStage;
import com.autohedge.backend.trading.pipeline.stage.PipelineStage;
import com.autohedge.backend.trading.pipeline.stage.QuantStage;
import com.autohedge.backend.trading.pipeline.stage.RiskStage;
import com.autohedge.backend.trading.pipeline.stage.ThesisStage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Drives one stock through thesis, quant, risk and order. Every failure is contained here:
 * callers always get exactly one {@link StockResult}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StockPipelineOrchestrator {

    private final ThesisStage thesisStage;
    private final QuantStage quantStage;
    private final RiskStage riskStage;
    private final OrderStage orderStage;
    private final MarketDataProvider marketDataProvider;
    private final PipelineProperties pipelineProperties;
    private final MetricsService metricsService;

    public StockResult run(StockPipelineRequest request) {
        String previousStock = MDC.get("stock");
        MDC.put("stock", request.stock());
        try {
            StockResult result = new StockRun(request).execute();
            metricsService.recordStockResult(result.status(), result.thesisAttempts());
            log.info("Pipeline for {} finished {} after {} thesis attempt(s)",
                    request.stock(), result.status().wireName(), result.thesisAttempts());
            return result;
        } finally {
            if (previousStock == null) {
                MDC.remove("stock");
            } else {
                MDC.put("stock", previousStock);
            }
        }
    }

    private <I, O> O attempt(PipelineStage<I, O> stage, I input) {
        int allowed = 1 + pipelineProperties.getStageParseRetries();
        for (int attempt = 1; ; attempt++) {
            try {
                O output = stage.run(input);
                metricsService.recordStageOutcome(stage.name(), "success");
                return output;
            } catch (StageParseException e) {
                metricsService.recordStageOutcome(stage.name(), "parse_error");
                if (attempt >= allowed) {
                    throw e;
                }
                log.warn("Unparseable {} answer (attempt {}/{}): {}", stage.name().wireName(), attempt, allowed, e.getMessage());
            } catch (StageUnavailableException e) {
                metricsService.recordStageOutcome(stage.name(), "unavailable");
                throw e;
            }
        }
    }

    /** Mutable state of a single stock run; confined to the calling thread. */
    private final class StockRun {

        private final StockPipelineRequest request;
        private final int maxRetries = pipelineProperties.getMaxRetries();
        private final List<Thesis> thesisHistory = new ArrayList<>();
        private final List<RiskAssessment> riskHistory = new ArrayList<>();

        private PipelineState state = PipelineState.INIT;
        private int retryCount;
        private String priorRejectionRationale;
        private MarketSnapshot snapshot;
        private Thesis thesis;
        private QuantAnalysis quantAnalysis;
        private RiskAssessment riskAssessment;
        private TradeOrder order;
        private boolean exhausted;
        private String failureReason;
        private PipelineStageName failedStage;

        private StockRun(StockPipelineRequest request) {
            this.request = request;
        }

        StockResult execute() {
            while (!state.isTerminal()) {
                PipelineState next;
                try {
                    next = step();
                } catch (StageUnavailableException | StageParseException e) {
                    next = fail(stageOf(e), e.getMessage());
                } catch (RuntimeException e) {
                    log.error("Unexpected error in {} for {}", state, request.stock(), e);
                    next = fail(currentStage(), "Unexpected error: " + e.getMessage());
                }
                if (!state.canTransitionTo(next)) {
                    throw new IllegalStateException("Illegal pipeline transition " + state + " -> " + next);
                }
                log.debug("{}: {} -> {}", request.stock(), state, next);
                state = next;
            }
            return toResult();
        }

        private PipelineState step() {
            return switch (state) {
                case INIT -> PipelineState.THESIS;
                case THESIS -> {
                    int attemptNo = thesisHistory.size() + 1;
                    thesis = attempt(thesisStage, new ThesisInput(request.stock(), request.task(), request.allocation(),
                            request.riskLevel(), request.strategyType(), priorRejectionRationale, attemptNo));
                    thesisHistory.add(thesis);
                    yield PipelineState.QUANT;
                }
                case QUANT -> {
                    MarketSnapshot marketSnapshot = snapshot();
                    quantAnalysis = attempt(quantStage, new QuantInput(request.stock(), thesis, marketSnapshot));
                    yield PipelineState.RISK;
                }
                case RISK -> {
                    riskAssessment = attempt(riskStage, new RiskInput(request.stock(), thesis, quantAnalysis,
                            request.allocation(), request.riskLevel()));
                    riskHistory.add(riskAssessment);
                    PipelineState next = PipelineState.afterRisk(riskAssessment.verdict(), retryCount, maxRetries);
                    if (next == PipelineState.FAILED) {
                        exhausted = true;
                        failureReason = "Rejected by risk after " + thesisHistory.size() + " thesis attempt(s): "
                                + riskAssessment.rationale();
                    }
                    yield next;
                }
                case RETRY_THESIS -> {
                    retryCount++;
                    priorRejectionRationale = riskAssessment.rationale();
                    log.info("Risk rejected {}; re-thesis {}/{}", request.stock(), retryCount, maxRetries);
                    yield PipelineState.THESIS;
                }
                case ORDER -> {
                    order = attempt(orderStage, new OrderInput(request.stock(), thesis, quantAnalysis,
                            riskAssessment, request.allocation()));
                    yield PipelineState.DONE;
                }
                default -> throw new IllegalStateException("No step from terminal state " + state);
            };
        }

        /** Fetched once per stock and reused across thesis retries. */
        private MarketSnapshot snapshot() {
            if (snapshot == null) {
                try {
                    snapshot = marketDataProvider.fetch(request.stock());
                    metricsService.recordStageOutcome(PipelineStageName.MARKET_DATA, "success");
                } catch (SymbolNotFoundException | MarketDataUnavailableException e) {
                    metricsService.recordStageOutcome(PipelineStageName.MARKET_DATA, "unavailable");
                    throw new StageUnavailableException(PipelineStageName.MARKET_DATA, e.getMessage(), e);
                }
            }
            return snapshot;
        }

        private PipelineState fail(PipelineStageName stage, String reason) {
            failedStage = stage;
            failureReason = reason;
            log.warn("Pipeline for {} failed at {}: {}", request.stock(), stage.wireName(), reason);
            return PipelineState.FAILED;
        }

        private PipelineStageName stageOf(RuntimeException e) {
            if (e instanceof StageUnavailableException unavailable) {
                return unavailable.getStage();
            }
            return ((StageParseException) e).getStage();
        }

        private PipelineStageName currentStage() {
            return switch (state) {
                case QUANT -> snapshot == null ? PipelineStageName.MARKET_DATA : PipelineStageName.QUANT;
                case RISK -> PipelineStageName.RISK;
                case ORDER -> PipelineStageName.ORDER;
                default -> PipelineStageName.THESIS;
            };
        }

        private StockResult toResult() {
            StockStatus status;
            RiskAssessment finalRisk = riskAssessment;
            if (state == PipelineState.DONE) {
                status = StockStatus.COMPLETED;
            } else if (exhausted) {
                status = StockStatus.REJECTED_EXHAUSTED;
            } else {
                status = StockStatus.FAILED;
                if (finalRisk != null && finalRisk.isApproved()) {
                    finalRisk = null;
                }
            }
            return new StockResult(
                    request.stock(),
                    status,
                    thesis,
                    quantAnalysis,
                    finalRisk,
                    status == StockStatus.COMPLETED ? order : null,
                    thesisHistory,
                    riskHistory,
                    thesisHistory.size(),
                    status == StockStatus.COMPLETED ? null : failureReason,
                    status == StockStatus.FAILED ? failedStage : null
            );
        }
    }
}
