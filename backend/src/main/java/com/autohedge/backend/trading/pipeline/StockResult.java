package com.autohedge.backend.trading.pipeline;

import java.util.List;

/**
 * Terminal outcome for one stock. {@code order} is present exactly when the final
 * {@code riskAssessment} is approved.
 */
public record StockResult(
        String stock,
        StockStatus status,
        Thesis thesis,
        QuantAnalysis quantAnalysis,
        RiskAssessment riskAssessment,
        TradeOrder order,
        List<Thesis> thesisHistory,
        List<RiskAssessment> riskHistory,
        int thesisAttempts,
        String failureReason,
        PipelineStageName failedStage
) {
    public StockResult {
        thesisHistory = thesisHistory == null ? List.of() : List.copyOf(thesisHistory);
        riskHistory = riskHistory == null ? List.of() : List.copyOf(riskHistory);
    }

    public static StockResult failed(String stock, PipelineStageName stage, String reason) {
        return new StockResult(stock, StockStatus.FAILED, null, null, null, null,
                List.of(), List.of(), 0, reason, stage);
    }
}
