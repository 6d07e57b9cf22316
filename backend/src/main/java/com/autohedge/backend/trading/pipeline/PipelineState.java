package com.autohedge.backend.trading.pipeline;

/**
 * Per-stock pipeline states. {@code DONE} and {@code FAILED} are terminal.
 */
public enum PipelineState {
    INIT,
    THESIS,
    QUANT,
    RISK,
    ORDER,
    RETRY_THESIS,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    public boolean canTransitionTo(PipelineState target) {
        if (target == null || isTerminal()) return false;
        if (target == FAILED) return true;
        return switch (this) {
            case INIT -> target == THESIS;
            case THESIS -> target == QUANT;
            case QUANT -> target == RISK;
            case RISK -> target == ORDER || target == RETRY_THESIS;
            case RETRY_THESIS -> target == THESIS;
            case ORDER -> target == DONE;
            default -> false;
        };
    }

    /**
     * State after the risk gate. {@code retryCount} is the number of re-thesis rounds already spent.
     */
    public static PipelineState afterRisk(RiskVerdict verdict, int retryCount, int maxRetries) {
        if (verdict == RiskVerdict.APPROVED) {
            return ORDER;
        }
        return retryCount < maxRetries ? RETRY_THESIS : FAILED;
    }
}
