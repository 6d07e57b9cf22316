package com.autohedge.backend.trading.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.math.BigDecimal;
import java.time.Instant;

public record RiskAssessment(
        String stock,
        int thesisAttempt,
        RiskVerdict verdict,
        String rationale,
        BigDecimal positionSizeHint,
        Instant generatedAt
) {
    @JsonIgnore
    public boolean isApproved() {
        return verdict == RiskVerdict.APPROVED;
    }
}
