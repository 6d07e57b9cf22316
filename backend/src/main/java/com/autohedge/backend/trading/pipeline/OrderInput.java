package com.autohedge.backend.trading.pipeline;

import java.math.BigDecimal;

public record OrderInput(
        String stock,
        Thesis thesis,
        QuantAnalysis quantAnalysis,
        RiskAssessment riskAssessment,
        BigDecimal allocation
) {}
