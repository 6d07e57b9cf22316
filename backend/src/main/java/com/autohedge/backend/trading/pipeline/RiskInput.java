package com.autohedge.backend.trading.pipeline;

import java.math.BigDecimal;

public record RiskInput(
        String stock,
        Thesis thesis,
        QuantAnalysis quantAnalysis,
        BigDecimal allocation,
        int riskLevel
) {}
