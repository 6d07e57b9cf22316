package com.autohedge.backend.trading.pipeline;

import java.math.BigDecimal;

public record ThesisInput(
        String stock,
        String task,
        BigDecimal allocation,
        int riskLevel,
        String strategyType,
        String priorRejectionRationale,
        int attempt
) {}
