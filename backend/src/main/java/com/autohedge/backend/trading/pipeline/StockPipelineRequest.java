package com.autohedge.backend.trading.pipeline;

import java.math.BigDecimal;

public record StockPipelineRequest(
        String stock,
        String task,
        BigDecimal allocation,
        int riskLevel,
        String strategyType
) {}
