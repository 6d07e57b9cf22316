package com.autohedge.backend.trading.fund;

import java.math.BigDecimal;
import java.util.List;

/**
 * @param id        identifier to stamp on the output; a random one is used when null
 * @param riskLevel 1..10; the configured default applies when null
 */
public record FundRunRequest(
        String id,
        String name,
        String description,
        List<String> stocks,
        String task,
        BigDecimal allocation,
        Integer riskLevel,
        String strategyType
) {}
