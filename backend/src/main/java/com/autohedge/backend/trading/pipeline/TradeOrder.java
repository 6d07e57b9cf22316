package com.autohedge.backend.trading.pipeline;

import java.math.BigDecimal;
import java.time.Instant;

public record TradeOrder(
        String stock,
        OrderSide side,
        OrderType orderType,
        BigDecimal entryPrice,
        BigDecimal stopLoss,
        BigDecimal takeProfit,
        BigDecimal quantity,
        Instant generatedAt
) {}
