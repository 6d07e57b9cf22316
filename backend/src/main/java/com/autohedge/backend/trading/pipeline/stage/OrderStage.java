package com.autohedge.backend.trading.pipeline.stage;

import com.autohedge.backend.trading.agent.AgentCapability;
import com.autohedge.backend.trading.agent.AgentResponseParser;
import com.autohedge.backend.trading.agent.AgentRole;
import com.autohedge.backend.trading.pipeline.OrderInput;
import com.autohedge.backend.trading.pipeline.OrderSide;
import com.autohedge.backend.trading.pipeline.OrderType;
import com.autohedge.backend.trading.pipeline.PipelineStageName;
import com.autohedge.backend.trading.pipeline.TradeOrder;
import com.autohedge.backend.util.MoneyUtils;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class OrderStage extends AgentBackedStage<OrderInput, TradeOrder> {

    public OrderStage(AgentCapability agentCapability, AgentResponseParser parser) {
        super(agentCapability, parser);
    }

    @Override
    public PipelineStageName name() {
        return PipelineStageName.ORDER;
    }

    @Override
    public TradeOrder run(OrderInput input) {
        if (input.riskAssessment() == null || !input.riskAssessment().isApproved()) {
            throw new IllegalArgumentException("Order generation requires an approved risk assessment for " + input.stock());
        }
        String prompt = "Produce an order for " + input.stock()
                + ". Approved position size: " + plain(input.riskAssessment().positionSizeHint())
                + ".\n\nThesis:\n" + input.thesis().narrative()
                + "\n\nRisk rationale:\n" + input.riskAssessment().rationale();
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("stock", input.stock());
        context.put("allocation", input.allocation());
        context.put("position_size", input.riskAssessment().positionSizeHint());
        context.put("quant_score", input.quantAnalysis().score());

        JsonNode json = requireObject(call(AgentRole.EXECUTION, prompt, context));
        String sideText = requireText(json, "side");
        OrderSide side = OrderSide.fromWire(sideText)
                .orElseThrow(() -> parseError("Unknown side '" + sideText + "'"));
        String typeText = requireText(json, "order_type");
        OrderType orderType = OrderType.fromWire(typeText)
                .orElseThrow(() -> parseError("Unknown order type '" + typeText + "'"));
        BigDecimal entryPrice = positive(json, "entry_price");
        BigDecimal stopLoss = positive(json, "stop_loss");
        BigDecimal quantity = positive(json, "quantity");
        BigDecimal takeProfit = optionalNumber(json, "take_profit").map(MoneyUtils::bd).orElse(null);
        return new TradeOrder(input.stock(), side, orderType, entryPrice, stopLoss, takeProfit, quantity, Instant.now());
    }

    private BigDecimal positive(JsonNode json, String field) {
        double value = requireNumber(json, field);
        if (value <= 0) {
            throw parseError("Field '" + field + "' must be positive, got " + value);
        }
        return MoneyUtils.bd(value);
    }
}
