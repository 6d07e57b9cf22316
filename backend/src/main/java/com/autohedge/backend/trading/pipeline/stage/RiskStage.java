package com.autohedge.backend.trading.pipeline.stage;

import com.autohedge.backend.trading.agent.AgentCapability;
import com.autohedge.backend.trading.agent.AgentResponseParser;
import com.autohedge.backend.trading.agent.AgentRole;
import com.autohedge.backend.trading.pipeline.PipelineStageName;
import com.autohedge.backend.trading.pipeline.RiskAssessment;
import com.autohedge.backend.trading.pipeline.RiskInput;
import com.autohedge.backend.trading.pipeline.RiskVerdict;
import com.autohedge.backend.util.MoneyUtils;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Risk gate. The suggested position size is capped at the stock's allocation; a missing size
 * counts as zero.
 */
@Slf4j
@Component
public class RiskStage extends AgentBackedStage<RiskInput, RiskAssessment> {

    public RiskStage(AgentCapability agentCapability, AgentResponseParser parser) {
        super(agentCapability, parser);
    }

    @Override
    public PipelineStageName name() {
        return PipelineStageName.RISK;
    }

    @Override
    public RiskAssessment run(RiskInput input) {
        String prompt = "Assess the risk of a position in " + input.stock()
                + " with allocation " + plain(input.allocation())
                + " at risk level " + input.riskLevel() + ".\n\nThesis:\n" + input.thesis().narrative()
                + "\n\nQuantitative analysis (score " + input.quantAnalysis().score() + "):\n"
                + input.quantAnalysis().summary();
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("stock", input.stock());
        context.put("allocation", input.allocation());
        context.put("risk_level", input.riskLevel());
        context.put("quant_score", input.quantAnalysis().score());
        context.put("signals", input.quantAnalysis().signals());

        JsonNode json = requireObject(call(AgentRole.RISK, prompt, context));
        String verdictText = requireText(json, "verdict");
        RiskVerdict verdict = RiskVerdict.fromWire(verdictText)
                .orElseThrow(() -> parseError("Unknown verdict '" + verdictText + "'"));
        String rationale = requireText(json, "rationale");
        BigDecimal positionSize = positionSize(json, input.allocation());
        return new RiskAssessment(input.stock(), input.thesis().attempt(), verdict, rationale, positionSize, Instant.now());
    }

    private BigDecimal positionSize(JsonNode json, BigDecimal allocation) {
        double raw = optionalNumber(json, "position_size").orElse(0.0);
        if (raw < 0) {
            throw parseError("Negative position size " + raw);
        }
        BigDecimal size = MoneyUtils.bd(raw);
        if (allocation != null && size.compareTo(allocation) > 0) {
            log.debug("Clamping position size {} to allocation {}", size, allocation);
            return MoneyUtils.scale(allocation);
        }
        return size;
    }
}
