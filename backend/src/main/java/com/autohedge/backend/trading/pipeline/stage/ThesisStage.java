package com.autohedge.backend.trading.pipeline.stage;

import com.autohedge.backend.trading.agent.AgentCapability;
import com.autohedge.backend.trading.agent.AgentResponseParser;
import com.autohedge.backend.trading.agent.AgentRole;
import com.autohedge.backend.trading.pipeline.PipelineStageName;
import com.autohedge.backend.trading.pipeline.Thesis;
import com.autohedge.backend.trading.pipeline.ThesisInput;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Asks the director for an investment thesis. Plain text answers are taken as-is; a JSON answer
 * must carry a {@code thesis} field.
 */
@Component
public class ThesisStage extends AgentBackedStage<ThesisInput, Thesis> {

    public ThesisStage(AgentCapability agentCapability, AgentResponseParser parser) {
        super(agentCapability, parser);
    }

    @Override
    public PipelineStageName name() {
        return PipelineStageName.THESIS;
    }

    @Override
    public Thesis run(ThesisInput input) {
        String raw = call(AgentRole.DIRECTOR, prompt(input), context(input));
        return new Thesis(input.stock(), narrative(raw), input.attempt(), input.priorRejectionRationale(), Instant.now());
    }

    private String narrative(String raw) {
        if (raw == null || raw.isBlank()) {
            throw parseError("Empty thesis");
        }
        Optional<JsonNode> json = parser.parseObject(raw);
        if (json.isPresent()) {
            return requireText(json.get(), "thesis");
        }
        return raw.trim();
    }

    private String prompt(ThesisInput input) {
        StringBuilder prompt = new StringBuilder()
                .append("Task: ").append(input.task()).append('\n')
                .append("Stock: ").append(input.stock()).append('\n')
                .append("Allocation: ").append(plain(input.allocation())).append('\n')
                .append("Risk level (1-10): ").append(input.riskLevel());
        if (input.strategyType() != null) {
            prompt.append('\n').append("Strategy: ").append(input.strategyType());
        }
        if (input.priorRejectionRationale() != null) {
            prompt.append("\n\nYour previous thesis was rejected by risk management:\n")
                    .append(input.priorRejectionRationale())
                    .append("\nWrite a revised thesis that addresses this rejection.");
        }
        return prompt.toString();
    }

    private Map<String, Object> context(ThesisInput input) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("stock", input.stock());
        context.put("attempt", input.attempt());
        context.put("allocation", input.allocation());
        context.put("risk_level", input.riskLevel());
        if (input.strategyType() != null) {
            context.put("strategy_type", input.strategyType());
        }
        return context;
    }
}
