package com.autohedge.backend.trading.pipeline.stage;

import com.autohedge.backend.trading.agent.AgentCapability;
import com.autohedge.backend.trading.agent.AgentResponseParser;
import com.autohedge.backend.trading.agent.AgentRole;
import com.autohedge.backend.trading.pipeline.PipelineStageName;
import com.autohedge.backend.trading.pipeline.QuantAnalysis;
import com.autohedge.backend.trading.pipeline.QuantInput;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class QuantStage extends AgentBackedStage<QuantInput, QuantAnalysis> {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public QuantStage(AgentCapability agentCapability, AgentResponseParser parser, ObjectMapper objectMapper) {
        super(agentCapability, parser);
        this.objectMapper = objectMapper;
    }

    @Override
    public PipelineStageName name() {
        return PipelineStageName.QUANT;
    }

    @Override
    public QuantAnalysis run(QuantInput input) {
        String prompt = "Evaluate the thesis for " + input.stock() + " against the market data.\n\nThesis:\n"
                + input.thesis().narrative();
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("stock", input.stock());
        context.put("quote", input.snapshot().quote());
        context.put("indicators", input.snapshot().indicators());
        context.put("fundamentals", input.snapshot().fundamentals());

        JsonNode json = requireObject(call(AgentRole.QUANT, prompt, context));
        String summary = requireText(json, "summary");
        double score = requireNumber(json, "score");
        if (!(score >= 0 && score <= 100)) {
            throw parseError("Score " + score + " outside 0..100");
        }
        JsonNode signals = json.get("signals");
        Map<String, Object> signalMap = signals != null && signals.isObject()
                ? objectMapper.convertValue(signals, MAP_TYPE)
                : Map.of();
        return new QuantAnalysis(input.stock(), input.thesis().attempt(), summary, score, signalMap, Instant.now());
    }
}
