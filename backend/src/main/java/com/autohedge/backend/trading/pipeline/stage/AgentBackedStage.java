package com.autohedge.backend.trading.pipeline.stage;

import com.autohedge.backend.exception.StageParseException;
import com.autohedge.backend.exception.StageUnavailableException;
import com.autohedge.backend.trading.agent.AgentCapability;
import com.autohedge.backend.trading.agent.AgentResponseException;
import com.autohedge.backend.trading.agent.AgentResponseParser;
import com.autohedge.backend.trading.agent.AgentRole;
import com.autohedge.backend.trading.agent.AgentUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

@Slf4j
@RequiredArgsConstructor
abstract class AgentBackedStage<I, O> implements PipelineStage<I, O> {

    protected final AgentCapability agentCapability;
    protected final AgentResponseParser parser;

    protected String call(AgentRole role, String prompt, Map<String, Object> context) {
        try {
            String response = agentCapability.invoke(role, prompt, context);
            log.debug("Stage {} received {} chars from {}", name(), response == null ? 0 : response.length(), role.wireName());
            return response;
        } catch (AgentUnavailableException e) {
            throw new StageUnavailableException(name(), e.getMessage(), e);
        } catch (AgentResponseException e) {
            throw new StageParseException(name(), e.getMessage(), e);
        }
    }

    protected JsonNode requireObject(String raw) {
        return parser.parseObject(raw)
                .orElseThrow(() -> parseError("Answer carries no JSON object"));
    }

    protected String requireText(JsonNode node, String field) {
        return parser.text(node, field)
                .orElseThrow(() -> parseError("Missing field '" + field + "'"));
    }

    protected double requireNumber(JsonNode node, String field) {
        return parser.number(node, field)
                .orElseThrow(() -> parseError("Missing or non-numeric field '" + field + "'"));
    }

    /** Absent or null is empty; a value that is present but not a finite number is a parse error. */
    protected Optional<Double> optionalNumber(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        return Optional.of(requireNumber(node, field));
    }

    protected static String plain(BigDecimal amount) {
        return amount == null ? "0" : amount.stripTrailingZeros().toPlainString();
    }

    protected StageParseException parseError(String message) {
        return new StageParseException(name(), message);
    }
}
