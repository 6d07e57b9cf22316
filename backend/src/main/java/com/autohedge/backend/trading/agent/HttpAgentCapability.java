package com.autohedge.backend.trading.agent;

import com.autohedge.backend.config.AgentProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;
import java.util.function.Supplier;

/**
 * {@link AgentCapability} backed by an OpenAI-compatible {@code /v1/chat/completions} endpoint.
 * Every role maps to a system message; the prompt and the serialised context form the user message.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HttpAgentCapability implements AgentCapability {

    private static final String COMPLETIONS_PATH = "/v1/chat/completions";

    private final RestTemplate agentRestTemplate;
    private final CircuitBreaker agentCircuitBreaker;
    private final RateLimiter agentRateLimiter;
    private final AgentProperties agentProperties;
    private final ObjectMapper objectMapper;

    @Override
    public String invoke(AgentRole role, String prompt, Map<String, Object> context) {
        if (!hasApiKey()) {
            throw new AgentUnavailableException("No API key configured for the reasoning provider");
        }
        String body = buildRequestBody(role, prompt, context);
        Supplier<String> decorated = CircuitBreaker.decorateSupplier(agentCircuitBreaker, () -> post(body));
        decorated = RateLimiter.decorateSupplier(agentRateLimiter, decorated);
        try {
            String raw = decorated.get();
            return extractContent(raw);
        } catch (CallNotPermittedException e) {
            throw new AgentUnavailableException("Reasoning provider circuit is open", e);
        } catch (RequestNotPermitted e) {
            throw new AgentUnavailableException("Reasoning provider rate limit exhausted", e);
        }
    }

    @Override
    public boolean isAvailable() {
        return hasApiKey() && agentCircuitBreaker.getState() != CircuitBreaker.State.OPEN;
    }

    private boolean hasApiKey() {
        return agentProperties.getApiKey() != null && !agentProperties.getApiKey().isBlank();
    }

    private String post(String body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(agentProperties.getApiKey());
        String url = agentProperties.getBaseUrl() + COMPLETIONS_PATH;
        try {
            ResponseEntity<String> response = agentRestTemplate.exchange(
                    url, HttpMethod.POST, new HttpEntity<>(body, headers), String.class);
            return response.getBody();
        } catch (HttpStatusCodeException e) {
            log.warn("Reasoning provider answered {}: {}", e.getStatusCode().value(), e.getResponseBodyAsString());
            throw new AgentUnavailableException("Reasoning provider returned HTTP " + e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            throw new AgentUnavailableException("Reasoning provider unreachable: " + e.getMessage(), e);
        }
    }

    private String buildRequestBody(AgentRole role, String prompt, Map<String, Object> context) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", agentProperties.getModel());
        root.put("temperature", agentProperties.getTemperature());
        ArrayNode messages = root.putArray("messages");
        messages.addObject()
                .put("role", "system")
                .put("content", role.systemPrompt());
        messages.addObject()
                .put("role", "user")
                .put("content", prompt + "\n\nContext:\n" + writeContext(context));
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise agent request", e);
        }
    }

    private String writeContext(Map<String, Object> context) {
        if (context == null || context.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(context);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise agent context", e);
        }
    }

    private String extractContent(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new AgentResponseException("Empty response body");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new AgentResponseException("Response body is not JSON");
        }
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual() || content.asText().isBlank()) {
            throw new AgentResponseException("Response carries no message content");
        }
        return content.asText();
    }
}
