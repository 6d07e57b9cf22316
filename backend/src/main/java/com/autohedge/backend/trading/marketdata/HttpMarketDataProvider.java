package com.autohedge.backend.trading.marketdata;

import com.autohedge.backend.config.MarketDataProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.Map;
import java.util.function.Supplier;

@Slf4j
@Service
@RequiredArgsConstructor
public class HttpMarketDataProvider implements MarketDataProvider {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final RestTemplate marketDataRestTemplate;
    private final CircuitBreaker marketDataCircuitBreaker;
    private final RateLimiter marketDataRateLimiter;
    private final MarketDataProperties marketDataProperties;
    private final ObjectMapper objectMapper;

    @Override
    public MarketSnapshot fetch(String symbol) {
        if (!isConfigured()) {
            throw new MarketDataUnavailableException("Market data base URL is not configured", null);
        }
        Supplier<String> decorated = CircuitBreaker.decorateSupplier(marketDataCircuitBreaker, () -> get(symbol));
        decorated = RateLimiter.decorateSupplier(marketDataRateLimiter, decorated);
        try {
            return toSnapshot(symbol, decorated.get());
        } catch (CallNotPermittedException | RequestNotPermitted e) {
            throw new MarketDataUnavailableException("Market data provider not accepting calls", e);
        }
    }

    @Override
    public boolean isAvailable() {
        return isConfigured() && marketDataCircuitBreaker.getState() != CircuitBreaker.State.OPEN;
    }

    private boolean isConfigured() {
        return marketDataProperties.getBaseUrl() != null && !marketDataProperties.getBaseUrl().isBlank();
    }

    private String get(String symbol) {
        HttpHeaders headers = new HttpHeaders();
        if (marketDataProperties.getApiKey() != null && !marketDataProperties.getApiKey().isBlank()) {
            headers.setBearerAuth(marketDataProperties.getApiKey());
        }
        try {
            return marketDataRestTemplate.exchange(
                    marketDataProperties.getBaseUrl() + "/quotes/{symbol}",
                    HttpMethod.GET,
                    new HttpEntity<>(headers),
                    String.class,
                    symbol
            ).getBody();
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                throw new SymbolNotFoundException(symbol);
            }
            throw new MarketDataUnavailableException("Market data provider returned HTTP " + e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            throw new MarketDataUnavailableException("Market data provider unreachable: " + e.getMessage(), e);
        }
    }

    private MarketSnapshot toSnapshot(String symbol, String body) {
        if (body == null || body.isBlank()) {
            throw new SymbolNotFoundException(symbol);
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            return new MarketSnapshot(
                    symbol,
                    toMap(root.get("quote")),
                    toMap(root.get("indicators")),
                    toMap(root.get("fundamentals")),
                    Instant.now()
            );
        } catch (JsonProcessingException e) {
            log.warn("Unreadable market data payload for {}: {}", symbol, e.getMessage());
            throw new MarketDataUnavailableException("Unreadable market data payload for " + symbol, e);
        }
    }

    private Map<String, Object> toMap(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        return objectMapper.convertValue(node, MAP_TYPE);
    }
}
