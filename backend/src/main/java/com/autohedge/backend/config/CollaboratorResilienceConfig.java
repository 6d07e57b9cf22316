package com.autohedge.backend.config;

import com.autohedge.backend.trading.agent.AgentResponseException;
import com.autohedge.backend.trading.marketdata.SymbolNotFoundException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Circuit breakers and rate limiters for the two external collaborators. No Retry:
 * stage retries belong to the pipeline orchestrator.
 */
@Configuration
public class CollaboratorResilienceConfig {

    @Bean
    public CircuitBreaker agentCircuitBreaker(AgentProperties agentProperties) {
        AgentProperties.Resilience resilience = agentProperties.getResilience();
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(resilience.getFailureRateThreshold())
                .waitDurationInOpenState(Duration.ofSeconds(resilience.getWaitOpenSeconds()))
                .slidingWindowSize(resilience.getSlidingWindowSize())
                .ignoreExceptions(AgentResponseException.class)
                .build();
        return CircuitBreaker.of("agent", config);
    }

    @Bean
    public RateLimiter agentRateLimiter(AgentProperties agentProperties) {
        AgentProperties.Resilience resilience = agentProperties.getResilience();
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(resilience.getLimitPerSecond())
                .timeoutDuration(Duration.ofMillis(resilience.getRateTimeoutMs()))
                .build();
        return RateLimiter.of("agent", config);
    }

    @Bean
    public CircuitBreaker marketDataCircuitBreaker(MarketDataProperties marketDataProperties) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofSeconds(marketDataProperties.getWaitOpenSeconds()))
                .slidingWindowSize(20)
                .ignoreExceptions(SymbolNotFoundException.class)
                .build();
        return CircuitBreaker.of("market-data", config);
    }

    @Bean
    public RateLimiter marketDataRateLimiter(MarketDataProperties marketDataProperties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(marketDataProperties.getLimitPerSecond())
                .timeoutDuration(Duration.ofSeconds(5))
                .build();
        return RateLimiter.of("market-data", config);
    }
}
