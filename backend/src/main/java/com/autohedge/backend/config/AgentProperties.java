package com.autohedge.backend.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "autohedge.agent")
@Data
@Validated
public class AgentProperties {

    @NotBlank
    private String baseUrl = "https://api.openai.com";

    private String apiKey;

    @NotBlank
    private String model = "gpt-4o";

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private double temperature = 0.3;

    @Min(1)
    private int connectTimeoutMs = 10000;

    @Min(1)
    private int readTimeoutMs = 60000;

    private Resilience resilience = new Resilience();

    @Data
    public static class Resilience {
        @Min(1)
        private float failureRateThreshold = 50;

        @Min(1)
        private long waitOpenSeconds = 30;

        @Min(1)
        private int slidingWindowSize = 20;

        @Min(1)
        private int limitPerSecond = 5;

        @Min(0)
        private long rateTimeoutMs = 5000;
    }
}
