package com.autohedge.backend.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "autohedge.market-data")
@Data
@Validated
public class MarketDataProperties {

    /**
     * Root of the quote service; {@code GET {baseUrl}/quotes/{symbol}} must answer with
     * {@code {"quote": {..}, "indicators": {..}, "fundamentals": {..}}}.
     */
    private String baseUrl;

    private String apiKey;

    @Min(1)
    private int connectTimeoutMs = 5000;

    @Min(1)
    private int readTimeoutMs = 15000;

    @Min(1)
    private int limitPerSecond = 10;

    @Min(1)
    private long waitOpenSeconds = 30;
}
