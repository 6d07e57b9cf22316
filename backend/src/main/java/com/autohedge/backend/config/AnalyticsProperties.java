package com.autohedge.backend.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "autohedge.analytics")
@Data
@Validated
public class AnalyticsProperties {

    @Min(1)
    @Max(365)
    private int lookbackDays = 30;

    @Min(1)
    private int topStocks = 5;
}
