package com.autohedge.backend.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "autohedge.pipeline")
@Data
@Validated
public class PipelineProperties {

    /** Re-thesis rounds allowed after a risk rejection. */
    @Min(0)
    private int maxRetries = 2;

    /** Extra attempts of the same stage after an unparseable answer. */
    @Min(0)
    private int stageParseRetries = 1;

    /** Orchestrators running at once per fund run; 0 sizes the pool to the stock count. */
    @Min(0)
    private int workerPoolWidth = 0;

    @Min(1)
    private int maxWorkerPoolWidth = 8;

    @Min(1)
    @Max(10)
    private int defaultRiskLevel = 5;
}
