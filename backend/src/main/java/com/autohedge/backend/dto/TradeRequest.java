package com.autohedge.backend.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeRequest {
    @NotEmpty
    @Size(max = 50)
    private List<@NotBlank @Size(max = 20) String> stocks;
    @NotBlank
    @Size(min = 10, max = 4000)
    private String task;
    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal allocation;
    @Size(max = 100)
    private String strategyType;
    @Min(1)
    @Max(10)
    private Integer riskLevel;
}
