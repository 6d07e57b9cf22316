package com.autohedge.backend.dto;

import com.autohedge.backend.model.TradeStatus;
import com.autohedge.backend.trading.fund.AutoHedgeOutput;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeResponse {
    private String id;
    private String userId;
    private List<String> stocks;
    private String task;
    private BigDecimal allocation;
    private String strategyType;
    private int riskLevel;
    private TradeStatus status;
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;
    private String errorMessage;
    private AutoHedgeOutput result;
}
