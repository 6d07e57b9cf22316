package com.autohedge.backend.dto;

import com.autohedge.backend.model.TradeStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeSubmissionResponse {
    private String id;
    private TradeStatus status;
    private Instant createdAt;
}
