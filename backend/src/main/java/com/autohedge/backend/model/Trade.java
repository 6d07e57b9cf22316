package com.autohedge.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A submitted fund run. After creation, status, timestamps, error and result only change
 * through the compare-and-set updates in {@code TradeRepository}.
 */
@Entity
@Table(name = "trades")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Trade {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "user_id", nullable = false, length = 36)
    private String userId;

    @Convert(converter = StringListConverter.class)
    @Column(nullable = false, length = 4000)
    private List<String> stocks;

    @Column(nullable = false, length = 4000)
    private String task;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal allocation;

    @Column(name = "strategy_type", length = 100)
    private String strategyType;

    @Column(name = "risk_level", nullable = false)
    private int riskLevel;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TradeStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    /** Serialised AutoHedgeOutput; present iff status is COMPLETED. */
    @Column(name = "result_json", length = 1000000)
    private String resultJson;

    @Version
    private Long version;

    @PrePersist
    void onCreate() {
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (status == null) {
            status = TradeStatus.PENDING;
        }
    }
}
