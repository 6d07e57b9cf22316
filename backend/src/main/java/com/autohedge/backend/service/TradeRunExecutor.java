package com.autohedge.backend.service;

import com.autohedge.backend.exception.CollaboratorUnavailableException;
import com.autohedge.backend.exception.ValidationException;
import com.autohedge.backend.model.TradeStatus;
import com.autohedge.backend.repository.TradeRepository;
import com.autohedge.backend.trading.fund.AutoHedgeOutput;
import com.autohedge.backend.trading.fund.FundRunRequest;
import com.autohedge.backend.trading.fund.FundRunner;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;

/**
 * Runs one submitted trade on the trade executor: pending, running, then completed or failed.
 * Each move is a compare-and-set; a move that matches no row means the trade was deleted and the
 * work is dropped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TradeRunExecutor {

    private final TradeRepository tradeRepository;
    private final FundRunner fundRunner;
    private final TradeArtifactStore artifactStore;
    private final MetricsService metricsService;
    private final ObjectMapper objectMapper;

    public void executeTrade(String tradeId, String userId, FundRunRequest request) {
        MDC.put("tradeId", tradeId);
        MDC.put("userId", userId);
        Instant startedAt = Instant.now();
        log.info("EXECUTOR START: trade {} for user {}", tradeId, userId);
        try {
            if (tradeRepository.markRunning(tradeId, TradeStatus.PENDING, TradeStatus.RUNNING, startedAt) == 0) {
                log.info("Trade {} is no longer pending; dropping run", tradeId);
                metricsService.recordCasConflict();
                return;
            }

            AutoHedgeOutput output;
            try {
                output = fundRunner.run(request);
            } catch (CollaboratorUnavailableException | ValidationException e) {
                log.warn("Trade {} could not start: {}", tradeId, e.getMessage());
                finishFailed(tradeId, e.getMessage(), startedAt);
                return;
            }

            String json = serialize(output);
            int updated = tradeRepository.finish(tradeId, TradeStatus.RUNNING, TradeStatus.COMPLETED,
                    Instant.now(), json, null);
            if (updated == 0) {
                log.info("Trade {} was deleted while running; discarding result", tradeId);
                metricsService.recordCasConflict();
                return;
            }
            artifactStore.write(tradeId, json);
            if (!tradeRepository.existsById(tradeId)) {
                artifactStore.delete(tradeId);
            }
            metricsService.recordTradeFinished(TradeStatus.COMPLETED, Duration.between(startedAt, Instant.now()));
            log.info("✅ Trade {} completed with {} stock result(s)", tradeId, output.results().size());
        } catch (Exception ex) {
            log.error("❌ Trade {} failed", tradeId, ex);
            finishFailed(tradeId, ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName(), startedAt);
        } finally {
            log.info("EXECUTOR STOP: trade {}", tradeId);
            MDC.clear();
        }
    }

    private void finishFailed(String tradeId, String message, Instant startedAt) {
        int updated = tradeRepository.finish(tradeId, TradeStatus.RUNNING, TradeStatus.FAILED,
                Instant.now(), null, truncate(message));
        if (updated == 0) {
            log.info("Trade {} no longer running; failure not recorded", tradeId);
            metricsService.recordCasConflict();
            return;
        }
        metricsService.recordTradeFinished(TradeStatus.FAILED, Duration.between(startedAt, Instant.now()));
    }

    private String serialize(AutoHedgeOutput output) {
        try {
            return objectMapper.writeValueAsString(output);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise fund output", e);
        }
    }

    private static String truncate(String message) {
        if (message == null) {
            return "Trade failed";
        }
        return message.length() > 2000 ? message.substring(0, 2000) : message;
    }
}
