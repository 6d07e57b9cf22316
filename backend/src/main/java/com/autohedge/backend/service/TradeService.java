package com.autohedge.backend.service;

import com.autohedge.backend.config.PipelineProperties;
import com.autohedge.backend.dto.TradeRequest;
import com.autohedge.backend.dto.TradeResponse;
import com.autohedge.backend.dto.TradeSubmissionResponse;
import com.autohedge.backend.exception.NotFoundException;
import com.autohedge.backend.exception.ValidationException;
import com.autohedge.backend.model.Trade;
import com.autohedge.backend.model.TradeStatus;
import com.autohedge.backend.model.User;
import com.autohedge.backend.repository.OffsetPageRequest;
import com.autohedge.backend.repository.TradeRepository;
import com.autohedge.backend.repository.UserRepository;
import com.autohedge.backend.trading.fund.AutoHedgeOutput;
import com.autohedge.backend.trading.fund.FundRunRequest;
import com.autohedge.backend.trading.fund.FundRunner;
import com.autohedge.backend.util.MoneyUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

@Slf4j
@Service
public class TradeService {

    static final String NOT_FOUND_MESSAGE = "Trade not found";
    static final String DISPATCH_REJECTED_MESSAGE = "Trade executor is saturated; the fund run was not started";

    private final TradeRepository tradeRepository;
    private final UserRepository userRepository;
    private final TradeRunExecutor tradeRunExecutor;
    private final TradeArtifactStore artifactStore;
    private final PipelineProperties pipelineProperties;
    private final MetricsService metricsService;
    private final ObjectMapper objectMapper;
    private final Executor tradeExecutor;

    public TradeService(TradeRepository tradeRepository,
                        UserRepository userRepository,
                        TradeRunExecutor tradeRunExecutor,
                        TradeArtifactStore artifactStore,
                        PipelineProperties pipelineProperties,
                        MetricsService metricsService,
                        ObjectMapper objectMapper,
                        @Qualifier("tradeExecutor") Executor tradeExecutor) {
        this.tradeRepository = tradeRepository;
        this.userRepository = userRepository;
        this.tradeRunExecutor = tradeRunExecutor;
        this.artifactStore = artifactStore;
        this.pipelineProperties = pipelineProperties;
        this.metricsService = metricsService;
        this.objectMapper = objectMapper;
        this.tradeExecutor = tradeExecutor;
    }

    @Transactional
    public TradeSubmissionResponse submit(String userId, TradeRequest request) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new NotFoundException("User not found"));
        List<String> stocks = FundRunner.normalizeStocks(request.getStocks());
        if (stocks.isEmpty()) {
            throw new ValidationException("At least one stock symbol is required");
        }
        int riskLevel = request.getRiskLevel() != null ? request.getRiskLevel() : pipelineProperties.getDefaultRiskLevel();
        Trade trade = tradeRepository.saveAndFlush(Trade.builder()
                .userId(userId)
                .stocks(stocks)
                .task(request.getTask().trim())
                .allocation(MoneyUtils.scale(request.getAllocation()))
                .strategyType(request.getStrategyType())
                .riskLevel(riskLevel)
                .status(TradeStatus.PENDING)
                .build());
        String tradeId = trade.getId();
        FundRunRequest runRequest = new FundRunRequest(tradeId, user.getFundName(), user.getFundDescription(), stocks,
                trade.getTask(), trade.getAllocation(), riskLevel, trade.getStrategyType());

        // Dispatch only after commit so the executor always finds the pending row.
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                try {
                    tradeExecutor.execute(() -> tradeRunExecutor.executeTrade(tradeId, userId, runRequest));
                } catch (RejectedExecutionException e) {
                    failUndispatched(tradeId, e);
                }
            }
        });
        metricsService.recordTradeSubmitted();
        log.info("Accepted trade {} for user {} over {}", tradeId, userId, stocks);

        return TradeSubmissionResponse.builder()
                .id(tradeId)
                .status(trade.getStatus())
                .createdAt(trade.getCreatedAt())
                .build();
    }

    private void failUndispatched(String tradeId, RejectedExecutionException e) {
        log.error("Trade executor rejected trade {}: {}", tradeId, e.getMessage());
        int updated = tradeRepository.failPending(tradeId, Instant.now(), DISPATCH_REJECTED_MESSAGE);
        if (updated == 0) {
            metricsService.recordCasConflict();
            return;
        }
        metricsService.recordTradeFinished(TradeStatus.FAILED, null);
    }

    @Transactional(readOnly = true)
    public List<TradeResponse> list(String userId, TradeStatus status, int limit, int skip) {
        if (limit < 1 || limit > 100) {
            throw new ValidationException("limit must be between 1 and 100");
        }
        if (skip < 0) {
            throw new ValidationException("skip must not be negative");
        }
        OffsetPageRequest page = new OffsetPageRequest(skip, limit);
        List<Trade> trades = status == null
                ? tradeRepository.findByUserIdOrderByCreatedAtDesc(userId, page)
                : tradeRepository.findByUserIdAndStatusOrderByCreatedAtDesc(userId, status, page);
        return trades.stream()
                .map(this::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public TradeResponse get(String userId, String tradeId) {
        return tradeRepository.findByIdAndUserId(tradeId, userId)
                .map(this::toResponse)
                .orElseThrow(() -> new NotFoundException(NOT_FOUND_MESSAGE));
    }

    /** Removes the record only; a running fund run is left to finish and its result discarded. */
    @Transactional
    public void delete(String userId, String tradeId) {
        if (tradeRepository.deleteOwned(tradeId, userId) == 0) {
            throw new NotFoundException(NOT_FOUND_MESSAGE);
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                artifactStore.delete(tradeId);
            }
        });
        log.info("Deleted trade {} for user {}", tradeId, userId);
    }

    private TradeResponse toResponse(Trade trade) {
        return TradeResponse.builder()
                .id(trade.getId())
                .userId(trade.getUserId())
                .stocks(trade.getStocks())
                .task(trade.getTask())
                .allocation(trade.getAllocation())
                .strategyType(trade.getStrategyType())
                .riskLevel(trade.getRiskLevel())
                .status(trade.getStatus())
                .createdAt(trade.getCreatedAt())
                .startedAt(trade.getStartedAt())
                .completedAt(trade.getCompletedAt())
                .errorMessage(trade.getErrorMessage())
                .result(trade.getStatus() == TradeStatus.COMPLETED ? readResult(trade) : null)
                .build();
    }

    public AutoHedgeOutput readResult(Trade trade) {
        if (trade.getResultJson() == null) {
            return null;
        }
        try {
            return objectMapper.readValue(trade.getResultJson(), AutoHedgeOutput.class);
        } catch (JsonProcessingException e) {
            log.error("Stored result of trade {} is unreadable", trade.getId(), e);
            throw new IllegalStateException("Stored trade result is unreadable", e);
        }
    }
}
