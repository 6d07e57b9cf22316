package com.autohedge.backend.trading.fund;

import com.autohedge.backend.config.PipelineProperties;
import com.autohedge.backend.exception.CollaboratorUnavailableException;
import com.autohedge.backend.exception.ValidationException;
import com.autohedge.backend.trading.agent.AgentCapability;
import com.autohedge.backend.trading.marketdata.MarketDataProvider;
import com.autohedge.backend.trading.pipeline.StockPipelineOrchestrator;
import com.autohedge.backend.trading.pipeline.StockPipelineRequest;
import com.autohedge.backend.trading.pipeline.StockResult;
import com.autohedge.backend.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;

/**
 * Fans a fund run out to one {@link StockPipelineOrchestrator} per stock and joins the results
 * back in input order. A stock that fails never affects its siblings.
 */
@Slf4j
@Service
public class FundRunner {

    private final StockPipelineOrchestrator orchestrator;
    private final AgentCapability agentCapability;
    private final MarketDataProvider marketDataProvider;
    private final PipelineProperties pipelineProperties;
    private final Executor pipelineExecutor;

    public FundRunner(StockPipelineOrchestrator orchestrator,
                      AgentCapability agentCapability,
                      MarketDataProvider marketDataProvider,
                      PipelineProperties pipelineProperties,
                      @Qualifier("pipelineExecutor") Executor pipelineExecutor) {
        this.orchestrator = orchestrator;
        this.agentCapability = agentCapability;
        this.marketDataProvider = marketDataProvider;
        this.pipelineProperties = pipelineProperties;
        this.pipelineExecutor = pipelineExecutor;
    }

    public AutoHedgeOutput run(FundRunRequest request) {
        List<String> stocks = normalizeStocks(request.stocks());
        if (stocks.isEmpty()) {
            throw new ValidationException("At least one stock symbol is required");
        }
        if (!MoneyUtils.isPositive(request.allocation())) {
            throw new ValidationException("Allocation must be positive");
        }
        preflight();

        BigDecimal perStock = MoneyUtils.divide(request.allocation(), stocks.size());
        int riskLevel = request.riskLevel() != null ? request.riskLevel() : pipelineProperties.getDefaultRiskLevel();
        int width = width(stocks.size());
        log.info("Fund run '{}' over {} stock(s), width {}, {} per stock", request.name(), stocks.size(), width, perStock);

        Semaphore permits = new Semaphore(width);
        List<CompletableFuture<StockResult>> futures = new ArrayList<>(stocks.size());
        for (String stock : stocks) {
            StockPipelineRequest stockRequest =
                    new StockPipelineRequest(stock, request.task(), perStock, riskLevel, request.strategyType());
            permits.acquireUninterruptibly();
            try {
                futures.add(CompletableFuture
                        .supplyAsync(() -> runStock(stockRequest), pipelineExecutor)
                        .whenComplete((result, error) -> permits.release()));
            } catch (RejectedExecutionException e) {
                permits.release();
                log.error("Pipeline executor rejected {}", stock, e);
                futures.add(CompletableFuture.completedFuture(
                        StockResult.failed(stock, null, "Pipeline executor saturated")));
            }
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<StockResult> results = futures.stream().map(CompletableFuture::join).toList();
        return new AutoHedgeOutput(
                request.id() != null ? request.id() : UUID.randomUUID().toString(),
                request.name(),
                request.description(),
                stocks,
                request.task(),
                MoneyUtils.scale(request.allocation()),
                Instant.now(),
                results
        );
    }

    private StockResult runStock(StockPipelineRequest request) {
        try {
            return orchestrator.run(request);
        } catch (RuntimeException e) {
            log.error("Pipeline for {} crashed", request.stock(), e);
            return StockResult.failed(request.stock(), null, "Unexpected error: " + e.getMessage());
        }
    }

    private void preflight() {
        if (!agentCapability.isAvailable()) {
            throw new CollaboratorUnavailableException("Reasoning provider is unavailable");
        }
        if (!marketDataProvider.isAvailable()) {
            throw new CollaboratorUnavailableException("Market data provider is unavailable");
        }
    }

    int width(int stockCount) {
        int configured = pipelineProperties.getWorkerPoolWidth() > 0 ? pipelineProperties.getWorkerPoolWidth() : stockCount;
        return Math.max(1, Math.min(Math.min(configured, pipelineProperties.getMaxWorkerPoolWidth()), stockCount));
    }

    /** Trims, upper-cases and de-duplicates symbols, keeping first occurrence order. */
    public static List<String> normalizeStocks(List<String> stocks) {
        if (stocks == null) {
            return List.of();
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String stock : stocks) {
            if (stock != null && !stock.isBlank()) {
                unique.add(stock.trim().toUpperCase(Locale.ROOT));
            }
        }
        return List.copyOf(unique);
    }
}
