package com.autohedge.backend.service;

import com.autohedge.backend.exception.CollaboratorUnavailableException;
import com.autohedge.backend.model.Trade;
import com.autohedge.backend.model.TradeStatus;
import com.autohedge.backend.model.User;
import com.autohedge.backend.repository.TradeRepository;
import com.autohedge.backend.repository.UserRepository;
import com.autohedge.backend.trading.fund.AutoHedgeOutput;
import com.autohedge.backend.trading.fund.FundRunRequest;
import com.autohedge.backend.trading.fund.FundRunner;
import com.autohedge.backend.trading.pipeline.StockResult;
import com.autohedge.backend.trading.pipeline.StockStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.boot.test.context.TestConfiguration;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DataJpaTest
@Import({TradeRunExecutor.class, TradeRunExecutorTest.TestConfig.class})
class TradeRunExecutorTest {

    @TestConfiguration
    static class TestConfig {
        @Bean
        ObjectMapper objectMapper() {
            return new ObjectMapper().findAndRegisterModules();
        }
    }

    @Autowired
    private TradeRepository tradeRepository;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private TradeRunExecutor tradeRunExecutor;

    @MockBean
    private FundRunner fundRunner;

    @MockBean
    private TradeArtifactStore artifactStore;

    @MockBean
    private MetricsService metricsService;

    private User user;

    @BeforeEach
    void setUp() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        user = userRepository.save(User.builder()
                .username("exec_" + suffix)
                .email("exec_" + suffix + "@example.com")
                .fundName("Executor Fund")
                .build());
    }

    private Trade pendingTrade() {
        return tradeRepository.saveAndFlush(Trade.builder()
                .userId(user.getId())
                .stocks(List.of("AAPL"))
                .task("Evaluate AAPL for the fund")
                .allocation(new BigDecimal("1000.0000"))
                .riskLevel(5)
                .status(TradeStatus.PENDING)
                .build());
    }

    private FundRunRequest request(Trade trade) {
        return new FundRunRequest(trade.getId(), "Executor Fund", null, trade.getStocks(), trade.getTask(),
                trade.getAllocation(), trade.getRiskLevel(), null);
    }

    private static AutoHedgeOutput output(String id) {
        StockResult result = new StockResult("AAPL", StockStatus.REJECTED_EXHAUSTED, null, null, null, null,
                List.of(), List.of(), 3, "Rejected by risk after 3 thesis attempt(s): too risky", null);
        return new AutoHedgeOutput(id, "Executor Fund", null, List.of("AAPL"), "Evaluate AAPL for the fund",
                new BigDecimal("1000.0000"), Instant.now(), List.of(result));
    }

    @Test
    void executeTradeStoresResultAndCompletes() {
        Trade trade = pendingTrade();
        when(fundRunner.run(any())).thenReturn(output(trade.getId()));

        tradeRunExecutor.executeTrade(trade.getId(), user.getId(), request(trade));

        Trade stored = tradeRepository.findById(trade.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(TradeStatus.COMPLETED);
        assertThat(stored.getStartedAt()).isNotNull();
        assertThat(stored.getCompletedAt()).isNotNull();
        assertThat(stored.getResultJson()).contains("\"AAPL\"").contains("REJECTED_EXHAUSTED".toLowerCase());
        assertThat(stored.getErrorMessage()).isNull();
        assertThat(stored.getVersion()).isGreaterThan(trade.getVersion());
        verify(artifactStore).write(eq(trade.getId()), anyString());
        verify(metricsService).recordTradeFinished(eq(TradeStatus.COMPLETED), any());
    }

    @Test
    void collaboratorOutageMarksFailed() {
        Trade trade = pendingTrade();
        when(fundRunner.run(any())).thenThrow(new CollaboratorUnavailableException("Market data provider is unavailable"));

        tradeRunExecutor.executeTrade(trade.getId(), user.getId(), request(trade));

        Trade stored = tradeRepository.findById(trade.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(TradeStatus.FAILED);
        assertThat(stored.getErrorMessage()).isEqualTo("Market data provider is unavailable");
        assertThat(stored.getResultJson()).isNull();
        verify(artifactStore, never()).write(anyString(), anyString());
    }

    @Test
    void unexpectedErrorMarksFailedWithMessage() {
        Trade trade = pendingTrade();
        when(fundRunner.run(any())).thenThrow(new RuntimeException("boom"));

        tradeRunExecutor.executeTrade(trade.getId(), user.getId(), request(trade));

        Trade stored = tradeRepository.findById(trade.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(TradeStatus.FAILED);
        assertThat(stored.getErrorMessage()).isEqualTo("boom");
    }

    @Test
    void tradeNotPendingIsDropped() {
        Trade trade = pendingTrade();
        tradeRepository.markRunning(trade.getId(), TradeStatus.PENDING, TradeStatus.RUNNING, Instant.now());

        tradeRunExecutor.executeTrade(trade.getId(), user.getId(), request(trade));

        verify(fundRunner, never()).run(any());
        verify(metricsService).recordCasConflict();
    }

    @Test
    void tradeDeletedWhileRunningDiscardsResult() {
        Trade trade = pendingTrade();
        when(fundRunner.run(any())).thenAnswer(inv -> {
            tradeRepository.deleteOwned(trade.getId(), user.getId());
            return output(trade.getId());
        });

        tradeRunExecutor.executeTrade(trade.getId(), user.getId(), request(trade));

        assertThat(tradeRepository.findById(trade.getId())).isEmpty();
        verify(artifactStore, never()).write(anyString(), anyString());
        verify(metricsService).recordCasConflict();
    }
}
