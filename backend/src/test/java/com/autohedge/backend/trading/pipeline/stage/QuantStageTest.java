package com.autohedge.backend.trading.pipeline.stage;

import com.autohedge.backend.exception.StageParseException;
import com.autohedge.backend.trading.agent.AgentCapability;
import com.autohedge.backend.trading.agent.AgentResponseParser;
import com.autohedge.backend.trading.agent.AgentRole;
import com.autohedge.backend.trading.marketdata.MarketSnapshot;
import com.autohedge.backend.trading.pipeline.QuantAnalysis;
import com.autohedge.backend.trading.pipeline.QuantInput;
import com.autohedge.backend.trading.pipeline.Thesis;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class QuantStageTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AgentCapability agent = mock(AgentCapability.class);
    private final QuantStage stage = new QuantStage(agent, new AgentResponseParser(objectMapper), objectMapper);

    private QuantInput input() {
        Thesis thesis = new Thesis("AAPL", "Services margin expansion", 2, "prior", Instant.now());
        MarketSnapshot snapshot = new MarketSnapshot("AAPL", Map.of("price", 190.5), Map.of("rsi", 61), Map.of(), Instant.now());
        return new QuantInput("AAPL", thesis, snapshot);
    }

    @Test
    void parsesSummaryScoreAndSignals() {
        when(agent.invoke(eq(AgentRole.QUANT), anyString(), anyMap()))
                .thenReturn("```json\n{\"summary\": \"Momentum intact\", \"score\": 72, \"signals\": {\"rsi\": 61, \"trend\": \"up\"}}\n```");

        QuantAnalysis analysis = stage.run(input());

        assertThat(analysis.summary()).isEqualTo("Momentum intact");
        assertThat(analysis.score()).isEqualTo(72.0);
        assertThat(analysis.thesisAttempt()).isEqualTo(2);
        assertThat(analysis.signals()).containsEntry("trend", "up");
    }

    @Test
    void passesMarketDataAsContext() {
        when(agent.invoke(eq(AgentRole.QUANT), anyString(), anyMap()))
                .thenReturn("{\"summary\": \"ok\", \"score\": 50}");

        stage.run(input());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> context = ArgumentCaptor.forClass(Map.class);
        verify(agent).invoke(eq(AgentRole.QUANT), anyString(), context.capture());
        assertThat(context.getValue()).containsKeys("quote", "indicators", "fundamentals");
        assertThat(context.getValue().get("quote")).isEqualTo(Map.of("price", 190.5));
    }

    @Test
    void scoreOutOfRangeIsParseError() {
        when(agent.invoke(eq(AgentRole.QUANT), anyString(), anyMap()))
                .thenReturn("{\"summary\": \"too keen\", \"score\": 140}");

        assertThatThrownBy(() -> stage.run(input())).isInstanceOf(StageParseException.class);
    }

    @Test
    void missingSummaryIsParseError() {
        when(agent.invoke(eq(AgentRole.QUANT), anyString(), anyMap()))
                .thenReturn("{\"score\": 40}");

        assertThatThrownBy(() -> stage.run(input())).isInstanceOf(StageParseException.class);
    }

    @Test
    void nanScoreIsParseError() {
        when(agent.invoke(eq(AgentRole.QUANT), anyString(), anyMap()))
                .thenReturn("{\"summary\": \"unsure\", \"score\": \"NaN\"}");

        assertThatThrownBy(() -> stage.run(input())).isInstanceOf(StageParseException.class);
    }
}
