package com.autohedge.backend.trading.pipeline.stage;

import com.autohedge.backend.exception.StageParseException;
import com.autohedge.backend.exception.StageUnavailableException;
import com.autohedge.backend.trading.agent.AgentCapability;
import com.autohedge.backend.trading.agent.AgentResponseParser;
import com.autohedge.backend.trading.agent.AgentRole;
import com.autohedge.backend.trading.agent.AgentUnavailableException;
import com.autohedge.backend.trading.pipeline.PipelineStageName;
import com.autohedge.backend.trading.pipeline.Thesis;
import com.autohedge.backend.trading.pipeline.ThesisInput;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ThesisStageTest {

    private final AgentCapability agent = mock(AgentCapability.class);
    private final ThesisStage stage = new ThesisStage(agent, new AgentResponseParser(new ObjectMapper()));

    private ThesisInput input(String priorRejection, int attempt) {
        return new ThesisInput("NVDA", "Analyze NVDA for a growth position", new BigDecimal("50000"), 5,
                null, priorRejection, attempt);
    }

    @Test
    void plainTextBecomesNarrative() {
        when(agent.invoke(eq(AgentRole.DIRECTOR), anyString(), anyMap())).thenReturn("  Data center demand keeps growing.  ");

        Thesis thesis = stage.run(input(null, 1));

        assertThat(thesis.stock()).isEqualTo("NVDA");
        assertThat(thesis.narrative()).isEqualTo("Data center demand keeps growing.");
        assertThat(thesis.attempt()).isEqualTo(1);
        assertThat(thesis.priorRejectionRationale()).isNull();
        assertThat(thesis.generatedAt()).isNotNull();
    }

    @Test
    void jsonAnswerUsesThesisField() {
        when(agent.invoke(eq(AgentRole.DIRECTOR), anyString(), anyMap())).thenReturn("{\"thesis\": \"Revised view\"}");

        Thesis thesis = stage.run(input("Too concentrated", 2));

        assertThat(thesis.narrative()).isEqualTo("Revised view");
        assertThat(thesis.priorRejectionRationale()).isEqualTo("Too concentrated");
        assertThat(thesis.attempt()).isEqualTo(2);
    }

    @Test
    void promptCarriesPriorRejection() {
        when(agent.invoke(eq(AgentRole.DIRECTOR), anyString(), anyMap())).thenReturn("ok thesis");

        stage.run(input("Valuation too stretched", 2));

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(agent).invoke(eq(AgentRole.DIRECTOR), prompt.capture(), anyMap());
        assertThat(prompt.getValue()).contains("Valuation too stretched").contains("NVDA");
    }

    @Test
    void blankAnswerIsParseError() {
        when(agent.invoke(eq(AgentRole.DIRECTOR), anyString(), anyMap())).thenReturn("   ");

        assertThatThrownBy(() -> stage.run(input(null, 1)))
                .isInstanceOf(StageParseException.class)
                .extracting("stage").isEqualTo(PipelineStageName.THESIS);
    }

    @Test
    void unavailableAgentIsStageUnavailable() {
        when(agent.invoke(eq(AgentRole.DIRECTOR), anyString(), anyMap()))
                .thenThrow(new AgentUnavailableException("timeout"));

        assertThatThrownBy(() -> stage.run(input(null, 1)))
                .isInstanceOf(StageUnavailableException.class)
                .hasMessageContaining("timeout");
    }
}
