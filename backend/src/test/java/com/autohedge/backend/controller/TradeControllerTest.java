package com.autohedge.backend.controller;

import com.autohedge.backend.dto.UserCreateRequest;
import com.autohedge.backend.dto.UserRegistrationResponse;
import com.autohedge.backend.model.TradeStatus;
import com.autohedge.backend.repository.TradeRepository;
import com.autohedge.backend.security.ApiKeyAuthenticationFilter;
import com.autohedge.backend.service.TradeRunExecutor;
import com.autohedge.backend.service.UserService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class TradeControllerTest {

    private static final String VALID_TRADE = """
            {"stocks": ["nvda", "AAPL", "NVDA"], "task": "Build a growth allocation", "allocation": 50000,
             "strategy_type": "momentum", "risk_level": 6}
            """;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private UserService userService;

    @Autowired
    private TradeRepository tradeRepository;

    @Autowired
    private ObjectMapper objectMapper;

    // Keeps submitted trades pending.
    @MockBean
    private TradeRunExecutor tradeRunExecutor;

    private String apiKey;
    private String otherApiKey;

    @BeforeEach
    void setUp() {
        apiKey = register().getApiKey();
        otherApiKey = register().getApiKey();
    }

    private UserRegistrationResponse register() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        return userService.register(UserCreateRequest.builder()
                .username("trader_" + suffix)
                .email("trader_" + suffix + "@example.com")
                .fundName("Trader Fund")
                .build());
    }

    private String submit(String key) throws Exception {
        String body = mockMvc.perform(post("/trades")
                        .header(ApiKeyAuthenticationFilter.API_KEY_HEADER, key)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(VALID_TRADE))
                .andExpect(status().isAccepted())
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(body).get("id").asText();
    }

    @Test
    void submitReturnsPendingTradeWithNormalizedStocks() throws Exception {
        mockMvc.perform(post("/trades")
                        .header(ApiKeyAuthenticationFilter.API_KEY_HEADER, apiKey)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(VALID_TRADE))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.id").isNotEmpty())
                .andExpect(jsonPath("$.status").value("pending"))
                .andExpect(jsonPath("$.created_at").isNotEmpty());

        String tradeId = submit(apiKey);
        mockMvc.perform(get("/trades/{id}", tradeId).header(ApiKeyAuthenticationFilter.API_KEY_HEADER, apiKey))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stocks.length()").value(2))
                .andExpect(jsonPath("$.stocks[0]").value("NVDA"))
                .andExpect(jsonPath("$.stocks[1]").value("AAPL"))
                .andExpect(jsonPath("$.risk_level").value(6))
                .andExpect(jsonPath("$.status").value("pending"));
    }

    @Test
    void missingOrUnknownKeyIsUnauthorized() throws Exception {
        mockMvc.perform(post("/trades").contentType(MediaType.APPLICATION_JSON).content(VALID_TRADE))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("UNAUTHORIZED"));
        mockMvc.perform(get("/trades").header(ApiKeyAuthenticationFilter.API_KEY_HEADER, "ah_bogus"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void otherUsersTradeIsNotFound() throws Exception {
        String tradeId = submit(apiKey);

        mockMvc.perform(get("/trades/{id}", tradeId).header(ApiKeyAuthenticationFilter.API_KEY_HEADER, otherApiKey))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Trade not found"));
        mockMvc.perform(delete("/trades/{id}", tradeId).header(ApiKeyAuthenticationFilter.API_KEY_HEADER, otherApiKey))
                .andExpect(status().isNotFound());
        assertThat(tradeRepository.findById(tradeId)).isPresent();
    }

    @Test
    void deleteTwiceReturnsNotFoundSecondTime() throws Exception {
        String tradeId = submit(apiKey);

        mockMvc.perform(delete("/trades/{id}", tradeId).header(ApiKeyAuthenticationFilter.API_KEY_HEADER, apiKey))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Trade deleted successfully"));
        mockMvc.perform(delete("/trades/{id}", tradeId).header(ApiKeyAuthenticationFilter.API_KEY_HEADER, apiKey))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/trades/{id}", tradeId).header(ApiKeyAuthenticationFilter.API_KEY_HEADER, apiKey))
                .andExpect(status().isNotFound());
    }

    @Test
    void invalidBodiesAreUnprocessable() throws Exception {
        String[] bodies = {
                "{\"stocks\": [], \"task\": \"Build a growth allocation\", \"allocation\": 100}",
                "{\"stocks\": [\"AAPL\"], \"task\": \"short\", \"allocation\": 100}",
                "{\"stocks\": [\"AAPL\"], \"task\": \"Build a growth allocation\", \"allocation\": 0}",
                "{\"stocks\": [\"AAPL\"], \"task\": \"Build a growth allocation\", \"allocation\": 100, \"risk_level\": 11}",
                "{\"stocks\": [\"  \"], \"task\": \"Build a growth allocation\", \"allocation\": 100}",
                "{not json"
        };
        for (String body : bodies) {
            mockMvc.perform(post("/trades")
                            .header(ApiKeyAuthenticationFilter.API_KEY_HEADER, apiKey)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body))
                    .andExpect(status().isUnprocessableEntity());
        }
    }

    @Test
    void listFiltersByStatusAndPages() throws Exception {
        String first = submit(apiKey);
        String second = submit(apiKey);
        String third = submit(apiKey);
        tradeRepository.markRunning(first, TradeStatus.PENDING, TradeStatus.RUNNING, Instant.now());

        String body = mockMvc.perform(get("/trades").header(ApiKeyAuthenticationFilter.API_KEY_HEADER, apiKey))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        JsonNode all = objectMapper.readTree(body);
        assertThat(all).hasSize(3);
        assertThat(all.get(0).get("id").asText()).isEqualTo(third);
        assertThat(all.get(2).get("id").asText()).isEqualTo(first);

        mockMvc.perform(get("/trades").param("status", "running").header(ApiKeyAuthenticationFilter.API_KEY_HEADER, apiKey))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].id").value(first));
        mockMvc.perform(get("/trades").param("limit", "1").param("skip", "1")
                        .header(ApiKeyAuthenticationFilter.API_KEY_HEADER, apiKey))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].id").value(second));
        mockMvc.perform(get("/trades").header(ApiKeyAuthenticationFilter.API_KEY_HEADER, otherApiKey))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    void invalidListParametersAreUnprocessable() throws Exception {
        mockMvc.perform(get("/trades").param("status", "bogus").header(ApiKeyAuthenticationFilter.API_KEY_HEADER, apiKey))
                .andExpect(status().isUnprocessableEntity());
        mockMvc.perform(get("/trades").param("limit", "0").header(ApiKeyAuthenticationFilter.API_KEY_HEADER, apiKey))
                .andExpect(status().isUnprocessableEntity());
        mockMvc.perform(get("/trades").param("limit", "101").header(ApiKeyAuthenticationFilter.API_KEY_HEADER, apiKey))
                .andExpect(status().isUnprocessableEntity());
        mockMvc.perform(get("/trades").param("skip", "-1").header(ApiKeyAuthenticationFilter.API_KEY_HEADER, apiKey))
                .andExpect(status().isUnprocessableEntity());
    }

    @Test
    void analyticsHistoryCountsOwnTradesOnly() throws Exception {
        submit(apiKey);
        submit(apiKey);

        mockMvc.perform(get("/analytics/history").param("days", "7").header(ApiKeyAuthenticationFilter.API_KEY_HEADER, apiKey))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.period_days").value(7))
                .andExpect(jsonPath("$.total_trades").value(2))
                .andExpect(jsonPath("$.in_flight_trades").value(2));
        mockMvc.perform(get("/analytics/history").param("days", "400").header(ApiKeyAuthenticationFilter.API_KEY_HEADER, apiKey))
                .andExpect(status().isUnprocessableEntity());
    }
}
