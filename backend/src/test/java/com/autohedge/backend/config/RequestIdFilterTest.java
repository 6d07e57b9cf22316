package com.autohedge.backend.config;

import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class RequestIdFilterTest {

    private final RequestIdFilter filter = new RequestIdFilter();

    @Test
    void clientIdsAreEchoedAndVisibleDuringTheRequest() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/trades");
        request.addHeader(RequestIdFilter.REQUEST_ID_HEADER, "req-42");
        request.addHeader(RequestIdFilter.CORRELATION_ID_HEADER, "batch:7");
        MockHttpServletResponse response = new MockHttpServletResponse();
        Map<String, String> seen = new HashMap<>();
        FilterChain chain = (req, res) -> {
            seen.put("request", MDC.get(RequestIdFilter.REQUEST_ID_KEY));
            seen.put("correlation", MDC.get(RequestIdFilter.CORRELATION_ID_KEY));
        };

        filter.doFilter(request, response, chain);

        assertThat(seen).containsEntry("request", "req-42").containsEntry("correlation", "batch:7");
        assertThat(response.getHeader(RequestIdFilter.REQUEST_ID_HEADER)).isEqualTo("req-42");
        assertThat(response.getHeader(RequestIdFilter.CORRELATION_ID_HEADER)).isEqualTo("batch:7");
        assertThat(MDC.get(RequestIdFilter.REQUEST_ID_KEY)).isNull();
    }

    @Test
    void malformedIdIsReplacedWithGeneratedOne() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/trades");
        request.addHeader(RequestIdFilter.REQUEST_ID_HEADER, "evil\r\nSet-Cookie: x=1");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, res) -> { });

        String requestId = response.getHeader(RequestIdFilter.REQUEST_ID_HEADER);
        assertThat(UUID.fromString(requestId)).isNotNull();
        assertThat(response.getHeader(RequestIdFilter.CORRELATION_ID_HEADER)).isEqualTo(requestId);
    }

    @Test
    void onlyShortTokensAreAccepted() {
        assertThat(RequestIdFilter.accept("  abc.DEF_1-2:3  ")).isEqualTo("abc.DEF_1-2:3");
        assertThat(RequestIdFilter.accept("x".repeat(64))).hasSize(64);
        assertThat(RequestIdFilter.accept("x".repeat(65))).isNull();
        assertThat(RequestIdFilter.accept("has space")).isNull();
        assertThat(RequestIdFilter.accept("")).isNull();
        assertThat(RequestIdFilter.accept(null)).isNull();
    }

    @Test
    void unrelatedMdcEntriesSurviveTheRequest() throws Exception {
        MDC.put("tradeId", "t-1");
        try {
            filter.doFilter(new MockHttpServletRequest("GET", "/trades"), new MockHttpServletResponse(), (req, res) -> { });

            assertThat(MDC.get("tradeId")).isEqualTo("t-1");
        } finally {
            MDC.remove("tradeId");
        }
    }
}
