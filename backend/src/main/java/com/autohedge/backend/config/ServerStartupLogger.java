package com.autohedge.backend.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class ServerStartupLogger implements ApplicationListener<WebServerInitializedEvent> {

    private final Environment environment;
    private final AgentProperties agentProperties;
    private final MarketDataProperties marketDataProperties;
    private final PipelineProperties pipelineProperties;

    @Override
    public void onApplicationEvent(WebServerInitializedEvent event) {
        int port = event.getWebServer().getPort();
        String address = environment.getProperty("server.address");
        String contextPath = environment.getProperty("server.servlet.context-path", "");
        String host = (address == null || address.isBlank() || "0.0.0.0".equals(address)) ? "localhost" : address;
        log.info("Server started on port {} (base URL: {})", port, String.format("http://%s:%d%s", host, port, contextPath));
        log.info("Agent model {} at {} (api key {}), market data at {}, max retries {}",
                agentProperties.getModel(),
                agentProperties.getBaseUrl(),
                agentProperties.getApiKey() == null || agentProperties.getApiKey().isBlank() ? "missing" : "set",
                marketDataProperties.getBaseUrl() == null || marketDataProperties.getBaseUrl().isBlank()
                        ? "<not configured>" : marketDataProperties.getBaseUrl(),
                pipelineProperties.getMaxRetries());
    }
}
