package com.autohedge.backend.config;

import com.autohedge.backend.security.ApiKeyAuthenticationFilter;
import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI autoHedgeOpenApi() {
        SecurityScheme apiKeyScheme = new SecurityScheme()
                .type(SecurityScheme.Type.APIKEY)
                .in(SecurityScheme.In.HEADER)
                .name(ApiKeyAuthenticationFilter.API_KEY_HEADER);
        return new OpenAPI()
                .info(new Info()
                        .title("AutoHedge API")
                        .description("Trade recommendation pipeline and trade lifecycle service")
                        .version("1.0"))
                .components(new Components().addSecuritySchemes("apiKey", apiKeyScheme))
                .addSecurityItem(new SecurityRequirement().addList("apiKey"));
    }
}
