package com.vtrade.backend.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    static final String BEARER_SCHEME = "bearerAuth";

    @Bean
    public OpenAPI vtradeOpenApi() {
        SecurityScheme bearerScheme = new SecurityScheme()
                .type(SecurityScheme.Type.HTTP)
                .scheme("bearer")
                .bearerFormat("JWT")
                .description("Access token whose role claim is USER or ADMIN; /api/admin/** needs ADMIN");
        return new OpenAPI()
                .info(new Info()
                        .title("vtrade API")
                        .description("Order lifecycle, positions and settlement for simulated retail trading accounts")
                        .version("1.0"))
                .components(new Components().addSecuritySchemes(BEARER_SCHEME, bearerScheme))
                .addSecurityItem(new SecurityRequirement().addList(BEARER_SCHEME))
                .tags(List.of(
                        new Tag().name("Orders").description("Place, quote, modify and cancel orders"),
                        new Tag().name("Positions").description("Open positions, exits and stop-loss/target"),
                        new Tag().name("Account").description("Margin summary and ledger transactions"),
                        new Tag().name("Admin").description("Position overrides, funds, risk configs and worker health")));
    }
}
