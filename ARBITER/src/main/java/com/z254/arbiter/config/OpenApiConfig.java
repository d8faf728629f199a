package com.z254.arbiter.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI documentation configuration for ARBITER service.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8090}")
    private int serverPort;

    @Bean
    public OpenAPI arbiterOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("ARBITER Governance Decision API")
                        .description("""
                                ARBITER issues ALLOW / DENY / ESCALATE / MONITOR decisions for content
                                and learns from reviewer feedback.

                                ## Features

                                - **Prediction**: Feature extraction, model routing and explained decisions
                                - **Model Lifecycle**: Versioned registry with promotion and rollback
                                - **A/B Testing**: Weighted champion/candidate traffic splits
                                - **Online Learning**: Incremental updates from corrected feedback
                                - **Drift Monitoring**: Distribution checks over logged features
                                """)
                        .version("0.1.0")
                        .contact(new Contact()
                                .name("BUTTERFLY Team")
                                .email("butterfly@254studioz.com")
                                .url("https://254carbon.com"))
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")))
                .tags(List.of(
                        new Tag().name("Governance").description("Decisions, feedback and engine status"),
                        new Tag().name("Models").description("Model versions, metrics and lifecycle"),
                        new Tag().name("A/B Tests").description("Champion/candidate experiments"),
                        new Tag().name("Drift").description("Feature drift checks and history")));
    }
}
