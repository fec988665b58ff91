package com.z254.butterfly.hermes.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for HERMES service.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI hermesOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("HERMES API")
                        .description("""
                                HERMES - Message Routing and Sub-Agent Delegation for the BUTTERFLY Ecosystem.

                                Routes messages between servers and fans work out to pools of sub-agents.

                                ## Features
                                - **Routing**: Performance-weighted, round-robin and least-connections selection
                                - **Resilience**: Per-server circuit breakers and capability-based failover
                                - **Delegation**: Parallel, sequential, pipeline and adaptive strategies
                                - **Aggregation**: Merge, select-best, vote and weighted-average results
                                - **Health**: Agent liveness, scaling and optimization recommendations
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("254STUDIOZ Engineering")
                                .email("engineering@254carbon.com")
                                .url("https://254carbon.com"))
                        .license(new License()
                                .name("Proprietary")
                                .url("https://254carbon.com/licenses")))
                .servers(List.of(
                        new Server().url("/").description("Current server"),
                        new Server().url("http://localhost:8090").description("Local development")
                ));
    }
}
