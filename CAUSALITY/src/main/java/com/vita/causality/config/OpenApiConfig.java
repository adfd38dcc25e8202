package com.vita.causality.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI documentation configuration for CAUSALITY service.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8090}")
    private int serverPort;

    @Bean
    public OpenAPI causalityOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("CAUSALITY Reasoning Service API")
                        .description("""
                                CAUSALITY explains symptoms from personal health data.
                                
                                ## Features
                                
                                - **Symptom queries**: Bounded ReAct reasoning with a bio-rule fallback
                                - **Counterfactuals**: Templated interventions per causal family
                                - **Debt scores**: Metabolic, digital and somatic debt over a window
                                - **Causal paths**: Learned DAG paths from a cause category to symptoms
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")
                ))
                .tags(List.of(
                        new Tag()
                                .name("Causal")
                                .description("Causal reasoning and counterfactual operations")
                ));
    }
}
