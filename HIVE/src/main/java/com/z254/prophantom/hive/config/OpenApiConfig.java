package com.z254.prophantom.hive.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for HIVE.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI hiveOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("HIVE API")
                        .description("""
                                HIVE - shared agent runtime for the ProPhantom agent suite.
                                
                                Nine conversational agent types run on one runtime and differ only by profile.
                                
                                ## Features
                                - **Sessions**: per user and agent, with relationship tiers and milestones
                                - **Memory**: typed, associative memory with relevance ranking and consolidation
                                - **Analytics**: running baselines, anomaly flags and health reports
                                - **Streaming**: WebSocket conversations with acknowledged, replayable delivery
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server().url("/").description("Current server"),
                        new Server().url("http://localhost:8090").description("Local development")
                ));
    }
}
