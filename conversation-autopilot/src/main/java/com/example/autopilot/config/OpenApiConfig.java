package com.example.autopilot.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info =
                @Info(
                        title = "Conversation Autopilot API",
                        version = "1.0",
                        description = "Message ingestion, approval console and listing endpoints for the conversation autopilot."))
public class OpenApiConfig {

    @Bean
    public GroupedOpenApi conversationApi() {
        return GroupedOpenApi.builder()
                .group("conversations")
                .pathsToMatch("/api/conversations/**")
                .build();
    }

    @Bean
    public GroupedOpenApi consoleApi() {
        return GroupedOpenApi.builder()
                .group("console")
                .pathsToMatch("/api/approvals/**", "/api/listing/**", "/api/meetups/**")
                .build();
    }
}
