package com.example.autopilot.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

@Configuration
public class ReasoningClientConfig {

    @Bean
    public RestClient reasoningRestClient(RestClient.Builder builder, AutopilotProperties properties) {
        AutopilotProperties.Reasoning reasoning = properties.getReasoning();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) reasoning.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) reasoning.getReadTimeout().toMillis());

        builder.requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (StringUtils.hasText(reasoning.getApiKey())) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + reasoning.getApiKey());
        }
        return builder.build();
    }
}
