package com.example.autopilot.reasoning;

import com.example.autopilot.config.AutopilotProperties;
import com.example.autopilot.service.exception.ReasoningException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Calls an OpenAI-compatible {@code /chat/completions} endpoint. Base URLs are tried in order; a
 * 503 is retried on the same URL, any other failure moves on to the next one.
 */
@Slf4j
@Component
public class HttpReasoningClient implements ReasoningClient {

    private final RestClient restClient;
    private final AutopilotProperties properties;
    private final ReasoningPromptBuilder promptBuilder;
    private final ObjectMapper objectMapper;

    public HttpReasoningClient(
            @Qualifier("reasoningRestClient") RestClient restClient,
            AutopilotProperties properties,
            ReasoningPromptBuilder promptBuilder,
            ObjectMapper objectMapper) {
        this.restClient = restClient;
        this.properties = properties;
        this.promptBuilder = promptBuilder;
        this.objectMapper = objectMapper;
    }

    @Override
    public ReasoningResult analyze(ReasoningRequest request) {
        AutopilotProperties.Reasoning config = properties.getReasoning();
        Map<String, Object> body = Map.of(
                "model", config.getModel(),
                "temperature", config.getTemperature(),
                "messages", List.of(
                        Map.of("role", "system", "content", ReasoningPromptBuilder.SYSTEM_PROMPT),
                        Map.of("role", "user", "content", promptBuilder.build(request))));

        String lastError = "no base URL configured";
        for (String baseUrl : config.getBaseUrls()) {
            String url = trimTrailingSlash(baseUrl) + "/chat/completions";
            for (int attempt = 1; attempt <= Math.max(config.getAttemptsPerEndpoint(), 1); attempt++) {
                try {
                    JsonNode response = restClient.post()
                            .uri(url)
                            .body(body)
                            .retrieve()
                            .body(JsonNode.class);
                    return parse(response);
                } catch (HttpStatusCodeException ex) {
                    lastError = "%s attempt %d: HTTP %d".formatted(url, attempt, ex.getStatusCode().value());
                    if (ex.getStatusCode().value() != HttpStatus.SERVICE_UNAVAILABLE.value()) {
                        break;
                    }
                    log.warn("Reasoning endpoint {} unavailable (attempt {})", url, attempt);
                } catch (RestClientException | ReasoningException ex) {
                    lastError = "%s attempt %d: %s".formatted(url, attempt, ex.getMessage());
                    break;
                }
            }
            log.warn("Reasoning endpoint failed: {}", lastError);
        }
        throw new ReasoningException("All reasoning endpoints failed. Last error: " + lastError);
    }

    private ReasoningResult parse(JsonNode response) {
        JsonNode content = response == null ? null : response.path("choices").path(0).path("message").path("content");
        if (content == null || !content.isTextual()) {
            throw new ReasoningException("Completion carried no message content");
        }
        String json = extractJsonObject(content.asText());
        try {
            return objectMapper.readValue(json, ReasoningResult.class);
        } catch (JsonProcessingException ex) {
            throw new ReasoningException("Completion content is not a valid result object", ex);
        }
    }

    static String extractJsonObject(String content) {
        int start = content.indexOf('{');
        int end = content.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new ReasoningException("No JSON object in completion content");
        }
        return content.substring(start, end + 1);
    }

    private String trimTrailingSlash(String baseUrl) {
        String trimmed = StringUtils.trimWhitespace(baseUrl);
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
