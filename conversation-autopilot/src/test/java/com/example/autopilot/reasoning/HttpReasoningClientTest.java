package com.example.autopilot.reasoning;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServiceUnavailable;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.example.autopilot.config.AutopilotProperties;
import com.example.autopilot.service.exception.ReasoningException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class HttpReasoningClientTest {

    private static final String PRIMARY = "http://primary.local/v1/chat/completions";
    private static final String FALLBACK = "http://fallback.local/v1/chat/completions";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AutopilotProperties properties = new AutopilotProperties();

    private MockRestServiceServer server;
    private HttpReasoningClient client;

    @BeforeEach
    void setUp() {
        properties.getReasoning().setBaseUrls(List.of("http://primary.local/v1/", "http://fallback.local/v1"));
        properties.getReasoning().setAttemptsPerEndpoint(2);
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new HttpReasoningClient(builder.build(), properties, new ReasoningPromptBuilder(), objectMapper);
    }

    @Test
    void parsesResultWrappedInProse() throws Exception {
        server.expect(requestTo(PRIMARY))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.model").value("gemini-3-flash"))
                .andExpect(jsonPath("$.messages[1].content").value(containsString("Is it available?")))
                .andRespond(withSuccess(completion("Here you go:\n{\"category\":\"simple_question\","
                        + "\"requires_approval\":false,\"reply_if_accepted\":\"Yes it is\",\"extra\":1}"),
                        MediaType.APPLICATION_JSON));

        ReasoningResult result = client.analyze(request());

        assertThat(result.getCategory()).isEqualTo("simple_question");
        assertThat(result.getRequiresApproval()).isFalse();
        assertThat(result.getReplyIfAccepted()).isEqualTo("Yes it is");
        server.verify();
    }

    @Test
    void retriesSameEndpointWhenUnavailable() throws Exception {
        server.expect(requestTo(PRIMARY)).andRespond(withServiceUnavailable());
        server.expect(requestTo(PRIMARY))
                .andRespond(withSuccess(completion("{\"category\":\"other\"}"), MediaType.APPLICATION_JSON));

        assertThat(client.analyze(request()).getCategory()).isEqualTo("other");
        server.verify();
    }

    @Test
    void movesToFallbackOnOtherErrors() throws Exception {
        server.expect(requestTo(PRIMARY)).andRespond(withServerError());
        server.expect(requestTo(FALLBACK))
                .andRespond(withSuccess(completion("{\"category\":\"price_negotiation\",\"requires_approval\":true}"),
                        MediaType.APPLICATION_JSON));

        ReasoningResult result = client.analyze(request());

        assertThat(result.getCategory()).isEqualTo("price_negotiation");
        assertThat(result.getRequiresApproval()).isTrue();
        server.verify();
    }

    @Test
    void failsWhenEveryEndpointFails() throws Exception {
        server.expect(requestTo(PRIMARY))
                .andRespond(withSuccess(completion("I cannot help with that."), MediaType.APPLICATION_JSON));
        server.expect(requestTo(FALLBACK)).andRespond(withServiceUnavailable());
        server.expect(requestTo(FALLBACK)).andRespond(withServiceUnavailable());

        assertThatThrownBy(() -> client.analyze(request()))
                .isInstanceOf(ReasoningException.class)
                .hasMessageContaining("fallback.local")
                .hasMessageContaining("503");
        server.verify();
    }

    @Test
    void extractsOutermostObject() {
        assertThat(HttpReasoningClient.extractJsonObject("```json\n{\"a\":{\"b\":1}}\n```")).isEqualTo("{\"a\":{\"b\":1}}");
        assertThatThrownBy(() -> HttpReasoningClient.extractJsonObject("no json here"))
                .isInstanceOf(ReasoningException.class);
    }

    private ReasoningRequest request() {
        return ReasoningRequest.builder()
                .conversationId("thread-42")
                .displayName("Dana")
                .history(List.of())
                .batchMessages(List.of("Is it available?"))
                .build();
    }

    private String completion(String content) throws JsonProcessingException {
        return objectMapper.writeValueAsString(Map.of(
                "choices", List.of(Map.of("message", Map.of("role", "assistant", "content", content)))));
    }
}
