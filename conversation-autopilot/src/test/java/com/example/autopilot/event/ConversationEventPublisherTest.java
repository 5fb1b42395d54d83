package com.example.autopilot.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.autopilot.config.AutopilotProperties;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;

@ExtendWith(MockitoExtension.class)
class ConversationEventPublisherTest {

    private static final Instant NOW = Instant.parse("2026-03-01T18:00:00Z");

    @Mock
    private KafkaTemplate<String, ConversationEvent> kafkaTemplate;

    @Captor
    private ArgumentCaptor<ConversationEvent> eventCaptor;

    private final List<ConversationEvent> received = new ArrayList<>();

    private ConversationEventPublisher publisher;

    @BeforeEach
    void setUp() {
        ConversationEventListener failing = event -> {
            throw new IllegalStateException("console offline");
        };
        ConversationEventListener recording = received::add;
        publisher = new ConversationEventPublisher(List.of(failing, recording), kafkaTemplate,
                new AutopilotProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void failingListenerDoesNotStopOthers() {
        when(kafkaTemplate.send(eq("autopilot.lifecycle"), eq("thread-42"), any(ConversationEvent.class)))
                .thenReturn(new CompletableFuture<>());

        publisher.publish("thread-42", ConversationEventType.BATCH_CLOSED, Map.of("size", 2));

        assertThat(received).singleElement().satisfies(event -> {
            assertThat(event.getType()).isEqualTo(ConversationEventType.BATCH_CLOSED);
            assertThat(event.getOccurredAt()).isEqualTo(NOW);
            assertThat(event.getPayload()).containsEntry("size", 2);
        });
        verify(kafkaTemplate).send(eq("autopilot.lifecycle"), eq("thread-42"), eventCaptor.capture());
        assertThat(eventCaptor.getValue().getEventId()).isNotBlank();
    }

    @Test
    void brokerFailureIsOnlyLogged() {
        when(kafkaTemplate.send(eq("autopilot.lifecycle"), eq("thread-42"), any(ConversationEvent.class)))
                .thenThrow(new KafkaException("broker down"));

        assertThatCode(() -> publisher.publish("thread-42", ConversationEventType.REPLY_SENT, null))
                .doesNotThrowAnyException();
        assertThat(received).singleElement().satisfies(event -> assertThat(event.getPayload()).isEmpty());
    }
}
