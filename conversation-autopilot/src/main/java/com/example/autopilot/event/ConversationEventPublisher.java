package com.example.autopilot.event;

import com.example.autopilot.config.AutopilotProperties;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Fans lifecycle events out to in-process listeners and the lifecycle topic. Publishing never
 * fails the caller; lost events are logged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConversationEventPublisher {

    private final List<ConversationEventListener> listeners;
    private final KafkaTemplate<String, ConversationEvent> conversationEventKafkaTemplate;
    private final AutopilotProperties properties;
    private final Clock clock;

    public void publish(String conversationId, ConversationEventType type, Map<String, Object> payload) {
        publish(ConversationEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .type(type)
                .conversationId(conversationId)
                .occurredAt(clock.instant())
                .payload(payload != null ? payload : Map.of())
                .build());
    }

    public void publish(ConversationEvent event) {
        for (ConversationEventListener listener : listeners) {
            try {
                listener.onConversationEvent(event);
            } catch (RuntimeException ex) {
                log.warn("Listener {} failed on {} for conversation {}",
                        listener.getClass().getSimpleName(), event.getType(), event.getConversationId(), ex);
            }
        }
        try {
            conversationEventKafkaTemplate
                    .send(properties.getKafka().getLifecycleTopic(), event.getConversationId(), event)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.warn("Lifecycle event {} for conversation {} was not published",
                                    event.getType(), event.getConversationId(), ex);
                        }
                    });
        } catch (KafkaException ex) {
            log.warn("Lifecycle event {} for conversation {} was not published",
                    event.getType(), event.getConversationId(), ex);
        }
    }
}
