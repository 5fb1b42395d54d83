package com.example.autopilot.messaging;

import com.example.autopilot.dto.InboundMessagePayload;
import com.example.autopilot.service.ConversationOrchestrator;
import com.example.autopilot.service.IngestResult;
import com.example.autopilot.service.exception.ServiceException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

/**
 * Consumes messages published by the chat connector. Records failing validation or rejected by the
 * orchestrator are dropped; storage failures are rethrown so the container redelivers the record.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "autopilot.kafka.inbound-enabled", havingValue = "true", matchIfMissing = true)
public class InboundMessageListener {

    private final ConversationOrchestrator orchestrator;
    private final Validator validator;

    @KafkaListener(
            topics = "${autopilot.kafka.inbound-topic:autopilot.inbound}",
            groupId = "${autopilot.kafka.consumer-group:conversation-autopilot}",
            containerFactory = "inboundMessageListenerContainerFactory")
    public void onInboundMessage(InboundMessagePayload payload) {
        if (payload == null) {
            log.warn("Dropping empty inbound record");
            return;
        }
        Set<ConstraintViolation<InboundMessagePayload>> violations = validator.validate(payload);
        if (!violations.isEmpty()) {
            log.warn("Dropping invalid inbound message for conversation {}: {}",
                    abbreviate(payload.getConversationId()),
                    violations.stream()
                            .map(violation -> violation.getPropertyPath() + " " + violation.getMessage())
                            .sorted()
                            .collect(Collectors.joining(", ")));
            return;
        }
        try {
            IngestResult result = orchestrator.ingest(payload.toInboundMessage());
            log.debug("Inbound message for conversation {} ingested: {}", payload.getConversationId(), result);
        } catch (ServiceException ex) {
            if (ex.isTransient()) {
                throw ex;
            }
            log.warn("Dropping inbound message for conversation {}: {}", payload.getConversationId(), ex.getMessage());
        }
    }

    private static String abbreviate(String value) {
        if (value == null || value.length() <= 64) {
            return value;
        }
        return value.substring(0, 64) + "...";
    }
}
