package com.example.autopilot.messaging;

import com.example.autopilot.config.AutopilotProperties;
import com.example.autopilot.domain.OutboundReply;
import com.example.autopilot.service.OutboundReplySink;
import com.example.autopilot.service.exception.ReplyDeliveryException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Hands replies to the chat connector through the outbound topic, keyed by conversation so a
 * conversation's replies stay ordered. A send counts as delivered once the broker acknowledges it.
 */
@Slf4j
@Component
public class KafkaOutboundReplySink implements OutboundReplySink {

    private final KafkaTemplate<String, OutboundReply> kafkaTemplate;
    private final AutopilotProperties properties;

    public KafkaOutboundReplySink(
            @Qualifier("outboundReplyKafkaTemplate") KafkaTemplate<String, OutboundReply> kafkaTemplate,
            AutopilotProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.properties = properties;
    }

    @Override
    public void deliver(OutboundReply reply) {
        String topic = properties.getKafka().getOutboundTopic();
        Duration timeout = properties.getKafka().getSendTimeout();
        try {
            kafkaTemplate.send(topic, reply.getConversationId(), reply)
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("Reply {} for conversation {} acknowledged on {}", reply.getDedupKey(), reply.getConversationId(), topic);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ReplyDeliveryException("Interrupted while sending reply " + reply.getDedupKey(), ex);
        } catch (ExecutionException ex) {
            throw new ReplyDeliveryException("Broker rejected reply " + reply.getDedupKey(), ex.getCause());
        } catch (TimeoutException ex) {
            throw new ReplyDeliveryException("Timed out sending reply " + reply.getDedupKey(), ex);
        } catch (KafkaException ex) {
            throw new ReplyDeliveryException("Unable to send reply " + reply.getDedupKey(), ex);
        }
    }
}
