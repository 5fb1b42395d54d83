package com.example.autopilot.messaging;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.autopilot.config.AutopilotProperties;
import com.example.autopilot.domain.OutboundReply;
import com.example.autopilot.service.exception.ReplyDeliveryException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import org.apache.kafka.common.errors.NotLeaderOrFollowerException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

@ExtendWith(MockitoExtension.class)
class KafkaOutboundReplySinkTest {

    private static final String TOPIC = "autopilot.outbound";

    @Mock
    private KafkaTemplate<String, OutboundReply> kafkaTemplate;

    private AutopilotProperties properties;

    private KafkaOutboundReplySink sink;

    private final OutboundReply reply = OutboundReply.builder()
            .conversationId("thread-42")
            .dedupKey("reply-b1")
            .text("Yes, still available!")
            .requestedAt(Instant.parse("2026-03-01T18:00:04Z"))
            .build();

    @BeforeEach
    void setUp() {
        properties = new AutopilotProperties();
        properties.getKafka().setOutboundTopic(TOPIC);
        properties.getKafka().setSendTimeout(Duration.ofMillis(50));
        sink = new KafkaOutboundReplySink(kafkaTemplate, properties);
    }

    @Test
    void acknowledgedSendIsKeyedByConversation() {
        CompletableFuture<SendResult<String, OutboundReply>> acked = CompletableFuture.completedFuture(null);
        when(kafkaTemplate.send(TOPIC, "thread-42", reply)).thenReturn(acked);

        assertThatCode(() -> sink.deliver(reply)).doesNotThrowAnyException();
        verify(kafkaTemplate).send(TOPIC, "thread-42", reply);
    }

    @Test
    void brokerRejectionIsRetryable() {
        CompletableFuture<SendResult<String, OutboundReply>> failed =
                CompletableFuture.failedFuture(new NotLeaderOrFollowerException("leader moved"));
        when(kafkaTemplate.send(TOPIC, "thread-42", reply)).thenReturn(failed);

        assertThatThrownBy(() -> sink.deliver(reply))
                .isInstanceOfSatisfying(ReplyDeliveryException.class,
                        ex -> assertThat(ex.isTransient()).isTrue())
                .hasMessageContaining("reply-b1")
                .hasCauseInstanceOf(NotLeaderOrFollowerException.class);
    }

    @Test
    void unacknowledgedSendTimesOut() {
        when(kafkaTemplate.send(TOPIC, "thread-42", reply)).thenReturn(new CompletableFuture<>());

        assertThatThrownBy(() -> sink.deliver(reply))
                .isInstanceOf(ReplyDeliveryException.class)
                .hasMessageStartingWith("Timed out sending reply reply-b1");
    }

    @Test
    void producerFailureBeforeSendIsWrapped() {
        when(kafkaTemplate.send(TOPIC, "thread-42", reply)).thenThrow(new KafkaException("producer closed"));

        assertThatThrownBy(() -> sink.deliver(reply))
                .isInstanceOf(ReplyDeliveryException.class)
                .hasMessageStartingWith("Unable to send reply reply-b1")
                .hasCauseInstanceOf(KafkaException.class);
    }
}
