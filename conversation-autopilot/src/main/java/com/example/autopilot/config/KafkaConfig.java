package com.example.autopilot.config;

import com.example.autopilot.domain.OutboundReply;
import com.example.autopilot.dto.InboundMessagePayload;
import com.example.autopilot.event.ConversationEvent;
import java.util.Map;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.serializer.JsonDeserializer;

@Configuration
public class KafkaConfig {

    @Bean
    public ProducerFactory<String, ConversationEvent> conversationEventProducerFactory(KafkaProperties properties) {
        return new DefaultKafkaProducerFactory<>(properties.buildProducerProperties());
    }

    @Bean
    public KafkaTemplate<String, ConversationEvent> conversationEventKafkaTemplate(
            ProducerFactory<String, ConversationEvent> conversationEventProducerFactory) {
        return new KafkaTemplate<>(conversationEventProducerFactory);
    }

    @Bean
    public ProducerFactory<String, OutboundReply> outboundReplyProducerFactory(KafkaProperties properties) {
        return new DefaultKafkaProducerFactory<>(properties.buildProducerProperties());
    }

    @Bean
    public KafkaTemplate<String, OutboundReply> outboundReplyKafkaTemplate(
            ProducerFactory<String, OutboundReply> outboundReplyProducerFactory) {
        return new KafkaTemplate<>(outboundReplyProducerFactory);
    }

    @Bean
    public ConsumerFactory<String, InboundMessagePayload> inboundMessageConsumerFactory(KafkaProperties properties) {
        Map<String, Object> config = properties.buildConsumerProperties();
        JsonDeserializer<InboundMessagePayload> valueDeserializer = new JsonDeserializer<>(InboundMessagePayload.class, false);
        valueDeserializer.addTrustedPackages(InboundMessagePayload.class.getPackageName());
        return new DefaultKafkaConsumerFactory<>(config, new StringDeserializer(), valueDeserializer);
    }

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, InboundMessagePayload> inboundMessageListenerContainerFactory(
            ConsumerFactory<String, InboundMessagePayload> inboundMessageConsumerFactory) {
        ConcurrentKafkaListenerContainerFactory<String, InboundMessagePayload> factory =
                new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(inboundMessageConsumerFactory);
        return factory;
    }

    @Bean
    public NewTopic lifecycleTopic(AutopilotProperties properties) {
        return TopicBuilder.name(properties.getKafka().getLifecycleTopic())
                .partitions(6)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic outboundTopic(AutopilotProperties properties) {
        return TopicBuilder.name(properties.getKafka().getOutboundTopic())
                .partitions(12)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic inboundTopic(AutopilotProperties properties) {
        return TopicBuilder.name(properties.getKafka().getInboundTopic())
                .partitions(12)
                .replicas(1)
                .build();
    }
}
