package com.example.rentalchat.config;

import com.example.rentalchat.event.ChatEvent;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

@Configuration
public class KafkaConfig {

    @Bean
    public ProducerFactory<String, ChatEvent> chatEventProducerFactory(KafkaProperties properties) {
        return new DefaultKafkaProducerFactory<>(properties.buildProducerProperties());
    }

    @Bean
    public KafkaTemplate<String, ChatEvent> chatEventKafkaTemplate(
            ProducerFactory<String, ChatEvent> chatEventProducerFactory) {
        return new KafkaTemplate<>(chatEventProducerFactory);
    }

    @Bean
    public NewTopic lifecycleTopic(ChatProperties chatProperties) {
        // keyed by conversation id so one conversation's events stay ordered within a partition
        return TopicBuilder.name(chatProperties.getKafka().getLifecycleTopic())
                .partitions(6)
                .replicas(1)
                .build();
    }
}
