package com.example.rentalchat.event;

import com.example.rentalchat.config.ChatProperties;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes integration events for downstream consumers (notifications, analytics). Publishing happens
 * after the state change is durable and never fails the calling operation.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChatEventPublisher {

    private final KafkaTemplate<String, ChatEvent> chatEventKafkaTemplate;
    private final ChatProperties chatProperties;

    public void publish(ChatEventType type, String conversationId, Map<String, Object> payload) {
        if (!chatProperties.getKafka().isEnabled()) {
            return;
        }
        ChatEvent event = ChatEvent.of(type, conversationId, payload);
        String topic = chatProperties.getKafka().getLifecycleTopic();
        try {
            chatEventKafkaTemplate.send(topic, conversationId, event).whenComplete((result, ex) -> {
                if (ex != null) {
                    log.warn("Failed to publish {} for conversation {}", type, conversationId, ex);
                }
            });
        } catch (RuntimeException ex) {
            log.warn("Failed to publish {} for conversation {}", type, conversationId, ex);
        }
    }
}
