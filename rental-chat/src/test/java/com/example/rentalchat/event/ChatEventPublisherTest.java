package com.example.rentalchat.event;

import com.example.rentalchat.config.ChatProperties;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.apache.kafka.common.KafkaException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChatEventPublisherTest {

    @Mock
    private KafkaTemplate<String, ChatEvent> kafkaTemplate;

    private ChatProperties properties;
    private ChatEventPublisher publisher;

    @BeforeEach
    void setUp() {
        properties = new ChatProperties();
        publisher = new ChatEventPublisher(kafkaTemplate, properties);
    }

    @Test
    void publish_shouldSendToLifecycleTopicKeyedByConversation() {
        when(kafkaTemplate.send(anyString(), anyString(), any(ChatEvent.class)))
                .thenReturn(new CompletableFuture<SendResult<String, ChatEvent>>());

        publisher.publish(ChatEventType.MESSAGE_CREATED, "conv-1", Map.of("messageId", "m-1"));

        ArgumentCaptor<ChatEvent> event = ArgumentCaptor.forClass(ChatEvent.class);
        verify(kafkaTemplate).send(eq("chat.lifecycle"), eq("conv-1"), event.capture());
        assertThat(event.getValue().getType()).isEqualTo(ChatEventType.MESSAGE_CREATED);
        assertThat(event.getValue().getConversationId()).isEqualTo("conv-1");
        assertThat(event.getValue().getEventId()).isNotBlank();
        assertThat(event.getValue().getOccurredAt()).isNotNull();
        assertThat(event.getValue().getPayload()).containsEntry("messageId", "m-1");
    }

    @Test
    void publish_disabledShouldSkipKafka() {
        properties.getKafka().setEnabled(false);

        publisher.publish(ChatEventType.CONVERSATION_STARTED, "conv-1", Map.of());

        verifyNoInteractions(kafkaTemplate);
    }

    @Test
    void publish_brokerFailureShouldNotPropagate() {
        when(kafkaTemplate.send(anyString(), anyString(), any(ChatEvent.class)))
                .thenThrow(new KafkaException("broker unavailable"));

        assertThatCode(() -> publisher.publish(ChatEventType.MESSAGES_READ, "conv-1", Map.of("count", 2)))
                .doesNotThrowAnyException();
    }

    @Test
    void publish_asyncFailureShouldNotPropagate() {
        when(kafkaTemplate.send(anyString(), anyString(), any(ChatEvent.class)))
                .thenReturn(CompletableFuture.failedFuture(new KafkaException("timed out")));

        assertThatCode(() -> publisher.publish(ChatEventType.MESSAGES_READ, "conv-1", Map.of("count", 2)))
                .doesNotThrowAnyException();
    }
}
