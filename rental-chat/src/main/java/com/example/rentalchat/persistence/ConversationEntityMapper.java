package com.example.rentalchat.persistence;

import com.example.rentalchat.domain.ChatMessage;
import com.example.rentalchat.domain.Conversation;
import com.example.rentalchat.domain.LastMessageSummary;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class ConversationEntityMapper {

    public Conversation toConversation(ConversationEntity entity) {
        if (entity == null) {
            return null;
        }
        return Conversation.builder()
                .id(entity.getId())
                .participants(List.copyOf(entity.getParticipants()))
                .scopeRef(entity.getScopeRef())
                .lastMessage(toSummary(entity))
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }

    public ChatMessage toMessage(MessageEntity entity) {
        if (entity == null) {
            return null;
        }
        return ChatMessage.builder()
                .id(entity.getMessageId())
                .sequence(entity.getSequence())
                .conversationId(entity.getConversationId())
                .type(entity.getType())
                .senderId(entity.getSenderId())
                .content(entity.getContent())
                .readBy(Set.copyOf(entity.getReadBy()))
                .createdAt(entity.getCreatedAt())
                .build();
    }

    private LastMessageSummary toSummary(ConversationEntity entity) {
        if (entity.getLastMessageAt() == null) {
            return null;
        }
        return LastMessageSummary.builder()
                .content(entity.getLastMessageContent())
                .senderId(entity.getLastMessageSenderId())
                .sentAt(entity.getLastMessageAt())
                .build();
    }
}
