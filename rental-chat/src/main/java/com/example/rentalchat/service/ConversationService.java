package com.example.rentalchat.service;

import com.example.rentalchat.config.ChatProperties;
import com.example.rentalchat.delivery.DeliveryRouter;
import com.example.rentalchat.delivery.LiveEvent;
import com.example.rentalchat.domain.ChatMessage;
import com.example.rentalchat.domain.Conversation;
import com.example.rentalchat.domain.LastMessageSummary;
import com.example.rentalchat.domain.MessageType;
import com.example.rentalchat.domain.RoomKey;
import com.example.rentalchat.dto.ConversationView;
import com.example.rentalchat.event.ChatEventPublisher;
import com.example.rentalchat.event.ChatEventType;
import com.example.rentalchat.service.ConversationDirectory.FindOrCreateResult;
import com.example.rentalchat.service.exception.AuthorizationException;
import com.example.rentalchat.service.exception.NotFoundException;
import com.example.rentalchat.service.exception.ValidationException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Orchestrates the directory, the message store and live delivery. Every state change is made durable
 * first; live delivery and integration events follow and never fail the operation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationService {

    private final ConversationDirectory directory;
    private final MessageStore messageStore;
    private final DeliveryRouter deliveryRouter;
    private final ConversationLocks locks;
    private final RedisKeyFactory keyFactory;
    private final ChatEventPublisher eventPublisher;
    private final ConversationViewAssembler viewAssembler;
    private final ChatProperties chatProperties;

    public ConversationView startConversation(String initiatorId, String recipientId, String scopeRef) {
        requireText(initiatorId, "Initiator id is required");
        requireText(recipientId, "Recipient id is required");
        if (initiatorId.equals(recipientId)) {
            throw new ValidationException("Cannot start a conversation with yourself");
        }
        String scope = StringUtils.hasText(scopeRef) ? scopeRef.trim() : null;

        FindOrCreateResult result = directory.findOrCreate(List.of(initiatorId, recipientId), scope);
        Conversation conversation = result.conversation();
        if (result.created()) {
            String conversationId = conversation.getId();
            LastMessageSummary summary = locks.withLock(keyFactory.conversationLockKey(conversationId), () -> {
                ChatMessage started = messageStore.append(conversationId, initiatorId, MessageType.SYSTEM,
                        chatProperties.getConversations().getStartedMessage());
                LastMessageSummary startedSummary = LastMessageSummary.of(started);
                updateSummary(conversationId, startedSummary);
                return startedSummary;
            });
            conversation.setLastMessage(summary);

            safeBroadcast(RoomKey.user(recipientId), LiveEvent.conversationUpdated(conversation.getId(), summary), null);

            Map<String, Object> payload = new HashMap<>();
            payload.put("participants", conversation.getParticipants());
            payload.put("initiatorId", initiatorId);
            if (scope != null) {
                payload.put("scopeRef", scope);
            }
            eventPublisher.publish(ChatEventType.CONVERSATION_STARTED, conversation.getId(), payload);
        }

        return viewAssembler.assemble(conversation, messageStore.unreadCount(conversation.getId(), initiatorId));
    }

    /**
     * Appends a message and then fans it out. Appends to one conversation are serialized so that live
     * delivery happens in persistence order.
     */
    public ChatMessage sendMessage(String conversationId, String senderId, String content) {
        Conversation conversation = authorizeParticipant(conversationId, senderId);

        ChatMessage message = locks.withLock(keyFactory.conversationLockKey(conversationId), () -> {
            ChatMessage appended = messageStore.append(conversationId, senderId, MessageType.TEXT, content);
            LastMessageSummary summary = LastMessageSummary.of(appended);
            updateSummary(conversationId, summary);

            safeBroadcast(RoomKey.conversation(conversationId), LiveEvent.messageCreated(appended), null);
            conversation.getParticipants().stream()
                    .filter(participant -> !participant.equals(senderId))
                    .forEach(participant -> safeBroadcast(
                            RoomKey.user(participant), LiveEvent.conversationUpdated(conversationId, summary), null));
            return appended;
        });

        eventPublisher.publish(ChatEventType.MESSAGE_CREATED, conversationId, Map.of(
                "messageId", message.getId(),
                "senderId", senderId,
                "sequence", message.getSequence()));
        return message;
    }

    public List<ChatMessage> listMessages(String conversationId, String userId, Long afterSequence, Integer limit) {
        authorizeParticipant(conversationId, userId);
        ChatProperties.Messages messages = chatProperties.getMessages();
        int pageSize = pageSize(limit, messages.getDefaultPageSize(), messages.getMaxPageSize());
        return messageStore.listByConversation(conversationId, afterSequence, pageSize);
    }

    /**
     * Marks every message in the conversation as read by the user. System messages take no part in read tracking.
     *
     * @return number of messages newly marked
     */
    public int markRead(String conversationId, String userId) {
        authorizeParticipant(conversationId, userId);
        int marked = messageStore.markRead(conversationId, userId);
        if (marked > 0) {
            safeBroadcast(
                    RoomKey.conversation(conversationId), LiveEvent.messagesRead(conversationId, userId, marked), null);
            eventPublisher.publish(ChatEventType.MESSAGES_READ, conversationId, Map.of(
                    "userId", userId,
                    "count", marked));
        }
        return marked;
    }

    public long unreadCount(String conversationId, String userId) {
        authorizeParticipant(conversationId, userId);
        return messageStore.unreadCount(conversationId, userId);
    }

    public List<ConversationView> getConversationsWithUnread(String userId, Integer limit) {
        requireText(userId, "User id is required");
        ChatProperties.Conversations conversations = chatProperties.getConversations();
        int pageSize = pageSize(limit, conversations.getDefaultPageSize(), conversations.getMaxPageSize());
        return viewAssembler.assembleAll(
                directory.listForUser(userId, pageSize),
                conversation -> messageStore.unreadCount(conversation.getId(), userId));
    }

    public ConversationView getConversation(String conversationId, String userId) {
        Conversation conversation = authorizeParticipant(conversationId, userId);
        return viewAssembler.assemble(conversation, messageStore.unreadCount(conversationId, userId));
    }

    /**
     * Broadcasts a typing signal to the conversation room, skipping the originating session.
     */
    public void typing(String conversationId, String userId, boolean started, String originSessionId) {
        authorizeParticipant(conversationId, userId);
        RoomKey room = RoomKey.conversation(conversationId);
        LiveEvent event = started ? LiveEvent.typingStart(room, userId) : LiveEvent.typingStop(room, userId);
        safeBroadcast(room, event, originSessionId);
    }

    public Conversation authorizeParticipant(String conversationId, String userId) {
        requireText(conversationId, "Conversation id is required");
        requireText(userId, "User id is required");
        Conversation conversation = directory.findById(conversationId)
                .orElseThrow(() -> new NotFoundException("Conversation not found"));
        if (!conversation.hasParticipant(userId)) {
            throw new AuthorizationException("User is not a participant of this conversation");
        }
        return conversation;
    }

    // the summary is advisory; the next successful send repairs it
    private void updateSummary(String conversationId, LastMessageSummary summary) {
        try {
            directory.updateLastMessage(conversationId, summary);
        } catch (RuntimeException ex) {
            log.warn("Failed to update last message of conversation {}", conversationId, ex);
        }
    }

    private void safeBroadcast(RoomKey room, LiveEvent event, String excludeSessionId) {
        try {
            deliveryRouter.broadcast(room, event, excludeSessionId);
        } catch (RuntimeException ex) {
            log.warn("Broadcast of {} to {} failed", event.name(), room, ex);
        }
    }

    private int pageSize(Integer requested, int defaultSize, int maxSize) {
        if (requested == null || requested <= 0) {
            return defaultSize;
        }
        return Math.min(requested, maxSize);
    }

    private void requireText(String value, String message) {
        if (!StringUtils.hasText(value)) {
            throw new ValidationException(message);
        }
    }
}
