package com.example.rentalchat.persistence;

import com.example.rentalchat.config.ChatProperties;
import com.example.rentalchat.domain.ChatMessage;
import com.example.rentalchat.domain.MessageType;
import com.example.rentalchat.service.MessageStore;
import com.example.rentalchat.service.exception.ValidationException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

@Slf4j
@Repository
public class JpaMessageStore implements MessageStore {

    private final MessageJpaRepository messageJpaRepository;
    private final ConversationEntityMapper mapper;
    private final ChatProperties chatProperties;
    private final TransactionTemplate transactionTemplate;
    private final TransactionTemplate readOnlyTemplate;

    public JpaMessageStore(
            MessageJpaRepository messageJpaRepository,
            ConversationEntityMapper mapper,
            ChatProperties chatProperties,
            PlatformTransactionManager transactionManager) {
        this.messageJpaRepository = messageJpaRepository;
        this.mapper = mapper;
        this.chatProperties = chatProperties;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.readOnlyTemplate = new TransactionTemplate(transactionManager);
        this.readOnlyTemplate.setReadOnly(true);
    }

    @Override
    public ChatMessage append(String conversationId, String senderId, MessageType type, String content) {
        requireText(conversationId, "Conversation id is required");
        requireText(senderId, "Sender id is required");
        if (!StringUtils.hasText(content)) {
            throw new ValidationException("Message content must not be empty");
        }
        int maxLength = chatProperties.getMessages().getMaxLength();
        if (content.length() > maxLength) {
            throw new ValidationException("Message content exceeds %d characters".formatted(maxLength));
        }

        MessageEntity entity = new MessageEntity();
        entity.setMessageId(UUID.randomUUID().toString());
        entity.setConversationId(conversationId);
        entity.setSenderId(senderId);
        entity.setType(type != null ? type : MessageType.TEXT);
        entity.setContent(content);
        entity.setCreatedAt(Instant.now());
        entity.getReadBy().add(senderId);

        return StoreFailures.guard("append", () ->
                transactionTemplate.execute(status -> mapper.toMessage(messageJpaRepository.save(entity))));
    }

    @Override
    public List<ChatMessage> listByConversation(String conversationId, Long afterSequence, int limit) {
        if (!StringUtils.hasText(conversationId) || limit <= 0) {
            return Collections.emptyList();
        }
        PageRequest page = PageRequest.of(0, limit);
        return StoreFailures.guard("listByConversation", () -> readOnlyTemplate.execute(status -> {
            if (afterSequence != null) {
                return messageJpaRepository
                        .findByConversationIdAndSequenceGreaterThanOrderBySequenceAsc(conversationId, afterSequence, page)
                        .stream()
                        .map(mapper::toMessage)
                        .toList();
            }
            List<ChatMessage> newestFirst = new ArrayList<>(messageJpaRepository
                    .findByConversationIdOrderBySequenceDesc(conversationId, page)
                    .stream()
                    .map(mapper::toMessage)
                    .toList());
            Collections.reverse(newestFirst);
            return List.copyOf(newestFirst);
        }));
    }

    @Override
    public int markRead(String conversationId, String userId) {
        requireText(conversationId, "Conversation id is required");
        requireText(userId, "User id is required");
        try {
            return doMarkRead(conversationId, userId);
        } catch (DataIntegrityViolationException ex) {
            // a concurrent markRead for the same user inserted some of the same rows first
            log.debug("Concurrent read marking for {} in {}, retrying", userId, conversationId);
            try {
                return doMarkRead(conversationId, userId);
            } catch (DataIntegrityViolationException again) {
                // the competing calls committed the same rows
                log.debug("Read marking for {} in {} already done concurrently", userId, conversationId);
                return 0;
            }
        }
    }

    private int doMarkRead(String conversationId, String userId) {
        Integer marked = StoreFailures.guard("markRead", () -> transactionTemplate.execute(
                status -> messageJpaRepository.markRead(conversationId, userId, MessageType.SYSTEM.name())));
        return marked != null ? marked : 0;
    }

    @Override
    public long unreadCount(String conversationId, String userId) {
        Long count = StoreFailures.guard("unreadCount", () -> readOnlyTemplate.execute(
                status -> messageJpaRepository.countUnread(conversationId, userId, MessageType.SYSTEM)));
        return count != null ? count : 0L;
    }

    private void requireText(String value, String message) {
        if (!StringUtils.hasText(value)) {
            throw new ValidationException(message);
        }
    }
}
