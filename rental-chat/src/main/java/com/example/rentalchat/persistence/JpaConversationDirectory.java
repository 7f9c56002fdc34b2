package com.example.rentalchat.persistence;

import com.example.rentalchat.domain.Conversation;
import com.example.rentalchat.domain.LastMessageSummary;
import com.example.rentalchat.service.ConversationDirectory;
import com.example.rentalchat.service.ConversationLocks;
import com.example.rentalchat.service.RedisKeyFactory;
import com.example.rentalchat.service.exception.NotFoundException;
import com.example.rentalchat.service.exception.ValidationException;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
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
public class JpaConversationDirectory implements ConversationDirectory {

    private final ConversationJpaRepository conversationJpaRepository;
    private final ConversationEntityMapper mapper;
    private final ConversationLocks locks;
    private final RedisKeyFactory keyFactory;
    private final TransactionTemplate transactionTemplate;
    private final TransactionTemplate readOnlyTemplate;

    public JpaConversationDirectory(
            ConversationJpaRepository conversationJpaRepository,
            ConversationEntityMapper mapper,
            ConversationLocks locks,
            RedisKeyFactory keyFactory,
            PlatformTransactionManager transactionManager) {
        this.conversationJpaRepository = conversationJpaRepository;
        this.mapper = mapper;
        this.locks = locks;
        this.keyFactory = keyFactory;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.readOnlyTemplate = new TransactionTemplate(transactionManager);
        this.readOnlyTemplate.setReadOnly(true);
    }

    @Override
    public FindOrCreateResult findOrCreate(List<String> participantIds, String scopeRef) {
        List<String> participants = normalizeParticipants(participantIds);
        String participantKey = ConversationDirectory.participantKey(participants);
        String scopeKey = ConversationDirectory.scopeKey(scopeRef);

        return locks.withLock(keyFactory.creationLockKey(participantKey, scopeKey), () -> {
            Optional<Conversation> existing = find(participantKey, scopeKey);
            if (existing.isPresent()) {
                return new FindOrCreateResult(existing.get(), false);
            }
            try {
                Conversation created = StoreFailures.guard("findOrCreate", () -> transactionTemplate.execute(
                        status -> mapper.toConversation(conversationJpaRepository.saveAndFlush(
                                newEntity(participants, participantKey, scopeKey, scopeRef)))));
                log.info("Created conversation {} for [{}] scope '{}'", created.getId(), participantKey, scopeKey);
                return new FindOrCreateResult(created, true);
            } catch (DataIntegrityViolationException ex) {
                // lost the race on the unique (participant_key, scope_key) constraint
                log.debug("Conversation for [{}] scope '{}' created concurrently", participantKey, scopeKey);
                Conversation winner = find(participantKey, scopeKey).orElseThrow(() -> ex);
                return new FindOrCreateResult(winner, false);
            }
        });
    }

    @Override
    public Optional<Conversation> findById(String conversationId) {
        if (!StringUtils.hasText(conversationId)) {
            return Optional.empty();
        }
        return StoreFailures.guard("findById", () -> readOnlyTemplate.execute(
                status -> conversationJpaRepository.findById(conversationId).map(mapper::toConversation)));
    }

    @Override
    public List<Conversation> listForUser(String userId, int limit) {
        if (!StringUtils.hasText(userId) || limit <= 0) {
            return Collections.emptyList();
        }
        return StoreFailures.guard("listForUser", () -> readOnlyTemplate.execute(status -> conversationJpaRepository
                .findForUser(userId, PageRequest.of(0, limit))
                .stream()
                .map(mapper::toConversation)
                .toList()));
    }

    @Override
    public void updateLastMessage(String conversationId, LastMessageSummary summary) {
        if (summary == null) {
            throw new ValidationException("Last message summary is required");
        }
        Integer updated = StoreFailures.guard("updateLastMessage", () -> transactionTemplate.execute(
                status -> conversationJpaRepository.updateLastMessage(
                        conversationId,
                        summary.getContent(),
                        summary.getSenderId(),
                        summary.getSentAt(),
                        Instant.now())));
        if (updated == null || updated == 0) {
            throw new NotFoundException("Conversation not found");
        }
    }

    private Optional<Conversation> find(String participantKey, String scopeKey) {
        return StoreFailures.guard("findByKey", () -> readOnlyTemplate.execute(status -> conversationJpaRepository
                .findByParticipantKeyAndScopeKey(participantKey, scopeKey)
                .map(mapper::toConversation)));
    }

    private ConversationEntity newEntity(
            List<String> participants, String participantKey, String scopeKey, String scopeRef) {
        Instant now = Instant.now();
        ConversationEntity entity = new ConversationEntity();
        entity.setId(UUID.randomUUID().toString());
        entity.getParticipants().addAll(participants);
        entity.setParticipantKey(participantKey);
        entity.setScopeKey(scopeKey);
        entity.setScopeRef(scopeRef);
        entity.setCreatedAt(now);
        entity.setUpdatedAt(now);
        return entity;
    }

    private List<String> normalizeParticipants(List<String> participantIds) {
        if (participantIds == null) {
            throw new ValidationException("Participants are required");
        }
        List<String> participants = participantIds.stream()
                .filter(StringUtils::hasText)
                .map(String::trim)
                .distinct()
                .toList();
        if (participants.size() < 2 || participants.size() != participantIds.size()) {
            throw new ValidationException("A conversation needs at least two distinct participants");
        }
        return participants;
    }
}
