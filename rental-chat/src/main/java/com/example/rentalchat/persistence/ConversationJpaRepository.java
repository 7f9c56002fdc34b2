package com.example.rentalchat.persistence;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ConversationJpaRepository extends JpaRepository<ConversationEntity, String> {

    Optional<ConversationEntity> findByParticipantKeyAndScopeKey(String participantKey, String scopeKey);

    @Query("select c from ConversationEntity c "
            + "where :userId member of c.participants "
            + "order by coalesce(c.lastMessageAt, c.createdAt) desc, c.id asc")
    List<ConversationEntity> findForUser(@Param("userId") String userId, Pageable pageable);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update ConversationEntity c set "
            + "c.lastMessageContent = :content, "
            + "c.lastMessageSenderId = :senderId, "
            + "c.lastMessageAt = :sentAt, "
            + "c.updatedAt = :updatedAt "
            + "where c.id = :id")
    int updateLastMessage(
            @Param("id") String id,
            @Param("content") String content,
            @Param("senderId") String senderId,
            @Param("sentAt") Instant sentAt,
            @Param("updatedAt") Instant updatedAt);
}
