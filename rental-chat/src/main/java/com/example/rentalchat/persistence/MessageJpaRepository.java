package com.example.rentalchat.persistence;

import com.example.rentalchat.domain.MessageType;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MessageJpaRepository extends JpaRepository<MessageEntity, Long> {

    List<MessageEntity> findByConversationIdOrderBySequenceDesc(String conversationId, Pageable pageable);

    List<MessageEntity> findByConversationIdAndSequenceGreaterThanOrderBySequenceAsc(
            String conversationId, Long sequence, Pageable pageable);

    /**
     * Set union of {@code userId} into the read set of every foreign message of the conversation,
     * skipping messages of {@code excludedType}.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = """
            INSERT INTO chat_message_reads (message_seq_no, user_id)
            SELECT m.seq_no, CAST(:userId AS VARCHAR(128))
            FROM chat_messages m
            WHERE m.conversation_id = :conversationId
              AND m.sender_id <> :userId
              AND m.type <> :excludedType
              AND NOT EXISTS (
                  SELECT 1 FROM chat_message_reads r
                  WHERE r.message_seq_no = m.seq_no AND r.user_id = :userId)
            """, nativeQuery = true)
    int markRead(
            @Param("conversationId") String conversationId,
            @Param("userId") String userId,
            @Param("excludedType") String excludedType);

    @Query("select count(m) from MessageEntity m "
            + "where m.conversationId = :conversationId "
            + "and m.senderId <> :userId "
            + "and m.type <> :excludedType "
            + "and :userId not member of m.readBy")
    long countUnread(
            @Param("conversationId") String conversationId,
            @Param("userId") String userId,
            @Param("excludedType") MessageType excludedType);
}
