package com.example.autopilot.persistence;

import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MessageJpaRepository extends JpaRepository<MessageEntity, Long> {

    boolean existsByConversationIdAndDedupKey(String conversationId, String dedupKey);

    List<MessageEntity> findByConversationIdOrderBySequenceAsc(String conversationId);

    List<MessageEntity> findByConversationIdOrderBySequenceDesc(String conversationId, Pageable pageable);

    @Modifying
    @Query("delete from MessageEntity m where m.conversationId = :conversationId")
    int deleteByConversationId(@Param("conversationId") String conversationId);
}
