package com.deepansh.rag.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

@Repository
public interface ChatSessionRepository extends JpaRepository<ChatSessionEntity, String> {

    /**
     * Single UPDATE so concurrent turns on one session never lose an increment.
     */
    @Modifying
    @Transactional
    @Query("UPDATE ChatSessionEntity s SET " +
           "s.messageCount = s.messageCount + 1, " +
           "s.totalTokens = s.totalTokens + :tokens, " +
           "s.totalProcessingTime = s.totalProcessingTime + :processingTime, " +
           "s.lastAccessedAt = :now " +
           "WHERE s.sessionId = :sessionId")
    int incrementStats(@Param("sessionId") String sessionId,
                       @Param("tokens") long tokens,
                       @Param("processingTime") double processingTime,
                       @Param("now") Instant now);
}
