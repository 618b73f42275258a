package com.ai.callanalytics.repository;

import com.ai.callanalytics.entity.ConversationAnalysis;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ConversationAnalysisRepository extends JpaRepository<ConversationAnalysis, Long> {

    Optional<ConversationAnalysis> findFirstByConversation_IdOrderByIdDesc(Long conversationId);

    @Modifying
    @Query("DELETE FROM ConversationAnalysis a WHERE a.conversation.id = :conversationId")
    int deleteByConversationId(@Param("conversationId") Long conversationId);
}
