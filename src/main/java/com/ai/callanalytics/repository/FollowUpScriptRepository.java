package com.ai.callanalytics.repository;

import com.ai.callanalytics.entity.FollowUpScript;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;

@Repository
public interface FollowUpScriptRepository extends JpaRepository<FollowUpScript, Long> {

    List<FollowUpScript> findBySentOrderByCreatedAtAscIdAsc(Boolean sent);

    List<FollowUpScript> findByConversation_IdOrderByIdAsc(Long conversationId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM FollowUpScript s WHERE s.id = :id")
    Optional<FollowUpScript> findByIdForUpdate(@Param("id") Long id);
}
