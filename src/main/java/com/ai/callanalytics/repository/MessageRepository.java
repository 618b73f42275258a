package com.ai.callanalytics.repository;

import com.ai.callanalytics.entity.Message;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface MessageRepository extends JpaRepository<Message, Long> {

    List<Message> findByConversation_IdOrderByTimestampAscIdAsc(Long conversationId);

    Slice<Message> findSliceByConversation_IdOrderByTimestampAscIdAsc(Long conversationId, Pageable pageable);
}
