package com.ai.callanalytics.service;

import com.ai.callanalytics.entity.Conversation;
import com.ai.callanalytics.entity.FollowUpScript;
import com.ai.callanalytics.exception.InvalidArgumentException;
import com.ai.callanalytics.exception.InvalidStateException;
import com.ai.callanalytics.exception.ResourceNotFoundException;
import com.ai.callanalytics.repository.ConversationRepository;
import com.ai.callanalytics.repository.FollowUpScriptRepository;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Follow-up scripts and their one-way {@code unsent -> sent} delivery flag.
 */
@Service
@RequiredArgsConstructor
public class FollowUpScriptService {

    private static final Logger log = LoggerFactory.getLogger(FollowUpScriptService.class);

    private final FollowUpScriptRepository repository;
    private final ConversationRepository conversationRepository;

    @Transactional
    public FollowUpScript create(Long conversationId, String scriptContent) {
        if (StringUtils.isBlank(scriptContent)) {
            throw new InvalidArgumentException("Script content is required");
        }
        Conversation conversation = conversationRepository.findById(conversationId)
                .orElseThrow(() -> ResourceNotFoundException.conversation(conversationId));

        FollowUpScript script = repository.save(FollowUpScript.builder()
                .conversation(conversation)
                .scriptContent(scriptContent)
                .sent(false)
                .build());

        log.info("Follow-up script saved: id={} conversation id={} callSid={}",
                script.getId(), conversationId, conversation.getCallSid());
        return script;
    }

    // row lock keeps two sweepers from both flipping the flag
    @Transactional
    public FollowUpScript markSent(Long scriptId, LocalDateTime sentAt) {
        FollowUpScript script = repository.findByIdForUpdate(scriptId)
                .orElseThrow(() -> ResourceNotFoundException.script(scriptId));
        if (script.isSent()) {
            log.warn("Script id={} already sent at {}", scriptId, script.getSentAt());
            throw new InvalidStateException("Script " + scriptId + " was already sent at " + script.getSentAt());
        }
        script.setSent(true);
        script.setSentAt(sentAt != null ? sentAt : LocalDateTime.now());
        script = repository.save(script);

        log.info("Follow-up script marked sent: id={} at {}", scriptId, script.getSentAt());
        return script;
    }

    @Transactional(readOnly = true)
    public List<FollowUpScript> listPending() {
        return repository.findBySentOrderByCreatedAtAscIdAsc(false);
    }

    @Transactional(readOnly = true)
    public List<FollowUpScript> listByConversation(Long conversationId) {
        return repository.findByConversation_IdOrderByIdAsc(conversationId);
    }
}
