package com.ai.callanalytics.service;

import com.ai.callanalytics.dto.AnalysisDto;
import com.ai.callanalytics.dto.ConversationDetailDto;
import com.ai.callanalytics.dto.ConversationDto;
import com.ai.callanalytics.dto.MessageDto;
import com.ai.callanalytics.entity.Conversation;
import com.ai.callanalytics.exception.DuplicateCallSidException;
import com.ai.callanalytics.exception.IntegrityViolationException;
import com.ai.callanalytics.exception.InvalidArgumentException;
import com.ai.callanalytics.exception.ResourceNotFoundException;
import com.ai.callanalytics.repository.ConversationAnalysisRepository;
import com.ai.callanalytics.repository.ConversationRepository;
import com.ai.callanalytics.repository.MessageRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Owns conversation identity and timing. Message counters are kept in step by
 * {@link MessageLogService}; {@link #finalizeConversation} may still overwrite them (last writer wins).
 */
@Service
public class ConversationService {

    private static final Logger log = LoggerFactory.getLogger(ConversationService.class);

    private final ConversationRepository repository;
    private final MessageRepository messageRepository;
    private final ConversationAnalysisRepository analysisRepository;

    @Value("${leads.conversations.default-list-limit:10}")
    private int defaultListLimit;

    public ConversationService(ConversationRepository repository,
                               MessageRepository messageRepository,
                               ConversationAnalysisRepository analysisRepository) {
        this.repository = repository;
        this.messageRepository = messageRepository;
        this.analysisRepository = analysisRepository;
    }

    @Transactional
    public Conversation create(String callSid, String phoneNumber, LocalDateTime startTime) {
        if (StringUtils.isBlank(callSid)) {
            throw new InvalidArgumentException("callSid is required");
        }
        if (startTime == null) {
            throw new InvalidArgumentException("startTime is required");
        }
        String sid = callSid.trim();
        if (repository.existsByCallSid(sid)) {
            log.warn("Rejected duplicate conversation callSid={}", sid);
            throw new DuplicateCallSidException(sid);
        }

        Conversation conversation = Conversation.builder()
                .callSid(sid)
                .phoneNumber(StringUtils.trimToNull(phoneNumber))
                .startTime(startTime)
                .build();
        try {
            // flush now so a concurrent insert of the same call_sid fails here, not at commit
            conversation = repository.saveAndFlush(conversation);
        } catch (DataIntegrityViolationException e) {
            log.warn("Concurrent insert lost for callSid={}", sid);
            throw new DuplicateCallSidException(sid, e);
        }
        log.info("Conversation started: id={} callSid={} phone={}", conversation.getId(), sid, conversation.getPhoneNumber());
        return conversation;
    }

    @Transactional
    public Conversation finalizeConversation(Long conversationId,
                                             LocalDateTime endTime,
                                             BigDecimal durationSeconds,
                                             Integer userCount,
                                             Integer assistantCount) {
        Conversation conversation = repository.findByIdForUpdate(conversationId)
                .orElseThrow(() -> ResourceNotFoundException.conversation(conversationId));

        if (endTime == null) {
            throw new InvalidArgumentException("endTime is required");
        }
        if (endTime.isBefore(conversation.getStartTime())) {
            throw new InvalidArgumentException("endTime " + endTime + " is before startTime " + conversation.getStartTime());
        }
        if (durationSeconds != null && durationSeconds.signum() < 0) {
            throw new InvalidArgumentException("durationSeconds must not be negative");
        }
        if ((userCount != null && userCount < 0) || (assistantCount != null && assistantCount < 0)) {
            throw new InvalidArgumentException("message counts must not be negative");
        }

        int users = userCount != null ? userCount : conversation.getTotalUserMessages();
        int assistants = assistantCount != null ? assistantCount : conversation.getTotalAssistantMessages();
        BigDecimal duration = durationSeconds != null
                ? durationSeconds
                : secondsBetween(conversation.getStartTime(), endTime);

        if (sameFinalState(conversation, endTime, duration, users, assistants)) {
            log.debug("Finalize repeated with identical values for id={}", conversationId);
            return conversation;
        }

        conversation.setEndTime(endTime);
        conversation.setDurationSeconds(duration);
        conversation.setTotalUserMessages(users);
        conversation.setTotalAssistantMessages(assistants);
        conversation = repository.save(conversation);

        log.info("Conversation finalized: id={} callSid={} duration={}s messages={}/{}",
                conversationId, conversation.getCallSid(), duration, users, assistants);
        return conversation;
    }

    @Transactional(readOnly = true)
    public Conversation get(Long conversationId) {
        return repository.findById(conversationId)
                .orElseThrow(() -> ResourceNotFoundException.conversation(conversationId));
    }

    @Transactional(readOnly = true)
    public Conversation getByCallSid(String callSid) {
        return repository.findByCallSid(callSid)
                .orElseThrow(() -> ResourceNotFoundException.conversation(callSid));
    }

    @Transactional(readOnly = true)
    public List<Conversation> listRecent(Integer limit) {
        int size = (limit == null || limit <= 0) ? defaultListLimit : limit;
        return repository.findAllByOrderByStartTimeDescIdDesc(PageRequest.of(0, size));
    }

    @Transactional(readOnly = true)
    public ConversationDetailDto getDetail(String callSid) {
        Conversation conversation = getByCallSid(callSid);
        List<MessageDto> messages = messageRepository
                .findByConversation_IdOrderByTimestampAscIdAsc(conversation.getId()).stream()
                .map(MessageDto::from)
                .collect(Collectors.toList());
        AnalysisDto analysis = analysisRepository
                .findFirstByConversation_IdOrderByIdDesc(conversation.getId())
                .map(AnalysisDto::from)
                .orElse(null);
        return new ConversationDetailDto(ConversationDto.from(conversation), messages, analysis);
    }

    /**
     * Removes the conversation. Messages, analysis and scripts go with it through the
     * {@code ON DELETE CASCADE} foreign keys, inside this same transaction.
     */
    @Transactional
    public void delete(Long conversationId) {
        Conversation conversation = repository.findById(conversationId)
                .orElseThrow(() -> ResourceNotFoundException.conversation(conversationId));
        try {
            repository.delete(conversation);
            repository.flush();
        } catch (DataIntegrityViolationException e) {
            throw new IntegrityViolationException("Could not delete conversation id=" + conversationId, e);
        }
        log.info("Conversation deleted: id={} callSid={}", conversationId, conversation.getCallSid());
    }

    /**
     * Idempotent create used by call-status webhooks, which may be delivered more than once.
     */
    @Transactional
    public Conversation getOrCreate(String callSid, String phoneNumber, LocalDateTime startTime) {
        return repository.findByCallSid(callSid)
                .orElseGet(() -> create(callSid, phoneNumber, startTime));
    }

    /**
     * Finalizes from the call's own clock and the counters maintained by the message log.
     */
    @Transactional
    public Conversation complete(String callSid, String phoneNumber, LocalDateTime endTime, BigDecimal durationSeconds) {
        Conversation conversation = repository.findByCallSid(callSid).orElse(null);
        if (conversation == null) {
            LocalDateTime start = durationSeconds != null
                    ? endTime.minus(Duration.ofMillis(durationSeconds.movePointRight(3).longValue()))
                    : endTime;
            conversation = create(callSid, phoneNumber, start);
        }
        return finalizeConversation(conversation.getId(), endTime, durationSeconds, null, null);
    }

    private static boolean sameFinalState(Conversation c, LocalDateTime endTime, BigDecimal duration, int users, int assistants) {
        return Objects.equals(c.getEndTime(), endTime)
                && c.getDurationSeconds() != null
                && c.getDurationSeconds().compareTo(duration) == 0
                && Objects.equals(c.getTotalUserMessages(), users)
                && Objects.equals(c.getTotalAssistantMessages(), assistants);
    }

    static BigDecimal secondsBetween(LocalDateTime start, LocalDateTime end) {
        return BigDecimal.valueOf(Duration.between(start, end).toMillis())
                .divide(BigDecimal.valueOf(1000), 2, RoundingMode.HALF_UP);
    }
}
