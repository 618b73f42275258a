package com.ai.callanalytics.service;

import com.ai.callanalytics.entity.Conversation;
import com.ai.callanalytics.entity.Message;
import com.ai.callanalytics.entity.MessageRole;
import com.ai.callanalytics.exception.InvalidArgumentException;
import com.ai.callanalytics.exception.ResourceNotFoundException;
import com.ai.callanalytics.repository.ConversationRepository;
import com.ai.callanalytics.repository.MessageRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Slice;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Append-only utterance log per conversation.
 */
@Service
public class MessageLogService {

    private static final Logger log = LoggerFactory.getLogger(MessageLogService.class);

    private final MessageRepository repository;
    private final ConversationRepository conversationRepository;

    public MessageLogService(MessageRepository repository, ConversationRepository conversationRepository) {
        this.repository = repository;
        this.conversationRepository = conversationRepository;
    }

    /**
     * Stores one utterance and bumps the parent's role counter in the same transaction.
     * The parent row is locked first, so appends to one conversation are serialized.
     */
    @Transactional
    public Message append(Long conversationId,
                          String role,
                          String content,
                          LocalDateTime timestamp,
                          BigDecimal confidence) {
        MessageRole messageRole = MessageRole.fromValue(role)
                .orElseThrow(() -> new InvalidArgumentException("Unsupported role: " + role));
        if (StringUtils.isBlank(content)) {
            throw new InvalidArgumentException("Message content is required");
        }
        if (timestamp == null) {
            throw new InvalidArgumentException("Message timestamp is required");
        }
        if (confidence != null && (confidence.signum() < 0 || confidence.compareTo(BigDecimal.ONE) > 0)) {
            throw new InvalidArgumentException("Confidence must be within [0,1]: " + confidence);
        }

        Conversation conversation = conversationRepository.findByIdForUpdate(conversationId)
                .orElseThrow(() -> ResourceNotFoundException.conversation(conversationId));

        Message message = repository.save(Message.builder()
                .conversation(conversation)
                .role(messageRole)
                .content(content)
                .confidence(confidence)
                .timestamp(timestamp)
                .build());

        conversation.incrementCounter(messageRole);
        conversationRepository.save(conversation);

        log.info("[{}] {}: {}", conversation.getCallSid(), messageRole.value(), StringUtils.abbreviate(content, 50));
        return message;
    }

    @Transactional(readOnly = true)
    public List<Message> listByConversation(Long conversationId) {
        return repository.findByConversation_IdOrderByTimestampAscIdAsc(conversationId);
    }

    @Transactional(readOnly = true)
    public Slice<Message> listByConversation(Long conversationId, int page, int size) {
        if (page < 0 || size <= 0) {
            throw new InvalidArgumentException("page must be >= 0 and size > 0");
        }
        return repository.findSliceByConversation_IdOrderByTimestampAscIdAsc(conversationId, PageRequest.of(page, size));
    }

    /**
     * Plain-text transcript in the form the analysis engine consumes:
     * a header line, a blank line, then one {@code Speaker: text} line per message.
     */
    @Transactional(readOnly = true)
    public String renderTranscript(String callSid) {
        Conversation conversation = conversationRepository.findByCallSid(callSid)
                .orElseThrow(() -> ResourceNotFoundException.conversation(callSid));

        StringBuilder text = new StringBuilder();
        text.append("Conversación del ")
                .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(conversation.getStartTime()))
                .append("\n\n");
        for (Message m : repository.findByConversation_IdOrderByTimestampAscIdAsc(conversation.getId())) {
            text.append(m.getRole().displayName()).append(": ").append(m.getContent());
            if (m.getConfidence() != null && m.getConfidence().signum() != 0) {
                text.append(String.format(Locale.ROOT, " (confianza: %.2f)", m.getConfidence()));
            }
            text.append('\n');
        }
        return text.toString();
    }
}
