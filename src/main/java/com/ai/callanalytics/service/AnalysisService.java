package com.ai.callanalytics.service;

import com.ai.callanalytics.dto.AnalysisRequest;
import com.ai.callanalytics.entity.Conversation;
import com.ai.callanalytics.entity.ConversationAnalysis;
import com.ai.callanalytics.entity.LeadGrade;
import com.ai.callanalytics.exception.InvalidArgumentException;
import com.ai.callanalytics.exception.ResourceNotFoundException;
import com.ai.callanalytics.repository.ConversationAnalysisRepository;
import com.ai.callanalytics.repository.ConversationRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Stores the analysis engine's verdict for a conversation.
 * <p>
 * At most one record exists per conversation: a repeated upsert replaces the fields of the
 * existing row and keeps its id. The parent conversation row is locked for the duration of
 * the write, which serializes concurrent upserts for the same call.
 */
@Service
public class AnalysisService {

    private static final Logger log = LoggerFactory.getLogger(AnalysisService.class);

    static final int MIN_INTEREST = 1;
    static final int MAX_INTEREST = 10;
    private static final int SENTIMENT_LABEL_LENGTH = 50;

    private final ConversationAnalysisRepository repository;
    private final ConversationRepository conversationRepository;
    private final ObjectMapper mapper = new ObjectMapper();

    public AnalysisService(ConversationAnalysisRepository repository, ConversationRepository conversationRepository) {
        this.repository = repository;
        this.conversationRepository = conversationRepository;
    }

    @Transactional
    public ConversationAnalysis upsert(Long conversationId, AnalysisRequest request) {
        if (request == null) {
            throw new InvalidArgumentException("Analysis payload is required");
        }
        Integer interest = request.getNivelInteres();
        if (interest != null && (interest < MIN_INTEREST || interest > MAX_INTEREST)) {
            throw new InvalidArgumentException("nivelInteres must be between " + MIN_INTEREST + " and " + MAX_INTEREST + ": " + interest);
        }
        LeadGrade grade = StringUtils.isBlank(request.getCalificacionLead())
                ? LeadGrade.TIBIO
                : LeadGrade.fromLabel(request.getCalificacionLead())
                        .orElseThrow(() -> new InvalidArgumentException("Unknown lead grade: " + request.getCalificacionLead()));

        Conversation conversation = conversationRepository.findByIdForUpdate(conversationId)
                .orElseThrow(() -> ResourceNotFoundException.conversation(conversationId));

        ConversationAnalysis analysis = repository.findFirstByConversation_IdOrderByIdDesc(conversationId)
                .orElseGet(() -> ConversationAnalysis.builder().conversation(conversation).build());
        boolean replacing = analysis.getId() != null;

        analysis.setResumen(request.getResumen());
        analysis.setSentimiento(sentimentLabel(request.getSentimiento()));
        analysis.setSentimientoDetalle(request.getSentimiento());
        analysis.setInteresCliente(request.getInteresCliente());
        analysis.setNivelInteres(interest);
        analysis.setCalificacionLead(grade.label());
        analysis.setProximosPasos(toStoredText("proximosPasos", request.getProximosPasos()));
        analysis.setPropiedadesMencionadas(toStoredText("propiedadesMencionadas", request.getPropiedadesMencionadas()));
        analysis.setPuntosClave(toStoredText("puntosClave", request.getPuntosClave()));
        analysis = repository.save(analysis);

        log.info("Analysis {} for conversation id={} callSid={}: grade={} interest={}",
                replacing ? "replaced" : "stored", conversationId, conversation.getCallSid(), grade.label(), interest);
        if (grade == LeadGrade.CALIENTE) {
            log.info("Hot lead detected: callSid={} phone={}", conversation.getCallSid(), conversation.getPhoneNumber());
        }
        return analysis;
    }

    @Transactional(readOnly = true)
    public Optional<ConversationAnalysis> get(Long conversationId) {
        return repository.findFirstByConversation_IdOrderByIdDesc(conversationId);
    }

    /**
     * Drops the analysis so the conversation no longer shows up as a graded lead.
     *
     * @return whether a record was removed
     */
    @Transactional
    public boolean delete(Long conversationId) {
        conversationRepository.findByIdForUpdate(conversationId)
                .orElseThrow(() -> ResourceNotFoundException.conversation(conversationId));
        int removed = repository.deleteByConversationId(conversationId);
        if (removed > 0) {
            log.info("Analysis removed for conversation id={}", conversationId);
        }
        return removed > 0;
    }

    /** "positivo - muy interesado" becomes "positivo". */
    static String sentimentLabel(String sentiment) {
        if (sentiment == null) return null;
        String label = sentiment.contains("-")
                ? sentiment.substring(0, sentiment.indexOf('-')).trim()
                : sentiment.trim();
        return StringUtils.left(label, SENTIMENT_LABEL_LENGTH);
    }

    String toStoredText(String field, Object value) {
        if (value == null) return null;
        if (value instanceof String) return (String) value;
        if (value instanceof Collection || value instanceof Map || value.getClass().isArray()) {
            try {
                return mapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new InvalidArgumentException("Could not serialize " + field + ": " + e.getOriginalMessage());
            }
        }
        return String.valueOf(value);
    }
}
