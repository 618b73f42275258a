package com.ai.callanalytics.controller;

import com.ai.callanalytics.dto.AnalysisDto;
import com.ai.callanalytics.dto.AnalysisRequest;
import com.ai.callanalytics.dto.AppendMessageRequest;
import com.ai.callanalytics.dto.ConversationDetailDto;
import com.ai.callanalytics.dto.ConversationDto;
import com.ai.callanalytics.dto.CreateConversationRequest;
import com.ai.callanalytics.dto.CreateScriptRequest;
import com.ai.callanalytics.dto.FinalizeConversationRequest;
import com.ai.callanalytics.dto.MessageDto;
import com.ai.callanalytics.dto.ScriptDto;
import com.ai.callanalytics.exception.InvalidArgumentException;
import com.ai.callanalytics.exception.ResourceNotFoundException;
import com.ai.callanalytics.service.AnalysisService;
import com.ai.callanalytics.service.ConversationService;
import com.ai.callanalytics.service.FollowUpScriptService;
import com.ai.callanalytics.service.MessageLogService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/conversations")
@RequiredArgsConstructor
public class ConversationController {

    private final ConversationService conversationService;
    private final MessageLogService messageLogService;
    private final AnalysisService analysisService;
    private final FollowUpScriptService scriptService;

    @PostMapping
    public ResponseEntity<ConversationDto> create(@RequestBody CreateConversationRequest request) {
        if (request == null) throw new InvalidArgumentException("Request body is required");
        ConversationDto created = ConversationDto.from(conversationService.create(
                request.getCallSid(), request.getPhoneNumber(), request.getStartTime()));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping
    public List<ConversationDto> listRecent(@RequestParam(required = false) Integer limit) {
        return conversationService.listRecent(limit).stream()
                .map(ConversationDto::from)
                .collect(Collectors.toList());
    }

    @GetMapping("/{id}")
    public ConversationDto get(@PathVariable Long id) {
        return ConversationDto.from(conversationService.get(id));
    }

    @GetMapping("/by-call-sid/{callSid}")
    public ConversationDetailDto getByCallSid(@PathVariable String callSid) {
        return conversationService.getDetail(callSid);
    }

    @GetMapping(value = "/by-call-sid/{callSid}/transcript", produces = MediaType.TEXT_PLAIN_VALUE)
    public String transcript(@PathVariable String callSid) {
        return messageLogService.renderTranscript(callSid);
    }

    @PutMapping("/{id}/finalize")
    public ConversationDto finalizeConversation(@PathVariable Long id, @RequestBody FinalizeConversationRequest request) {
        if (request == null) throw new InvalidArgumentException("Request body is required");
        return ConversationDto.from(conversationService.finalizeConversation(
                id,
                request.getEndTime(),
                request.getDurationSeconds(),
                request.getTotalUserMessages(),
                request.getTotalAssistantMessages()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        conversationService.delete(id);
        return ResponseEntity.noContent().build();
    }

    // =========================================================
    // MESSAGES
    // =========================================================
    @PostMapping("/{id}/messages")
    public ResponseEntity<MessageDto> appendMessage(@PathVariable Long id, @RequestBody AppendMessageRequest request) {
        if (request == null) throw new InvalidArgumentException("Request body is required");
        MessageDto message = MessageDto.from(messageLogService.append(
                id, request.getRole(), request.getContent(), request.getTimestamp(), request.getConfidence()));
        return ResponseEntity.status(HttpStatus.CREATED).body(message);
    }

    @GetMapping("/{id}/messages")
    public List<MessageDto> listMessages(@PathVariable Long id,
                                         @RequestParam(required = false) Integer page,
                                         @RequestParam(required = false) Integer size) {
        if (page == null && size == null) {
            return messageLogService.listByConversation(id).stream()
                    .map(MessageDto::from)
                    .collect(Collectors.toList());
        }
        return messageLogService.listByConversation(id, page != null ? page : 0, size != null ? size : 50)
                .map(MessageDto::from)
                .getContent();
    }

    // =========================================================
    // ANALYSIS
    // =========================================================
    @PutMapping("/{id}/analysis")
    public AnalysisDto upsertAnalysis(@PathVariable Long id, @RequestBody AnalysisRequest request) {
        return AnalysisDto.from(analysisService.upsert(id, request));
    }

    @GetMapping("/{id}/analysis")
    public AnalysisDto getAnalysis(@PathVariable Long id) {
        return analysisService.get(id)
                .map(AnalysisDto::from)
                .orElseThrow(() -> ResourceNotFoundException.analysis(id));
    }

    @DeleteMapping("/{id}/analysis")
    public ResponseEntity<Void> deleteAnalysis(@PathVariable Long id) {
        return analysisService.delete(id)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    // =========================================================
    // FOLLOW-UP SCRIPTS
    // =========================================================
    @PostMapping("/{id}/scripts")
    public ResponseEntity<ScriptDto> createScript(@PathVariable Long id, @RequestBody CreateScriptRequest request) {
        if (request == null) throw new InvalidArgumentException("Request body is required");
        ScriptDto script = ScriptDto.from(scriptService.create(id, request.getScriptContent()));
        return ResponseEntity.status(HttpStatus.CREATED).body(script);
    }

    @GetMapping("/{id}/scripts")
    public List<ScriptDto> listScripts(@PathVariable Long id) {
        return scriptService.listByConversation(id).stream()
                .map(ScriptDto::from)
                .collect(Collectors.toList());
    }
}
