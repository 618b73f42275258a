package com.ai.callanalytics.controller;

import com.ai.callanalytics.dto.MarkSentRequest;
import com.ai.callanalytics.dto.ScriptDto;
import com.ai.callanalytics.service.FollowUpScriptService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Endpoints for the delivery sweeper.
 */
@RestController
@RequestMapping("/api/scripts")
@RequiredArgsConstructor
public class ScriptController {

    private final FollowUpScriptService scriptService;

    @GetMapping("/pending")
    public List<ScriptDto> pending() {
        return scriptService.listPending().stream()
                .map(ScriptDto::from)
                .collect(Collectors.toList());
    }

    @PostMapping("/{id}/sent")
    public ScriptDto markSent(@PathVariable Long id, @RequestBody(required = false) MarkSentRequest request) {
        return ScriptDto.from(scriptService.markSent(id, request != null ? request.getSentAt() : null));
    }
}
