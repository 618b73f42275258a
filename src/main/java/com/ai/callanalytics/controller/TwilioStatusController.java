package com.ai.callanalytics.controller;

import com.ai.callanalytics.entity.Conversation;
import com.ai.callanalytics.exception.DuplicateCallSidException;
import com.ai.callanalytics.service.ConversationService;
import com.twilio.security.RequestValidator;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Set;

/**
 * Twilio call-status webhook. Opens the conversation row when the call starts and
 * finalizes it when Twilio reports the call as completed.
 */
@RestController
public class TwilioStatusController {

    private static final Logger log = LoggerFactory.getLogger(TwilioStatusController.class);

    private static final Set<String> STARTED = Set.of("initiated", "ringing", "in-progress");
    private static final String COMPLETED = "completed";

    private final ConversationService conversationService;
    private final Clock clock;

    @Value("${twilio.auth-token:}")
    private String authToken;

    @Value("${twilio.base-url:}")
    private String baseUrl;

    public TwilioStatusController(ConversationService conversationService, Clock clock) {
        this.conversationService = conversationService;
        this.clock = clock;
    }

    @PostMapping(value = "/twilio/voice/status", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public ResponseEntity<Void> status(@RequestParam Map<String, String> params,
                                       @RequestHeader(value = "X-Twilio-Signature", required = false) String signature,
                                       HttpServletRequest request) {
        if (!signatureValid(request, params, signature)) {
            log.warn("Rejected status callback with invalid signature for callSid={}", params.get("CallSid"));
            return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
        }

        String callSid = params.getOrDefault("CallSid", "");
        String status = params.getOrDefault("CallStatus", "").toLowerCase();
        String from = params.get("From");
        if (StringUtils.isBlank(callSid)) {
            return ResponseEntity.badRequest().build();
        }

        LocalDateTime now = LocalDateTime.now(clock);
        if (STARTED.contains(status)) {
            open(callSid, from, now);
        } else if (COMPLETED.equals(status)) {
            BigDecimal duration = parseDuration(params.get("CallDuration"));
            Conversation c;
            try {
                c = conversationService.complete(callSid, from, now, duration);
            } catch (DuplicateCallSidException e) {
                // a start callback inserted the row first; it exists now
                log.info("Conversation for callSid={} created concurrently, completing existing row", callSid);
                c = conversationService.complete(callSid, from, now, duration);
            }
            log.info("Call completed -> conversation id={} callSid={} duration={}s", c.getId(), callSid, c.getDurationSeconds());
        } else {
            log.info("Ignoring call status {} for callSid={}", status, callSid);
        }
        return ResponseEntity.noContent().build();
    }

    /**
     * Start callbacks for one call often arrive together. The one that loses the insert
     * race reads the row the winner created.
     */
    private Conversation open(String callSid, String from, LocalDateTime now) {
        try {
            return conversationService.getOrCreate(callSid, from, now);
        } catch (DuplicateCallSidException e) {
            log.info("Conversation for callSid={} created concurrently, reusing it", callSid);
            return conversationService.getByCallSid(callSid);
        }
    }

    private boolean signatureValid(HttpServletRequest request, Map<String, String> params, String signature) {
        if (StringUtils.isBlank(authToken)) {
            return true;
        }
        if (StringUtils.isBlank(signature)) {
            return false;
        }
        String url = StringUtils.isNotBlank(baseUrl)
                ? baseUrl.trim().replaceAll("/$", "") + request.getRequestURI()
                : request.getRequestURL().toString();
        return new RequestValidator(authToken).validate(url, params, signature);
    }

    private static BigDecimal parseDuration(String raw) {
        if (StringUtils.isBlank(raw)) return null;
        try {
            BigDecimal value = new BigDecimal(raw.trim());
            return value.signum() < 0 ? null : value;
        } catch (NumberFormatException e) {
            log.warn("Unparseable CallDuration '{}', computing from start time", raw);
            return null;
        }
    }
}
