package com.ai.callanalytics.controller;

import com.ai.callanalytics.exception.CallStoreException;
import com.ai.callanalytics.exception.DuplicateCallSidException;
import jakarta.servlet.RequestDispatcher;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.servlet.error.ErrorAttributes;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.ServletWebRequest;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;

/**
 * Error dispatch endpoint. Store failures become {@code application/problem+json} typed by the
 * failure ({@code urn:call-analytics:duplicate-call-sid}, ...); anything else is typed by status.
 */
@RestController
@RequestMapping("${server.error.path:${error.path:/error}}")
public class ErrorController implements org.springframework.boot.web.servlet.error.ErrorController {

    private static final Logger log = LoggerFactory.getLogger(ErrorController.class);

    static final String TYPE_PREFIX = "urn:call-analytics:";

    private final ErrorAttributes errorAttributes;
    private final Clock clock;

    public ErrorController(ErrorAttributes errorAttributes, Clock clock) {
        this.errorAttributes = errorAttributes;
        this.clock = clock;
    }

    @RequestMapping
    public ResponseEntity<ProblemDetail> error(HttpServletRequest request) {
        Throwable error = errorAttributes.getError(new ServletWebRequest(request));
        HttpStatus status = statusOf(request.getAttribute(RequestDispatcher.ERROR_STATUS_CODE));
        String path = StringUtils.defaultIfBlank(
                (String) request.getAttribute(RequestDispatcher.ERROR_REQUEST_URI), request.getRequestURI());

        if (status.is5xxServerError()) {
            log.error("Request {} failed with {}", path, status.value(), error);
        }

        ProblemDetail pd = ProblemDetail.forStatus(status);
        pd.setTitle(status.getReasonPhrase());
        pd.setInstance(URI.create(path));
        pd.setProperty("timestamp", Instant.now(clock).toString());

        if (error instanceof CallStoreException) {
            pd.setType(URI.create(TYPE_PREFIX + typeName(error.getClass())));
            pd.setDetail(error.getMessage());
            if (error instanceof DuplicateCallSidException) {
                pd.setProperty("callSid", ((DuplicateCallSidException) error).getCallSid());
            }
        } else {
            pd.setType(URI.create(TYPE_PREFIX + "status-" + status.value()));
            // internals stay in the log for server errors
            pd.setDetail(error != null && !status.is5xxServerError()
                    ? error.getMessage()
                    : status.getReasonPhrase());
        }

        return ResponseEntity
                .status(status)
                .contentType(MediaType.APPLICATION_PROBLEM_JSON)
                .body(pd);
    }

    private static HttpStatus statusOf(Object code) {
        if (code instanceof Integer) {
            HttpStatus resolved = HttpStatus.resolve((Integer) code);
            if (resolved != null) return resolved;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    /** DuplicateCallSidException becomes duplicate-call-sid. */
    static String typeName(Class<?> type) {
        String name = StringUtils.removeEnd(type.getSimpleName(), "Exception");
        return String.join("-", StringUtils.splitByCharacterTypeCamelCase(name)).toLowerCase();
    }
}
