package com.ai.callanalytics.controller;

import com.ai.callanalytics.exception.DuplicateCallSidException;
import com.ai.callanalytics.exception.ResourceNotFoundException;
import jakarta.servlet.RequestDispatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.servlet.error.DefaultErrorAttributes;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorControllerTest {

    private ErrorController controller;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-01-01T10:00:00Z"), ZoneOffset.UTC);
        controller = new ErrorController(new DefaultErrorAttributes(), clock);
    }

    private MockHttpServletRequest errorDispatch(int status, String uri, Throwable error) {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/error");
        request.setAttribute(RequestDispatcher.ERROR_STATUS_CODE, status);
        request.setAttribute(RequestDispatcher.ERROR_REQUEST_URI, uri);
        if (error != null) {
            request.setAttribute(RequestDispatcher.ERROR_EXCEPTION, error);
        }
        return request;
    }

    @Test
    @DisplayName("A duplicate callSid is typed by the failure and carries the callSid")
    void duplicateCallSid() {
        // When
        ResponseEntity<ProblemDetail> response = controller.error(
                errorDispatch(409, "/api/conversations", new DuplicateCallSidException("CA123")));

        // Then
        ProblemDetail pd = response.getBody();
        assertThat(response.getStatusCode().value()).isEqualTo(409);
        assertThat(response.getHeaders().getContentType()).isEqualTo(MediaType.APPLICATION_PROBLEM_JSON);
        assertThat(pd.getType()).isEqualTo(URI.create("urn:call-analytics:duplicate-call-sid"));
        assertThat(pd.getDetail()).contains("CA123");
        assertThat(pd.getInstance()).isEqualTo(URI.create("/api/conversations"));
        assertThat(pd.getProperties())
                .containsEntry("callSid", "CA123")
                .containsEntry("timestamp", "2024-01-01T10:00:00Z");
    }

    @Test
    @DisplayName("A missing resource keeps its message")
    void notFound() {
        ProblemDetail pd = controller.error(
                errorDispatch(404, "/api/conversations/9", ResourceNotFoundException.conversation(9L))).getBody();

        assertThat(pd.getType()).isEqualTo(URI.create("urn:call-analytics:resource-not-found"));
        assertThat(pd.getDetail()).isEqualTo("Conversation not found: id=9");
    }

    @Test
    @DisplayName("Unexpected server errors do not leak their message")
    void serverErrorHidesInternals() {
        ProblemDetail pd = controller.error(
                errorDispatch(500, "/api/reports/hot-leads", new IllegalStateException("pool exhausted"))).getBody();

        assertThat(pd.getStatus()).isEqualTo(500);
        assertThat(pd.getType()).isEqualTo(URI.create("urn:call-analytics:status-500"));
        assertThat(pd.getDetail()).isEqualTo("Internal Server Error");
    }

    @Test
    @DisplayName("Type names are the exception name in kebab case")
    void typeName() {
        assertThat(ErrorController.typeName(DuplicateCallSidException.class)).isEqualTo("duplicate-call-sid");
        assertThat(ErrorController.typeName(ResourceNotFoundException.class)).isEqualTo("resource-not-found");
    }
}
