package com.ai.callanalytics.controller;

import com.ai.callanalytics.entity.Conversation;
import com.ai.callanalytics.entity.ConversationAnalysis;
import com.ai.callanalytics.entity.Message;
import com.ai.callanalytics.entity.MessageRole;
import com.ai.callanalytics.exception.DuplicateCallSidException;
import com.ai.callanalytics.exception.InvalidArgumentException;
import com.ai.callanalytics.exception.ResourceNotFoundException;
import com.ai.callanalytics.service.AnalysisService;
import com.ai.callanalytics.service.ConversationService;
import com.ai.callanalytics.service.FollowUpScriptService;
import com.ai.callanalytics.service.MessageLogService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ConversationController.class)
class ConversationControllerTest {

    private static final LocalDateTime START = LocalDateTime.of(2024, 1, 1, 10, 0);

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ConversationService conversationService;

    @MockBean
    private MessageLogService messageLogService;

    @MockBean
    private AnalysisService analysisService;

    @MockBean
    private FollowUpScriptService scriptService;

    private Conversation conversation() {
        return Conversation.builder()
                .id(1L)
                .callSid("CA123")
                .phoneNumber("+34600111222")
                .startTime(START)
                .build();
    }

    @Nested
    @DisplayName("POST /api/conversations")
    class Create {

        @Test
        @DisplayName("Should return 201 with the created conversation")
        void shouldCreate() throws Exception {
            when(conversationService.create("CA123", "+34600111222", START)).thenReturn(conversation());

            mockMvc.perform(post("/api/conversations")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                {
                                    "callSid": "CA123",
                                    "phoneNumber": "+34600111222",
                                    "startTime": "2024-01-01T10:00:00"
                                }
                                """))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.id").value(1))
                    .andExpect(jsonPath("$.callSid").value("CA123"))
                    .andExpect(jsonPath("$.totalUserMessages").value(0));
        }

        @Test
        @DisplayName("Should return 409 for a duplicate callSid")
        void shouldReturnConflict() throws Exception {
            when(conversationService.create(eq("CA123"), any(), any()))
                    .thenThrow(new DuplicateCallSidException("CA123"));

            mockMvc.perform(post("/api/conversations")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"callSid\":\"CA123\",\"startTime\":\"2024-01-01T10:00:00\"}"))
                    .andExpect(status().isConflict());
        }
    }

    @Test
    @DisplayName("GET /api/conversations/{id} returns 404 for an unknown id")
    void getUnknownConversation() throws Exception {
        when(conversationService.get(42L)).thenThrow(ResourceNotFoundException.conversation(42L));

        mockMvc.perform(get("/api/conversations/42"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("PUT /api/conversations/{id}/finalize passes every field through")
    void finalizeConversation() throws Exception {
        Conversation finalized = conversation();
        finalized.setEndTime(START.plusMinutes(2));
        finalized.setDurationSeconds(new BigDecimal("120.5"));
        finalized.setTotalUserMessages(1);
        finalized.setTotalAssistantMessages(1);
        when(conversationService.finalizeConversation(1L, START.plusMinutes(2), new BigDecimal("120.5"), 1, 1))
                .thenReturn(finalized);

        mockMvc.perform(put("/api/conversations/1/finalize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                            {
                                "endTime": "2024-01-01T10:02:00",
                                "durationSeconds": 120.5,
                                "totalUserMessages": 1,
                                "totalAssistantMessages": 1
                            }
                            """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.durationSeconds").value(120.5))
                .andExpect(jsonPath("$.totalAssistantMessages").value(1));
    }

    @Nested
    @DisplayName("Messages")
    class Messages {

        @Test
        @DisplayName("Should append a message and return 201")
        void shouldAppend() throws Exception {
            Message saved = Message.builder()
                    .id(10L)
                    .conversation(conversation())
                    .role(MessageRole.USER)
                    .content("Hola")
                    .confidence(new BigDecimal("0.9"))
                    .timestamp(START)
                    .build();
            when(messageLogService.append(eq(1L), eq("user"), eq("Hola"), eq(START), any())).thenReturn(saved);

            mockMvc.perform(post("/api/conversations/1/messages")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"role\":\"user\",\"content\":\"Hola\",\"timestamp\":\"2024-01-01T10:00:00\",\"confidence\":0.9}"))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.role").value("user"))
                    .andExpect(jsonPath("$.conversationId").value(1));
        }

        @Test
        @DisplayName("Should return 400 for an unsupported role")
        void shouldRejectRole() throws Exception {
            when(messageLogService.append(eq(1L), eq("system"), any(), any(), isNull()))
                    .thenThrow(new InvalidArgumentException("Unsupported role: system"));

            mockMvc.perform(post("/api/conversations/1/messages")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"role\":\"system\",\"content\":\"x\",\"timestamp\":\"2024-01-01T10:00:00\"}"))
                    .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("Should list an empty conversation as an empty array")
        void shouldListEmpty() throws Exception {
            when(messageLogService.listByConversation(1L)).thenReturn(List.of());

            mockMvc.perform(get("/api/conversations/1/messages"))
                    .andExpect(status().isOk())
                    .andExpect(content().json("[]"));
        }
    }

    @Nested
    @DisplayName("Analysis")
    class Analysis {

        @Test
        @DisplayName("Should upsert and echo the stored analysis")
        void shouldUpsert() throws Exception {
            ConversationAnalysis stored = ConversationAnalysis.builder()
                    .id(3L)
                    .conversation(conversation())
                    .calificacionLead("caliente")
                    .nivelInteres(8)
                    .sentimiento("positivo")
                    .build();
            when(analysisService.upsert(eq(1L), any())).thenReturn(stored);

            mockMvc.perform(put("/api/conversations/1/analysis")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("""
                                {
                                    "calificacionLead": "caliente",
                                    "nivelInteres": 8,
                                    "sentimiento": "positivo",
                                    "puntosClave": ["presupuesto 300k", "zona norte"]
                                }
                                """))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.calificacionLead").value("caliente"))
                    .andExpect(jsonPath("$.nivelInteres").value(8));
        }

        @Test
        @DisplayName("Should return 404 when no analysis exists")
        void shouldReturnNotFoundWhenAbsent() throws Exception {
            when(analysisService.get(1L)).thenReturn(Optional.empty());

            mockMvc.perform(get("/api/conversations/1/analysis"))
                    .andExpect(status().isNotFound());
        }
    }

    @Test
    @DisplayName("GET transcript returns plain text")
    void transcript() throws Exception {
        when(messageLogService.renderTranscript("CA123"))
                .thenReturn("Conversación del 2024-01-01T10:00:00\n\nUsuario: Hola\n");

        mockMvc.perform(get("/api/conversations/by-call-sid/CA123/transcript"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_PLAIN))
                .andExpect(content().string(org.hamcrest.Matchers.containsString("Usuario: Hola")));
    }

    @Test
    @DisplayName("DELETE /api/conversations/{id} returns 204")
    void deleteConversation() throws Exception {
        mockMvc.perform(delete("/api/conversations/1"))
                .andExpect(status().isNoContent());

        verify(conversationService).delete(1L);
    }
}
