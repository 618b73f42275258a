package com.ai.callanalytics.controller;

import com.ai.callanalytics.config.ClockConfig;
import com.ai.callanalytics.entity.Conversation;
import com.ai.callanalytics.exception.DuplicateCallSidException;
import com.ai.callanalytics.service.ConversationService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(TwilioStatusController.class)
@Import(ClockConfig.class)
class TwilioStatusControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ConversationService conversationService;

    @Test
    @DisplayName("Ringing opens the conversation")
    void ringingCreates() throws Exception {
        mockMvc.perform(post("/twilio/voice/status")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("CallSid", "CA777")
                        .param("From", "+34600111222")
                        .param("CallStatus", "ringing"))
                .andExpect(status().isNoContent());

        verify(conversationService).getOrCreate(eq("CA777"), eq("+34600111222"), any());
        verify(conversationService, never()).complete(any(), any(), any(), any());
    }

    @Test
    @DisplayName("Completed finalizes with the reported duration")
    void completedFinalizes() throws Exception {
        when(conversationService.complete(eq("CA777"), any(), any(), eq(new BigDecimal("42"))))
                .thenReturn(Conversation.builder().id(1L).callSid("CA777").durationSeconds(new BigDecimal("42")).build());

        mockMvc.perform(post("/twilio/voice/status")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("CallSid", "CA777")
                        .param("CallStatus", "completed")
                        .param("CallDuration", "42"))
                .andExpect(status().isNoContent());

        verify(conversationService).complete(eq("CA777"), any(), any(), eq(new BigDecimal("42")));
    }

    @Test
    @DisplayName("A start callback that loses the insert race reuses the existing row")
    void concurrentStartIsIdempotent() throws Exception {
        when(conversationService.getOrCreate(eq("CA777"), any(), any()))
                .thenThrow(new DuplicateCallSidException("CA777"));
        when(conversationService.getByCallSid("CA777"))
                .thenReturn(Conversation.builder().id(1L).callSid("CA777").build());

        mockMvc.perform(post("/twilio/voice/status")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("CallSid", "CA777")
                        .param("CallStatus", "in-progress"))
                .andExpect(status().isNoContent());

        verify(conversationService).getByCallSid("CA777");
    }

    @Test
    @DisplayName("A completion that races a start callback completes the existing row")
    void concurrentCompletionRetriesOnce() throws Exception {
        when(conversationService.complete(eq("CA777"), any(), any(), any()))
                .thenThrow(new DuplicateCallSidException("CA777"))
                .thenReturn(Conversation.builder().id(1L).callSid("CA777").build());

        mockMvc.perform(post("/twilio/voice/status")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("CallSid", "CA777")
                        .param("CallStatus", "completed"))
                .andExpect(status().isNoContent());

        verify(conversationService, times(2)).complete(eq("CA777"), any(), any(), any());
    }

    @Test
    @DisplayName("Other statuses are acknowledged and ignored")
    void otherStatusIgnored() throws Exception {
        mockMvc.perform(post("/twilio/voice/status")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("CallSid", "CA777")
                        .param("CallStatus", "busy"))
                .andExpect(status().isNoContent());

        verifyNoInteractions(conversationService);
    }

    @Test
    @DisplayName("A missing CallSid is a bad request")
    void missingCallSid() throws Exception {
        mockMvc.perform(post("/twilio/voice/status")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("CallStatus", "completed"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(conversationService);
    }
}
