package com.ai.callanalytics.dto;

import com.ai.callanalytics.entity.Conversation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConversationDto {

    private Long id;
    private String callSid;
    private String phoneNumber;
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private BigDecimal durationSeconds;
    private Integer totalUserMessages;
    private Integer totalAssistantMessages;
    private LocalDateTime createdAt;

    public static ConversationDto from(Conversation c) {
        return ConversationDto.builder()
                .id(c.getId())
                .callSid(c.getCallSid())
                .phoneNumber(c.getPhoneNumber())
                .startTime(c.getStartTime())
                .endTime(c.getEndTime())
                .durationSeconds(c.getDurationSeconds())
                .totalUserMessages(c.getTotalUserMessages())
                .totalAssistantMessages(c.getTotalAssistantMessages())
                .createdAt(c.getCreatedAt())
                .build();
    }
}
