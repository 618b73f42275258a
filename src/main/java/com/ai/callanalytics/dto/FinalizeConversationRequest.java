package com.ai.callanalytics.dto;

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
public class FinalizeConversationRequest {

    private LocalDateTime endTime;

    private BigDecimal durationSeconds;

    private Integer totalUserMessages;

    private Integer totalAssistantMessages;
}
