package com.ai.callanalytics.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * One transcribed or synthesized utterance as delivered by the telephony pipeline.
 */
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AppendMessageRequest {

    private String role;

    private String content;

    private LocalDateTime timestamp;

    /** Speech-to-text confidence in [0,1]; usually absent for assistant turns. */
    private BigDecimal confidence;
}
