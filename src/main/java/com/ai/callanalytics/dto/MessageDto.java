package com.ai.callanalytics.dto;

import com.ai.callanalytics.entity.Message;
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
public class MessageDto {

    private Long id;
    private Long conversationId;
    private String role;
    private String content;
    private BigDecimal confidence;
    private LocalDateTime timestamp;
    private LocalDateTime createdAt;

    public static MessageDto from(Message m) {
        return MessageDto.builder()
                .id(m.getId())
                .conversationId(m.getConversation().getId())
                .role(m.getRole().value())
                .content(m.getContent())
                .confidence(m.getConfidence())
                .timestamp(m.getTimestamp())
                .createdAt(m.getCreatedAt())
                .build();
    }
}
