package com.ai.callanalytics.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Root aggregate for one recorded call. Messages, analysis and follow-up scripts
 * hang off this row and are removed with it by the database cascade.
 */
@Entity
@Table(name = "conversaciones", indexes = {
    @Index(name = "idx_conversaciones_call_sid", columnList = "call_sid"),
    @Index(name = "idx_conversaciones_start_time", columnList = "start_time")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Conversation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "call_sid", nullable = false, unique = true, updatable = false, length = 100)
    private String callSid;

    @Column(name = "phone_number", length = 50)
    private String phoneNumber;

    @Column(name = "start_time", nullable = false)
    private LocalDateTime startTime;

    @Column(name = "end_time")
    private LocalDateTime endTime;

    @Column(name = "duration_seconds", precision = 10, scale = 2)
    private BigDecimal durationSeconds;

    @Column(name = "total_user_messages")
    @Builder.Default
    private Integer totalUserMessages = 0;

    @Column(name = "total_assistant_messages")
    @Builder.Default
    private Integer totalAssistantMessages = 0;

    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = LocalDateTime.now();
        if (totalUserMessages == null) totalUserMessages = 0;
        if (totalAssistantMessages == null) totalAssistantMessages = 0;
    }

    public void incrementCounter(MessageRole role) {
        if (role == MessageRole.USER) {
            totalUserMessages = (totalUserMessages == null ? 0 : totalUserMessages) + 1;
        } else {
            totalAssistantMessages = (totalAssistantMessages == null ? 0 : totalAssistantMessages) + 1;
        }
    }

    public boolean isFinalized() {
        return endTime != null;
    }
}
