package com.ai.callanalytics.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import org.hibernate.type.NumericBooleanConverter;

import java.time.LocalDateTime;

@Entity
@Table(name = "scripts_seguimiento", indexes = {
    @Index(name = "idx_scripts_conversation_id", columnList = "conversation_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FollowUpScript {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "conversation_id", nullable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Conversation conversation;

    @Column(name = "script_content", columnDefinition = "TEXT", nullable = false)
    private String scriptContent;

    // enviado is a 0/1 SMALLINT column
    @Convert(converter = NumericBooleanConverter.class)
    @Column(name = "enviado")
    @Builder.Default
    private Boolean sent = Boolean.FALSE;

    @Column(name = "fecha_envio")
    private LocalDateTime sentAt;

    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = LocalDateTime.now();
        if (sent == null) sent = Boolean.FALSE;
    }

    public boolean isSent() {
        return Boolean.TRUE.equals(sent);
    }
}
