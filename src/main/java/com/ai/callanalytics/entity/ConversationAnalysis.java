package com.ai.callanalytics.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.LocalDateTime;

/**
 * Qualitative assessment of a call. Lead grade and interest level are stored as the
 * plain string and integer the schema defines; validation happens in the service layer.
 */
@Entity
@Table(name = "analisis_conversaciones", indexes = {
    @Index(name = "idx_analisis_conversation_id", columnList = "conversation_id"),
    @Index(name = "idx_analisis_calificacion_lead", columnList = "calificacion_lead"),
    @Index(name = "idx_analisis_nivel_interes", columnList = "nivel_interes")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConversationAnalysis {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "conversation_id", nullable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Conversation conversation;

    @Column(columnDefinition = "TEXT")
    private String resumen;

    @Column(length = 50)
    private String sentimiento;

    @Column(name = "sentimiento_detalle", columnDefinition = "TEXT")
    private String sentimientoDetalle;

    @Column(name = "interes_cliente", columnDefinition = "TEXT")
    private String interesCliente;

    @Column(name = "nivel_interes")
    private Integer nivelInteres;

    @Column(name = "calificacion_lead", length = 20)
    private String calificacionLead;

    @Column(name = "proximos_pasos", columnDefinition = "TEXT")
    private String proximosPasos;

    @Column(name = "propiedades_mencionadas", columnDefinition = "TEXT")
    private String propiedadesMencionadas;

    @Column(name = "puntos_clave", columnDefinition = "TEXT")
    private String puntosClave;

    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = LocalDateTime.now();
    }
}
