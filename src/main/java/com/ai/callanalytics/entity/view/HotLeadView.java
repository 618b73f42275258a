package com.ai.callanalytics.entity.view;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Read-only mapping of the {@code leads_calientes} view.
 */
@Entity
@Immutable
@Table(name = "leads_calientes")
@Getter
@NoArgsConstructor
public class HotLeadView {

    @Id
    @Column(name = "call_sid")
    private String callSid;

    @Column(name = "phone_number")
    private String phoneNumber;

    @Column(name = "start_time")
    private LocalDateTime startTime;

    @Column(name = "duration_seconds")
    private BigDecimal durationSeconds;

    @Column(name = "resumen")
    private String resumen;

    @Column(name = "sentimiento")
    private String sentimiento;

    @Column(name = "nivel_interes")
    private Integer nivelInteres;

    @Column(name = "calificacion_lead")
    private String calificacionLead;

    @Column(name = "interes_cliente")
    private String interesCliente;

    @Column(name = "proximos_pasos")
    private String proximosPasos;
}
