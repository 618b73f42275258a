package com.ai.callanalytics.entity.view;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Read-only mapping of the {@code estadisticas_conversaciones} view, one row per calendar day.
 */
@Entity
@Immutable
@Table(name = "estadisticas_conversaciones")
@Getter
@NoArgsConstructor
public class DailyStatisticsView {

    @Id
    @Column(name = "fecha")
    private LocalDate fecha;

    @Column(name = "total_conversaciones")
    private Long totalConversaciones;

    @Column(name = "duracion_promedio")
    private BigDecimal duracionPromedio;

    @Column(name = "total_mensajes")
    private Long totalMensajes;

    @Column(name = "leads_calientes")
    private Long leadsCalientes;

    @Column(name = "leads_tibios")
    private Long leadsTibios;

    @Column(name = "leads_frios")
    private Long leadsFrios;

    @Column(name = "interes_promedio")
    private BigDecimal interesPromedio;
}
