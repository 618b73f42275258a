package com.ai.callanalytics.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Analysis payload as produced by the analysis engine.
 * <p>
 * {@code sentimiento} may carry a detail suffix ("positivo - muy interesado"); the part before
 * the first dash becomes the label. The last three fields accept either plain text or a JSON list.
 */
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AnalysisRequest {

    private String resumen;

    private String sentimiento;

    private String interesCliente;

    private Integer nivelInteres;

    private String calificacionLead;

    private Object proximosPasos;

    private Object propiedadesMencionadas;

    private Object puntosClave;
}
