package com.ai.callanalytics.dto;

import com.ai.callanalytics.entity.ConversationAnalysis;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.LocalDateTime;

@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AnalysisDto {

    private Long id;
    private Long conversationId;
    private String resumen;
    private String sentimiento;
    private String sentimientoDetalle;
    private String interesCliente;
    private Integer nivelInteres;
    private String calificacionLead;
    private String proximosPasos;
    private String propiedadesMencionadas;
    private String puntosClave;
    private LocalDateTime createdAt;

    public static AnalysisDto from(ConversationAnalysis a) {
        return AnalysisDto.builder()
                .id(a.getId())
                .conversationId(a.getConversation().getId())
                .resumen(a.getResumen())
                .sentimiento(a.getSentimiento())
                .sentimientoDetalle(a.getSentimientoDetalle())
                .interesCliente(a.getInteresCliente())
                .nivelInteres(a.getNivelInteres())
                .calificacionLead(a.getCalificacionLead())
                .proximosPasos(a.getProximosPasos())
                .propiedadesMencionadas(a.getPropiedadesMencionadas())
                .puntosClave(a.getPuntosClave())
                .createdAt(a.getCreatedAt())
                .build();
    }
}
