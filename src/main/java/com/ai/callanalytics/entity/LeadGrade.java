package com.ai.callanalytics.entity;

import java.util.Optional;

/**
 * Sales-readiness label produced by the analysis engine.
 */
public enum LeadGrade {
    CALIENTE("caliente"),
    TIBIO("tibio"),
    FRIO("frio");

    private final String label;

    LeadGrade(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Optional<LeadGrade> fromLabel(String raw) {
        if (raw == null) return Optional.empty();
        String normalized = raw.trim();
        for (LeadGrade grade : values()) {
            if (grade.label.equalsIgnoreCase(normalized)) return Optional.of(grade);
        }
        return Optional.empty();
    }
}
