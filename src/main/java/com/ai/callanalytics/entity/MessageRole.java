package com.ai.callanalytics.entity;

import java.util.Optional;

/**
 * Speaker of an utterance. Persisted as the lowercase {@link #value()}.
 */
public enum MessageRole {
    USER("user", "Usuario"),
    ASSISTANT("assistant", "Asistente");

    private final String value;
    private final String displayName;

    MessageRole(String value, String displayName) {
        this.value = value;
        this.displayName = displayName;
    }

    public String value() {
        return value;
    }

    public String displayName() {
        return displayName;
    }

    public static Optional<MessageRole> fromValue(String raw) {
        if (raw == null) return Optional.empty();
        String normalized = raw.trim();
        for (MessageRole role : values()) {
            if (role.value.equalsIgnoreCase(normalized)) return Optional.of(role);
        }
        return Optional.empty();
    }
}
