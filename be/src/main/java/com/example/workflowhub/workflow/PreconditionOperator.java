package com.example.workflowhub.workflow;

import java.util.Locale;
import java.util.Optional;

public enum PreconditionOperator {
    PRESENT,
    ABSENT,
    EQUALS,
    NOT_EQUALS,
    IN;

    public static Optional<PreconditionOperator> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public boolean requiresValue() {
        return this == EQUALS || this == NOT_EQUALS;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
