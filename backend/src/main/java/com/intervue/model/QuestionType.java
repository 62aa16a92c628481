package com.intervue.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum QuestionType {
    THEORY,
    PRACTICAL;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static QuestionType fromWireValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("qtype is required");
        }
        try {
            return QuestionType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("qtype must be one of: theory, practical", ex);
        }
    }
}
