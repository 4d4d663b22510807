package com.purchasingpower.docflow.registry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.purchasingpower.docflow.exception.ConfigurationException;

/** How a workflow target is processed. */
public enum HandlerMode {
    INTEGRATE_THEN_QUESTIONS("integrate_then_questions"),
    QUESTIONS_THEN_INTEGRATE("questions_then_integrate"),
    REVIEW_GATE("review_gate");

    private final String value;

    HandlerMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static HandlerMode fromValue(String text) {
        for (HandlerMode candidate : values()) {
            if (candidate.value.equals(text)) {
                return candidate;
            }
        }
        throw new ConfigurationException("Unknown HandlerMode '" + text + "'");
    }
}
