package com.purchasingpower.docflow.registry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.purchasingpower.docflow.exception.ConfigurationException;

/** Deterministic checks a review gate runs before asking for a review. */
public enum GatePreCheck {
    NO_OPEN_QUESTIONS("no_open_questions"),
    LOW_RISKS_ONLY("low_risks_only");

    private final String value;

    GatePreCheck(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static GatePreCheck fromValue(String text) {
        for (GatePreCheck candidate : values()) {
            if (candidate.value.equals(text)) {
                return candidate;
            }
        }
        throw new ConfigurationException("Unknown GatePreCheck '" + text + "'");
    }
}
