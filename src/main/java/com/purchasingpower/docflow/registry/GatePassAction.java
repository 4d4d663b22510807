package com.purchasingpower.docflow.registry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.purchasingpower.docflow.exception.ConfigurationException;

/** Follow-up edits a review gate performs once it passes. */
public enum GatePassAction {
    LOCK_SCOPE_SECTIONS("lock_scope_sections"),
    RECORD_APPROVAL("record_approval");

    private final String value;

    GatePassAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static GatePassAction fromValue(String text) {
        for (GatePassAction candidate : values()) {
            if (candidate.value.equals(text)) {
                return candidate;
            }
        }
        throw new ConfigurationException("Unknown GatePassAction '" + text + "'");
    }
}
