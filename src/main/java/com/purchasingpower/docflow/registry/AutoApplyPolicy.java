package com.purchasingpower.docflow.registry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.purchasingpower.docflow.exception.ConfigurationException;

/** When review patches are merged without a human. */
public enum AutoApplyPolicy {
    NEVER("never"),
    ALWAYS("always"),
    IF_VALIDATION_PASSES("if_validation_passes");

    private final String value;

    AutoApplyPolicy(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static AutoApplyPolicy fromValue(String text) {
        for (AutoApplyPolicy candidate : values()) {
            if (candidate.value.equals(text)) {
                return candidate;
            }
        }
        throw new ConfigurationException("Unknown AutoApplyPolicy '" + text + "'");
    }
}
