package com.purchasingpower.docflow.registry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.purchasingpower.docflow.exception.ConfigurationException;

/** Shape of the prose a completion should produce for a section. */
public enum OutputFormat {
    PROSE("prose"),
    BULLETS("bullets"),
    SUBSECTIONS("subsections");

    private final String value;

    OutputFormat(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static OutputFormat fromValue(String text) {
        for (OutputFormat candidate : values()) {
            if (candidate.value.equals(text)) {
                return candidate;
            }
        }
        throw new ConfigurationException("Unknown OutputFormat '" + text + "'");
    }
}
