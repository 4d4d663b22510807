package com.purchasingpower.docflow.question;

import java.util.Optional;

public enum QuestionStatus {
    OPEN("Open"),
    RESOLVED("Resolved"),
    DEFERRED("Deferred");

    private final String label;

    QuestionStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** Open and deferred questions still need attention. */
    public boolean isPending() {
        return this != RESOLVED;
    }

    public static Optional<QuestionStatus> fromLabel(String text) {
        if (text == null) {
            return Optional.empty();
        }
        for (QuestionStatus status : values()) {
            if (status.label.equalsIgnoreCase(text.strip())) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
