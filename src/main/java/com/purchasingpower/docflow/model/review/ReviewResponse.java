package com.purchasingpower.docflow.model.review;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * What the completion service returned for a review gate.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ReviewResponse {

    /** As reported by the reviewer; the gate recomputes it from issue severities. */
    private boolean passed;

    private List<ReviewIssue> issues;

    private List<ReviewPatch> patches;

    private String summary;

    public List<ReviewIssue> getIssues() {
        if (issues == null) {
            issues = new ArrayList<>();
        }
        return issues;
    }

    public List<ReviewPatch> getPatches() {
        if (patches == null) {
            patches = new ArrayList<>();
        }
        return patches;
    }

    public long blockerCount() {
        return getIssues().stream().filter(ReviewIssue::isBlocker).count();
    }

    public long warningCount() {
        return getIssues().size() - blockerCount();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ReviewIssue {
        @Builder.Default
        private Severity severity = Severity.WARNING;
        private String section;
        private String description;
        private String suggestion;

        public boolean isBlocker() {
            return severity == Severity.BLOCKER;
        }

        public void setSeverity(Severity severity) {
            this.severity = severity == null ? Severity.WARNING : severity;
        }
    }

    public enum Severity {
        BLOCKER,  // fails the gate
        WARNING,
        INFO;

        /** Unrecognized severities are treated as warnings. */
        @JsonCreator
        public static Severity fromValue(String text) {
            if (text == null) {
                return WARNING;
            }
            try {
                return valueOf(text.strip().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return WARNING;
            }
        }

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /**
     * Suggested replacement text for one section.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ReviewPatch {
        private String section;
        private String suggestion;
        private String rationale;
    }
}
