package com.purchasingpower.docflow.question;

import java.util.Map;

/**
 * Maps subsection-level question targets onto the section that owns them.
 */
public final class QuestionTargets {

    private static final Map<String, String> CANONICAL = Map.of(
            "primary_goals", "goals_objectives",
            "secondary_goals", "goals_objectives",
            "non_goals", "goals_objectives");

    private QuestionTargets() {
    }

    public static String canonical(String target) {
        if (target == null) {
            return null;
        }
        String trimmed = target.strip();
        return CANONICAL.getOrDefault(trimmed, trimmed);
    }
}
