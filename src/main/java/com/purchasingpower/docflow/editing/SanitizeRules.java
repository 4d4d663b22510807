package com.purchasingpower.docflow.editing;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Per-region content filters applied to generated text before it is spliced in.
 */
@Value
@Builder
public class SanitizeRules {

    /** Drop bullet items whose normalized text was already seen. */
    boolean dedupeBullets;

    /** Heading texts allowed to survive sanitization (compared case-insensitively). */
    @Singular
    List<String> preservedHeadings;

    /** Lines matching any of these are removed. */
    @Singular
    List<Pattern> removePatterns;

    public static SanitizeRules defaults() {
        return SanitizeRules.builder().build();
    }
}
