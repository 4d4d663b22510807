package com.purchasingpower.docflow.registry;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.purchasingpower.docflow.editing.SanitizeRules;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Processing policy for one section or review gate.
 *
 * <p>YAML keys are snake_case, e.g. {@code output_format: bullets}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class HandlerConfig {

    @Builder.Default
    private HandlerMode mode = HandlerMode.INTEGRATE_THEN_QUESTIONS;

    @Builder.Default
    private OutputFormat outputFormat = OutputFormat.PROSE;

    private boolean subsections;

    private boolean dedupe;

    @Builder.Default
    private List<String> preserveHeaders = List.of();

    @Builder.Default
    private List<String> sanitizeRemove = List.of();

    @Builder.Default
    private String llmProfile = "requirements";

    @Builder.Default
    private ReviewScope scope = ReviewScope.CURRENT_SECTION;

    @Builder.Default
    private AutoApplyPolicy autoApplyPatches = AutoApplyPolicy.NEVER;

    @Builder.Default
    private List<String> validationRules = List.of();

    @Builder.Default
    private List<GatePreCheck> preChecks = List.of();

    @Builder.Default
    private List<GatePassAction> onPass = List.of();

    public static HandlerConfig defaults() {
        return HandlerConfig.builder().build();
    }

    @JsonIgnore
    public boolean isReviewGate() {
        return mode == HandlerMode.REVIEW_GATE;
    }

    /**
     * Content filters for the editor, built from this policy.
     */
    @JsonIgnore
    public SanitizeRules sanitizeRules() {
        SanitizeRules.SanitizeRulesBuilder rules = SanitizeRules.builder()
                .dedupeBullets(dedupe)
                .preservedHeadings(preserveHeaders);
        for (String regex : sanitizeRemove) {
            rules.removePattern(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
        }
        return rules.build();
    }
}
