package com.purchasingpower.docflow.model.review;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A question proposed by the completion service.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GeneratedQuestion(
        @JsonProperty("question") String question,
        @JsonProperty("section_target") @JsonAlias("target") String sectionTarget,
        @JsonProperty("rationale") String rationale) {
}
