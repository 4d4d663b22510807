package com.purchasingpower.docflow.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Registry entry for one document type.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class DocumentTypeConfig {

    /** Policy for sections that have no entry of their own; may be null. */
    private HandlerConfig defaults;

    private Map<String, HandlerConfig> sections = new LinkedHashMap<>();

    /** Target id (section or gate) to the version reached when it completes. */
    private Map<String, String> versionMilestones = new LinkedHashMap<>();
}
