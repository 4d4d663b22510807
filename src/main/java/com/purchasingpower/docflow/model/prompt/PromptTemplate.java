package com.purchasingpower.docflow.model.prompt;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Prompt template loaded from {@code classpath:prompts/*.yaml}.
 *
 * <pre>
 * name: draft-section
 * version: 1.0
 * description: Draft a blank section from completed sections
 * systemPrompt: |
 *   {{{profile}}}
 * userPrompt: |
 *   Draft the section {{sectionId}}...
 * </pre>
 *
 * Both prompts are Mustache; use triple braces for document text so it is not HTML-escaped.
 *
 * @see com.purchasingpower.docflow.service.PromptLibraryService
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PromptTemplate {
    private String name;
    private String version;
    private String description;
    private String systemPrompt;
    private String userPrompt;
}
