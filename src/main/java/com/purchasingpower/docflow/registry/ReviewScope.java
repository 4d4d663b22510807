package com.purchasingpower.docflow.registry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.purchasingpower.docflow.exception.ConfigurationException;

import java.util.Arrays;
import java.util.List;

/**
 * Which sections a target looks at: {@code current_section}, {@code all_prior_sections},
 * {@code entire_document} or an explicit {@code sections:a,b,c} list.
 */
public record ReviewScope(ScopeKind kind, List<String> sections) {

    public static final ReviewScope CURRENT_SECTION = new ReviewScope(ScopeKind.CURRENT_SECTION, List.of());
    public static final ReviewScope ALL_PRIOR_SECTIONS = new ReviewScope(ScopeKind.ALL_PRIOR_SECTIONS, List.of());
    public static final ReviewScope ENTIRE_DOCUMENT = new ReviewScope(ScopeKind.ENTIRE_DOCUMENT, List.of());

    private static final String EXPLICIT_PREFIX = "sections:";

    public ReviewScope {
        sections = List.copyOf(sections);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ReviewScope parse(String text) {
        if (text == null) {
            throw new ConfigurationException("Scope must not be null");
        }
        String value = text.strip();
        switch (value) {
            case "current_section":
                return CURRENT_SECTION;
            case "all_prior_sections":
                return ALL_PRIOR_SECTIONS;
            case "entire_document":
                return ENTIRE_DOCUMENT;
            default:
                break;
        }
        if (value.startsWith(EXPLICIT_PREFIX)) {
            List<String> ids = Arrays.stream(value.substring(EXPLICIT_PREFIX.length()).split(","))
                    .map(String::strip)
                    .filter(id -> !id.isEmpty())
                    .toList();
            if (ids.isEmpty()) {
                throw new ConfigurationException("Scope '" + text + "' lists no sections");
            }
            return new ReviewScope(ScopeKind.EXPLICIT_SECTIONS, ids);
        }
        throw new ConfigurationException("Unknown scope '" + text + "'");
    }

    @JsonValue
    public String value() {
        return switch (kind) {
            case CURRENT_SECTION -> "current_section";
            case ALL_PRIOR_SECTIONS -> "all_prior_sections";
            case ENTIRE_DOCUMENT -> "entire_document";
            case EXPLICIT_SECTIONS -> EXPLICIT_PREFIX + String.join(",", sections);
        };
    }
}
