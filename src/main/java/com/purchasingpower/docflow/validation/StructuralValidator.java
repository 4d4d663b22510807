package com.purchasingpower.docflow.validation;

import com.purchasingpower.docflow.exception.StructuralException;

import java.util.List;

/**
 * Batch structural checks over a marker document.
 *
 * <p>Every check runs independently; all violations are collected.
 */
public interface StructuralValidator {

    ValidationReport validate(List<String> lines);

    /**
     * Validates and additionally reports every section, subsection and table
     * marker present in {@code templateLines} but absent from {@code lines}.
     */
    ValidationReport validate(List<String> lines, List<String> templateLines);

    /**
     * Throws the first structural error, if any.
     */
    default void validateOrThrow(List<String> lines) {
        ValidationReport report = validate(lines);
        if (!report.isValid()) {
            StructuralException first = report.getErrors().get(0);
            throw first;
        }
    }
}
