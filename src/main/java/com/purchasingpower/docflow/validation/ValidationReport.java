package com.purchasingpower.docflow.validation;

import com.purchasingpower.docflow.exception.StructuralException;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a structural validation pass.
 *
 * <p>{@code lines} is the validated document, including any auto-repairs.
 * The caller's list is never modified.
 */
@Value
@Builder
public class ValidationReport {
    List<StructuralException> errors;
    List<String> repairs;
    List<String> lines;

    public boolean isValid() {
        return errors.isEmpty();
    }

    public boolean isRepaired() {
        return !repairs.isEmpty();
    }
}
