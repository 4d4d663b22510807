package com.purchasingpower.docflow.completion;

/**
 * Outcome of one completion criterion.
 *
 * @param blocking a failed blocking check keeps the document incomplete; a failed
 *                 non-blocking check is reported as a warning
 */
public record CompletionCheck(String criterion, boolean passed, String details, boolean blocking) {

    public static CompletionCheck passed(String criterion, String details) {
        return new CompletionCheck(criterion, true, details, true);
    }

    public static CompletionCheck failed(String criterion, String details) {
        return new CompletionCheck(criterion, false, details, true);
    }
}
