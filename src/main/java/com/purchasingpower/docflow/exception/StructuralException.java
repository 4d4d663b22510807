package com.purchasingpower.docflow.exception;

/**
 * Base type for every structural defect in a marker document.
 *
 * <p>The validator collects these exhaustively; "raise on first error" paths
 * throw the first one found.
 */
public class StructuralException extends RuntimeException {

    public StructuralException(String message) {
        super(message);
    }

    public StructuralException(String message, Throwable cause) {
        super(message, cause);
    }
}
