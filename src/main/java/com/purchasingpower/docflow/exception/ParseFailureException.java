package com.purchasingpower.docflow.exception;

/**
 * Raised immediately when a document block that downstream logic depends on
 * cannot be read at all. Never collected.
 */
public class ParseFailureException extends RuntimeException {

    public ParseFailureException(String message) {
        super(message);
    }
}
