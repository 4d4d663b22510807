package com.purchasingpower.docflow.exception;

import lombok.Getter;

@Getter
public class CompletionServiceException extends RuntimeException {

    private final String operation;

    public CompletionServiceException(String operation, String message) {
        super(operation + ": " + message);
        this.operation = operation;
    }

    public CompletionServiceException(String operation, String message, Throwable cause) {
        super(operation + ": " + message, cause);
        this.operation = operation;
    }
}
