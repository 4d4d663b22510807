package com.purchasingpower.docflow.exception;

import lombok.Getter;

@Getter
public class WorkflowOrderException extends ParseFailureException {

    /** 1-based line the failure refers to, 0 when the block is missing. */
    private final int lineNumber;

    public WorkflowOrderException(String message, int lineNumber) {
        super(message);
        this.lineNumber = lineNumber;
    }
}
