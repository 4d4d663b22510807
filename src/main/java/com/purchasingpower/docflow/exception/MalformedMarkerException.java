package com.purchasingpower.docflow.exception;

import lombok.Getter;

@Getter
public class MalformedMarkerException extends StructuralException {

    private final int lineNumber;
    private final String content;
    private final String reason;

    public MalformedMarkerException(int lineNumber, String content, String reason) {
        super(String.format("Malformed marker at line %d: %s (%s)", lineNumber, content.strip(), reason));
        this.lineNumber = lineNumber;
        this.content = content;
        this.reason = reason;
    }
}
