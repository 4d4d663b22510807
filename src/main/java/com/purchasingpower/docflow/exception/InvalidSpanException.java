package com.purchasingpower.docflow.exception;

import lombok.Getter;

@Getter
public class InvalidSpanException extends StructuralException {

    private final String regionId;
    private final String reason;

    public InvalidSpanException(String regionId, String reason) {
        super(String.format("Invalid span for '%s': %s", regionId, reason));
        this.regionId = regionId;
        this.reason = reason;
    }
}
