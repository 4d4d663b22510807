package com.purchasingpower.docflow.exception;

import lombok.Getter;

@Getter
public class OrphanedLockException extends StructuralException {

    private final String lockId;
    private final int lineNumber;

    public OrphanedLockException(String lockId, int lineNumber) {
        super(String.format("Lock marker for '%s' at line %d has no matching section", lockId, lineNumber));
        this.lockId = lockId;
        this.lineNumber = lineNumber;
    }
}
