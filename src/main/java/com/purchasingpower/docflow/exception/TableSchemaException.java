package com.purchasingpower.docflow.exception;

import lombok.Getter;

/**
 * A fixed-schema table deviates from its canonical shape.
 * {@code lineNumber} is 1-based, or 0 when the problem is not tied to one row.
 */
@Getter
public class TableSchemaException extends StructuralException {

    private final String tableId;
    private final int lineNumber;
    private final String reason;

    public TableSchemaException(String tableId, int lineNumber, String reason) {
        super(lineNumber > 0
                ? String.format("Table '%s' line %d: %s", tableId, lineNumber, reason)
                : String.format("Table '%s': %s", tableId, reason));
        this.tableId = tableId;
        this.lineNumber = lineNumber;
        this.reason = reason;
    }
}
