package com.purchasingpower.docflow.parser;

import com.purchasingpower.docflow.exception.InvalidSpanException;

/**
 * Half-open line interval of a subsection, always inside its parent section span.
 */
public record SubsectionSpan(String subsectionId, String parentId, int start, int end) {

    public SubsectionSpan {
        if (start < 0 || start >= end) {
            throw new InvalidSpanException(subsectionId, "start " + start + " must be non-negative and before end " + end);
        }
    }
}
