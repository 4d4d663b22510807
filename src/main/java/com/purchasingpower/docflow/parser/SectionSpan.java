package com.purchasingpower.docflow.parser;

import com.purchasingpower.docflow.exception.InvalidSpanException;

/**
 * Half-open line interval {@code [start, end)} owned by a section marker.
 */
public record SectionSpan(String sectionId, int start, int end) {

    public SectionSpan {
        if (start < 0 || start >= end) {
            throw new InvalidSpanException(sectionId, "start " + start + " must be non-negative and before end " + end);
        }
    }

    public boolean contains(int line) {
        return line >= start && line < end;
    }
}
