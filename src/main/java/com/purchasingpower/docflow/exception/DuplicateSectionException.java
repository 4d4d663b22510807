package com.purchasingpower.docflow.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class DuplicateSectionException extends StructuralException {

    private final String sectionId;
    private final List<Integer> lineNumbers;

    public DuplicateSectionException(String sectionId, List<Integer> lineNumbers) {
        super(String.format("Duplicate section '%s' at lines: %s", sectionId, lineNumbers));
        this.sectionId = sectionId;
        this.lineNumbers = List.copyOf(lineNumbers);
    }
}
