package com.purchasingpower.docflow.exception;

import lombok.Getter;

/**
 * Reported in template-diff mode for a marker the template declares but the document lacks.
 */
@Getter
public class MissingTemplateMarkerException extends StructuralException {

    private final String markerKind;
    private final String markerId;

    public MissingTemplateMarkerException(String markerKind, String markerId) {
        super(String.format("Missing %s:%s marker required by template", markerKind, markerId));
        this.markerKind = markerKind;
        this.markerId = markerId;
    }
}
