package com.purchasingpower.docflow.editing;

import java.util.List;

/**
 * The only sanctioned way to change a region's prose.
 *
 * <p>Implementations validate the document before and after the edit and
 * return a new list; the input list is never modified.
 */
public interface MarkerPreservingEditor {

    /**
     * Replaces the free-text body of {@code lines[start, end)} with {@code newBody}.
     *
     * @throws com.purchasingpower.docflow.exception.InvalidSpanException if the span is empty or out of bounds
     * @throws com.purchasingpower.docflow.exception.StructuralException if the document is already invalid
     *                                                                    or the edit would corrupt it
     */
    List<String> replaceBody(List<String> lines, int start, int end, String regionId, String newBody,
                             SanitizeRules rules);

    default List<String> replaceBody(List<String> lines, int start, int end, String regionId, String newBody) {
        return replaceBody(lines, start, end, regionId, newBody, SanitizeRules.defaults());
    }
}
