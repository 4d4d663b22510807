package com.purchasingpower.docflow.marker;

/**
 * Every kind of marker event the tokenizer can emit.
 */
public enum MarkerKind {
    SECTION,
    SUBSECTION,
    TABLE,
    SECTION_LOCK,
    META,
    REVIEW_GATE_RESULT,
    WORKFLOW_ORDER_START,
    PLACEHOLDER,
    /** A recognized marker keyword whose syntax is invalid. */
    MALFORMED
}
