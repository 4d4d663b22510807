package com.purchasingpower.docflow.workflow;

/**
 * Processing state of one workflow section.
 *
 * <p>Flow: NEEDS_CONTENT → AWAITING_ANSWERS → READY_TO_INTEGRATE → COMPLETE, with
 * LOCKED as a terminal state reachable from any of them.
 */
public enum SectionStatus {

    /** Listed in the workflow order but no marker in the document. */
    MISSING,

    /** No further automated edits. */
    LOCKED,

    /** Blank, nothing asked yet: draft from context or generate questions. */
    NEEDS_CONTENT,

    /** Questions are out and unanswered. */
    AWAITING_ANSWERS,

    /** At least one answered question has not been folded into the prose. */
    READY_TO_INTEGRATE,

    /** No placeholder and no pending questions. */
    COMPLETE;

    public boolean isActionable() {
        return this == NEEDS_CONTENT || this == AWAITING_ANSWERS || this == READY_TO_INTEGRATE;
    }
}
