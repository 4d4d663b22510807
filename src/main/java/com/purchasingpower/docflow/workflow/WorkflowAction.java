package com.purchasingpower.docflow.workflow;

public enum WorkflowAction {
    INTEGRATION,
    DRAFT,
    QUESTION_GENERATION,
    REVIEW_GATE,
    NO_ACTION,
    /** Every target is locked, complete or passed. */
    COMPLETE
}
