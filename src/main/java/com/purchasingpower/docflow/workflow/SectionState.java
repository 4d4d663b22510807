package com.purchasingpower.docflow.workflow;

/**
 * Derived, never stored.
 */
public record SectionState(String sectionId,
                           boolean exists,
                           boolean locked,
                           boolean blank,
                           int openQuestions,
                           int answeredQuestions) {

    public static SectionState missing(String sectionId) {
        return new SectionState(sectionId, false, false, false, 0, 0);
    }

    public boolean hasOpenQuestions() {
        return openQuestions > 0;
    }

    public boolean hasAnsweredQuestions() {
        return answeredQuestions > 0;
    }

    public SectionStatus status() {
        if (!exists) {
            return SectionStatus.MISSING;
        }
        if (locked) {
            return SectionStatus.LOCKED;
        }
        if (hasAnsweredQuestions()) {
            return SectionStatus.READY_TO_INTEGRATE;
        }
        if (hasOpenQuestions()) {
            return SectionStatus.AWAITING_ANSWERS;
        }
        return blank ? SectionStatus.NEEDS_CONTENT : SectionStatus.COMPLETE;
    }

    public boolean isComplete() {
        return status() == SectionStatus.COMPLETE;
    }
}
