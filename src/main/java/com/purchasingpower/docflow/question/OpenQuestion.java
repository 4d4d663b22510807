package com.purchasingpower.docflow.question;

import java.util.Set;

/**
 * One row of a question ledger.
 *
 * @param line 0-based line of the row in the document it was parsed from
 */
public record OpenQuestion(String questionId,
                           String question,
                           String date,
                           String answer,
                           String target,
                           QuestionStatus status,
                           int line) {

    private static final Set<String> EMPTY_ANSWERS = Set.of("", "-", "pending");
    private static final String WARNING_PREFIX = "[WARNING]";

    /** Has an answer that has not been folded into prose yet. */
    public boolean isAnswered() {
        return status.isPending() && !EMPTY_ANSWERS.contains(answer.strip().toLowerCase());
    }

    /** Still waiting on a human answer. */
    public boolean isAwaitingAnswer() {
        return status.isPending() && !isAnswered();
    }

    /** Review warnings are recorded as questions but never block a gate. */
    public boolean isWarning() {
        return question.startsWith(WARNING_PREFIX);
    }
}
