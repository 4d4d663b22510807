package com.purchasingpower.docflow.question;

/**
 * A question to be added to a ledger.
 */
public record NewQuestion(String question, String target, String rationale) {

    public NewQuestion(String question, String target) {
        this(question, target, null);
    }
}
