package com.purchasingpower.docflow.exception;

import lombok.Getter;

@Getter
public class QuestionTableException extends ParseFailureException {

    private final String tableId;

    public QuestionTableException(String tableId, String message) {
        super(message);
        this.tableId = tableId;
    }
}
