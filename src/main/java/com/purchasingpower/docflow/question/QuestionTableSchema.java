package com.purchasingpower.docflow.question;

import java.util.List;

/**
 * The two fixed question table layouts.
 */
public enum QuestionTableSchema {

    /** Per-section ledger, one table per section named {@code <section>_questions}. */
    SECTION(List.of("Question ID", "Question", "Date", "Answer", "Status")),

    /** Whole-document ledger with an explicit target column. */
    LEGACY(List.of("Question ID", "Question", "Date", "Answer", "Section Target", "Resolution Status"));

    public static final String LEGACY_TABLE_ID = "open_questions";
    public static final String SECTION_TABLE_SUFFIX = "_questions";

    private final List<String> columns;

    QuestionTableSchema(List<String> columns) {
        this.columns = columns;
    }

    public List<String> columns() {
        return columns;
    }

    public int columnCount() {
        return columns.size();
    }

    public String headerRow() {
        return "| " + String.join(" | ", columns) + " |";
    }

    public String separatorRow() {
        StringBuilder row = new StringBuilder("|");
        for (String column : columns) {
            row.append("-".repeat(column.length() + 2)).append("|");
        }
        return row.toString();
    }

    /**
     * Schema enforced for a table id, or null for free-form tables.
     */
    public static QuestionTableSchema forTableId(String tableId) {
        if (LEGACY_TABLE_ID.equals(tableId)) {
            return LEGACY;
        }
        if (tableId != null && tableId.endsWith(SECTION_TABLE_SUFFIX)) {
            return SECTION;
        }
        return null;
    }
}
