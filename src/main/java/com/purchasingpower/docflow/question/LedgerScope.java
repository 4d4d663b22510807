package com.purchasingpower.docflow.question;

/**
 * Which table a ledger operation works on.
 *
 * @param sectionId owning section for per-section tables, null for the legacy table
 */
public record LedgerScope(String tableId, QuestionTableSchema schema, String sectionId) {

    public static LedgerScope forSection(String sectionId) {
        return new LedgerScope(sectionId + QuestionTableSchema.SECTION_TABLE_SUFFIX,
                QuestionTableSchema.SECTION, sectionId);
    }

    public static LedgerScope legacy() {
        return new LedgerScope(QuestionTableSchema.LEGACY_TABLE_ID, QuestionTableSchema.LEGACY, null);
    }

    public boolean isLegacy() {
        return schema == QuestionTableSchema.LEGACY;
    }
}
