package com.purchasingpower.docflow.question;

import java.util.List;
import java.util.Optional;

/**
 * Question tables: parsing, id allocation, insertion with duplicate suppression
 * and idempotent resolution. Every mutation returns a new line list.
 */
public interface QuestionLedger {

    /**
     * @throws com.purchasingpower.docflow.exception.QuestionTableException when the table is absent or its header is wrong
     */
    LedgerTable parse(List<String> lines, LedgerScope scope);

    /**
     * The table holding a section's questions: its own table when present,
     * otherwise the legacy whole-document table.
     */
    Optional<LedgerScope> scopeFor(List<String> lines, String sectionId);

    /**
     * Pending and resolved questions about {@code sectionId} or one of {@code subsectionIds}.
     */
    List<OpenQuestion> questionsFor(List<String> lines, String sectionId, List<String> subsectionIds);

    String nextId(LedgerScope scope, List<OpenQuestion> existing);

    LedgerUpdate insert(List<String> lines, LedgerScope scope, NewQuestion question, String date);

    LedgerUpdate insertBatch(List<String> lines, LedgerScope scope, List<NewQuestion> questions, String date);

    LedgerUpdate resolve(List<String> lines, LedgerScope scope, String questionId);

    LedgerUpdate resolveBatch(List<String> lines, LedgerScope scope, List<String> questionIds);
}
