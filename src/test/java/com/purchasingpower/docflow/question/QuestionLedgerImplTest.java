package com.purchasingpower.docflow.question;

import com.purchasingpower.docflow.exception.QuestionTableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.purchasingpower.docflow.TestDocuments.DATE;
import static com.purchasingpower.docflow.TestDocuments.lines;
import static com.purchasingpower.docflow.TestDocuments.row;
import static com.purchasingpower.docflow.TestDocuments.section;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Question Ledger Tests")
class QuestionLedgerImplTest {

    private static final LedgerScope SCOPE = LedgerScope.forSection("problem_statement");

    private QuestionLedgerImpl ledger;
    private List<String> doc;

    @BeforeEach
    void setUp() {
        ledger = new QuestionLedgerImpl();
        doc = section("problem_statement", null, false,
                row("problem_statement-Q1", "What problem are we solving?", "", "Open"),
                row("problem_statement-Q2", "Who reported it?", "Support", "Resolved"));
    }

    @Nested
    @DisplayName("Per-section table")
    class SectionTable {

        @Test
        @DisplayName("Should parse rows with their status and line")
        void parse() {
            LedgerTable table = ledger.parse(doc, SCOPE);

            assertThat(table.questions()).hasSize(2);
            OpenQuestion first = table.questions().get(0);
            assertEquals("problem_statement-Q1", first.questionId());
            assertEquals("problem_statement", first.target());
            assertEquals(11, first.line());
            assertTrue(first.isAwaitingAnswer());
            assertEquals(QuestionStatus.RESOLVED, table.questions().get(1).status());
        }

        @Test
        @DisplayName("Should never reuse the id of a row it cannot parse")
        void skippedRowIdsStayTaken() {
            // Given
            List<String> withUnknownStatus = section("scope", null, false,
                    row("scope-Q1", "Old question?", "", "Pending"),
                    "| scope-Q2 | Short row |");
            LedgerScope scope = LedgerScope.forSection("scope");

            // When
            LedgerUpdate update = ledger.insert(withUnknownStatus, scope,
                    new NewQuestion("New question?", null, null), DATE);

            // Then
            assertThat(update.questionIds()).containsExactly("scope-Q3");
            assertEquals(1, update.lines().stream().filter(l -> l.startsWith("| scope-Q1 |")).count());
        }

        @Test
        @DisplayName("Should allocate ids above the highest existing one, resolved included")
        void nextId() {
            assertEquals("problem_statement-Q3", ledger.nextId(SCOPE, ledger.parse(doc, SCOPE).questions()));
        }

        @Test
        @DisplayName("Should insert a new question as an Open row at the top of the table")
        void insert() {
            LedgerUpdate update = ledger.insert(doc, SCOPE, new NewQuestion("Who are the | users?", null), DATE);

            assertTrue(update.changed());
            assertThat(update.questionIds()).containsExactly("problem_statement-Q3");
            assertEquals("| problem_statement-Q3 | Who are the / users? | 2024-01-15 |  | Open |", update.lines().get(11));
            assertEquals(doc.size() + 1, update.lines().size());
        }

        @Test
        @DisplayName("Should return the existing id for a question that differs only in case and spacing")
        void duplicateSuppressed() {
            LedgerUpdate update = ledger.insert(doc, SCOPE,
                    new NewQuestion("  what PROBLEM   are we solving? ", null), DATE);

            assertFalse(update.changed());
            assertThat(update.questionIds()).containsExactly("problem_statement-Q1");
            assertEquals(doc, update.lines());
        }

        @Test
        @DisplayName("Should dedupe within a batch and keep batch order")
        void insertBatch() {
            LedgerUpdate update = ledger.insertBatch(doc, SCOPE, List.of(
                    new NewQuestion("Which regions?", null),
                    new NewQuestion("which  regions?", null),
                    new NewQuestion("What is the deadline?", null)), DATE);

            assertEquals(2, update.changedCount());
            assertThat(update.questionIds())
                    .containsExactly("problem_statement-Q3", "problem_statement-Q3", "problem_statement-Q4");
            assertThat(update.lines().get(11)).contains("problem_statement-Q3");
            assertThat(update.lines().get(12)).contains("problem_statement-Q4");
        }

        @Test
        @DisplayName("Should resolve idempotently")
        void resolve() {
            LedgerUpdate first = ledger.resolve(doc, SCOPE, "problem_statement-Q1");
            LedgerUpdate second = ledger.resolve(first.lines(), SCOPE, "problem_statement-Q1");

            assertEquals(1, first.changedCount());
            assertEquals(row("problem_statement-Q1", "What problem are we solving?", "", "Resolved"),
                    first.lines().get(11));
            assertEquals(0, second.changedCount());
            assertEquals(first.lines(), second.lines());
        }

        @Test
        @DisplayName("Should ignore unknown and already-resolved ids in a batch")
        void resolveBatch() {
            LedgerUpdate update = ledger.resolveBatch(doc, SCOPE,
                    List.of("problem_statement-Q2", "problem_statement-Q9", "problem_statement-Q1"));

            assertThat(update.questionIds()).containsExactly("problem_statement-Q1");
        }

        @Test
        @DisplayName("Should fail with a typed error when the table is absent or misshapen")
        void typedFailures() {
            assertThatThrownBy(() -> ledger.parse(doc, LedgerScope.forSection("goals_objectives")))
                    .isInstanceOf(QuestionTableException.class)
                    .hasMessageContaining("not found");

            List<String> wrongHeader = lines("""
                    <!-- section:problem_statement -->
                    <!-- table:problem_statement_questions -->
                    | ID | Question | Status |
                    |---|---|---|
                    """);
            assertThatThrownBy(() -> ledger.parse(wrongHeader, SCOPE))
                    .isInstanceOf(QuestionTableException.class)
                    .hasMessageContaining("expected");
        }
    }

    @Nested
    @DisplayName("Legacy whole-document table")
    class LegacyTable {

        private final List<String> legacyDoc = lines("""
                <!-- section:goals_objectives -->
                <!-- PLACEHOLDER -->
                <!-- subsection:primary_goals -->
                <!-- section:risks_open_issues -->
                <!-- subsection:open_questions -->
                <!-- table:open_questions -->
                | Question ID | Question | Date | Answer | Section Target | Resolution Status |
                |---|---|---|---|---|---|
                | Q-001 | Main goal? | 2024-01-01 | Growth | primary_goals | Open |
                | Q-002 | Budget? | 2024-01-01 |  | constraints | Open |
                """);

        @Test
        @DisplayName("Should fall back to the legacy table when a section has none")
        void scopeFallsBack() {
            assertEquals(LedgerScope.legacy(), ledger.scopeFor(legacyDoc, "goals_objectives").orElseThrow());
            assertThat(ledger.scopeFor(List.of("<!-- section:x -->"), "x")).isEmpty();
        }

        @Test
        @DisplayName("Should select questions by target, mapping subsection targets to their section")
        void questionsFor() {
            List<OpenQuestion> questions = ledger.questionsFor(legacyDoc, "goals_objectives", List.of());

            assertThat(questions).extracting(OpenQuestion::questionId).containsExactly("Q-001");
            assertTrue(questions.get(0).isAnswered());
        }

        @Test
        @DisplayName("Should use zero-padded ids and treat the target as part of the duplicate key")
        void legacyInsert() {
            LedgerUpdate update = ledger.insertBatch(legacyDoc, LedgerScope.legacy(), List.of(
                    new NewQuestion("Budget?", "constraints"),
                    new NewQuestion("Budget?", "assumptions")), DATE);

            assertThat(update.questionIds()).containsExactly("Q-002", "Q-003");
            assertEquals("| Q-003 | Budget? | 2024-01-15 |  | assumptions | Open |", update.lines().get(8));
        }
    }
}
