package com.purchasingpower.docflow.parser;

import com.purchasingpower.docflow.exception.InvalidSpanException;
import com.purchasingpower.docflow.exception.WorkflowOrderException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.purchasingpower.docflow.TestDocuments.lines;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Document Parser Tests")
class DocumentParserTest {

    private static final List<String> DOC = lines("""
            <!-- section:problem_statement -->
            ## Problem Statement
            Customers cannot track orders.
            <!-- section_lock:problem_statement lock=false -->
            <!-- section:goals_objectives -->
            ## Goals
            <!-- PLACEHOLDER -->
            <!-- subsection:primary_goals -->
            ### Primary Goals
            - Track orders
            <!-- subsection:questions_issues -->
            <!-- table:goals_objectives_questions -->
            | Question ID | Question | Date | Answer | Status |
            |---|---|---|---|---|
            | goals_objectives-Q1 | Who? | 2024-01-01 |  | Open |

            <!-- section_lock:goals_objectives lock=false -->
            <!-- section_lock:goals_objectives lock=true -->
            """);

    @Nested
    @DisplayName("Spans")
    class Spans {

        @Test
        @DisplayName("Should pair each section marker with the next one, the last with EOF")
        void findSections() {
            List<SectionSpan> spans = DocumentParser.findSections(DOC);

            assertThat(spans).containsExactly(
                    new SectionSpan("problem_statement", 0, 4),
                    new SectionSpan("goals_objectives", 4, DOC.size()));
        }

        @Test
        @DisplayName("Should scope subsection spans to their parent")
        void findSubsectionsWithin() {
            SectionSpan goals = DocumentParser.findSection(DOC, "goals_objectives").orElseThrow();

            List<SubsectionSpan> subs = DocumentParser.findSubsectionsWithin(DOC, goals);

            assertThat(subs).containsExactly(
                    new SubsectionSpan("primary_goals", "goals_objectives", 7, 10),
                    new SubsectionSpan("questions_issues", "goals_objectives", 10, DOC.size()));
        }

        @Test
        @DisplayName("Should reject empty spans")
        void emptySpanRejected() {
            assertThatThrownBy(() -> new SectionSpan("x", 3, 3)).isInstanceOf(InvalidSpanException.class);
        }
    }

    @Nested
    @DisplayName("Tables")
    class Tables {

        @Test
        @DisplayName("Should locate the pipe run after the table marker")
        void findTableBlock() {
            Optional<TableBlock> block = DocumentParser.findTableBlock(DOC, "goals_objectives_questions");

            assertTrue(block.isPresent());
            assertEquals(11, block.get().markerLine());
            assertEquals(12, block.get().start());
            assertEquals(15, block.get().end());
            assertEquals(3, block.get().rowCount());
        }

        @Test
        @DisplayName("Should report a table as absent when a section starts before any row")
        void tableBeforeNextSectionIsAbsent() {
            List<String> doc = lines("""
                    <!-- section:a -->
                    <!-- table:a_questions -->

                    <!-- section:b -->
                    | Question ID | Question | Date | Answer | Status |
                    """);

            assertThat(DocumentParser.findTableBlock(doc, "a_questions")).isEmpty();
            assertThat(DocumentParser.findTableBlock(doc, "missing")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Workflow order")
    class WorkflowOrder {

        @Test
        @DisplayName("Should read targets in declared order, skipping blanks and comments")
        void extractWorkflowOrder() {
            List<String> doc = lines("""
                    <!-- workflow:order
                    problem_statement

                    # drafted last
                    goals_objectives
                    review_gate:coherence_check
                    -->
                    """);

            assertThat(DocumentParser.extractWorkflowOrder(doc))
                    .containsExactly("problem_statement", "goals_objectives", "review_gate:coherence_check");
        }

        @Test
        @DisplayName("Should fail on a duplicate target, naming its line")
        void duplicateTargetFails() {
            List<String> doc = lines("""
                    intro
                    <!-- workflow:order
                    problem_statement
                    goals_objectives
                    problem_statement
                    -->
                    """);

            assertThatThrownBy(() -> DocumentParser.extractWorkflowOrder(doc))
                    .isInstanceOf(WorkflowOrderException.class)
                    .hasMessage("Duplicate workflow target 'problem_statement' on line 5");
        }

        @Test
        @DisplayName("Should fail when the block is missing or never closed")
        void missingOrUnterminated() {
            assertThatThrownBy(() -> DocumentParser.extractWorkflowOrder(List.of("no block")))
                    .isInstanceOf(WorkflowOrderException.class)
                    .hasMessage("Workflow order block not found");
            assertThatThrownBy(() -> DocumentParser.extractWorkflowOrder(List.of("<!-- workflow:order", "a")))
                    .isInstanceOf(WorkflowOrderException.class)
                    .hasMessageContaining("is not terminated");
        }
    }

    @Test
    @DisplayName("Should read metadata from value attributes and labeled bullets")
    void extractMetadata() {
        List<String> doc = lines("""
                <!-- meta:doc_type value="planning" -->
                <!-- meta:version -->
                - **Version:** 0.3
                """);

        Map<String, String> metadata = DocumentParser.extractMetadata(doc);

        assertEquals("planning", metadata.get("doc_type"));
        assertEquals("0.3", metadata.get("version"));
        assertEquals("planning", DocumentParser.docType(doc));
        assertEquals("requirements", DocumentParser.docType(List.of("# No metadata")));
    }

    @Test
    @DisplayName("Should judge blankness from the section preamble only")
    void isBlank() {
        SectionSpan problem = DocumentParser.findSection(DOC, "problem_statement").orElseThrow();
        SectionSpan goals = DocumentParser.findSection(DOC, "goals_objectives").orElseThrow();

        assertFalse(DocumentParser.isBlank(DOC, problem));
        assertTrue(DocumentParser.isBlank(DOC, goals));

        List<String> placeholderOnlyInSubsection = lines("""
                <!-- section:goals_objectives -->
                Overview text.
                <!-- subsection:secondary_goals -->
                <!-- PLACEHOLDER -->
                """);
        SectionSpan span = DocumentParser.findSection(placeholderOnlyInSubsection, "goals_objectives").orElseThrow();
        assertFalse(DocumentParser.isBlank(placeholderOnlyInSubsection, span));
    }

    @Test
    @DisplayName("Should take the last lock marker as authoritative")
    void isLocked() {
        SectionSpan problem = DocumentParser.findSection(DOC, "problem_statement").orElseThrow();
        SectionSpan goals = DocumentParser.findSection(DOC, "goals_objectives").orElseThrow();

        assertFalse(DocumentParser.isLocked(DOC, problem));
        assertTrue(DocumentParser.isLocked(DOC, goals));
    }

    @Test
    @DisplayName("Should return the last result marker for a gate")
    void findReviewGateResult() {
        List<String> doc = lines("""
                <!-- review_gate_result:review_gate:coherence_check status=failed issues=1 warnings=0 -->
                <!-- review_gate_result:review_gate:coherence_check status=passed issues=0 warnings=2 -->
                """);

        ReviewGateRecord record = DocumentParser.findReviewGateResult(doc, "review_gate:coherence_check").orElseThrow();

        assertTrue(record.passed());
        assertEquals(2, record.warnings());
        assertEquals(1, record.line());
        assertEquals(doc.get(1), record.toMarker());
    }

    @Test
    @DisplayName("Should strip markers, heading and dividers from a section body")
    void sectionBody() {
        SectionSpan problem = DocumentParser.findSection(DOC, "problem_statement").orElseThrow();

        assertEquals("Customers cannot track orders.", DocumentParser.sectionBody(DOC, problem));
    }
}
