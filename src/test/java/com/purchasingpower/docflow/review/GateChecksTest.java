package com.purchasingpower.docflow.review;

import com.purchasingpower.docflow.question.QuestionLedgerImpl;
import com.purchasingpower.docflow.registry.GatePreCheck;
import com.purchasingpower.docflow.workflow.SectionStateEvaluator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.purchasingpower.docflow.TestDocuments.document;
import static com.purchasingpower.docflow.TestDocuments.row;
import static com.purchasingpower.docflow.TestDocuments.section;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Gate Checks Tests")
class GateChecksTest {

    private final GateChecks checks = new GateChecks(new SectionStateEvaluator(new QuestionLedgerImpl()));

    private static final List<String> ORDER = List.of("problem_statement", "goals_objectives");

    @Test
    @DisplayName("Should report open questions but ignore review warnings and answered ones")
    void openQuestions() {
        List<String> doc = document("requirements", ORDER, List.of(
                section("problem_statement", "Orders get lost.", false,
                        row("problem_statement-Q1", "[WARNING] Wording is vague", "", "Open"),
                        row("problem_statement-Q2", "Which carriers?", "UPS", "Open")),
                section("goals_objectives", "- Track orders", false,
                        row("goals_objectives-Q1", "What target?", "", "Open"),
                        row("goals_objectives-Q2", "Which region?", "", "Deferred"))));

        List<String> failures = checks.run(List.of(GatePreCheck.NO_OPEN_QUESTIONS), doc, ORDER);

        assertThat(failures).containsExactly("Section goals_objectives has 2 open question(s)");
    }

    @Test
    @DisplayName("Should fail on any risk that is not Low/Low and skip placeholder rows")
    void risks() {
        List<String> doc = new ArrayList<>(document("requirements", ORDER, List.of(
                section("problem_statement", "Orders get lost.", false),
                section("goals_objectives", "- Track orders", false))));
        doc.addAll(List.of(
                "<!-- table:risks -->",
                "| ID | Risk | Probability | Impact | Mitigation |",
                "| --- | --- | --- | --- | --- |",
                "| R1 | Carrier API outage | Low | Low | Retry |",
                "| R2 | Data loss | Medium | High | Backups |",
                "| R3 | - | High | High | - |"));

        List<String> failures = checks.run(List.of(GatePreCheck.LOW_RISKS_ONLY), doc, ORDER);

        assertThat(failures).containsExactly("Risk 'Data loss' is Medium/High, expected Low/Low");
    }

    @Test
    @DisplayName("Should pass when there is no risks table")
    void noRisksTable() {
        List<String> doc = document("requirements", ORDER, List.of(
                section("problem_statement", "Orders get lost.", false),
                section("goals_objectives", "- Track orders", false)));

        assertThat(checks.run(List.of(GatePreCheck.NO_OPEN_QUESTIONS, GatePreCheck.LOW_RISKS_ONLY), doc, ORDER))
                .isEmpty();
    }
}
