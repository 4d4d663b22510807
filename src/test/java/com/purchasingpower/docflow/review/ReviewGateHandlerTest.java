package com.purchasingpower.docflow.review;

import com.purchasingpower.docflow.client.CompletionService;
import com.purchasingpower.docflow.configuration.DocFlowProperties;
import com.purchasingpower.docflow.editing.BodySanitizer;
import com.purchasingpower.docflow.editing.MarkerPreservingEditorImpl;
import com.purchasingpower.docflow.model.review.ReviewResponse;
import com.purchasingpower.docflow.model.review.ReviewResponse.ReviewIssue;
import com.purchasingpower.docflow.model.review.ReviewResponse.ReviewPatch;
import com.purchasingpower.docflow.model.review.ReviewResponse.Severity;
import com.purchasingpower.docflow.parser.DocumentParser;
import com.purchasingpower.docflow.parser.ReviewGateRecord;
import com.purchasingpower.docflow.question.QuestionLedgerImpl;
import com.purchasingpower.docflow.registry.AutoApplyPolicy;
import com.purchasingpower.docflow.registry.HandlerConfig;
import com.purchasingpower.docflow.registry.HandlerRegistry;
import com.purchasingpower.docflow.validation.StructuralValidatorImpl;
import com.purchasingpower.docflow.workflow.SectionStateEvaluator;
import com.purchasingpower.docflow.workflow.StepOutcome;
import com.purchasingpower.docflow.workflow.WorkflowAction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.io.ClassPathResource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static com.purchasingpower.docflow.TestDocuments.document;
import static com.purchasingpower.docflow.TestDocuments.row;
import static com.purchasingpower.docflow.TestDocuments.section;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Review Gate Handler Tests")
class ReviewGateHandlerTest {

    private static final String GATE = "review_gate:coherence_check";
    private static final List<String> ORDER = List.of("problem_statement", "goals_objectives", GATE);

    @Mock
    private CompletionService completionService;

    private HandlerRegistry registry;
    private ReviewGateHandler handler;

    @BeforeEach
    void setUp() {
        QuestionLedgerImpl ledger = new QuestionLedgerImpl();
        registry = HandlerRegistry.load(new ClassPathResource("handler-registry.yaml"));
        handler = new ReviewGateHandler(
                new ReviewScopeResolver(),
                new PatchValidator(),
                new GateChecks(new SectionStateEvaluator(ledger)),
                ledger,
                new MarkerPreservingEditorImpl(new StructuralValidatorImpl(), new BodySanitizer()),
                completionService,
                registry,
                new DocFlowProperties(),
                Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC));
    }

    private HandlerConfig gateConfig() {
        return registry.configFor("requirements", GATE);
    }

    private static List<String> completeDocument(String... goalRows) {
        return document("requirements", ORDER, List.of(
                section("problem_statement", "Orders get lost.", false),
                section("goals_objectives", "- Track every order", false, goalRows)));
    }

    @Test
    @DisplayName("Should fail the gate without a review call when pre-checks fail")
    void preCheckFailure() {
        // Given
        List<String> doc = completeDocument(row("goals_objectives-Q1", "What target?", "", "Open"));

        // When
        StepOutcome outcome = handler.execute(doc, GATE, "requirements", ORDER, gateConfig());

        // Then
        verifyNoInteractions(completionService);
        assertTrue(outcome.result().isBlocked());
        assertThat(outcome.result().getBlockedReasons())
                .containsExactly("[BLOCKER] Section goals_objectives has 1 open question(s)");
        ReviewGateRecord record = DocumentParser.findReviewGateResult(outcome.lines(), GATE).orElseThrow();
        assertFalse(record.passed());
        assertEquals(1, record.issues());
    }

    @Test
    @DisplayName("Should record the result and lock scope sections when the review passes")
    void passLocksSections() {
        // Given
        List<String> doc = completeDocument();
        when(completionService.review(eq(GATE), eq("requirements"),
                eq(Map.of("problem_statement", "Orders get lost.", "goals_objectives", "- Track every order")),
                any()))
                .thenReturn(ReviewResponse.builder()
                        .passed(true)
                        .issues(List.of(ReviewIssue.builder()
                                .severity(Severity.WARNING)
                                .section("goals_objectives")
                                .description("Goals could name an owner")
                                .build()))
                        .build());

        // When
        StepOutcome outcome = handler.execute(doc, GATE, "requirements", ORDER, gateConfig());

        // Then
        assertEquals(WorkflowAction.REVIEW_GATE, outcome.result().getAction());
        assertFalse(outcome.result().isBlocked());
        assertThat(outcome.lines())
                .contains("<!-- review_gate_result:review_gate:coherence_check status=passed issues=0 warnings=1 -->")
                .contains("<!-- section_lock:problem_statement lock=true -->")
                .contains("<!-- section_lock:goals_objectives lock=true -->")
                .contains("| goals_objectives-Q1 | [WARNING] Goals could name an owner | 2024-03-01 |  | Open |");
    }

    @Test
    @DisplayName("Should block on blocker issues and copy them into section ledgers")
    void blockers() {
        // Given
        List<String> doc = completeDocument();
        when(completionService.review(eq(GATE), eq("requirements"), any(), any()))
                .thenReturn(ReviewResponse.builder()
                        .passed(true)
                        .issues(List.of(ReviewIssue.builder()
                                .severity(Severity.BLOCKER)
                                .section("goals_objectives")
                                .description("Goals are not measurable")
                                .build()))
                        .build());

        // When
        StepOutcome outcome = handler.execute(doc, GATE, "requirements", ORDER, gateConfig());

        // Then
        assertTrue(outcome.result().isBlocked());
        assertThat(outcome.result().getBlockedReasons()).containsExactly("[BLOCKER] Goals are not measurable");
        assertThat(outcome.lines())
                .contains("<!-- review_gate_result:review_gate:coherence_check status=failed issues=1 warnings=0 -->")
                .contains("<!-- section_lock:goals_objectives lock=false -->")
                .contains("| goals_objectives-Q1 | [BLOCKER] Goals are not measurable | 2024-03-01 |  | Open |");
    }

    @Test
    @DisplayName("Should merge only valid patches when the policy always applies them")
    void appliesPatches() {
        // Given
        List<String> doc = completeDocument();
        HandlerConfig config = gateConfig().toBuilder()
                .autoApplyPatches(AutoApplyPolicy.ALWAYS)
                .onPass(List.of())
                .build();
        when(completionService.review(eq(GATE), eq("requirements"), any(), any()))
                .thenReturn(ReviewResponse.builder()
                        .passed(true)
                        .patches(List.of(
                                ReviewPatch.builder().section("problem_statement")
                                        .suggestion("Orders go missing between checkout and delivery.").build(),
                                ReviewPatch.builder().section("problem_statement")
                                        .suggestion("<!-- section:injected -->").build()))
                        .build());

        // When
        StepOutcome outcome = handler.execute(doc, GATE, "requirements", ORDER, config);

        // Then
        assertTrue(outcome.result().isChanged());
        assertThat(outcome.lines())
                .contains("Orders go missing between checkout and delivery.")
                .doesNotContain("Orders get lost.", "<!-- section:injected -->");
        assertThat(DocumentParser.sectionIds(outcome.lines())).containsExactly("problem_statement", "goals_objectives");
    }
}
