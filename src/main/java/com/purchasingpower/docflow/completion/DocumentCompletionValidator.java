package com.purchasingpower.docflow.completion;

import com.purchasingpower.docflow.marker.MarkerSyntax;
import com.purchasingpower.docflow.parser.DocumentParser;
import com.purchasingpower.docflow.parser.ReviewGateRecord;
import com.purchasingpower.docflow.parser.SectionSpan;
import com.purchasingpower.docflow.question.OpenQuestion;
import com.purchasingpower.docflow.question.QuestionStatus;
import com.purchasingpower.docflow.validation.StructuralValidator;
import com.purchasingpower.docflow.validation.ValidationReport;
import com.purchasingpower.docflow.workflow.SectionStateEvaluator;
import com.purchasingpower.docflow.workflow.SectionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a document is ready for downstream automation.
 *
 * <p>Strict mode also counts deferred questions and gate warnings as incomplete.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DocumentCompletionValidator {

    static final String NO_PLACEHOLDERS = "no_placeholders_in_required_sections";
    static final String NO_OPEN_QUESTIONS = "no_open_questions";
    static final String GATES_PASSED = "all_review_gates_pass";
    static final String STRUCTURE_VALID = "structure_valid";
    static final String WORKFLOW_COMPLETE = "all_workflow_targets_complete";

    private static final int MAX_LISTED_QUESTIONS = 5;

    private final StructuralValidator structuralValidator;
    private final SectionStateEvaluator evaluator;

    public CompletionStatus validate(List<String> lines, List<String> workflowOrder, boolean strict) {
        List<CompletionCheck> checks = List.of(
                checkNoPlaceholders(lines, workflowOrder),
                checkNoOpenQuestions(lines, workflowOrder, strict),
                checkGatesPassed(lines, workflowOrder, strict),
                checkStructure(lines, workflowOrder),
                checkWorkflowComplete(lines, workflowOrder));

        CompletionStatus.CompletionStatusBuilder status = CompletionStatus.builder().checks(checks);
        boolean complete = true;
        for (CompletionCheck check : checks) {
            if (check.passed()) {
                continue;
            }
            if (check.blocking()) {
                complete = false;
                status.blockingFailure(check.criterion());
            } else {
                status.warning(check.details());
            }
        }
        log.info("📋 Completion check: {}", complete ? "COMPLETE" : "INCOMPLETE");
        return status.complete(complete).summary(summarize(complete, checks)).build();
    }

    private CompletionCheck checkNoPlaceholders(List<String> lines, List<String> workflowOrder) {
        List<String> withPlaceholder = new ArrayList<>();
        for (String target : sectionTargets(workflowOrder)) {
            DocumentParser.findSection(lines, target)
                    .filter(span -> hasPlaceholder(lines, span))
                    .ifPresent(span -> withPlaceholder.add(target));
        }
        return withPlaceholder.isEmpty()
                ? CompletionCheck.passed(NO_PLACEHOLDERS, "All required sections have content")
                : CompletionCheck.failed(NO_PLACEHOLDERS, "Sections with PLACEHOLDER: " + String.join(", ", withPlaceholder));
    }

    private CompletionCheck checkNoOpenQuestions(List<String> lines, List<String> workflowOrder, boolean strict) {
        List<String> incomplete = new ArrayList<>();
        for (String target : sectionTargets(workflowOrder)) {
            Optional<SectionSpan> span = DocumentParser.findSection(lines, target);
            if (span.isEmpty()) {
                continue;
            }
            for (OpenQuestion question : evaluator.questionsFor(lines, span.get())) {
                boolean counts = question.status() == QuestionStatus.OPEN
                        || (strict && question.status() == QuestionStatus.DEFERRED);
                if (counts && !incomplete.contains(question.questionId())) {
                    incomplete.add(question.questionId());
                }
            }
        }
        if (incomplete.isEmpty()) {
            return CompletionCheck.passed(NO_OPEN_QUESTIONS, "All questions resolved");
        }
        String listed = String.join(", ", incomplete.subList(0, Math.min(MAX_LISTED_QUESTIONS, incomplete.size())));
        String suffix = incomplete.size() > MAX_LISTED_QUESTIONS
                ? " (showing first " + MAX_LISTED_QUESTIONS + " of " + incomplete.size() + ")"
                : "";
        return CompletionCheck.failed(NO_OPEN_QUESTIONS, incomplete.size() + " questions remain: " + listed + suffix);
    }

    private CompletionCheck checkGatesPassed(List<String> lines, List<String> workflowOrder, boolean strict) {
        List<String> gates = workflowOrder.stream().filter(MarkerSyntax::isReviewGate).toList();
        if (gates.isEmpty()) {
            return new CompletionCheck(GATES_PASSED, true, "No review gates in workflow", false);
        }
        List<String> failed = new ArrayList<>();
        for (String gate : gates) {
            Optional<ReviewGateRecord> record = DocumentParser.findReviewGateResult(lines, gate);
            if (record.isEmpty()) {
                failed.add(gate + " (not executed)");
            } else if (!record.get().passed()) {
                failed.add(gate + " (failed)");
            } else if (strict && record.get().warnings() > 0) {
                failed.add(gate + " (" + record.get().warnings() + " warnings)");
            }
        }
        return failed.isEmpty()
                ? CompletionCheck.passed(GATES_PASSED, "All " + gates.size() + " review gates passed")
                : CompletionCheck.failed(GATES_PASSED, "Failed gates: " + String.join(", ", failed));
    }

    private CompletionCheck checkStructure(List<String> lines, List<String> workflowOrder) {
        List<String> problems = new ArrayList<>();
        List<String> missing = sectionTargets(workflowOrder).stream()
                .filter(target -> DocumentParser.findSection(lines, target).isEmpty())
                .toList();
        if (!missing.isEmpty()) {
            problems.add("Missing sections: " + String.join(", ", missing));
        }
        ValidationReport report = structuralValidator.validate(lines);
        report.getErrors().forEach(error -> problems.add(error.getMessage()));
        return problems.isEmpty()
                ? CompletionCheck.passed(STRUCTURE_VALID, "Document structure valid")
                : CompletionCheck.failed(STRUCTURE_VALID, String.join("; ", problems));
    }

    private CompletionCheck checkWorkflowComplete(List<String> lines, List<String> workflowOrder) {
        List<String> incomplete = new ArrayList<>();
        for (String target : workflowOrder) {
            boolean done;
            if (MarkerSyntax.isReviewGate(target)) {
                done = DocumentParser.findReviewGateResult(lines, target).map(ReviewGateRecord::passed).orElse(false);
            } else {
                SectionStatus status = evaluator.evaluate(lines, target).status();
                done = status == SectionStatus.COMPLETE
                        || (status == SectionStatus.LOCKED && !hasPlaceholder(lines, DocumentParser.findSection(lines, target).orElseThrow()));
            }
            if (!done) {
                incomplete.add(target);
            }
        }
        return incomplete.isEmpty()
                ? CompletionCheck.passed(WORKFLOW_COMPLETE, "All workflow targets complete")
                : CompletionCheck.failed(WORKFLOW_COMPLETE, "Incomplete: " + String.join(", ", incomplete));
    }

    private static List<String> sectionTargets(List<String> workflowOrder) {
        return workflowOrder.stream().filter(target -> !MarkerSyntax.isReviewGate(target)).toList();
    }

    private static boolean hasPlaceholder(List<String> lines, SectionSpan span) {
        for (int i = span.start(); i < span.end(); i++) {
            if (lines.get(i).contains(MarkerSyntax.PLACEHOLDER)) {
                return true;
            }
        }
        return false;
    }

    private static String summarize(boolean complete, List<CompletionCheck> checks) {
        StringBuilder summary = new StringBuilder("Document Completion Status: ")
                .append(complete ? "COMPLETE" : "INCOMPLETE")
                .append("\n\n");
        for (CompletionCheck check : checks) {
            summary.append(check.passed() ? "✅ " : "❌ ").append(check.details()).append('\n');
        }
        List<CompletionCheck> blocking = checks.stream().filter(c -> !c.passed() && c.blocking()).toList();
        if (!blocking.isEmpty()) {
            summary.append("\nBlocking Issues:\n");
            blocking.forEach(c -> summary.append("- ").append(c.details()).append('\n'));
        }
        List<CompletionCheck> warnings = checks.stream().filter(c -> !c.passed() && !c.blocking()).toList();
        if (!warnings.isEmpty()) {
            summary.append("\nWarnings:\n");
            warnings.forEach(c -> summary.append("- ").append(c.details()).append('\n'));
        }
        if (!complete) {
            summary.append("\nDocument cannot proceed to downstream automation until all criteria met.\n");
        }
        return summary.toString().stripTrailing();
    }
}
