package com.purchasingpower.docflow.review;

import com.purchasingpower.docflow.client.CompletionService;
import com.purchasingpower.docflow.configuration.DocFlowProperties;
import com.purchasingpower.docflow.editing.DocumentEdits;
import com.purchasingpower.docflow.editing.MarkerPreservingEditor;
import com.purchasingpower.docflow.editing.ReplacementBoundaries;
import com.purchasingpower.docflow.model.review.ReviewResponse;
import com.purchasingpower.docflow.model.review.ReviewResponse.ReviewIssue;
import com.purchasingpower.docflow.model.review.ReviewResponse.ReviewPatch;
import com.purchasingpower.docflow.model.review.ReviewResponse.Severity;
import com.purchasingpower.docflow.parser.DocumentParser;
import com.purchasingpower.docflow.parser.SectionSpan;
import com.purchasingpower.docflow.question.LedgerScope;
import com.purchasingpower.docflow.question.NewQuestion;
import com.purchasingpower.docflow.question.QuestionLedger;
import com.purchasingpower.docflow.registry.GatePassAction;
import com.purchasingpower.docflow.registry.HandlerConfig;
import com.purchasingpower.docflow.registry.HandlerRegistry;
import com.purchasingpower.docflow.workflow.StepOutcome;
import com.purchasingpower.docflow.workflow.WorkflowAction;
import com.purchasingpower.docflow.workflow.WorkflowResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Runs a {@code review_gate:*} target.
 *
 * <p>Steps: resolve scope, run pre-checks (a failing pre-check fails the gate without a
 * model call), review, persist the result marker, copy issues into the affected sections'
 * question tables, merge patches as the policy allows, and on pass run the configured
 * follow-up actions.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReviewGateHandler {

    private final ReviewScopeResolver scopeResolver;
    private final PatchValidator patchValidator;
    private final GateChecks gateChecks;
    private final QuestionLedger ledger;
    private final MarkerPreservingEditor editor;
    private final CompletionService completionService;
    private final HandlerRegistry registry;
    private final DocFlowProperties properties;
    private final Clock clock;

    public StepOutcome execute(List<String> lines, String gateId, String docType, List<String> workflowOrder,
                               HandlerConfig config) {
        List<String> scope = scopeResolver.resolve(gateId, config.getScope(), lines, workflowOrder);
        log.info("🔍 Review gate {} over {} section(s): {}", gateId, scope.size(), scope);

        ReviewResponse review = reviewOrPreCheckFailure(lines, gateId, docType, scope, config);
        int blockers = (int) review.blockerCount();
        int warnings = (int) review.warningCount();
        boolean passed = blockers == 0;

        List<PatchCheck> checks = patchValidator.validate(lines, review.getPatches());
        checks.stream().filter(c -> !c.valid())
                .forEach(c -> log.warn("⚠️ Rejected patch for {}: {}", c.patch().getSection(), c.reason()));

        List<String> current = DocumentEdits.upsertReviewGateResult(lines, gateId, passed, blockers, warnings);
        current = recordIssues(current, review.getIssues());
        current = applyPatches(current, docType, patchValidator.selectForApplication(checks, config.getAutoApplyPatches()));

        if (passed) {
            current = runPassActions(current, scope, config.getOnPass());
        }

        WorkflowResult.WorkflowResultBuilder result = WorkflowResult.builder()
                .targetId(gateId)
                .action(WorkflowAction.REVIEW_GATE)
                .changed(!current.equals(lines))
                .blocked(!passed);
        if (passed) {
            log.info("✅ Review gate {} passed ({} warning(s))", gateId, warnings);
            result.summary("✅ " + gateId + " passed with " + warnings + " warning(s)");
        } else {
            log.info("❌ Review gate {} failed with {} blocker(s)", gateId, blockers);
            review.getIssues().stream()
                    .filter(ReviewIssue::isBlocker)
                    .forEach(issue -> result.blockedReason(describe(issue)));
            result.summary("❌ " + gateId + " failed with " + blockers + " blocker(s)");
        }
        return new StepOutcome(current, result.build());
    }

    private ReviewResponse reviewOrPreCheckFailure(List<String> lines, String gateId, String docType,
                                                   List<String> scope, HandlerConfig config) {
        List<String> failures = gateChecks.run(config.getPreChecks(), lines, scope);
        if (!failures.isEmpty()) {
            List<ReviewIssue> issues = new ArrayList<>();
            for (String failure : failures) {
                issues.add(ReviewIssue.builder().severity(Severity.BLOCKER).description(failure).build());
            }
            return ReviewResponse.builder()
                    .passed(false)
                    .issues(issues)
                    .summary("Automated checks failed")
                    .build();
        }

        Map<String, String> contents = new LinkedHashMap<>();
        for (String sectionId : scope) {
            Optional<SectionSpan> span = DocumentParser.findSection(lines, sectionId);
            if (span.isEmpty()) {
                log.warn("⚠️ Section {} in scope of {} not found", sectionId, gateId);
                continue;
            }
            SectionSpan prose = new SectionSpan(sectionId, span.get().start(),
                    ReplacementBoundaries.bodyEnd(lines, span.get()));
            contents.put(sectionId, DocumentParser.sectionBody(lines, prose));
        }
        return completionService.review(gateId, docType, contents, config);
    }

    /**
     * Adds each issue tied to a section as a {@code [SEVERITY] description} question
     * in that section's ledger.
     */
    private List<String> recordIssues(List<String> lines, List<ReviewIssue> issues) {
        Map<String, List<NewQuestion>> bySection = new LinkedHashMap<>();
        for (ReviewIssue issue : issues) {
            if (issue.getSection() == null || issue.getDescription() == null) {
                continue;
            }
            bySection.computeIfAbsent(issue.getSection(), s -> new ArrayList<>())
                    .add(new NewQuestion(describe(issue), issue.getSection(), issue.getSuggestion()));
        }

        List<String> current = lines;
        for (Map.Entry<String, List<NewQuestion>> entry : bySection.entrySet()) {
            if (DocumentParser.findSection(current, entry.getKey()).isEmpty()) {
                log.warn("⚠️ Review issue targets unknown section {}", entry.getKey());
                continue;
            }
            Optional<LedgerScope> scope = ledger.scopeFor(current, entry.getKey());
            if (scope.isEmpty()) {
                log.warn("⚠️ No question table for {}, {} issue(s) not recorded", entry.getKey(), entry.getValue().size());
                continue;
            }
            current = ledger.insertBatch(current, scope.get(), entry.getValue(), today()).lines();
        }
        return current;
    }

    private List<String> applyPatches(List<String> lines, String docType, List<ReviewPatch> patches) {
        List<String> current = lines;
        for (ReviewPatch patch : patches) {
            SectionSpan span = DocumentParser.findSection(current, patch.getSection()).orElseThrow();
            HandlerConfig sectionConfig = registry.configFor(docType, patch.getSection());
            current = editor.replaceBody(current, span.start(), ReplacementBoundaries.bodyEnd(current, span),
                    patch.getSection(), patch.getSuggestion(), sectionConfig.sanitizeRules());
            log.info("📝 Applied review patch to {}", patch.getSection());
        }
        return current;
    }

    private List<String> runPassActions(List<String> lines, List<String> scope, List<GatePassAction> actions) {
        List<String> current = lines;
        for (GatePassAction action : actions) {
            switch (action) {
                case LOCK_SCOPE_SECTIONS -> {
                    for (String sectionId : scope) {
                        if (DocumentParser.findSection(current, sectionId).isPresent()) {
                            current = DocumentEdits.setSectionLock(current, sectionId, true);
                        }
                    }
                    log.info("🔒 Locked {} section(s)", scope.size());
                }
                case RECORD_APPROVAL -> current = DocumentEdits.updateApprovalRecord(current, "Approved",
                        properties.getAutomationActor(), today());
            }
        }
        return current;
    }

    private static String describe(ReviewIssue issue) {
        return "[" + issue.getSeverity().name().toUpperCase(Locale.ROOT) + "] " + issue.getDescription();
    }

    private String today() {
        return LocalDate.now(clock).toString();
    }
}
