package com.purchasingpower.docflow.workflow;

import com.purchasingpower.docflow.configuration.DocFlowProperties;
import com.purchasingpower.docflow.exception.ConfigurationException;
import com.purchasingpower.docflow.marker.MarkerSyntax;
import com.purchasingpower.docflow.parser.DocumentParser;
import com.purchasingpower.docflow.parser.ReviewGateRecord;
import com.purchasingpower.docflow.registry.HandlerConfig;
import com.purchasingpower.docflow.registry.HandlerRegistry;
import com.purchasingpower.docflow.review.ReviewGateHandler;
import com.purchasingpower.docflow.validation.StructuralReportFormatter;
import com.purchasingpower.docflow.validation.StructuralValidator;
import com.purchasingpower.docflow.validation.ValidationReport;
import com.purchasingpower.docflow.versioning.DocumentVersioning;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks the workflow order and mutates exactly one target per step.
 *
 * <p>Each step starts from a structurally valid document (auto-repaired when the
 * repair is narrow enough), selects the first target that is neither locked, complete
 * nor a passed gate, and hands it to the section or gate handler.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkflowEngine {

    private final StructuralValidator structuralValidator;
    private final HandlerRegistry registry;
    private final SectionStateEvaluator evaluator;
    private final SectionHandler sectionHandler;
    private final ReviewGateHandler reviewGateHandler;
    private final DocumentVersioning versioning;
    private final DocFlowProperties properties;

    public StepOutcome runOnce(List<String> lines) {
        return runOnce(lines, false);
    }

    /**
     * @param dryRun compute the step but hand back the original lines
     * @throws com.purchasingpower.docflow.exception.StructuralException when the document is corrupt beyond repair
     */
    public StepOutcome runOnce(List<String> lines, boolean dryRun) {
        List<String> document = prepare(lines);
        String docType = DocumentParser.extractMetadata(document)
                .getOrDefault("doc_type", properties.getDefaultDocType());
        List<String> workflowOrder = DocumentParser.extractWorkflowOrder(document);

        for (String target : workflowOrder) {
            StepOutcome outcome = MarkerSyntax.isReviewGate(target)
                    ? stepGate(document, target, docType, workflowOrder)
                    : stepSection(document, target, docType, workflowOrder);
            if (outcome == null) {
                continue;
            }
            List<String> updated = outcome.lines();
            if (!updated.equals(document)) {
                updated = versioning.applyMilestones(updated, docType);
            }
            WorkflowResult result = outcome.result().toBuilder()
                    .changed(!updated.equals(lines))
                    .build();
            log.info("➡️ {}", result.getSummary());
            return new StepOutcome(dryRun ? lines : updated, result);
        }

        log.info("✅ All {} workflow target(s) complete", workflowOrder.size());
        return new StepOutcome(dryRun ? lines : document,
                WorkflowResult.complete().toBuilder().changed(!dryRun && !document.equals(lines)).build());
    }

    /**
     * Repeats {@link #runOnce(List)} until a step is blocked, changes nothing, or everything is complete.
     */
    public RunReport runUntilBlocked(List<String> lines, int maxSteps) {
        List<String> current = lines;
        List<WorkflowResult> steps = new ArrayList<>();
        for (int step = 1; step <= maxSteps; step++) {
            StepOutcome outcome = runOnce(current);
            steps.add(outcome.result());
            current = outcome.lines();
            WorkflowResult result = outcome.result();
            if (result.isComplete() || result.isBlocked() || !result.isChanged()) {
                log.info("⏹️ Stopped after {} step(s): {}", step, result.getSummary());
                return new RunReport(current, steps);
            }
        }
        log.warn("⚠️ Reached step limit {} without blocking", maxSteps);
        return new RunReport(current, steps);
    }

    public RunReport runUntilBlocked(List<String> lines) {
        return runUntilBlocked(lines, properties.getMaxSteps());
    }

    private List<String> prepare(List<String> lines) {
        ValidationReport report = structuralValidator.validate(lines);
        if (!report.isValid()) {
            log.error("❌ {}", StructuralReportFormatter.format(report));
            throw report.getErrors().get(0);
        }
        if (report.isRepaired()) {
            log.info("🔧 Applied {} structural repair(s) before processing", report.getRepairs().size());
        }
        return report.getLines();
    }

    private StepOutcome stepGate(List<String> lines, String gateId, String docType, List<String> workflowOrder) {
        if (DocumentParser.findReviewGateResult(lines, gateId).map(ReviewGateRecord::passed).orElse(false)) {
            log.debug("Gate {} already passed, skipping", gateId);
            return null;
        }
        HandlerConfig config = registry.configFor(docType, gateId);
        if (!config.isReviewGate()) {
            throw new ConfigurationException("Workflow target '" + gateId
                    + "' needs a review_gate policy in document type '" + docType + "'");
        }
        log.info("🎯 Selected gate {}", gateId);
        return reviewGateHandler.execute(lines, gateId, docType, workflowOrder, config);
    }

    private StepOutcome stepSection(List<String> lines, String sectionId, String docType, List<String> workflowOrder) {
        SectionStatus status = evaluator.evaluate(lines, sectionId).status();
        switch (status) {
            case MISSING -> {
                log.warn("⚠️ Workflow target {} has no section marker, skipping", sectionId);
                return null;
            }
            case LOCKED, COMPLETE -> {
                return null;
            }
            default -> {
                log.info("🎯 Selected section {} ({})", sectionId, status);
                return sectionHandler.execute(lines, sectionId, workflowOrder, registry.configFor(docType, sectionId));
            }
        }
    }
}
