package com.purchasingpower.docflow.service;

import com.purchasingpower.docflow.completion.CompletionStatus;
import com.purchasingpower.docflow.completion.DocumentCompletionValidator;
import com.purchasingpower.docflow.parser.DocumentParser;
import com.purchasingpower.docflow.validation.StructuralReportFormatter;
import com.purchasingpower.docflow.validation.StructuralValidator;
import com.purchasingpower.docflow.validation.ValidationReport;
import com.purchasingpower.docflow.workflow.RunReport;
import com.purchasingpower.docflow.workflow.StepOutcome;
import com.purchasingpower.docflow.workflow.WorkflowEngine;
import com.purchasingpower.docflow.workflow.WorkflowResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Text-in, text-out entry points over the workflow engine and validators.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentAutomationService {

    private final StructuralValidator structuralValidator;
    private final DocumentCompletionValidator completionValidator;
    private final WorkflowEngine workflowEngine;

    public StructureCheck checkStructure(String document) {
        return checkStructure(document, null);
    }

    /**
     * Validates the document, optionally against the template it was created from.
     * The returned text carries any repairs so callers can persist them.
     */
    public StructureCheck checkStructure(String document, String template) {
        ValidationReport report = template == null
                ? structuralValidator.validate(toLines(document))
                : structuralValidator.validate(toLines(document), toLines(template));
        return new StructureCheck(report.isValid(), report.isRepaired(),
                toText(report.getLines()), StructuralReportFormatter.format(report));
    }

    public CompletionStatus checkCompletion(String document, boolean strict) {
        List<String> lines = toLines(document);
        return completionValidator.validate(lines, DocumentParser.extractWorkflowOrder(lines), strict);
    }

    public DocumentStep step(String document, boolean dryRun) {
        StepOutcome outcome = workflowEngine.runOnce(toLines(document), dryRun);
        return new DocumentStep(toText(outcome.lines()), List.of(outcome.result()));
    }

    public DocumentStep runUntilBlocked(String document, int maxSteps) {
        RunReport report = workflowEngine.runUntilBlocked(toLines(document), maxSteps);
        log.info("Run finished after {} step(s)", report.steps().size());
        return new DocumentStep(toText(report.lines()), report.steps());
    }

    public DocumentStep runUntilBlocked(String document) {
        RunReport report = workflowEngine.runUntilBlocked(toLines(document));
        return new DocumentStep(toText(report.lines()), report.steps());
    }

    static List<String> toLines(String text) {
        return new ArrayList<>(Arrays.asList(text.split("\r?\n", -1)));
    }

    static String toText(List<String> lines) {
        return String.join("\n", lines);
    }

    public record StructureCheck(boolean valid, boolean repaired, String document, String report) {
    }

    public record DocumentStep(String document, List<WorkflowResult> steps) {
    }
}
