package com.purchasingpower.docflow.review;

import com.purchasingpower.docflow.parser.DocumentParser;
import com.purchasingpower.docflow.parser.MarkdownTables;
import com.purchasingpower.docflow.parser.SectionSpan;
import com.purchasingpower.docflow.parser.TableBlock;
import com.purchasingpower.docflow.question.OpenQuestion;
import com.purchasingpower.docflow.registry.GatePreCheck;
import com.purchasingpower.docflow.workflow.SectionStateEvaluator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Deterministic checks a gate runs before asking for a review.
 * Each returns human-readable failure descriptions; empty means the check passed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GateChecks {

    static final String RISKS_TABLE_ID = "risks";

    private final SectionStateEvaluator evaluator;

    public List<String> run(List<GatePreCheck> checks, List<String> lines, List<String> scope) {
        List<String> failures = new ArrayList<>();
        for (GatePreCheck check : checks) {
            List<String> found = switch (check) {
                case NO_OPEN_QUESTIONS -> openQuestions(lines, scope);
                case LOW_RISKS_ONLY -> nonLowRisks(lines);
            };
            if (!found.isEmpty()) {
                log.info("❌ Pre-check {} failed: {}", check.value(), found);
            }
            failures.addAll(found);
        }
        return failures;
    }

    /** Unanswered questions in scope, ignoring review warnings. */
    List<String> openQuestions(List<String> lines, List<String> scope) {
        List<String> failures = new ArrayList<>();
        for (String sectionId : scope) {
            Optional<SectionSpan> span = DocumentParser.findSection(lines, sectionId);
            if (span.isEmpty()) {
                continue;
            }
            long open = evaluator.questionsFor(lines, span.get()).stream()
                    .filter(OpenQuestion::isAwaitingAnswer)
                    .filter(q -> !q.isWarning())
                    .count();
            if (open > 0) {
                failures.add("Section " + sectionId + " has " + open + " open question(s)");
            }
        }
        return failures;
    }

    /** Risks whose probability or impact is not Low. A missing risks table passes. */
    List<String> nonLowRisks(List<String> lines) {
        Optional<TableBlock> table = DocumentParser.findTableBlock(lines, RISKS_TABLE_ID);
        if (table.isEmpty()) {
            return List.of();
        }
        List<String> failures = new ArrayList<>();
        for (int i = table.get().start() + 2; i < table.get().end(); i++) {
            List<String> cells = MarkdownTables.splitRow(lines.get(i));
            if (cells.size() < 4) {
                continue;
            }
            String description = cells.get(1);
            if (description.isEmpty() || description.equals("-")
                    || description.toLowerCase(Locale.ROOT).contains("placeholder")) {
                continue;
            }
            String probability = cells.get(2);
            String impact = cells.get(3);
            if (!probability.equalsIgnoreCase("low") || !impact.equalsIgnoreCase("low")) {
                failures.add("Risk '" + description + "' is " + probability + "/" + impact + ", expected Low/Low");
            }
        }
        return failures;
    }
}
