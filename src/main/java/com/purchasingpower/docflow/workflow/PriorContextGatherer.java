package com.purchasingpower.docflow.workflow;

import com.purchasingpower.docflow.editing.ReplacementBoundaries;
import com.purchasingpower.docflow.marker.MarkerSyntax;
import com.purchasingpower.docflow.parser.DocumentParser;
import com.purchasingpower.docflow.parser.SectionSpan;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the "completed sections so far" context for a target.
 *
 * <p>Pure function of (document, workflow order, target): walks the order up to the
 * target and keeps sections that exist, are complete or locked, and have a non-empty body.
 * Bodies stop at the question ledger.
 * Review gates are skipped.
 */
@Component
@RequiredArgsConstructor
public class PriorContextGatherer {

    private final SectionStateEvaluator evaluator;

    public Map<String, String> gather(List<String> lines, List<String> workflowOrder, String targetId) {
        Map<String, String> context = new LinkedHashMap<>();
        for (String id : workflowOrder) {
            if (id.equals(targetId)) {
                break;
            }
            if (MarkerSyntax.isReviewGate(id)) {
                continue;
            }
            Optional<SectionSpan> span = DocumentParser.findSection(lines, id);
            if (span.isEmpty()) {
                continue;
            }
            SectionStatus status = evaluator.evaluate(lines, id).status();
            if (status != SectionStatus.COMPLETE && status != SectionStatus.LOCKED) {
                continue;
            }
            SectionSpan prose = new SectionSpan(id, span.get().start(), ReplacementBoundaries.bodyEnd(lines, span.get()));
            String body = DocumentParser.sectionBody(lines, prose);
            if (!body.isEmpty() && !body.contains(MarkerSyntax.PLACEHOLDER)) {
                context.put(id, body);
            }
        }
        return context;
    }
}
