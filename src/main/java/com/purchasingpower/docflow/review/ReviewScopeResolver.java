package com.purchasingpower.docflow.review;

import com.google.common.base.Preconditions;
import com.purchasingpower.docflow.marker.MarkerSyntax;
import com.purchasingpower.docflow.parser.DocumentParser;
import com.purchasingpower.docflow.registry.ReviewScope;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a gate's scope policy into a concrete, ordered list of section ids.
 */
@Component
public class ReviewScopeResolver {

    public List<String> resolve(String gateId, ReviewScope scope, List<String> lines, List<String> workflowOrder) {
        Preconditions.checkNotNull(scope, "scope");
        return switch (scope.kind()) {
            case ALL_PRIOR_SECTIONS -> priorSections(gateId, workflowOrder);
            case ENTIRE_DOCUMENT -> DocumentParser.sectionIds(lines);
            case EXPLICIT_SECTIONS -> scope.sections();
            case CURRENT_SECTION -> {
                List<String> prior = priorSections(gateId, workflowOrder);
                yield prior.isEmpty() ? List.of() : List.of(prior.get(prior.size() - 1));
            }
        };
    }

    private List<String> priorSections(String gateId, List<String> workflowOrder) {
        Preconditions.checkArgument(workflowOrder.contains(gateId),
                "Gate %s is not in the workflow order", gateId);
        List<String> sections = new ArrayList<>();
        for (String target : workflowOrder) {
            if (target.equals(gateId)) {
                break;
            }
            if (!MarkerSyntax.isReviewGate(target)) {
                sections.add(target);
            }
        }
        return sections;
    }
}
