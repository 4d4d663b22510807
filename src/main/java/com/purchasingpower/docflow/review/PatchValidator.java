package com.purchasingpower.docflow.review;

import com.purchasingpower.docflow.marker.MarkerSyntax;
import com.purchasingpower.docflow.model.review.ReviewResponse.ReviewPatch;
import com.purchasingpower.docflow.parser.DocumentParser;
import com.purchasingpower.docflow.parser.SectionSpan;
import com.purchasingpower.docflow.registry.AutoApplyPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A patch may only replace the prose of an existing, unlocked section; it can never
 * bring structure of its own.
 */
@Slf4j
@Component
public class PatchValidator {

    public List<PatchCheck> validate(List<String> lines, List<ReviewPatch> patches) {
        Set<String> sections = Set.copyOf(DocumentParser.sectionIds(lines));
        Set<String> locked = DocumentParser.findSections(lines).stream()
                .filter(span -> DocumentParser.isLocked(lines, span))
                .map(SectionSpan::sectionId)
                .collect(Collectors.toSet());
        return patches.stream().map(patch -> check(patch, sections, locked)).toList();
    }

    private PatchCheck check(ReviewPatch patch, Set<String> sections, Set<String> locked) {
        if (patch.getSection() == null || !sections.contains(patch.getSection())) {
            return PatchCheck.rejected(patch, "Section '" + patch.getSection() + "' does not exist");
        }
        if (locked.contains(patch.getSection())) {
            return PatchCheck.rejected(patch, "Section '" + patch.getSection() + "' is locked");
        }
        if (patch.getSuggestion() == null || patch.getSuggestion().isBlank()) {
            return PatchCheck.rejected(patch, "Suggested text is empty");
        }
        if (MarkerSyntax.containsMarkerSyntax(patch.getSuggestion())) {
            return PatchCheck.rejected(patch, "Suggested text contains marker syntax");
        }
        return PatchCheck.accepted(patch);
    }

    /**
     * The patches the policy allows to be merged. {@code IF_VALIDATION_PASSES} is
     * all-or-nothing.
     */
    public List<ReviewPatch> selectForApplication(List<PatchCheck> checks, AutoApplyPolicy policy) {
        return switch (policy) {
            case NEVER -> List.of();
            case ALWAYS -> checks.stream().filter(PatchCheck::valid).map(PatchCheck::patch).toList();
            case IF_VALIDATION_PASSES -> checks.stream().allMatch(PatchCheck::valid)
                    ? checks.stream().map(PatchCheck::patch).toList()
                    : List.of();
        };
    }
}
