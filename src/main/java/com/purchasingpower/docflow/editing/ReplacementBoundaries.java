package com.purchasingpower.docflow.editing;

import com.purchasingpower.docflow.parser.DocumentParser;
import com.purchasingpower.docflow.parser.SectionSpan;
import com.purchasingpower.docflow.parser.SubsectionSpan;

import java.util.List;
import java.util.Set;

/**
 * Where a section's replaceable body ends.
 *
 * <p>A section that holds its question ledger in a {@code questions_issues} or
 * {@code open_questions} subsection may only be rewritten up to that subsection's
 * start line. Drafting, integration and patch application all go through here.
 */
public final class ReplacementBoundaries {

    public static final Set<String> LEDGER_SUBSECTIONS = Set.of("questions_issues", "open_questions");

    private ReplacementBoundaries() {
    }

    public static int bodyEnd(List<String> lines, SectionSpan span) {
        for (SubsectionSpan sub : DocumentParser.findSubsectionsWithin(lines, span)) {
            if (LEDGER_SUBSECTIONS.contains(sub.subsectionId())) {
                return sub.start();
            }
        }
        return span.end();
    }
}
