package com.purchasingpower.docflow.validation;

import com.purchasingpower.docflow.marker.MarkerKind;
import com.purchasingpower.docflow.marker.MarkerToken;
import com.purchasingpower.docflow.marker.MarkerTokenizer;
import com.purchasingpower.docflow.parser.DocumentParser;
import com.purchasingpower.docflow.parser.SectionSpan;
import com.purchasingpower.docflow.question.QuestionTableSchema;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Restores the open-questions subsection and table when the anchor section exists but
 * that boilerplate was dropped. Does nothing when the anchor section is absent.
 */
@Slf4j
final class OpenQuestionsRepair {

    static final String ANCHOR_SECTION = "risks_open_issues";
    static final String SUBSECTION_ID = "open_questions";
    static final String TABLE_ID = QuestionTableSchema.LEGACY_TABLE_ID;

    private OpenQuestionsRepair() {
    }

    /**
     * Applies the repair to {@code lines} in place and returns the repair descriptions.
     */
    static List<String> apply(List<String> lines) {
        List<String> repairs = new ArrayList<>();
        Optional<SectionSpan> anchor = DocumentParser.findSection(lines, ANCHOR_SECTION);
        if (anchor.isEmpty()) {
            return repairs;
        }

        SectionSpan span = anchor.get();
        List<MarkerToken> tokens = MarkerTokenizer.tokenize(lines.subList(span.start(), span.end()));
        boolean hasSubsection = tokens.stream()
                .anyMatch(t -> t.is(MarkerKind.SUBSECTION) && t.id().equals(SUBSECTION_ID));
        Optional<MarkerToken> tableMarker = tokens.stream()
                .filter(t -> t.is(MarkerKind.TABLE) && t.id().equals(TABLE_ID))
                .findFirst();
        boolean hasRows = tableMarker.isPresent() && DocumentParser.findTableBlock(lines, TABLE_ID).isPresent();

        if (hasSubsection && tableMarker.isPresent() && hasRows) {
            return repairs;
        }

        QuestionTableSchema schema = QuestionTableSchema.LEGACY;

        if (tableMarker.isPresent()) {
            int markerLine = span.start() + tableMarker.get().line();
            if (!hasRows) {
                lines.addAll(markerLine + 1, List.of(schema.headerRow(), schema.separatorRow()));
                repairs.add("Inserted missing header for table:" + TABLE_ID + " in section " + ANCHOR_SECTION);
            }
            if (!hasSubsection) {
                lines.addAll(markerLine, List.of("<!-- subsection:" + SUBSECTION_ID + " -->", "### Open Questions", ""));
                repairs.add("Inserted missing subsection:" + SUBSECTION_ID + " in section " + ANCHOR_SECTION);
            }
            log.info("⚠️ Repaired open questions table in section {}: {}", ANCHOR_SECTION, repairs);
            return repairs;
        }

        List<String> block = new ArrayList<>();
        if (!hasSubsection) {
            block.add("<!-- subsection:" + SUBSECTION_ID + " -->");
            block.add("### Open Questions");
            block.add("");
        }
        block.add("<!-- table:" + TABLE_ID + " -->");
        block.add(schema.headerRow());
        block.add(schema.separatorRow());
        block.add("");
        repairs.add(hasSubsection
                ? "Inserted missing table:" + TABLE_ID + " in section " + ANCHOR_SECTION
                : "Inserted missing subsection:" + SUBSECTION_ID + " with table:" + TABLE_ID
                        + " in section " + ANCHOR_SECTION);

        int insertAt = lockLine(tokens, span).orElse(span.end());
        lines.addAll(insertAt, block);
        log.info("⚠️ Repaired open questions structure in section {}: {}", ANCHOR_SECTION, repairs);
        return repairs;
    }

    private static Optional<Integer> lockLine(List<MarkerToken> tokens, SectionSpan span) {
        Integer line = null;
        for (MarkerToken token : tokens) {
            if (token.is(MarkerKind.SECTION_LOCK) && token.id().equals(span.sectionId())) {
                line = span.start() + token.line();
            }
        }
        return Optional.ofNullable(line);
    }
}
