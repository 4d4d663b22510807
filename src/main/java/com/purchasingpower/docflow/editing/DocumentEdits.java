package com.purchasingpower.docflow.editing;

import com.purchasingpower.docflow.exception.InvalidSpanException;
import com.purchasingpower.docflow.marker.MarkerKind;
import com.purchasingpower.docflow.marker.MarkerSyntax;
import com.purchasingpower.docflow.marker.MarkerToken;
import com.purchasingpower.docflow.marker.MarkerTokenizer;
import com.purchasingpower.docflow.parser.DocumentParser;
import com.purchasingpower.docflow.parser.MarkdownTables;
import com.purchasingpower.docflow.parser.ReviewGateRecord;
import com.purchasingpower.docflow.parser.SectionSpan;
import com.purchasingpower.docflow.parser.TableBlock;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Marker-level edits that do not touch region prose: locks, gate results and the
 * approval record. Each returns a new list.
 */
@Slf4j
public final class DocumentEdits {

    public static final String APPROVAL_TABLE_ID = "approval_record";

    private static final Map<String, Set<String>> APPROVAL_ROWS = Map.of(
            "status", Set.of("Current Status", "Status"),
            "actor", Set.of("Recommended By", "Reviewer"),
            "date", Set.of("Recommendation Date", "Review Date"));

    private static final Pattern LABELED_BULLET = Pattern.compile("^\\s*[-*]\\s*\\*\\*");

    private DocumentEdits() {
    }

    public static String lockMarker(String sectionId, boolean locked) {
        return "<!-- section_lock:" + sectionId + " lock=" + locked + " -->";
    }

    /**
     * Rewrites the section's last lock marker, or inserts one after the section's
     * last content line.
     */
    public static List<String> setSectionLock(List<String> lines, String sectionId, boolean locked) {
        SectionSpan span = DocumentParser.findSection(lines, sectionId)
                .orElseThrow(() -> new InvalidSpanException(sectionId, "section not found"));
        List<String> result = new ArrayList<>(lines);
        String marker = lockMarker(sectionId, locked);

        int lockLine = -1;
        for (MarkerToken token : MarkerTokenizer.tokenize(lines.subList(span.start(), span.end()))) {
            if (token.is(MarkerKind.SECTION_LOCK) && token.id().equals(sectionId)) {
                lockLine = span.start() + token.line();
            }
        }
        if (lockLine >= 0) {
            result.set(lockLine, marker);
            return result;
        }

        int insertAt = span.start() + 1;
        for (int i = span.end() - 1; i > span.start(); i--) {
            String stripped = lines.get(i).strip();
            if (!stripped.isEmpty() && !stripped.equals(MarkerSyntax.DIVIDER)) {
                insertAt = i + 1;
                break;
            }
        }
        result.add(insertAt, marker);
        return result;
    }

    /**
     * Writes the authoritative result marker for a gate. An existing marker with
     * different content is replaced; identical content leaves the document unchanged.
     * A new marker goes after the document header (metadata, workflow order, other results).
     */
    public static List<String> upsertReviewGateResult(List<String> lines, String gateId, boolean passed,
                                                      int issues, int warnings) {
        String marker = ReviewGateRecord.format(gateId, passed, issues, warnings);
        List<String> result = new ArrayList<>(lines);

        Optional<ReviewGateRecord> existing = DocumentParser.findReviewGateResult(lines, gateId);
        if (existing.isPresent()) {
            int line = existing.get().line();
            if (!lines.get(line).strip().equals(marker)) {
                result.set(line, marker);
            }
            return result;
        }

        result.add(headerEnd(lines), marker);
        return result;
    }

    private static int headerEnd(List<String> lines) {
        int lastHeader = -1;
        int i = 0;
        while (i < lines.size()) {
            String line = lines.get(i);
            if (MarkerSyntax.WORKFLOW_ORDER_START.matcher(line).find()) {
                int j = i;
                String segment = afterStart(line);
                while (!segment.contains("-->") && j + 1 < lines.size()) {
                    j++;
                    segment = lines.get(j);
                }
                lastHeader = j;
                i = j + 1;
            } else if (MarkerSyntax.META.matcher(line).find()) {
                // a value-less meta marker owns the labeled bullet under it
                boolean bullet = i + 1 < lines.size() && LABELED_BULLET.matcher(lines.get(i + 1)).find();
                lastHeader = bullet ? i + 1 : i;
                i = lastHeader + 1;
            } else if (MarkerSyntax.REVIEW_GATE_RESULT.matcher(line).find()) {
                lastHeader = i;
                i++;
            } else if (line.isBlank()) {
                i++;
            } else {
                break;
            }
        }
        return lastHeader + 1;
    }

    private static String afterStart(String line) {
        Matcher matcher = MarkerSyntax.WORKFLOW_ORDER_START.matcher(line);
        return matcher.find() ? line.substring(matcher.end()) : line;
    }

    /**
     * Fills the approval record table's status, actor and date rows.
     */
    public static List<String> updateApprovalRecord(List<String> lines, String status, String actor, String date) {
        List<String> result = new ArrayList<>(lines);
        Optional<TableBlock> table = DocumentParser.findTableBlock(lines, APPROVAL_TABLE_ID);
        if (table.isEmpty()) {
            log.warn("⚠️ No {} table found, approval not recorded", APPROVAL_TABLE_ID);
            return result;
        }

        Map<String, String> values = Map.of("status", status, "actor", actor, "date", date);
        for (int i = table.get().start(); i < table.get().end(); i++) {
            List<String> cells = MarkdownTables.splitRow(lines.get(i));
            if (cells.size() < 2) {
                continue;
            }
            for (Map.Entry<String, Set<String>> row : APPROVAL_ROWS.entrySet()) {
                if (row.getValue().contains(cells.get(0))) {
                    List<String> updated = new ArrayList<>(cells);
                    updated.set(1, values.get(row.getKey()));
                    result.set(i, MarkdownTables.formatRow(updated));
                }
            }
        }
        return result;
    }
}
