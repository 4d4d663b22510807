package com.purchasingpower.docflow.parser;

import com.purchasingpower.docflow.exception.WorkflowOrderException;
import com.purchasingpower.docflow.marker.MarkerKind;
import com.purchasingpower.docflow.marker.MarkerSyntax;
import com.purchasingpower.docflow.marker.MarkerToken;
import com.purchasingpower.docflow.marker.MarkerTokenizer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Structural pass over the marker token stream: spans, tables, workflow order and metadata.
 *
 * <p>All methods are pure functions of the line list; none of them mutate it.
 */
public final class DocumentParser {

    public static final String DEFAULT_DOC_TYPE = "requirements";

    private static final Pattern LABELED_BULLET = Pattern.compile(
            "^\\s*[-*]\\s*\\*\\*(?<label>[^*]+?)\\*\\*\\s*:?\\s*(?<value>.*?)\\s*$");

    private DocumentParser() {
    }

    // ======================================================================
    // SPANS
    // ======================================================================

    public static List<SectionSpan> findSections(List<String> lines) {
        return findSections(MarkerTokenizer.tokenize(lines), lines.size());
    }

    /**
     * Pairs every section marker with the next section marker's line, or EOF.
     */
    public static List<SectionSpan> findSections(List<MarkerToken> tokens, int lineCount) {
        List<MarkerToken> markers = tokens.stream().filter(t -> t.is(MarkerKind.SECTION)).toList();
        List<SectionSpan> spans = new ArrayList<>(markers.size());
        for (int i = 0; i < markers.size(); i++) {
            int end = i + 1 < markers.size() ? markers.get(i + 1).line() : lineCount;
            spans.add(new SectionSpan(markers.get(i).id(), markers.get(i).line(), end));
        }
        return spans;
    }

    public static Optional<SectionSpan> findSection(List<String> lines, String sectionId) {
        return findSections(lines).stream()
                .filter(span -> span.sectionId().equals(sectionId))
                .findFirst();
    }

    /**
     * Same pairing algorithm as {@link #findSections}, scoped to one parent span.
     */
    public static List<SubsectionSpan> findSubsectionsWithin(List<String> lines, SectionSpan parent) {
        List<MarkerToken> markers = MarkerTokenizer.tokenize(lines.subList(parent.start(), parent.end())).stream()
                .filter(t -> t.is(MarkerKind.SUBSECTION))
                .toList();
        List<SubsectionSpan> spans = new ArrayList<>(markers.size());
        for (int i = 0; i < markers.size(); i++) {
            int start = parent.start() + markers.get(i).line();
            int end = i + 1 < markers.size() ? parent.start() + markers.get(i + 1).line() : parent.end();
            spans.add(new SubsectionSpan(markers.get(i).id(), parent.sectionId(), start, end));
        }
        return spans;
    }

    public static Optional<SubsectionSpan> findSubsection(List<String> lines, String subsectionId) {
        for (SectionSpan section : findSections(lines)) {
            for (SubsectionSpan sub : findSubsectionsWithin(lines, section)) {
                if (sub.subsectionId().equals(subsectionId)) {
                    return Optional.of(sub);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Locates the first pipe-run after the table's marker.
     *
     * <p>Returns empty when the marker is missing or when a section marker comes
     * before any pipe line (the table is then misplaced, not empty).
     */
    public static Optional<TableBlock> findTableBlock(List<String> lines, String tableId) {
        List<MarkerToken> tokens = MarkerTokenizer.tokenize(lines);
        Optional<MarkerToken> marker = tokens.stream()
                .filter(t -> t.is(MarkerKind.TABLE) && t.id().equals(tableId))
                .findFirst();
        if (marker.isEmpty()) {
            return Optional.empty();
        }

        Set<Integer> sectionLines = new LinkedHashSet<>();
        tokens.stream().filter(t -> t.is(MarkerKind.SECTION)).forEach(t -> sectionLines.add(t.line()));

        int markerLine = marker.get().line();
        int start = -1;
        for (int i = markerLine + 1; i < lines.size(); i++) {
            if (sectionLines.contains(i)) {
                return Optional.empty();
            }
            if (MarkdownTables.isTableLine(lines.get(i))) {
                start = i;
                break;
            }
        }
        if (start < 0) {
            return Optional.empty();
        }

        int end = start;
        while (end < lines.size() && MarkdownTables.isTableLine(lines.get(end))) {
            end++;
        }
        return Optional.of(new TableBlock(tableId, markerLine, start, end));
    }

    // ======================================================================
    // WORKFLOW ORDER
    // ======================================================================

    /**
     * Reads the ordered, duplicate-free target list from the {@code workflow:order} block.
     *
     * @throws WorkflowOrderException when the block is missing, unterminated, empty
     *                                or names a target twice
     */
    public static List<String> extractWorkflowOrder(List<String> lines) {
        int startLine = -1;
        String remainder = null;
        for (int i = 0; i < lines.size(); i++) {
            Matcher matcher = MarkerSyntax.WORKFLOW_ORDER_START.matcher(lines.get(i));
            if (matcher.find()) {
                startLine = i;
                remainder = lines.get(i).substring(matcher.end());
                break;
            }
        }
        if (startLine < 0) {
            throw new WorkflowOrderException("Workflow order block not found", 0);
        }

        List<String> targets = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        boolean terminated = false;
        int lineIndex = startLine;
        String current = remainder;

        while (true) {
            int close = current.indexOf("-->");
            String entryText = close >= 0 ? current.substring(0, close) : current;
            addWorkflowEntry(entryText, lineIndex, targets, seen);
            if (close >= 0) {
                terminated = true;
                break;
            }
            lineIndex++;
            if (lineIndex >= lines.size()) {
                break;
            }
            current = lines.get(lineIndex);
        }

        if (!terminated) {
            throw new WorkflowOrderException(
                    "Workflow order block starting on line " + (startLine + 1) + " is not terminated with -->",
                    startLine + 1);
        }
        if (targets.isEmpty()) {
            throw new WorkflowOrderException(
                    "Workflow order block on line " + (startLine + 1) + " lists no targets", startLine + 1);
        }
        return List.copyOf(targets);
    }

    private static void addWorkflowEntry(String text, int lineIndex, List<String> targets, Set<String> seen) {
        String entry = text.strip();
        if (entry.isEmpty() || entry.startsWith("#")) {
            return;
        }
        if (!seen.add(entry)) {
            throw new WorkflowOrderException(
                    "Duplicate workflow target '" + entry + "' on line " + (lineIndex + 1), lineIndex + 1);
        }
        targets.add(entry);
    }

    // ======================================================================
    // METADATA
    // ======================================================================

    /**
     * Reads allow-listed {@code meta:} markers. A marker without a value attribute takes
     * the value of a following {@code - **Label**: value} line whose label matches the key.
     */
    public static Map<String, String> extractMetadata(List<String> lines) {
        Map<String, String> metadata = new LinkedHashMap<>();
        for (MarkerToken token : MarkerTokenizer.tokenize(lines)) {
            if (!token.is(MarkerKind.META)) {
                continue;
            }
            String value = token.attribute("value");
            if (value == null && token.line() + 1 < lines.size()) {
                value = labeledValue(lines.get(token.line() + 1), token.id()).orElse(null);
            }
            if (value != null) {
                metadata.putIfAbsent(token.id(), value);
            }
            if (token.attribute("version") != null) {
                metadata.putIfAbsent("version", token.attribute("version"));
            }
        }
        return metadata;
    }

    public static String docType(List<String> lines) {
        return extractMetadata(lines).getOrDefault("doc_type", DEFAULT_DOC_TYPE);
    }

    static Optional<String> labeledValue(String line, String key) {
        Matcher matcher = LABELED_BULLET.matcher(line);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        String label = normalizeLabel(matcher.group("label"));
        String value = matcher.group("value");
        if (!label.equals(key) || value.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(value);
    }

    private static String normalizeLabel(String label) {
        String normalized = label.strip().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_");
        return normalized.replaceAll("^_+|_+$", "");
    }

    // ======================================================================
    // SECTION QUERIES
    // ======================================================================

    /**
     * Section text without its markers, level-2 heading and dividers.
     */
    public static String sectionBody(List<String> lines, SectionSpan span) {
        List<String> body = new ArrayList<>();
        for (int i = span.start(); i < span.end(); i++) {
            String line = lines.get(i);
            String stripped = line.strip();
            if (MarkerSyntax.SECTION.matcher(line).find()
                    || MarkerSyntax.SECTION_LOCK.matcher(line).find()
                    || stripped.startsWith("## ")
                    || stripped.equals(MarkerSyntax.DIVIDER)) {
                continue;
            }
            body.add(line);
        }
        return String.join("\n", body).strip();
    }

    public static boolean isLocked(List<String> lines, SectionSpan span) {
        boolean locked = false;
        for (MarkerToken token : MarkerTokenizer.tokenize(lines.subList(span.start(), span.end()))) {
            if (token.is(MarkerKind.SECTION_LOCK) && token.id().equals(span.sectionId())) {
                locked = token.lockValue();
            }
        }
        return locked;
    }

    /**
     * True while the section's own body, from its marker up to its first subsection,
     * still carries a placeholder token.
     */
    public static boolean isBlank(List<String> lines, SectionSpan span) {
        int bodyEnd = findSubsectionsWithin(lines, span).stream()
                .mapToInt(SubsectionSpan::start)
                .findFirst()
                .orElse(span.end());
        for (int i = span.start(); i < bodyEnd; i++) {
            if (lines.get(i).contains(MarkerSyntax.PLACEHOLDER)) {
                return true;
            }
        }
        return false;
    }

    /**
     * The authoritative (last) result marker for a gate.
     */
    public static Optional<ReviewGateRecord> findReviewGateResult(List<String> lines, String gateId) {
        ReviewGateRecord found = null;
        for (MarkerToken token : MarkerTokenizer.tokenize(lines)) {
            if (token.is(MarkerKind.REVIEW_GATE_RESULT) && token.id().equals(gateId)) {
                found = new ReviewGateRecord(gateId, "passed".equals(token.attribute("status")),
                        token.intAttribute("issues"), token.intAttribute("warnings"), token.line());
            }
        }
        return Optional.ofNullable(found);
    }

    public static List<String> sectionIds(List<String> lines) {
        return findSections(lines).stream().map(SectionSpan::sectionId).distinct().toList();
    }
}
