package com.purchasingpower.docflow.editing;

import com.purchasingpower.docflow.marker.MarkerKind;
import com.purchasingpower.docflow.marker.MarkerSyntax;
import com.purchasingpower.docflow.marker.MarkerToken;
import com.purchasingpower.docflow.marker.MarkerTokenizer;
import com.purchasingpower.docflow.parser.DocumentParser;
import com.purchasingpower.docflow.parser.MarkdownTables;
import com.purchasingpower.docflow.parser.SectionSpan;
import com.purchasingpower.docflow.parser.SubsectionSpan;
import com.purchasingpower.docflow.parser.TableBlock;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Splits generated section text into table rows and prose.
 *
 * <p>Rows that follow a {@code ### Heading} naming one of the section's table
 * subsections are appended to that subsection's table (placeholder rows are dropped);
 * everything else is returned as preamble text. Ledger subsections never receive rows.
 */
@Slf4j
public final class TableRouting {

    private TableRouting() {
    }

    /**
     * @param lines     document with table content routed in
     * @param preamble  the prose left for the section preamble
     * @param rowsAdded data rows written into tables
     */
    public record Routed(List<String> lines, String preamble, int rowsAdded) {
    }

    public static Routed route(List<String> lines, SectionSpan section, String output) {
        Map<String, String> tablesBySubsection = tableSubsections(lines, section);
        if (tablesBySubsection.isEmpty() || output == null) {
            return new Routed(lines, output, 0);
        }

        Map<String, List<String>> rowsBySubsection = rowsByHeading(output, tablesBySubsection);
        if (rowsBySubsection.isEmpty()) {
            return new Routed(lines, output, 0);
        }

        List<String> current = lines;
        int added = 0;
        for (Map.Entry<String, List<String>> entry : rowsBySubsection.entrySet()) {
            String tableId = tablesBySubsection.get(entry.getKey());
            Appended appended = appendRows(current, tableId, entry.getValue());
            current = appended.lines();
            added += appended.count();
        }
        if (added > 0) {
            log.info("📝 Routed {} table row(s) into subsections of {}", added, section.sectionId());
        }
        return new Routed(current, nonTableText(output), added);
    }

    /**
     * Subsection id to the id of the first table it holds, for non-ledger subsections.
     */
    private static Map<String, String> tableSubsections(List<String> lines, SectionSpan section) {
        Map<String, String> tables = new LinkedHashMap<>();
        for (SubsectionSpan sub : DocumentParser.findSubsectionsWithin(lines, section)) {
            if (ReplacementBoundaries.LEDGER_SUBSECTIONS.contains(sub.subsectionId())) {
                continue;
            }
            MarkerTokenizer.tokenize(lines.subList(sub.start(), sub.end())).stream()
                    .filter(t -> t.is(MarkerKind.TABLE))
                    .map(MarkerToken::id)
                    .findFirst()
                    .ifPresent(tableId -> tables.put(sub.subsectionId(), tableId));
        }
        return tables;
    }

    private static Map<String, List<String>> rowsByHeading(String output, Map<String, String> tablesBySubsection) {
        Map<String, List<String>> rows = new LinkedHashMap<>();
        String current = null;
        for (String line : output.split("\n", -1)) {
            String stripped = line.strip();
            if (stripped.startsWith("###")) {
                String id = headingId(stripped.substring(3));
                current = tablesBySubsection.containsKey(id) ? id : null;
                continue;
            }
            if (current == null || !MarkdownTables.isTableLine(stripped) || MarkdownTables.isSeparatorRow(stripped)) {
                continue;
            }
            rows.computeIfAbsent(current, k -> new ArrayList<>()).add(stripped);
        }
        return rows;
    }

    static String headingId(String heading) {
        return heading.strip().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_").replaceAll("^_+|_+$", "");
    }

    private record Appended(List<String> lines, int count) {
    }

    /**
     * Appends rows after the table's existing data rows. Rows echoing the header,
     * rows with the wrong cell count and rows already present are skipped.
     */
    private static Appended appendRows(List<String> lines, String tableId, List<String> rows) {
        Optional<TableBlock> found = DocumentParser.findTableBlock(lines, tableId);
        if (found.isEmpty() || found.get().rowCount() < 2
                || !MarkdownTables.isSeparatorRow(lines.get(found.get().start() + 1))) {
            log.warn("⚠️ Table {} has no header and separator, rows not routed", tableId);
            return new Appended(lines, 0);
        }
        TableBlock block = found.get();
        List<String> header = MarkdownTables.splitRow(lines.get(block.start()));

        List<String> kept = new ArrayList<>();
        for (int i = block.start() + 2; i < block.end(); i++) {
            if (!lines.get(i).contains(MarkerSyntax.PLACEHOLDER)) {
                kept.add(lines.get(i));
            }
        }
        List<String> existingCells = kept.stream().map(r -> String.join("|", MarkdownTables.splitRow(r))).toList();

        List<String> additions = new ArrayList<>();
        for (String row : rows) {
            List<String> cells = MarkdownTables.splitRow(row);
            if (cells.size() != header.size() || cells.equals(header) || MarkerSyntax.containsMarkerSyntax(row)) {
                log.debug("Skipping row for {}: {}", tableId, row);
                continue;
            }
            String key = String.join("|", cells);
            if (existingCells.contains(key) || additions.stream()
                    .anyMatch(a -> String.join("|", MarkdownTables.splitRow(a)).equals(key))) {
                continue;
            }
            additions.add(MarkdownTables.formatRow(cells));
        }
        if (additions.isEmpty()) {
            return new Appended(lines, 0);
        }

        List<String> result = new ArrayList<>(lines.subList(0, block.start() + 2));
        result.addAll(kept);
        result.addAll(additions);
        result.addAll(lines.subList(block.end(), lines.size()));
        return new Appended(result, additions.size());
    }

    /**
     * Output with table rows and {@code ###} headings removed, blank runs collapsed.
     */
    static String nonTableText(String output) {
        List<String> kept = new ArrayList<>();
        for (String line : output.split("\n", -1)) {
            String stripped = line.strip();
            if (stripped.startsWith("###") || MarkdownTables.isTableLine(stripped)) {
                continue;
            }
            if (stripped.isEmpty() && (kept.isEmpty() || kept.get(kept.size() - 1).isBlank())) {
                continue;
            }
            kept.add(line);
        }
        return String.join("\n", kept).strip();
    }
}
