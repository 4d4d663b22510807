package com.purchasingpower.docflow.editing;

import com.purchasingpower.docflow.exception.InvalidSpanException;
import com.purchasingpower.docflow.exception.StructuralException;
import com.purchasingpower.docflow.marker.MarkerKind;
import com.purchasingpower.docflow.marker.MarkerSyntax;
import com.purchasingpower.docflow.marker.MarkerTokenizer;
import com.purchasingpower.docflow.parser.MarkdownTables;
import com.purchasingpower.docflow.validation.StructuralValidator;
import com.purchasingpower.docflow.validation.ValidationReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class MarkerPreservingEditorImpl implements MarkerPreservingEditor {

    private static final int HEADING_SCAN_LINES = 8;
    private static final int DIVIDER_SCAN_LINES = 3;
    private static final Set<MarkerKind> STRUCTURAL = EnumSet.of(MarkerKind.SECTION, MarkerKind.SUBSECTION,
            MarkerKind.TABLE);

    private final StructuralValidator validator;
    private final BodySanitizer sanitizer;

    @Override
    public List<String> replaceBody(List<String> lines, int start, int end, String regionId, String newBody,
                                    SanitizeRules rules) {
        validator.validateOrThrow(lines);

        if (start < 0 || end > lines.size()) {
            throw new InvalidSpanException(regionId, "span [" + start + ", " + end + ") out of bounds for "
                    + lines.size() + " lines");
        }
        if (start >= end) {
            throw new InvalidSpanException(regionId, "empty span [" + start + ", " + end + ")");
        }

        List<String> block = lines.subList(start, end);

        // Nested subsections are carried over untouched; only the preamble is rewritten.
        int firstSubsection = block.size();
        for (int i = 1; i < block.size(); i++) {
            if (MarkerSyntax.SUBSECTION.matcher(block.get(i)).find()) {
                firstSubsection = i;
                break;
            }
        }
        List<String> preamble = block.subList(0, firstSubsection);
        List<String> tail = block.subList(firstSubsection, block.size());

        String heading = null;
        for (int i = 1; i < Math.min(HEADING_SCAN_LINES, preamble.size()); i++) {
            String stripped = preamble.get(i).strip();
            if (stripped.startsWith("## ") || stripped.startsWith("### ")) {
                heading = preamble.get(i);
                break;
            }
        }

        String lock = null;
        for (String line : preamble) {
            if (MarkerSyntax.SECTION_LOCK.matcher(line).find()) {
                lock = line;
            }
        }

        List<String> tables = preambleTables(preamble);

        boolean keepDivider = false;
        if (tail.isEmpty()) {
            for (int i = Math.max(0, block.size() - DIVIDER_SCAN_LINES); i < block.size(); i++) {
                if (block.get(i).strip().equals(MarkerSyntax.DIVIDER)) {
                    keepDivider = true;
                }
            }
        }

        String sanitized = sanitizer.sanitize(newBody, rules);

        List<String> replacement = new ArrayList<>();
        replacement.add(block.get(0));
        if (heading != null) {
            replacement.add(heading);
        }
        replacement.add("");
        if (sanitized.isEmpty()) {
            replacement.add(MarkerSyntax.PLACEHOLDER);
        } else {
            replacement.addAll(List.of(sanitized.split("\n", -1)));
        }
        replacement.add("");
        if (!tables.isEmpty()) {
            replacement.addAll(tables);
            replacement.add("");
        }
        if (lock != null) {
            replacement.add(lock);
        }
        if (keepDivider) {
            replacement.add(MarkerSyntax.DIVIDER);
        }
        replacement.addAll(tail);

        List<String> before = structuralMarkers(block);
        List<String> afterMarkers = structuralMarkers(replacement);
        if (!before.equals(afterMarkers)) {
            throw new StructuralException("Edit to '" + regionId + "' would change its markers from "
                    + before + " to " + afterMarkers);
        }

        List<String> result = new ArrayList<>(lines.size() - block.size() + replacement.size());
        result.addAll(lines.subList(0, start));
        result.addAll(replacement);
        result.addAll(lines.subList(end, lines.size()));

        ValidationReport after = validator.validate(result);
        if (!after.isValid()) {
            StructuralException first = after.getErrors().get(0);
            throw new StructuralException("Edit to '" + regionId + "' would corrupt structure: "
                    + first.getMessage(), first);
        }

        log.debug("📝 Replaced body of '{}' ({} -> {} lines)", regionId, block.size(), replacement.size());
        return result;
    }

    /**
     * Table markers in the preamble with their pipe rows, in document order.
     */
    private static List<String> preambleTables(List<String> preamble) {
        List<String> tables = new ArrayList<>();
        for (int i = 1; i < preamble.size(); i++) {
            if (!MarkerSyntax.TABLE.matcher(preamble.get(i)).find()) {
                continue;
            }
            if (!tables.isEmpty()) {
                tables.add("");
            }
            tables.add(preamble.get(i));
            int row = i + 1;
            while (row < preamble.size() && preamble.get(row).isBlank()) {
                row++;
            }
            while (row < preamble.size() && MarkdownTables.isTableLine(preamble.get(row))) {
                tables.add(preamble.get(row));
                row++;
            }
            i = row - 1;
        }
        return tables;
    }

    private static List<String> structuralMarkers(List<String> lines) {
        return MarkerTokenizer.tokenize(lines).stream()
                .filter(t -> STRUCTURAL.contains(t.kind()))
                .map(t -> t.kind() + ":" + t.id())
                .sorted()
                .toList();
    }
}
