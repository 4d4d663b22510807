package com.purchasingpower.docflow.validation;

import com.purchasingpower.docflow.exception.DuplicateSectionException;
import com.purchasingpower.docflow.exception.InvalidSpanException;
import com.purchasingpower.docflow.exception.MalformedMarkerException;
import com.purchasingpower.docflow.exception.MissingTemplateMarkerException;
import com.purchasingpower.docflow.exception.OrphanedLockException;
import com.purchasingpower.docflow.exception.StructuralException;
import com.purchasingpower.docflow.exception.TableSchemaException;
import com.purchasingpower.docflow.marker.MarkerKind;
import com.purchasingpower.docflow.marker.MarkerToken;
import com.purchasingpower.docflow.marker.MarkerTokenizer;
import com.purchasingpower.docflow.parser.DocumentParser;
import com.purchasingpower.docflow.parser.MarkdownTables;
import com.purchasingpower.docflow.parser.TableBlock;
import com.purchasingpower.docflow.question.QuestionTableSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Default structural validator.
 *
 * <p>Order of work: narrow auto-repair on a private copy, then marker syntax,
 * duplicate sections, subsection placement, orphaned locks, fixed-schema tables and,
 * when a template is supplied, the template diff. Line numbers in errors are 1-based.
 */
@Slf4j
@Service
public class StructuralValidatorImpl implements StructuralValidator {

    @Override
    public ValidationReport validate(List<String> lines) {
        return validate(lines, null);
    }

    @Override
    public ValidationReport validate(List<String> lines, List<String> templateLines) {
        List<String> working = new ArrayList<>(lines);
        List<String> repairs = OpenQuestionsRepair.apply(working);

        List<MarkerToken> tokens = MarkerTokenizer.tokenize(working);
        List<StructuralException> errors = new ArrayList<>();

        checkMalformedMarkers(working, tokens, errors);
        checkDuplicateSections(tokens, errors);
        checkSubsectionPlacement(tokens, errors);
        checkOrphanedLocks(tokens, errors);
        checkQuestionTables(working, tokens, errors);
        if (templateLines != null) {
            checkAgainstTemplate(tokens, MarkerTokenizer.tokenize(templateLines), errors);
        }

        if (errors.isEmpty()) {
            log.debug("✅ Structure valid ({} lines, {} repairs)", working.size(), repairs.size());
        } else {
            log.warn("❌ Structural validation found {} error(s)", errors.size());
        }

        return ValidationReport.builder()
                .errors(List.copyOf(errors))
                .repairs(List.copyOf(repairs))
                .lines(List.copyOf(working))
                .build();
    }

    private void checkMalformedMarkers(List<String> lines, List<MarkerToken> tokens, List<StructuralException> errors) {
        for (MarkerToken token : tokens) {
            if (token.is(MarkerKind.MALFORMED)) {
                errors.add(new MalformedMarkerException(token.line() + 1, lines.get(token.line()), token.reason()));
            }
        }
    }

    private void checkDuplicateSections(List<MarkerToken> tokens, List<StructuralException> errors) {
        Map<String, List<Integer>> occurrences = new LinkedHashMap<>();
        for (MarkerToken token : tokens) {
            if (token.is(MarkerKind.SECTION)) {
                occurrences.computeIfAbsent(token.id(), id -> new ArrayList<>()).add(token.line() + 1);
            }
        }
        occurrences.forEach((id, lineNumbers) -> {
            if (lineNumbers.size() > 1) {
                errors.add(new DuplicateSectionException(id, lineNumbers));
            }
        });
    }

    private void checkSubsectionPlacement(List<MarkerToken> tokens, List<StructuralException> errors) {
        for (MarkerToken token : tokens) {
            if (token.is(MarkerKind.SECTION)) {
                return;
            }
            if (token.is(MarkerKind.SUBSECTION)) {
                errors.add(new InvalidSpanException(token.id(),
                        "subsection marker on line " + (token.line() + 1) + " is outside any section"));
            }
        }
    }

    private void checkOrphanedLocks(List<MarkerToken> tokens, List<StructuralException> errors) {
        Set<String> sectionIds = new LinkedHashSet<>();
        tokens.stream().filter(t -> t.is(MarkerKind.SECTION)).forEach(t -> sectionIds.add(t.id()));
        for (MarkerToken token : tokens) {
            if (token.is(MarkerKind.SECTION_LOCK) && !sectionIds.contains(token.id())) {
                errors.add(new OrphanedLockException(token.id(), token.line() + 1));
            }
        }
    }

    private void checkQuestionTables(List<String> lines, List<MarkerToken> tokens, List<StructuralException> errors) {
        Set<String> checked = new LinkedHashSet<>();
        for (MarkerToken token : tokens) {
            if (!token.is(MarkerKind.TABLE) || !checked.add(token.id())) {
                continue;
            }
            QuestionTableSchema schema = QuestionTableSchema.forTableId(token.id());
            if (schema == null) {
                continue;
            }
            Optional<TableBlock> block = DocumentParser.findTableBlock(lines, token.id());
            if (block.isEmpty()) {
                errors.add(new TableSchemaException(token.id(), token.line() + 1,
                        "table marker is not followed by table rows within its section"));
                continue;
            }
            checkTableShape(lines, block.get(), schema, errors);
        }
    }

    private void checkTableShape(List<String> lines, TableBlock block, QuestionTableSchema schema,
                                 List<StructuralException> errors) {
        String header = lines.get(block.start());
        List<String> columns = MarkdownTables.splitRow(header);
        if (!columns.equals(schema.columns())) {
            errors.add(new TableSchemaException(block.tableId(), block.start() + 1,
                    "expected columns " + schema.columns() + " but found " + columns));
        }
        if (block.rowCount() < 2 || !MarkdownTables.isSeparatorRow(lines.get(block.start() + 1))) {
            errors.add(new TableSchemaException(block.tableId(), block.start() + 1,
                    "header must be followed by a separator row"));
            return;
        }
        int expectedPipes = MarkdownTables.pipeCount(header);
        for (int i = block.start() + 2; i < block.end(); i++) {
            int pipes = MarkdownTables.pipeCount(lines.get(i));
            if (pipes != expectedPipes) {
                errors.add(new TableSchemaException(block.tableId(), i + 1,
                        "row has " + (pipes - 1) + " cells, expected " + (expectedPipes - 1)));
            }
        }
    }

    private void checkAgainstTemplate(List<MarkerToken> subject, List<MarkerToken> template,
                                      List<StructuralException> errors) {
        Set<String> present = markerKeys(subject);
        for (String key : markerKeys(template)) {
            if (!present.contains(key)) {
                String[] parts = key.split(":", 2);
                errors.add(new MissingTemplateMarkerException(parts[0], parts[1]));
            }
        }
    }

    private Set<String> markerKeys(List<MarkerToken> tokens) {
        Set<String> keys = new LinkedHashSet<>();
        for (MarkerToken token : tokens) {
            switch (token.kind()) {
                case SECTION -> keys.add("section:" + token.id());
                case SUBSECTION -> keys.add("subsection:" + token.id());
                case TABLE -> keys.add("table:" + token.id());
                default -> {
                    // other marker kinds are not part of the template contract
                }
            }
        }
        return keys;
    }
}
