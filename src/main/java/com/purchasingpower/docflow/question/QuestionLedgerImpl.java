package com.purchasingpower.docflow.question;

import com.purchasingpower.docflow.exception.QuestionTableException;
import com.purchasingpower.docflow.marker.MarkerSyntax;
import com.purchasingpower.docflow.parser.DocumentParser;
import com.purchasingpower.docflow.parser.MarkdownTables;
import com.purchasingpower.docflow.parser.TableBlock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
@Service
public class QuestionLedgerImpl implements QuestionLedger {

    private static final Pattern LEGACY_ID = Pattern.compile("^Q-(\\d{1,9})$");

    @Override
    public LedgerTable parse(List<String> lines, LedgerScope scope) {
        TableBlock block = DocumentParser.findTableBlock(lines, scope.tableId())
                .orElseThrow(() -> new QuestionTableException(scope.tableId(),
                        "Question table '" + scope.tableId() + "' not found"));

        QuestionTableSchema schema = scope.schema();
        List<String> header = MarkdownTables.splitRow(lines.get(block.start()));
        if (!header.equals(schema.columns())) {
            throw new QuestionTableException(scope.tableId(), "Question table '" + scope.tableId()
                    + "' has columns " + header + ", expected " + schema.columns());
        }
        if (block.rowCount() < 2 || !MarkdownTables.isSeparatorRow(lines.get(block.start() + 1))) {
            throw new QuestionTableException(scope.tableId(),
                    "Question table '" + scope.tableId() + "' is missing its separator row");
        }

        List<OpenQuestion> questions = new ArrayList<>();
        for (int i = block.start() + 2; i < block.end(); i++) {
            String row = lines.get(i);
            if (row.contains(MarkerSyntax.PLACEHOLDER)) {
                continue;
            }
            List<String> cells = MarkdownTables.splitRow(row);
            if (cells.size() != schema.columnCount()) {
                log.debug("Skipping row {} of {}: {} cells", i + 1, scope.tableId(), cells.size());
                continue;
            }
            String statusCell = cells.get(schema.columnCount() - 1);
            Optional<QuestionStatus> status = QuestionStatus.fromLabel(statusCell);
            if (status.isEmpty()) {
                log.debug("Skipping row {} of {}: unknown status '{}'", i + 1, scope.tableId(), statusCell);
                continue;
            }
            String target = scope.isLegacy() ? cells.get(4) : scope.sectionId();
            questions.add(new OpenQuestion(cells.get(0), cells.get(1), cells.get(2), cells.get(3),
                    target, status.get(), i));
        }
        return new LedgerTable(scope, block, List.copyOf(questions));
    }

    @Override
    public Optional<LedgerScope> scopeFor(List<String> lines, String sectionId) {
        LedgerScope own = LedgerScope.forSection(sectionId);
        if (DocumentParser.findTableBlock(lines, own.tableId()).isPresent()) {
            return Optional.of(own);
        }
        LedgerScope legacy = LedgerScope.legacy();
        if (DocumentParser.findTableBlock(lines, legacy.tableId()).isPresent()) {
            return Optional.of(legacy);
        }
        return Optional.empty();
    }

    @Override
    public List<OpenQuestion> questionsFor(List<String> lines, String sectionId, List<String> subsectionIds) {
        Optional<LedgerScope> scope = scopeFor(lines, sectionId);
        if (scope.isEmpty()) {
            return List.of();
        }
        List<OpenQuestion> questions = parse(lines, scope.get()).questions();
        if (!scope.get().isLegacy()) {
            return questions;
        }
        Set<String> targets = new HashSet<>(subsectionIds);
        targets.add(sectionId);
        return questions.stream()
                .filter(q -> targets.contains(q.target().strip())
                        || sectionId.equals(QuestionTargets.canonical(q.target())))
                .toList();
    }

    @Override
    public String nextId(LedgerScope scope, List<OpenQuestion> existing) {
        return nextIdAfter(scope, existing.stream().map(OpenQuestion::questionId).toList());
    }

    private String nextIdAfter(LedgerScope scope, Collection<String> usedIds) {
        Pattern idPattern = scope.isLegacy()
                ? LEGACY_ID
                : Pattern.compile("^" + Pattern.quote(scope.sectionId()) + "-Q(\\d{1,9})$");
        int max = 0;
        for (String id : usedIds) {
            Matcher matcher = idPattern.matcher(id);
            if (matcher.matches()) {
                max = Math.max(max, Integer.parseInt(matcher.group(1)));
            }
        }
        return formatId(scope, max + 1);
    }

    private String formatId(LedgerScope scope, int number) {
        return scope.isLegacy()
                ? String.format("Q-%03d", number)
                : scope.sectionId() + "-Q" + number;
    }

    @Override
    public LedgerUpdate insert(List<String> lines, LedgerScope scope, NewQuestion question, String date) {
        return insertBatch(lines, scope, List.of(question), date);
    }

    @Override
    public LedgerUpdate insertBatch(List<String> lines, LedgerScope scope, List<NewQuestion> questions, String date) {
        LedgerTable table = parse(lines, scope);

        Map<String, String> idsByKey = new HashMap<>();
        for (OpenQuestion existing : table.questions()) {
            idsByKey.putIfAbsent(duplicateKey(scope, existing.question(), existing.target()), existing.questionId());
        }

        // ids on rows the parser skipped (unknown status, wrong shape) stay taken
        List<String> usedIds = new ArrayList<>();
        for (int i = table.block().start() + 2; i < table.block().end(); i++) {
            List<String> cells = MarkdownTables.splitRow(lines.get(i));
            if (!cells.isEmpty() && !cells.get(0).isEmpty()) {
                usedIds.add(cells.get(0));
            }
        }

        List<String> newRows = new ArrayList<>();
        List<String> ids = new ArrayList<>();

        for (NewQuestion question : questions) {
            String text = cellText(question.question());
            if (text.isEmpty()) {
                continue;
            }
            String target = scope.isLegacy()
                    ? cellText(question.target() == null ? "" : question.target())
                    : scope.sectionId();
            String key = duplicateKey(scope, text, target);
            String existingId = idsByKey.get(key);
            if (existingId != null) {
                log.debug("Duplicate question suppressed, existing id {}", existingId);
                ids.add(existingId);
                continue;
            }

            String id = nextIdAfter(scope, usedIds);
            usedIds.add(id);
            idsByKey.put(key, id);
            ids.add(id);

            List<String> cells = scope.isLegacy()
                    ? List.of(id, text, date, "", target, QuestionStatus.OPEN.label())
                    : List.of(id, text, date, "", QuestionStatus.OPEN.label());
            newRows.add(MarkdownTables.formatRow(cells));
        }

        List<String> result = new ArrayList<>(lines);
        result.addAll(table.block().start() + 2, newRows);
        if (!newRows.isEmpty()) {
            log.info("📝 Added {} question(s) to {}", newRows.size(), scope.tableId());
        }
        return new LedgerUpdate(result, List.copyOf(ids), newRows.size());
    }

    @Override
    public LedgerUpdate resolve(List<String> lines, LedgerScope scope, String questionId) {
        return resolveBatch(lines, scope, List.of(questionId));
    }

    @Override
    public LedgerUpdate resolveBatch(List<String> lines, LedgerScope scope, List<String> questionIds) {
        LedgerTable table = parse(lines, scope);
        Set<String> wanted = new LinkedHashSet<>(questionIds);
        List<String> result = new ArrayList<>(lines);
        List<String> resolved = new ArrayList<>();

        for (OpenQuestion question : table.questions()) {
            if (!wanted.remove(question.questionId())) {
                continue;
            }
            if (question.status() == QuestionStatus.RESOLVED) {
                continue;
            }
            List<String> cells = new ArrayList<>(MarkdownTables.splitRow(lines.get(question.line())));
            cells.set(cells.size() - 1, QuestionStatus.RESOLVED.label());
            result.set(question.line(), MarkdownTables.formatRow(cells));
            resolved.add(question.questionId());
        }

        if (!wanted.isEmpty()) {
            log.warn("⚠️ Question id(s) not found in {}: {}", scope.tableId(), wanted);
        }
        return new LedgerUpdate(result, List.copyOf(resolved), resolved.size());
    }

    private String duplicateKey(LedgerScope scope, String question, String target) {
        String key = normalize(question);
        return scope.isLegacy() ? key + "|" + normalize(target == null ? "" : target) : key;
    }

    static String normalize(String text) {
        return text.strip().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private static String cellText(String text) {
        return text.replace('|', '/').replaceAll("\\s+", " ").strip();
    }
}
