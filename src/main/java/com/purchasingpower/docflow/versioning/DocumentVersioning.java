package com.purchasingpower.docflow.versioning;

import com.purchasingpower.docflow.configuration.DocFlowProperties;
import com.purchasingpower.docflow.marker.MarkerKind;
import com.purchasingpower.docflow.marker.MarkerSyntax;
import com.purchasingpower.docflow.marker.MarkerToken;
import com.purchasingpower.docflow.marker.MarkerTokenizer;
import com.purchasingpower.docflow.parser.DocumentParser;
import com.purchasingpower.docflow.parser.MarkdownTables;
import com.purchasingpower.docflow.parser.ReviewGateRecord;
import com.purchasingpower.docflow.parser.TableBlock;
import com.purchasingpower.docflow.registry.HandlerRegistry;
import com.purchasingpower.docflow.workflow.SectionStateEvaluator;
import com.purchasingpower.docflow.workflow.SectionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Moves the document version forward as workflow milestones complete.
 *
 * <p>Milestones come from the handler registry, per document type. A document
 * without a {@code meta:version} marker is never versioned.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DocumentVersioning {

    static final String DOCUMENT_CONTROL_TABLE = "document_control";
    static final String VERSION_HISTORY_TABLE = "version_history";
    static final String INITIAL_VERSION = "0.0";

    private static final Pattern VERSION = Pattern.compile("^(\\d{1,9})\\.(\\d{1,9})$");
    private static final Pattern VALUE_ATTRIBUTE = Pattern.compile("value=\"[^\"]*\"");
    private static final Pattern BULLET_VALUE = Pattern.compile("^(\\s*[-*]\\s*\\*\\*[^*]+\\*\\*\\s*:?\\s*).*$");

    private final HandlerRegistry registry;
    private final SectionStateEvaluator evaluator;
    private final DocFlowProperties properties;
    private final Clock clock;

    public String currentVersion(List<String> lines) {
        return DocumentParser.extractMetadata(lines).getOrDefault("version", INITIAL_VERSION);
    }

    /**
     * Highest milestone whose target is complete (sections) or passed (gates).
     */
    public Optional<Milestone> reachedMilestone(List<String> lines, String docType) {
        Milestone best = null;
        for (Map.Entry<String, String> entry : registry.versionMilestones(docType).entrySet()) {
            if (!isReached(lines, entry.getKey())) {
                continue;
            }
            if (best == null || compare(entry.getValue(), best.version()) > 0) {
                best = new Milestone(entry.getKey(), entry.getValue());
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Bumps the version when a higher milestone has been reached; otherwise returns the lines unchanged.
     */
    public List<String> applyMilestones(List<String> lines, String docType) {
        if (findVersionMarker(lines).isEmpty()) {
            return lines;
        }
        Optional<Milestone> milestone = reachedMilestone(lines, docType);
        String current = currentVersion(lines);
        if (milestone.isEmpty() || compare(milestone.get().version(), current) <= 0) {
            return lines;
        }
        log.info("🔖 Version {} -> {} ({} complete)", current, milestone.get().version(), milestone.get().targetId());
        return updateVersion(lines, milestone.get().version(), "Completed " + milestone.get().targetId());
    }

    public List<String> updateVersion(List<String> lines, String version, String changes) {
        List<String> result = new ArrayList<>(lines);
        updateMetaVersion(result, version);
        updateDocumentControl(result, version);
        addHistoryEntry(result, version, changes);
        return result;
    }

    private boolean isReached(List<String> lines, String targetId) {
        if (MarkerSyntax.isReviewGate(targetId)) {
            return DocumentParser.findReviewGateResult(lines, targetId).map(ReviewGateRecord::passed).orElse(false);
        }
        SectionStatus status = evaluator.evaluate(lines, targetId).status();
        return status == SectionStatus.COMPLETE || status == SectionStatus.LOCKED;
    }

    private Optional<MarkerToken> findVersionMarker(List<String> lines) {
        return MarkerTokenizer.tokenize(lines).stream()
                .filter(t -> t.is(MarkerKind.META) && t.id().equals("version"))
                .findFirst();
    }

    private void updateMetaVersion(List<String> lines, String version) {
        Optional<MarkerToken> marker = findVersionMarker(lines);
        if (marker.isEmpty()) {
            return;
        }
        int line = marker.get().line();
        if (marker.get().attribute("value") != null) {
            lines.set(line, VALUE_ATTRIBUTE.matcher(lines.get(line)).replaceFirst("value=\"" + version + "\""));
        } else if (line + 1 < lines.size()) {
            Matcher bullet = BULLET_VALUE.matcher(lines.get(line + 1));
            if (bullet.matches()) {
                lines.set(line + 1, bullet.group(1) + version);
            }
        }
    }

    private void updateDocumentControl(List<String> lines, String version) {
        Optional<TableBlock> table = DocumentParser.findTableBlock(lines, DOCUMENT_CONTROL_TABLE);
        if (table.isEmpty()) {
            return;
        }
        for (int i = table.get().start(); i < table.get().end(); i++) {
            List<String> cells = new ArrayList<>(MarkdownTables.splitRow(lines.get(i)));
            if (cells.size() >= 2 && cells.get(0).equals("Current Version")) {
                cells.set(1, version);
                lines.set(i, MarkdownTables.formatRow(cells));
                return;
            }
        }
    }

    private void addHistoryEntry(List<String> lines, String version, String changes) {
        Optional<TableBlock> table = DocumentParser.findTableBlock(lines, VERSION_HISTORY_TABLE);
        if (table.isEmpty() || table.get().rowCount() < 2) {
            return;
        }
        String row = MarkdownTables.formatRow(List.of(version, LocalDate.now(clock).toString(),
                properties.getAutomationActor(), changes));
        for (int i = table.get().start() + 2; i < table.get().end(); i++) {
            if (lines.get(i).contains(MarkerSyntax.PLACEHOLDER)) {
                lines.set(i, row);
                return;
            }
        }
        lines.add(table.get().end(), row);
    }

    /**
     * Compares {@code major.minor} versions; malformed versions sort lowest.
     */
    static int compare(String left, String right) {
        int[] a = parse(left);
        int[] b = parse(right);
        return a[0] != b[0] ? Integer.compare(a[0], b[0]) : Integer.compare(a[1], b[1]);
    }

    private static int[] parse(String version) {
        Matcher matcher = VERSION.matcher(version == null ? "" : version.strip());
        if (!matcher.matches()) {
            return new int[]{-1, -1};
        }
        return new int[]{Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2))};
    }

    public record Milestone(String targetId, String version) {
    }
}
