package com.purchasingpower.docflow.workflow;

import com.purchasingpower.docflow.client.CompletionService;
import com.purchasingpower.docflow.editing.MarkerPreservingEditor;
import com.purchasingpower.docflow.editing.ReplacementBoundaries;
import com.purchasingpower.docflow.editing.TableRouting;
import com.purchasingpower.docflow.exception.CompletionServiceException;
import com.purchasingpower.docflow.marker.MarkerSyntax;
import com.purchasingpower.docflow.model.review.GeneratedQuestion;
import com.purchasingpower.docflow.parser.DocumentParser;
import com.purchasingpower.docflow.parser.SectionSpan;
import com.purchasingpower.docflow.parser.SubsectionSpan;
import com.purchasingpower.docflow.question.LedgerScope;
import com.purchasingpower.docflow.question.LedgerUpdate;
import com.purchasingpower.docflow.question.NewQuestion;
import com.purchasingpower.docflow.question.OpenQuestion;
import com.purchasingpower.docflow.question.QuestionLedger;
import com.purchasingpower.docflow.question.QuestionTargets;
import com.purchasingpower.docflow.registry.HandlerConfig;
import com.purchasingpower.docflow.registry.HandlerMode;
import com.purchasingpower.docflow.registry.ScopeKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Executes one workflow step on an ordinary section.
 *
 * <p>Strict order within the step: integrate answered questions (and resolve them),
 * re-check blankness, draft from prior context only when nothing was integrated,
 * then generate questions if the section is still blank.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SectionHandler {

    private final SectionStateEvaluator evaluator;
    private final PriorContextGatherer priorContextGatherer;
    private final QuestionLedger ledger;
    private final MarkerPreservingEditor editor;
    private final CompletionService completionService;
    private final Clock clock;

    public StepOutcome execute(List<String> lines, String sectionId, List<String> workflowOrder, HandlerConfig config) {
        log.info("🔍 Processing section {} (mode: {})", sectionId, config.getMode().value());

        Map<String, String> priorContext = config.getScope().kind() == ScopeKind.ALL_PRIOR_SECTIONS
                ? priorContextGatherer.gather(lines, workflowOrder, sectionId)
                : Map.of();

        List<String> current = lines;
        WorkflowAction action = WorkflowAction.NO_ACTION;

        // 1. integrate
        int resolved = 0;
        boolean hadAnswered = evaluator.evaluate(current, sectionId).hasAnsweredQuestions();
        if (hadAnswered) {
            StepOutcome integration = integrateAnsweredQuestions(current, sectionId, priorContext, config);
            current = integration.lines();
            resolved = integration.result().getQuestionsResolved();
            action = WorkflowAction.INTEGRATION;
        }

        // 2. re-check
        SectionState state = evaluator.evaluate(current, sectionId);

        // 3. draft
        if (state.blank() && !hadAnswered && !priorContext.isEmpty()
                && config.getMode() == HandlerMode.INTEGRATE_THEN_QUESTIONS) {
            Optional<List<String>> drafted = tryDraft(current, sectionId, priorContext, config);
            if (drafted.isPresent()) {
                current = drafted.get();
                action = WorkflowAction.DRAFT;
                state = evaluator.evaluate(current, sectionId);
            }
        }

        boolean changed = !current.equals(lines);
        WorkflowResult.WorkflowResultBuilder result = WorkflowResult.builder()
                .targetId(sectionId)
                .questionsResolved(resolved);

        // 4. questions
        if (state.blank()) {
            if (state.hasOpenQuestions()) {
                return new StepOutcome(current,
                        WorkflowResult.blocked(sectionId, action, changed, waitingReason(state.openQuestions()))
                                .toBuilder().questionsResolved(resolved).build());
            }
            return generateQuestions(current, sectionId, priorContext, config, action, changed, resolved);
        }

        if (state.hasOpenQuestions() && !changed) {
            return new StepOutcome(current,
                    WorkflowResult.blocked(sectionId, action, false, waitingReason(state.openQuestions())));
        }

        String summary = switch (action) {
            case INTEGRATION -> "📝 " + sectionId + ": integrated " + resolved + " answered question(s)";
            case DRAFT -> "📝 " + sectionId + ": drafted from prior sections";
            default -> sectionId + ": nothing to do";
        };
        return new StepOutcome(current, result.action(action).changed(changed).summary(summary).build());
    }

    private StepOutcome generateQuestions(List<String> lines, String sectionId, Map<String, String> priorContext,
                                         HandlerConfig config, WorkflowAction previousAction, boolean changed,
                                         int resolved) {
        Optional<LedgerScope> scope = ledger.scopeFor(lines, sectionId);
        if (scope.isEmpty()) {
            log.warn("⚠️ Section {} is blank but has no question table", sectionId);
            return new StepOutcome(lines, WorkflowResult.blocked(sectionId, previousAction, changed,
                    "No question table available for " + sectionId));
        }

        SectionSpan span = DocumentParser.findSection(lines, sectionId).orElseThrow();
        String body = regionText(lines, span.start(), ReplacementBoundaries.bodyEnd(lines, span));
        List<GeneratedQuestion> generated = completionService.generateQuestions(sectionId, body, priorContext, config);

        List<NewQuestion> questions = new ArrayList<>();
        for (GeneratedQuestion question : generated) {
            questions.add(new NewQuestion(question.question(), question.sectionTarget(), question.rationale()));
        }
        LedgerUpdate update = ledger.insertBatch(lines, scope.get(), questions, today());

        if (!update.changed()) {
            return new StepOutcome(update.lines(), WorkflowResult.builder()
                    .targetId(sectionId)
                    .action(previousAction)
                    .changed(changed)
                    .questionsResolved(resolved)
                    .summary(sectionId + ": no new questions generated")
                    .build());
        }

        log.info("📝 Generated {} question(s) for {}", update.changedCount(), sectionId);
        return new StepOutcome(update.lines(), WorkflowResult.builder()
                .targetId(sectionId)
                .action(WorkflowAction.QUESTION_GENERATION)
                .changed(true)
                .blocked(true)
                .blockedReason(waitingReason(update.changedCount()))
                .questionsGenerated(update.changedCount())
                .questionsResolved(resolved)
                .summary("❓ " + sectionId + ": generated " + update.changedCount() + " question(s)")
                .build());
    }

    /**
     * Folds answered questions into prose, grouped by canonical target, then resolves them.
     */
    StepOutcome integrateAnsweredQuestions(List<String> lines, String sectionId, Map<String, String> priorContext,
                                           HandlerConfig config) {
        SectionSpan span = DocumentParser.findSection(lines, sectionId).orElseThrow();
        List<OpenQuestion> answered = evaluator.questionsFor(lines, span).stream()
                .filter(OpenQuestion::isAnswered)
                .toList();
        LedgerScope scope = ledger.scopeFor(lines, sectionId).orElseThrow();

        Map<String, List<OpenQuestion>> byTarget = new LinkedHashMap<>();
        for (OpenQuestion question : answered) {
            String target = QuestionTargets.canonical(question.target());
            if (target == null || target.isEmpty()) {
                target = sectionId;
            }
            byTarget.computeIfAbsent(target, t -> new ArrayList<>()).add(question);
        }

        List<String> current = lines;
        List<String> consumed = new ArrayList<>();
        for (Map.Entry<String, List<OpenQuestion>> group : byTarget.entrySet()) {
            SectionSpan section = DocumentParser.findSection(current, sectionId).orElseThrow();
            Region region = regionFor(current, section, group.getKey());
            String body = regionText(current, region.start(), region.end());

            String integrated = completionService.integrate(region.id(), body, group.getValue(), priorContext, config);
            if (integrated != null && !integrated.isBlank() && !integrated.strip().equals(body)) {
                current = region.id().equals(sectionId)
                        ? writeSectionBody(current, sectionId, integrated, config)
                        : editor.replaceBody(current, region.start(), region.end(), region.id(), integrated,
                                config.sanitizeRules());
            } else {
                log.info("Integration for {} left the text unchanged", region.id());
            }
            group.getValue().forEach(q -> consumed.add(q.questionId()));
        }

        LedgerUpdate update = ledger.resolveBatch(current, scope, consumed);
        log.info("✅ Integrated and resolved {} question(s) for {}", update.changedCount(), sectionId);
        return new StepOutcome(update.lines(), WorkflowResult.builder()
                .targetId(sectionId)
                .action(WorkflowAction.INTEGRATION)
                .changed(true)
                .questionsResolved(update.changedCount())
                .build());
    }

    private record Region(String id, int start, int end) {
    }

    /**
     * A subsection target rewrites its own span; anything else rewrites the section
     * up to its ledger boundary.
     */
    private Region regionFor(List<String> lines, SectionSpan section, String target) {
        if (!target.equals(section.sectionId())) {
            for (SubsectionSpan sub : DocumentParser.findSubsectionsWithin(lines, section)) {
                if (sub.subsectionId().equals(target)
                        && !ReplacementBoundaries.LEDGER_SUBSECTIONS.contains(sub.subsectionId())) {
                    return new Region(target, sub.start(), sub.end());
                }
            }
            log.warn("⚠️ Question target '{}' not found in {}, integrating into the section body",
                    target, section.sectionId());
        }
        return new Region(section.sectionId(), section.start(), ReplacementBoundaries.bodyEnd(lines, section));
    }

    private Optional<List<String>> tryDraft(List<String> lines, String sectionId, Map<String, String> priorContext,
                                            HandlerConfig config) {
        SectionSpan span = DocumentParser.findSection(lines, sectionId).orElseThrow();
        int end = ReplacementBoundaries.bodyEnd(lines, span);
        try {
            String draft = completionService.draft(sectionId, regionText(lines, span.start(), end), priorContext, config);
            if (draft == null || draft.isBlank()) {
                log.info("Draft for {} came back empty, falling back to questions", sectionId);
                return Optional.empty();
            }
            List<String> drafted = writeSectionBody(lines, sectionId, draft, config);
            if (drafted.equals(lines)) {
                log.info("Draft for {} changed nothing, falling back to questions", sectionId);
                return Optional.empty();
            }
            log.info("📝 Drafted {} from {} prior section(s)", sectionId, priorContext.size());
            return Optional.of(drafted);
        } catch (CompletionServiceException e) {
            log.warn("⚠️ Drafting {} failed, falling back to questions: {}", sectionId, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Routes table rows into the section's table subsections, then writes the remaining
     * prose up to the ledger boundary. Output that was all table rows leaves the preamble as is.
     */
    private List<String> writeSectionBody(List<String> lines, String sectionId, String text, HandlerConfig config) {
        SectionSpan span = DocumentParser.findSection(lines, sectionId).orElseThrow();
        TableRouting.Routed routed = TableRouting.route(lines, span, text);
        if (routed.preamble().isBlank()) {
            return routed.lines();
        }
        List<String> current = routed.lines();
        SectionSpan moved = DocumentParser.findSection(current, sectionId).orElseThrow();
        return editor.replaceBody(current, moved.start(), ReplacementBoundaries.bodyEnd(current, moved), sectionId,
                routed.preamble(), config.sanitizeRules());
    }

    /**
     * Region text without markers, headings, dividers or placeholders.
     */
    static String regionText(List<String> lines, int start, int end) {
        List<String> body = new ArrayList<>();
        for (int i = start; i < end; i++) {
            String line = lines.get(i);
            String stripped = line.strip();
            if (MarkerSyntax.containsMarkerSyntax(line)
                    || stripped.startsWith("#")
                    || stripped.equals(MarkerSyntax.DIVIDER)) {
                continue;
            }
            body.add(line);
        }
        return String.join("\n", body).strip();
    }

    private static String waitingReason(int count) {
        return "Waiting for " + count + " question(s) to be answered";
    }

    private String today() {
        return LocalDate.now(clock).toString();
    }
}
