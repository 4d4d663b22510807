package com.purchasingpower.docflow.workflow;

import com.purchasingpower.docflow.parser.DocumentParser;
import com.purchasingpower.docflow.parser.SectionSpan;
import com.purchasingpower.docflow.parser.SubsectionSpan;
import com.purchasingpower.docflow.question.OpenQuestion;
import com.purchasingpower.docflow.question.QuestionLedger;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class SectionStateEvaluator {

    private final QuestionLedger ledger;

    public SectionState evaluate(List<String> lines, String sectionId) {
        Optional<SectionSpan> span = DocumentParser.findSection(lines, sectionId);
        if (span.isEmpty()) {
            return SectionState.missing(sectionId);
        }
        List<OpenQuestion> questions = questionsFor(lines, span.get());
        int open = (int) questions.stream().filter(OpenQuestion::isAwaitingAnswer).count();
        int answered = (int) questions.stream().filter(OpenQuestion::isAnswered).count();
        return new SectionState(sectionId, true,
                DocumentParser.isLocked(lines, span.get()),
                DocumentParser.isBlank(lines, span.get()),
                open, answered);
    }

    public List<OpenQuestion> questionsFor(List<String> lines, SectionSpan span) {
        List<String> subsectionIds = DocumentParser.findSubsectionsWithin(lines, span).stream()
                .map(SubsectionSpan::subsectionId)
                .toList();
        return ledger.questionsFor(lines, span.sectionId(), subsectionIds);
    }
}
