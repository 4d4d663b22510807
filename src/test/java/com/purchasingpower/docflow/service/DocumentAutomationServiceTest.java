package com.purchasingpower.docflow.service;

import com.purchasingpower.docflow.client.CompletionService;
import com.purchasingpower.docflow.completion.CompletionStatus;
import com.purchasingpower.docflow.model.review.ReviewResponse;
import com.purchasingpower.docflow.service.DocumentAutomationService.DocumentStep;
import com.purchasingpower.docflow.service.DocumentAutomationService.StructureCheck;
import com.purchasingpower.docflow.workflow.WorkflowAction;
import com.purchasingpower.docflow.workflow.WorkflowResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

/**
 * Runs the façade against the bundled registry, prompts and profiles with a mocked
 * completion service.
 */
@SpringBootTest
@DisplayName("Document Automation Service Tests")
class DocumentAutomationServiceTest {

    @Autowired
    private DocumentAutomationService service;

    @MockBean
    private CompletionService completionService;

    private static String fixture(String name) throws IOException {
        return new ClassPathResource("documents/" + name).getContentAsString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Should repair missing open-questions boilerplate and report it")
    void repairsStructure() throws IOException {
        StructureCheck check = service.checkStructure(fixture("requirements-draft.md"));

        assertTrue(check.valid());
        assertTrue(check.repaired());
        assertThat(check.report()).startsWith("⚠️  Document structure repaired:");
        assertThat(check.document())
                .contains("<!-- subsection:open_questions -->")
                .contains("<!-- table:open_questions -->");
    }

    @Test
    @DisplayName("Should report markers the template requires but the document lacks")
    void templateDiff() throws IOException {
        String template = fixture("requirements-template.md") + "\n<!-- section:appendix -->\n## Appendix\n";

        StructureCheck check = service.checkStructure(fixture("requirements-draft.md"), template);

        assertFalse(check.valid());
        assertThat(check.report())
                .contains("Document Structure Validation Failed:")
                .contains("Missing section:appendix marker required by template");
    }

    @Test
    @DisplayName("Should run a draft through integration and review to a complete document")
    void runToCompletion() throws IOException {
        // Given
        when(completionService.integrate(eq("problem_statement"), anyString(), anyList(), anyMap(), any()))
                .thenReturn("Customers cannot see where their orders are after checkout.");
        when(completionService.review(eq("review_gate:coherence_check"), eq("requirements"), anyMap(), any()))
                .thenReturn(ReviewResponse.builder().passed(true).summary("Coherent").build());

        // When
        DocumentStep run = service.runUntilBlocked(fixture("requirements-draft.md"));

        // Then
        assertThat(run.steps()).extracting(WorkflowResult::getAction)
                .containsExactly(WorkflowAction.INTEGRATION, WorkflowAction.REVIEW_GATE, WorkflowAction.COMPLETE);
        assertThat(run.document())
                .contains("Customers cannot see where their orders are after checkout.")
                .contains("<!-- section_lock:problem_statement lock=true -->")
                .contains("- **Version:** 0.7");

        CompletionStatus completion = service.checkCompletion(run.document(), false);
        assertTrue(completion.isComplete(), completion.getSummary());
    }

    @Test
    @DisplayName("Should leave the text unchanged on a dry run")
    void dryRun() throws IOException {
        String draft = fixture("requirements-draft.md");
        when(completionService.integrate(anyString(), anyString(), anyList(), anyMap(), any()))
                .thenReturn("Customers cannot see where their orders are.");

        DocumentStep step = service.step(draft, true);

        assertThat(step.document()).isEqualTo(draft);
        assertThat(step.steps()).singleElement()
                .extracting(WorkflowResult::getAction).isEqualTo(WorkflowAction.INTEGRATION);
    }
}
