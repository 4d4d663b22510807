package com.purchasingpower.docflow.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.docflow.configuration.DocFlowProperties;
import com.purchasingpower.docflow.exception.CompletionServiceException;
import com.purchasingpower.docflow.model.review.GeneratedQuestion;
import com.purchasingpower.docflow.model.review.ReviewResponse;
import com.purchasingpower.docflow.model.review.ReviewResponse.Severity;
import com.purchasingpower.docflow.question.OpenQuestion;
import com.purchasingpower.docflow.question.QuestionStatus;
import com.purchasingpower.docflow.registry.HandlerConfig;
import com.purchasingpower.docflow.registry.HandlerMode;
import com.purchasingpower.docflow.registry.OutputFormat;
import com.purchasingpower.docflow.service.ProfileLoader;
import com.purchasingpower.docflow.service.PromptLibraryService;
import dev.langchain4j.model.chat.ChatLanguageModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("LLM Completion Service Tests")
class LlmCompletionServiceTest {

    private static final HandlerConfig CONFIG = HandlerConfig.builder()
            .mode(HandlerMode.INTEGRATE_THEN_QUESTIONS)
            .outputFormat(OutputFormat.BULLETS)
            .build();

    @Mock
    private ChatLanguageModel model;

    private LlmCompletionService service;

    @BeforeEach
    void setUp() {
        PromptLibraryService prompts = new PromptLibraryService();
        prompts.loadPrompts();
        DocFlowProperties properties = new DocFlowProperties();
        service = new LlmCompletionService(model, prompts,
                new ProfileLoader(new DefaultResourceLoader(), properties),
                new ObjectMapper(), properties);
    }

    @Test
    @DisplayName("Should render profile, prior sections and current body into the draft prompt")
    void draftPrompt() {
        // Given
        when(model.generate(anyString())).thenReturn("- Reduce lost orders\n<!-- section:x -->");

        // When
        String draft = service.draft("goals_objectives", "", Map.of("problem_statement", "Orders get lost."), CONFIG);

        // Then
        assertEquals("- Reduce lost orders", draft);
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(model).generate(prompt.capture());
        assertThat(prompt.getValue())
                .contains("# Base Policy")
                .contains("# Requirements Profile")
                .contains("Draft the body of the section \"goals_objectives\"")
                .contains("Output format: bullets")
                .contains("## problem_statement\nOrders get lost.");
    }

    @Test
    @DisplayName("Should parse generated questions and default their target")
    void generateQuestions() {
        // Given
        when(model.generate(anyString())).thenReturn("""
                ```json
                {"questions": [
                  {"question": "Which carriers are in scope?", "section_target": "", "rationale": "scope"},
                  {"question": "   "},
                  {"question": "What is the SLA?", "target": "success_criteria"}
                ]}
                ```
                """);

        // When
        List<GeneratedQuestion> questions = service.generateQuestions("problem_statement", "", Map.of(), CONFIG);

        // Then
        assertThat(questions).containsExactly(
                new GeneratedQuestion("Which carriers are in scope?", "problem_statement", "scope"),
                new GeneratedQuestion("What is the SLA?", "success_criteria", null));
    }

    @Test
    @DisplayName("Should reject question responses without a questions array")
    void malformedQuestions() {
        when(model.generate(anyString())).thenReturn("{\"items\": []}");

        assertThatThrownBy(() -> service.generateQuestions("problem_statement", "", Map.of(), CONFIG))
                .isInstanceOf(CompletionServiceException.class)
                .hasMessageContaining("questions");
    }

    @Test
    @DisplayName("Should include answered questions in the integration prompt")
    void integratePrompt() {
        // Given
        OpenQuestion answered = new OpenQuestion("problem_statement-Q1", "What problem?", "2024-01-15",
                "Orders vanish after checkout", "problem_statement", QuestionStatus.OPEN, 12);
        when(model.generate(anyString())).thenReturn("Customers lose track of orders after checkout.");

        // When
        String text = service.integrate("problem_statement", "", List.of(answered), Map.of(), CONFIG);

        // Then
        assertEquals("Customers lose track of orders after checkout.", text);
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(model).generate(prompt.capture());
        assertThat(prompt.getValue()).contains("What problem?").contains("Orders vanish after checkout");
    }

    @Test
    @DisplayName("Should map review issues and patches, treating unknown severities as warnings")
    void review() {
        // Given
        when(model.generate(anyString())).thenReturn("""
                {"passed": false,
                 "issues": [
                   {"severity": "blocker", "section": "goals_objectives", "description": "Not measurable"},
                   {"severity": "critical", "section": "problem_statement", "description": "Vague"}
                 ],
                 "patches": [{"section": "problem_statement", "suggestion": "Orders go missing."}],
                 "summary": "Needs work"}
                """);

        // When
        ReviewResponse response = service.review("review_gate:coherence_check", "requirements",
                Map.of("problem_statement", "Orders get lost."),
                HandlerConfig.builder().mode(HandlerMode.REVIEW_GATE).llmProfile("requirements_review").build());

        // Then
        assertFalse(response.isPassed());
        assertEquals(Severity.BLOCKER, response.getIssues().get(0).getSeverity());
        assertEquals(Severity.WARNING, response.getIssues().get(1).getSeverity());
        assertEquals(1, response.blockerCount());
        assertEquals("Orders go missing.", response.getPatches().get(0).getSuggestion());
    }

    @Test
    @DisplayName("Should wrap model failures and empty answers")
    void failures() {
        when(model.generate(anyString())).thenThrow(new RuntimeException("connection refused"));

        assertThatThrownBy(() -> service.draft("problem_statement", "", Map.of(), CONFIG))
                .isInstanceOf(CompletionServiceException.class)
                .hasFieldOrPropertyWithValue("operation", "draft")
                .hasRootCauseMessage("connection refused");
    }

    @Test
    @DisplayName("Should reject a review without an issues array")
    void reviewWithoutIssues() {
        when(model.generate(anyString())).thenReturn("{\"passed\": true}");

        assertThatThrownBy(() -> service.review("review_gate:x", "requirements", Map.of(),
                HandlerConfig.builder().mode(HandlerMode.REVIEW_GATE).llmProfile("requirements_review").build()))
                .isInstanceOf(CompletionServiceException.class)
                .hasMessageContaining("issues");
    }
}
