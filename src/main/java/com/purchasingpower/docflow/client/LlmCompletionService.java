package com.purchasingpower.docflow.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.docflow.configuration.DocFlowProperties;
import com.purchasingpower.docflow.exception.CompletionServiceException;
import com.purchasingpower.docflow.model.review.GeneratedQuestion;
import com.purchasingpower.docflow.model.review.ReviewResponse;
import com.purchasingpower.docflow.question.OpenQuestion;
import com.purchasingpower.docflow.registry.HandlerConfig;
import com.purchasingpower.docflow.service.ProfileLoader;
import com.purchasingpower.docflow.service.PromptLibraryService;
import com.purchasingpower.docflow.util.CallContext;
import com.purchasingpower.docflow.util.ExternalCallLogger;
import dev.langchain4j.model.chat.ChatLanguageModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link CompletionService} backed by a langchain4j {@link ChatLanguageModel}.
 *
 * <p>Prompts come from the prompt library; the system part carries the section's LLM profile.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LlmCompletionService implements CompletionService {

    private static final String SERVICE = "Completion";

    private final ChatLanguageModel model;
    private final PromptLibraryService prompts;
    private final ProfileLoader profiles;
    private final ObjectMapper objectMapper;
    private final DocFlowProperties properties;

    @Override
    public String draft(String sectionId, String currentBody, Map<String, String> priorContext, HandlerConfig config) {
        Map<String, Object> vars = baseVariables(sectionId, currentBody, priorContext, config);
        String response = call("draft", prompts.render("draft-section", vars));
        return LlmResponseParser.stripMarkerLines(response);
    }

    @Override
    public List<GeneratedQuestion> generateQuestions(String sectionId, String currentBody,
                                                     Map<String, String> priorContext, HandlerConfig config) {
        Map<String, Object> vars = baseVariables(sectionId, currentBody, priorContext, config);
        JsonNode root = callForJson("generate_questions", prompts.render("generate-questions", vars));

        JsonNode questions = root.get("questions");
        if (questions == null || !questions.isArray()) {
            throw new CompletionServiceException("generate_questions", "response has no 'questions' array");
        }

        List<GeneratedQuestion> result = new ArrayList<>();
        for (JsonNode node : questions) {
            GeneratedQuestion question = treeToValue("generate_questions", node, GeneratedQuestion.class);
            String text = LlmResponseParser.stripInlineMarkers(question.question());
            if (text.isEmpty()) {
                continue;
            }
            String target = question.sectionTarget() == null || question.sectionTarget().isBlank()
                    ? sectionId
                    : LlmResponseParser.stripInlineMarkers(question.sectionTarget());
            result.add(new GeneratedQuestion(text, target, question.rationale()));
        }
        log.info("Completion service proposed {} question(s) for {}", result.size(), sectionId);
        return result;
    }

    @Override
    public String integrate(String sectionId, String currentBody, List<OpenQuestion> answeredQuestions,
                            Map<String, String> priorContext, HandlerConfig config) {
        Map<String, Object> vars = baseVariables(sectionId, currentBody, priorContext, config);
        List<Map<String, Object>> answered = new ArrayList<>();
        for (OpenQuestion question : answeredQuestions) {
            answered.add(Map.of(
                    "questionId", question.questionId(),
                    "question", question.question(),
                    "answer", question.answer()));
        }
        vars.put("answeredQuestions", answered);
        String response = call("integrate", prompts.render("integrate-answers", vars));
        return LlmResponseParser.stripMarkerLines(response);
    }

    @Override
    public ReviewResponse review(String gateId, String docType, Map<String, String> sectionContents,
                                 HandlerConfig config) {
        Map<String, Object> vars = new HashMap<>();
        vars.put("gateId", gateId);
        vars.put("docType", docType);
        vars.put("profile", profiles.load(config.getLlmProfile()));
        vars.put("sections", sectionList(sectionContents));
        vars.put("rules", config.getValidationRules());
        vars.put("hasRules", !config.getValidationRules().isEmpty());

        JsonNode root = callForJson("review", prompts.render("review-gate", vars));
        JsonNode issues = root.get("issues");
        if (issues == null || !issues.isArray()) {
            throw new CompletionServiceException("review", "response has no 'issues' array");
        }
        JsonNode patches = root.get("patches");
        if (patches != null && !patches.isNull() && !patches.isArray()) {
            throw new CompletionServiceException("review", "'patches' must be an array");
        }
        return treeToValue("review", root, ReviewResponse.class);
    }

    private Map<String, Object> baseVariables(String sectionId, String currentBody,
                                              Map<String, String> priorContext, HandlerConfig config) {
        Map<String, Object> vars = new HashMap<>();
        vars.put("sectionId", sectionId);
        vars.put("currentBody", currentBody == null ? "" : currentBody);
        vars.put("outputFormat", config.getOutputFormat().value());
        vars.put("profile", profiles.load(config.getLlmProfile()));
        vars.put("priorSections", sectionList(priorContext));
        vars.put("hasPriorSections", priorContext != null && !priorContext.isEmpty());
        return vars;
    }

    private List<Map<String, String>> sectionList(Map<String, String> sections) {
        List<Map<String, String>> list = new ArrayList<>();
        if (sections != null) {
            sections.forEach((id, body) -> list.add(Map.of("id", id, "body", body)));
        }
        return list;
    }

    private JsonNode callForJson(String operation, String prompt) {
        String response = call(operation, prompt);
        String json = LlmResponseParser.extractJsonObject(response)
                .orElseThrow(() -> new CompletionServiceException(operation, "no JSON object in response"));
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new CompletionServiceException(operation, "invalid JSON in response", e);
        }
    }

    private <T> T treeToValue(String operation, JsonNode node, Class<T> type) {
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new CompletionServiceException(operation, "unexpected response shape", e);
        }
    }

    private String call(String operation, String prompt) {
        int excerpt = properties.getLlm().getLogExcerptLength();
        CallContext call = ExternalCallLogger.startCall(SERVICE, operation, log);
        call.logRequest(ExternalCallLogger.truncate(prompt, excerpt));
        String response;
        try {
            response = model.generate(prompt);
        } catch (RuntimeException e) {
            call.logError(e.getMessage(), e);
            throw new CompletionServiceException(operation, "model call failed", e);
        }
        if (response == null || response.isBlank()) {
            call.logError("empty response", null);
            throw new CompletionServiceException(operation, "empty response");
        }
        call.logResponse(ExternalCallLogger.truncate(response, excerpt));
        return response;
    }
}
