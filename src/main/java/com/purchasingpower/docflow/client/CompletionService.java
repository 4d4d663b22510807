package com.purchasingpower.docflow.client;

import com.purchasingpower.docflow.model.review.GeneratedQuestion;
import com.purchasingpower.docflow.model.review.ReviewResponse;
import com.purchasingpower.docflow.question.OpenQuestion;
import com.purchasingpower.docflow.registry.HandlerConfig;

import java.util.List;
import java.util.Map;

/**
 * Text-completion collaborator. The workflow treats every call as a black box and
 * only relies on the shape of the result.
 *
 * <p>{@code priorContext} maps section id to section body, in workflow order.
 *
 * @throws com.purchasingpower.docflow.exception.CompletionServiceException from any method
 *         when the model cannot be reached or its answer lacks required fields
 */
public interface CompletionService {

    String draft(String sectionId, String currentBody, Map<String, String> priorContext, HandlerConfig config);

    List<GeneratedQuestion> generateQuestions(String sectionId, String currentBody,
                                              Map<String, String> priorContext, HandlerConfig config);

    String integrate(String sectionId, String currentBody, List<OpenQuestion> answeredQuestions,
                     Map<String, String> priorContext, HandlerConfig config);

    ReviewResponse review(String gateId, String docType, Map<String, String> sectionContents, HandlerConfig config);
}
