package com.purchasingpower.docflow.workflow;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * What one workflow step did.
 */
@Value
@Builder(toBuilder = true)
public class WorkflowResult {
    String targetId;
    WorkflowAction action;
    boolean changed;
    boolean blocked;
    @Singular
    List<String> blockedReasons;
    int questionsGenerated;
    int questionsResolved;
    String summary;

    public static WorkflowResult complete() {
        return WorkflowResult.builder()
                .action(WorkflowAction.COMPLETE)
                .summary("✅ All workflow targets complete")
                .build();
    }

    public static WorkflowResult blocked(String targetId, WorkflowAction action, boolean changed, String reason) {
        return WorkflowResult.builder()
                .targetId(targetId)
                .action(action)
                .changed(changed)
                .blocked(true)
                .blockedReason(reason)
                .summary("⏸️ " + targetId + ": " + reason)
                .build();
    }

    public boolean isComplete() {
        return action == WorkflowAction.COMPLETE;
    }
}
