package com.purchasingpower.docflow.workflow;

import java.util.List;

/**
 * The document after a step, paired with what the step did.
 */
public record StepOutcome(List<String> lines, WorkflowResult result) {
}
