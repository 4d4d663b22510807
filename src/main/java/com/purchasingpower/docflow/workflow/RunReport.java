package com.purchasingpower.docflow.workflow;

import java.util.List;

public record RunReport(List<String> lines, List<WorkflowResult> steps) {

    public WorkflowResult lastStep() {
        return steps.isEmpty() ? null : steps.get(steps.size() - 1);
    }
}
