package com.purchasingpower.docflow.completion;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CompletionStatus {
    boolean complete;
    @Singular
    List<CompletionCheck> checks;
    @Singular
    List<String> blockingFailures;
    @Singular
    List<String> warnings;
    String summary;
}
