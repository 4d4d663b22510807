package com.purchasingpower.docflow.configuration;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Connection settings for the completion model (Ollama via langchain4j).
 */
@Data
public class LlmProperties {

    @NotBlank(message = "LLM base URL is required")
    private String baseUrl = "http://localhost:11434";

    @NotBlank(message = "LLM model name is required")
    private String modelName = "qwen2.5:7b";

    @Min(1)
    private int timeoutSeconds = 120;

    @Min(0)
    private int maxRetries = 3;

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private double temperature = 0.2;

    /** Longest prompt/response excerpt written to DEBUG logs. */
    @Min(50)
    private int logExcerptLength = 500;
}
