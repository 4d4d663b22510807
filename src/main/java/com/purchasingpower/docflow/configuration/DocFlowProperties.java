package com.purchasingpower.docflow.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "docflow")
public class DocFlowProperties {

    @NotBlank(message = "Handler registry location is required")
    private String handlerRegistry = "classpath:handler-registry.yaml";

    @NotBlank(message = "Profiles location is required")
    private String profilesLocation = "classpath:profiles/";

    @NotBlank
    private String defaultDocType = "requirements";

    /** Name written into approval records. */
    @NotBlank
    private String automationActor = "requirements-automation";

    @Min(1)
    private int maxSteps = 10;

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private LlmProperties llm = new LlmProperties();
}
