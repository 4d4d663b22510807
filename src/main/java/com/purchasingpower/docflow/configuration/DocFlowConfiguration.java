package com.purchasingpower.docflow.configuration;

import com.purchasingpower.docflow.registry.HandlerRegistry;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the completion model and the handler registry from {@link DocFlowProperties}.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(DocFlowProperties.class)
public class DocFlowConfiguration {

    @Bean
    public ChatLanguageModel completionModel(DocFlowProperties properties) {
        LlmProperties llm = properties.getLlm();
        log.info("🔧 Initializing completion model (Ollama)");
        log.info("   - URL: {}", llm.getBaseUrl());
        log.info("   - Model: {}", llm.getModelName());

        ChatLanguageModel model = OllamaChatModel.builder()
                .baseUrl(llm.getBaseUrl())
                .modelName(llm.getModelName())
                .timeout(Duration.ofSeconds(llm.getTimeoutSeconds()))
                .temperature(llm.getTemperature())
                .maxRetries(llm.getMaxRetries())
                .logRequests(false)
                .logResponses(false)
                .build();

        log.info("✅ Completion model initialized");
        return model;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public HandlerRegistry handlerRegistry(DocFlowProperties properties, ResourceLoader resourceLoader) {
        return HandlerRegistry.load(resourceLoader.getResource(properties.getHandlerRegistry()));
    }
}
