package com.purchasingpower.docflow.service;

import com.purchasingpower.docflow.configuration.DocFlowProperties;
import com.purchasingpower.docflow.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads LLM profiles: the shared {@code base_policy.md} followed by one task profile.
 */
@Slf4j
@Component
public class ProfileLoader {

    static final String BASE_POLICY = "base_policy";
    static final String SEPARATOR = "\n\n---\n\n";

    private final ResourceLoader resourceLoader;
    private final String location;
    private final Map<String, String> cache = new ConcurrentHashMap<>();

    public ProfileLoader(ResourceLoader resourceLoader, DocFlowProperties properties) {
        this.resourceLoader = resourceLoader;
        String configured = properties.getProfilesLocation();
        this.location = configured.endsWith("/") ? configured : configured + "/";
    }

    /**
     * @throws ConfigurationException when the base policy or the task profile is missing
     */
    public String load(String profileName) {
        return cache.computeIfAbsent(profileName,
                name -> read(BASE_POLICY) + SEPARATOR + read(name));
    }

    private String read(String name) {
        Resource resource = resourceLoader.getResource(location + name + ".md");
        if (!resource.exists()) {
            throw new ConfigurationException("LLM profile not found: " + location + name + ".md");
        }
        try (InputStream in = resource.getInputStream()) {
            String text = new String(in.readAllBytes(), StandardCharsets.UTF_8).strip();
            log.debug("Loaded profile {} ({} chars)", name, text.length());
            return text;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read LLM profile " + name, e);
        }
    }
}
