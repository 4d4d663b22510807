package com.purchasingpower.docflow.registry;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.base.Preconditions;
import com.purchasingpower.docflow.exception.ConfigurationException;
import com.purchasingpower.docflow.marker.MarkerSyntax;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Set;

/**
 * Maps (document type, target id) to a {@link HandlerConfig}.
 *
 * <p>Lookup falls back from the document type to {@code _default}, and from the
 * section entry to the document type's {@code defaults}.
 */
@Slf4j
public class HandlerRegistry {

    public static final String DEFAULT_DOC_TYPE_KEY = "_default";

    private final Map<String, DocumentTypeConfig> documentTypes;

    public HandlerRegistry(Map<String, DocumentTypeConfig> documentTypes) {
        this.documentTypes = Map.copyOf(Preconditions.checkNotNull(documentTypes, "documentTypes"));
        verify();
    }

    public static HandlerRegistry load(Resource resource) {
        ObjectMapper yaml = new ObjectMapper(new YAMLFactory())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        try (InputStream in = resource.getInputStream()) {
            Map<String, DocumentTypeConfig> types = yaml.readValue(in, new TypeReference<Map<String, DocumentTypeConfig>>() {
            });
            if (types == null || types.isEmpty()) {
                throw new ConfigurationException("Handler registry " + resource.getDescription() + " is empty");
            }
            log.info("Loaded handler registry with document types {}", types.keySet());
            return new HandlerRegistry(types);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read handler registry " + resource.getDescription(), e);
        }
    }

    public HandlerConfig configFor(String docType, String targetId) {
        DocumentTypeConfig type = documentType(docType);
        HandlerConfig config = type.getSections().get(targetId);
        if (config != null) {
            return config;
        }
        if (type.getDefaults() != null) {
            log.debug("No policy for '{}' in '{}', using defaults", targetId, docType);
            return type.getDefaults();
        }
        throw new ConfigurationException("No policy for '" + targetId + "' in document type '" + docType
                + "' and no defaults configured");
    }

    public Map<String, String> versionMilestones(String docType) {
        return documentType(docType).getVersionMilestones();
    }

    public Set<String> documentTypes() {
        return documentTypes.keySet();
    }

    private DocumentTypeConfig documentType(String docType) {
        DocumentTypeConfig type = documentTypes.get(docType);
        if (type != null) {
            return type;
        }
        DocumentTypeConfig fallback = documentTypes.get(DEFAULT_DOC_TYPE_KEY);
        if (fallback == null) {
            throw new ConfigurationException("Unknown document type '" + docType + "' and no "
                    + DEFAULT_DOC_TYPE_KEY + " entry");
        }
        log.warn("⚠️ Unknown document type '{}', using {}", docType, DEFAULT_DOC_TYPE_KEY);
        return fallback;
    }

    private void verify() {
        documentTypes.forEach((docType, type) -> type.getSections().forEach((targetId, config) -> {
            boolean gate = MarkerSyntax.isReviewGate(targetId);
            if (gate != config.isReviewGate()) {
                throw new ConfigurationException("Target '" + targetId + "' in '" + docType + "' has mode "
                        + config.getMode().value() + (gate ? ", review gates need review_gate" : ", only review gates may use it"));
            }
        }));
    }
}
