package com.purchasingpower.uicatalog.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.purchasingpower.uicatalog.exception.ComponentDetectionException;
import com.purchasingpower.uicatalog.model.catalog.ComponentCatalog;
import com.purchasingpower.uicatalog.model.design.DesignDocument;
import org.springframework.stereotype.Component;

/**
 * JSON boundary with the extraction and report-writing collaborators.
 * Catalog fields are written in snake_case.
 */
@Component
public class CatalogJsonWriter {

    private final ObjectMapper documentMapper;
    private final ObjectMapper catalogMapper;

    public CatalogJsonWriter(ObjectMapper objectMapper) {
        this.documentMapper = objectMapper;
        this.catalogMapper = objectMapper.copy()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public DesignDocument readDocument(String json) {
        try {
            DesignDocument document = documentMapper.readValue(json, DesignDocument.class);
            return document != null ? document : DesignDocument.empty();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed design document JSON: " + e.getOriginalMessage(), e);
        }
    }

    public String toJson(ComponentCatalog catalog) {
        try {
            return catalogMapper.writeValueAsString(catalog);
        } catch (JsonProcessingException e) {
            throw new ComponentDetectionException("Failed to serialize component catalog", e);
        }
    }
}
