package com.purchasingpower.uicatalog.model.catalog;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Display row for one component in the per-category catalog.
 */
@Value
@Builder
public class CatalogEntry {
    String name;
    String type;
    int instances;
    double reusabilityScore;
    double complexityScore;
    List<String> designTokens;
    List<String> accessibilityFeatures;

    public static CatalogEntry of(DetectedComponent component) {
        return CatalogEntry.builder()
                .name(component.getName())
                .type(component.getComponentType())
                .instances(component.getInstanceCount())
                .reusabilityScore(component.getReusabilityScore())
                .complexityScore(component.getComplexityScore())
                .designTokens(List.copyOf(component.getDesignTokens().keySet()))
                .accessibilityFeatures(List.copyOf(component.getAccessibilityFeatures()))
                .build();
    }
}
