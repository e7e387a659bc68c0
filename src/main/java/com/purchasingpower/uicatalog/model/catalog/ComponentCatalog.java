package com.purchasingpower.uicatalog.model.catalog;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Complete result of one detection run, handed to the report writers.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class ComponentCatalog {
    CatalogSummary summary;
    List<DetectedComponent> detectedComponents;
    ComponentPatterns componentPatterns;
    DesignSystemReport designSystem;
    DesignTokenAggregate designTokens;
    ReusabilityAnalysis reusabilityAnalysis;

    /**
     * Components grouped by atomic-design tier, only for tiers that were found.
     */
    Map<String, List<CatalogEntry>> componentCatalog;

    QualityAssessment qualityAssessment;
    List<String> recommendations;
}
