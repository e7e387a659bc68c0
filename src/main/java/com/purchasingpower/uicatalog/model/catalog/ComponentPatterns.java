package com.purchasingpower.uicatalog.model.catalog;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Cross-component statistics: type frequency, score distributions and naming habits.
 */
@Value
@Builder
public class ComponentPatterns {
    List<NamedCount> mostCommonTypes;
    ReusabilityDistribution reusabilityDistribution;
    ComplexityAnalysis complexityAnalysis;
    NamingPatterns namingPatterns;
    Map<String, Long> categoryDistribution;

    /**
     * Fractions of components with high (&gt; 0.7), medium and low (&lt; 0.3) reusability.
     */
    @Value
    @Builder
    public static class ReusabilityDistribution {
        double highReusability;
        double mediumReusability;
        double lowReusability;
        double averageReusability;
    }

    @Value
    @Builder
    public static class ComplexityAnalysis {
        double averageComplexity;
        double simple;
        double moderate;
        double complex;
        List<String> mostComplexComponents;
    }

    @Value
    @Builder
    public static class NamingPatterns {
        double namingConsistency;
        List<NamedCount> commonPrefixes;
        List<NamedCount> commonSuffixes;
        List<String> namingConventions;
    }
}
