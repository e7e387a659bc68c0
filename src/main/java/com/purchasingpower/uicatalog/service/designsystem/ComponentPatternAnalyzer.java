package com.purchasingpower.uicatalog.service.designsystem;

import com.purchasingpower.uicatalog.configuration.ComponentDetectionProperties;
import com.purchasingpower.uicatalog.model.catalog.ComponentPatterns;
import com.purchasingpower.uicatalog.model.catalog.ComponentPatterns.ComplexityAnalysis;
import com.purchasingpower.uicatalog.model.catalog.ComponentPatterns.ReusabilityDistribution;
import com.purchasingpower.uicatalog.model.catalog.DetectedComponent;
import com.purchasingpower.uicatalog.model.catalog.NamedCount;
import com.purchasingpower.uicatalog.util.Ratios;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.DoublePredicate;
import java.util.function.ToDoubleFunction;

/**
 * Statistics across all detected components.
 */
@Component
public class ComponentPatternAnalyzer {

    static final double HIGH_THRESHOLD = 0.7;
    static final double LOW_THRESHOLD = 0.3;
    private static final int MOST_COMPLEX_LIMIT = 3;

    private final NamingAnalyzer namingAnalyzer;
    private final int mostCommonTypesLimit;

    public ComponentPatternAnalyzer(NamingAnalyzer namingAnalyzer, ComponentDetectionProperties properties) {
        this.namingAnalyzer = namingAnalyzer;
        this.mostCommonTypesLimit = properties.getMostCommonTypesLimit();
    }

    public ComponentPatterns analyze(List<DetectedComponent> components) {
        return ComponentPatterns.builder()
                .mostCommonTypes(mostCommonTypes(components))
                .reusabilityDistribution(reusabilityDistribution(components))
                .complexityAnalysis(complexityAnalysis(components))
                .namingPatterns(namingAnalyzer.analyze(names(components)))
                .categoryDistribution(categoryDistribution(components))
                .build();
    }

    public ReusabilityDistribution reusabilityDistribution(List<DetectedComponent> components) {
        return ReusabilityDistribution.builder()
                .highReusability(fraction(components, DetectedComponent::getReusabilityScore, s -> s > HIGH_THRESHOLD))
                .mediumReusability(fraction(components, DetectedComponent::getReusabilityScore,
                        s -> s >= LOW_THRESHOLD && s <= HIGH_THRESHOLD))
                .lowReusability(fraction(components, DetectedComponent::getReusabilityScore, s -> s < LOW_THRESHOLD))
                .averageReusability(Ratios.average(components, DetectedComponent::getReusabilityScore))
                .build();
    }

    public ComplexityAnalysis complexityAnalysis(List<DetectedComponent> components) {
        List<String> mostComplex = components.stream()
                .sorted(Comparator.comparingDouble(DetectedComponent::getComplexityScore).reversed())
                .limit(MOST_COMPLEX_LIMIT)
                .map(DetectedComponent::getName)
                .toList();

        return ComplexityAnalysis.builder()
                .averageComplexity(Ratios.average(components, DetectedComponent::getComplexityScore))
                .simple(fraction(components, DetectedComponent::getComplexityScore, s -> s < LOW_THRESHOLD))
                .moderate(fraction(components, DetectedComponent::getComplexityScore,
                        s -> s >= LOW_THRESHOLD && s <= HIGH_THRESHOLD))
                .complex(fraction(components, DetectedComponent::getComplexityScore, s -> s > HIGH_THRESHOLD))
                .mostComplexComponents(mostComplex)
                .build();
    }

    /**
     * Component counts per tier, in first-seen order.
     */
    public Map<String, Long> categoryDistribution(List<DetectedComponent> components) {
        Map<String, Long> distribution = new LinkedHashMap<>();
        components.forEach(component -> distribution.merge(component.getCategory().wireName(), 1L, Long::sum));
        return distribution;
    }

    static List<String> names(List<DetectedComponent> components) {
        return components.stream().map(DetectedComponent::getName).toList();
    }

    private List<NamedCount> mostCommonTypes(List<DetectedComponent> components) {
        Map<String, Long> counts = new LinkedHashMap<>();
        components.forEach(component -> counts.merge(component.getComponentType(), 1L, Long::sum));
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder()))
                .limit(mostCommonTypesLimit)
                .map(entry -> new NamedCount(entry.getKey(), entry.getValue()))
                .toList();
    }

    private static double fraction(List<DetectedComponent> components,
                                   ToDoubleFunction<DetectedComponent> metric,
                                   DoublePredicate predicate) {
        long matching = components.stream().mapToDouble(metric).filter(predicate).count();
        return Ratios.ratio(matching, components.size());
    }
}
