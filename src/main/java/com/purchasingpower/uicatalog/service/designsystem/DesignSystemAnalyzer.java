package com.purchasingpower.uicatalog.service.designsystem;

import com.purchasingpower.uicatalog.model.catalog.CatalogEntry;
import com.purchasingpower.uicatalog.model.catalog.DesignSystemReport;
import com.purchasingpower.uicatalog.model.catalog.DetectedComponent;
import com.purchasingpower.uicatalog.model.catalog.ReusabilityAnalysis;
import com.purchasingpower.uicatalog.model.signature.DesignCategory;
import com.purchasingpower.uicatalog.util.Ratios;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Evaluates the detected components as a design system: atomic-design coverage,
 * naming consistency, maturity and reuse.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DesignSystemAnalyzer {

    static final double LOW_REUSABILITY = 0.3;
    static final double HIGH_REUSABILITY = 0.7;
    static final double DISTINCT_FIRST_WORD_LIMIT = 0.7;

    private final ComponentPatternAnalyzer patternAnalyzer;
    private final NamingAnalyzer namingAnalyzer;

    /**
     * Builds the design-system report.
     *
     * <p>Maturity is the mean of category coverage, average reusability and naming consistency.
     */
    public DesignSystemReport analyze(List<DetectedComponent> components) {
        List<DesignCategory> found = categoriesFound(components);
        List<DesignCategory> missing = Arrays.stream(DesignCategory.values())
                .filter(category -> !found.contains(category))
                .toList();

        double coverage = Ratios.ratio(found.size(), DesignCategory.values().length);
        double averageReusability = Ratios.average(components, DetectedComponent::getReusabilityScore);
        double namingConsistency = namingAnalyzer.namingConsistency(ComponentPatternAnalyzer.names(components));
        double maturity = Ratios.clamp01(Ratios.mean(coverage, averageReusability, namingConsistency));

        log.debug("Design system: {} of {} tiers, maturity {}", found.size(), DesignCategory.values().length, maturity);

        return DesignSystemReport.builder()
                .categoriesFound(found)
                .missingCategories(missing)
                .categoryCoverage(coverage)
                .maturityScore(maturity)
                .componentDistribution(patternAnalyzer.categoryDistribution(components))
                .designTokenCoverage(designTokenCoverage(components))
                .namingConsistency(namingConsistency)
                .recommendations(recommendations(components, missing))
                .build();
    }

    public ReusabilityAnalysis analyzeReusability(List<DetectedComponent> components) {
        return ReusabilityAnalysis.builder()
                .averageReusability(Ratios.average(components, DetectedComponent::getReusabilityScore))
                .highlyReusable(namesWhere(components, c -> c.getReusabilityScore() > HIGH_REUSABILITY))
                .poorlyReusable(namesWhere(components, c -> c.getReusabilityScore() < LOW_REUSABILITY))
                .reuseOpportunities(reuseOpportunities(components))
                .build();
    }

    /**
     * Catalog entries grouped by tier, for the tiers present in the report.
     */
    public Map<String, List<CatalogEntry>> buildCatalog(List<DetectedComponent> components, DesignSystemReport report) {
        Map<String, List<CatalogEntry>> catalog = new LinkedHashMap<>();
        for (DesignCategory category : report.getCategoriesFound()) {
            catalog.put(category.wireName(), components.stream()
                    .filter(component -> component.getCategory() == category)
                    .map(CatalogEntry::of)
                    .toList());
        }
        return catalog;
    }

    private static List<DesignCategory> categoriesFound(List<DetectedComponent> components) {
        Set<DesignCategory> found = new LinkedHashSet<>();
        components.forEach(component -> found.add(component.getCategory()));
        return List.copyOf(found);
    }

    /**
     * Share of components carrying each token category.
     */
    private static Map<String, Double> designTokenCoverage(List<DetectedComponent> components) {
        Map<String, Long> counts = new LinkedHashMap<>();
        components.forEach(component ->
                component.getDesignTokens().keySet().forEach(category -> counts.merge(category, 1L, Long::sum)));

        Map<String, Double> coverage = new LinkedHashMap<>();
        counts.forEach((category, count) -> coverage.put(category, Ratios.ratio(count, components.size())));
        return coverage;
    }

    private List<String> recommendations(List<DetectedComponent> components, List<DesignCategory> missing) {
        List<String> recommendations = new ArrayList<>();

        if (!missing.isEmpty()) {
            String tiers = missing.stream().map(DesignCategory::wireName).collect(Collectors.joining(", "));
            recommendations.add("Consider developing " + tiers + " components to complete atomic design hierarchy");
        }

        long lowReuse = components.stream().filter(c -> c.getReusabilityScore() < LOW_REUSABILITY).count();
        if (lowReuse > 0) {
            recommendations.add("Review " + lowReuse + " components with low reusability scores");
        }

        List<String> names = ComponentPatternAnalyzer.names(components);
        if (namingAnalyzer.distinctFirstWords(names) > components.size() * DISTINCT_FIRST_WORD_LIMIT) {
            recommendations.add("Establish consistent naming conventions for components");
        }

        return recommendations;
    }

    private static List<String> reuseOpportunities(List<DetectedComponent> components) {
        Map<String, Long> similar = new LinkedHashMap<>();
        components.forEach(component ->
                similar.merge(component.getComponentType() + " " + component.getCategory().wireName(), 1L, Long::sum));

        return similar.entrySet().stream()
                .filter(entry -> entry.getValue() > 1)
                .map(entry -> "Consider unifying " + entry.getValue() + " similar " + entry.getKey() + " components")
                .toList();
    }

    private static List<String> namesWhere(List<DetectedComponent> components,
                                           Predicate<DetectedComponent> filter) {
        return components.stream().filter(filter).map(DetectedComponent::getName).toList();
    }
}
