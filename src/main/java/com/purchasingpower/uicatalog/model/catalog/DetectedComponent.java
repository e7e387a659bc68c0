package com.purchasingpower.uicatalog.model.catalog;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.purchasingpower.uicatalog.model.design.ObjectContext;
import com.purchasingpower.uicatalog.model.signature.DesignCategory;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A UI component found in the document, with every place it occurs.
 *
 * <p>Immutable once built; always has at least one instance.
 *
 * @since 1.0.0
 */
@Value
public class DetectedComponent {
    String id;
    String name;
    String componentType;
    DesignCategory category;
    List<ObjectContext> instances;
    Map<String, Object> properties;
    UsagePattern usagePattern;
    double reusabilityScore;
    double complexityScore;
    Map<String, Map<String, Object>> designTokens;
    List<String> accessibilityFeatures;

    @Builder
    private DetectedComponent(String id,
                              String name,
                              String componentType,
                              DesignCategory category,
                              List<ObjectContext> instances,
                              Map<String, Object> properties,
                              UsagePattern usagePattern,
                              double reusabilityScore,
                              double complexityScore,
                              Map<String, Map<String, Object>> designTokens,
                              List<String> accessibilityFeatures) {
        this.id = id;
        this.name = name;
        this.componentType = componentType;
        this.category = category;
        this.instances = instances != null ? List.copyOf(instances) : List.of();
        this.properties = frozen(properties);
        this.usagePattern = usagePattern;
        this.reusabilityScore = reusabilityScore;
        this.complexityScore = complexityScore;
        this.designTokens = frozenTokens(designTokens);
        this.accessibilityFeatures = accessibilityFeatures != null ? List.copyOf(accessibilityFeatures) : List.of();
    }

    @JsonIgnore
    public int getInstanceCount() {
        return instances.size();
    }

    @JsonIgnore
    public boolean hasAccessibilityFeatures() {
        return !accessibilityFeatures.isEmpty();
    }

    // Token maps carry nulls for unset style fields.
    private static Map<String, Object> frozen(Map<String, Object> values) {
        return values != null ? Collections.unmodifiableMap(new LinkedHashMap<>(values)) : Map.of();
    }

    private static Map<String, Map<String, Object>> frozenTokens(Map<String, Map<String, Object>> tokens) {
        Map<String, Map<String, Object>> copy = new LinkedHashMap<>();
        if (tokens != null) {
            tokens.forEach((category, fields) -> copy.put(category, frozen(fields)));
        }
        return Collections.unmodifiableMap(copy);
    }
}
