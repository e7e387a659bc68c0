package com.purchasingpower.uicatalog.model.signature;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Defines how to recognise one kind of UI component.
 * Name and type patterns drive classification; property and structural patterns
 * are descriptive only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComponentSignatureDef {

    /**
     * Component type assigned when this signature matches.
     * Example: "button", "navigation"
     */
    private String name;

    /**
     * Substrings looked for in the lower-cased object name.
     * Example: ["btn", "button", "cta"]
     */
    @Builder.Default
    private List<String> namePatterns = new ArrayList<>();

    /**
     * Structural object types this component is usually drawn with.
     * Example: ["rectangle", "group"]
     */
    @Builder.Default
    private List<String> typePatterns = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> propertyPatterns = new LinkedHashMap<>();

    @Builder.Default
    private List<String> structuralPatterns = new ArrayList<>();

    /**
     * Minimum classification score, in (0, 1].
     */
    private double confidenceThreshold;

    public boolean matchesName(String objectName) {
        String lowered = objectName.toLowerCase(Locale.ROOT);
        return namePatterns.stream().anyMatch(lowered::contains);
    }

    public boolean matchesType(String objectType) {
        return typePatterns.contains(objectType);
    }

    /**
     * Copy with unmodifiable collections, used by the registry.
     */
    ComponentSignatureDef frozenCopy() {
        return ComponentSignatureDef.builder()
                .name(name)
                .namePatterns(namePatterns == null ? List.of() : List.copyOf(namePatterns))
                .typePatterns(typePatterns == null ? List.of() : List.copyOf(typePatterns))
                .propertyPatterns(propertyPatterns == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(propertyPatterns)))
                .structuralPatterns(structuralPatterns == null ? List.of() : List.copyOf(structuralPatterns))
                .confidenceThreshold(confidenceThreshold)
                .build();
    }
}
