package com.purchasingpower.uicatalog.model.signature;

import com.purchasingpower.uicatalog.exception.InvalidSignatureRegistryException;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, ordered set of component signatures.
 *
 * <p>Order matters: classification picks the first signature over its threshold,
 * and the individual pass picks the first signature whose name pattern matches.
 * Construction validates every entry and fails fast on misconfiguration.
 */
public final class ComponentSignatureRegistry {

    private final List<ComponentSignatureDef> signatures;

    public ComponentSignatureRegistry(List<ComponentSignatureDef> signatures) {
        if (signatures == null || signatures.isEmpty()) {
            throw new InvalidSignatureRegistryException(null, "at least one signature is required");
        }
        Set<String> names = new HashSet<>();
        for (ComponentSignatureDef signature : signatures) {
            validate(signature);
            if (!names.add(signature.getName())) {
                throw new InvalidSignatureRegistryException(signature.getName(), "duplicate signature name");
            }
        }
        this.signatures = signatures.stream()
                .map(ComponentSignatureDef::frozenCopy)
                .toList();
    }

    public List<ComponentSignatureDef> getSignatures() {
        return signatures;
    }

    public int size() {
        return signatures.size();
    }

    /**
     * First signature, in registry order, with a name pattern contained in the given name.
     */
    public Optional<ComponentSignatureDef> firstNameMatch(String objectName) {
        return signatures.stream()
                .filter(signature -> signature.matchesName(objectName))
                .findFirst();
    }

    public boolean anyNameMatch(String objectName) {
        return firstNameMatch(objectName).isPresent();
    }

    public boolean anyTypeMatch(String objectType) {
        return signatures.stream().anyMatch(signature -> signature.matchesType(objectType));
    }

    /**
     * The built-in signature set: button, input, card, navigation, modal.
     */
    public static ComponentSignatureRegistry defaults() {
        return new ComponentSignatureRegistry(List.of(
                ComponentSignatureDef.builder()
                        .name("button")
                        .namePatterns(List.of("btn", "button", "cta", "action"))
                        .typePatterns(List.of("rectangle", "group"))
                        .propertyPatterns(Map.of("clickable", true, "has_text", true))
                        .structuralPatterns(List.of("rounded_corners", "background_fill"))
                        .confidenceThreshold(0.7)
                        .build(),
                ComponentSignatureDef.builder()
                        .name("input")
                        .namePatterns(List.of("input", "field", "textbox", "search"))
                        .typePatterns(List.of("rectangle", "text"))
                        .propertyPatterns(Map.of("editable", true, "border", true))
                        .structuralPatterns(List.of("border", "placeholder_text"))
                        .confidenceThreshold(0.8)
                        .build(),
                ComponentSignatureDef.builder()
                        .name("card")
                        .namePatterns(List.of("card", "tile", "panel"))
                        .typePatterns(List.of("group", "rectangle"))
                        .propertyPatterns(Map.of("has_children", true, "background", true))
                        .structuralPatterns(List.of("border", "shadow", "padding"))
                        .confidenceThreshold(0.6)
                        .build(),
                ComponentSignatureDef.builder()
                        .name("navigation")
                        .namePatterns(List.of("nav", "menu", "tab", "breadcrumb"))
                        .typePatterns(List.of("group"))
                        .propertyPatterns(Map.of("has_multiple_items", true, "horizontal_layout", true))
                        .structuralPatterns(List.of("list_structure", "links"))
                        .confidenceThreshold(0.7)
                        .build(),
                ComponentSignatureDef.builder()
                        .name("modal")
                        .namePatterns(List.of("modal", "dialog", "popup", "overlay"))
                        .typePatterns(List.of("group"))
                        .propertyPatterns(Map.of("overlay", true, "centered", true))
                        .structuralPatterns(List.of("backdrop", "close_button"))
                        .confidenceThreshold(0.8)
                        .build()
        ));
    }

    private static void validate(ComponentSignatureDef signature) {
        if (signature == null) {
            throw new InvalidSignatureRegistryException(null, "null signature entry");
        }
        String name = signature.getName();
        if (name == null || name.isBlank()) {
            throw new InvalidSignatureRegistryException(null, "signature name must not be blank");
        }
        double threshold = signature.getConfidenceThreshold();
        if (!(threshold > 0.0 && threshold <= 1.0)) {
            throw new InvalidSignatureRegistryException(name,
                    "confidence threshold must be in (0, 1] but was " + threshold);
        }
        List<String> namePatterns = signature.getNamePatterns();
        List<String> typePatterns = signature.getTypePatterns();
        // without a name pattern the best reachable score is the 0.3 type weight
        if (namePatterns == null || namePatterns.isEmpty()) {
            throw new InvalidSignatureRegistryException(name, "needs at least one name pattern");
        }
        if (namePatterns.stream().anyMatch(p -> p == null || p.isEmpty())) {
            throw new InvalidSignatureRegistryException(name, "name patterns must not be empty strings");
        }
        if (typePatterns != null && typePatterns.stream().anyMatch(p -> p == null || p.isBlank())) {
            throw new InvalidSignatureRegistryException(name, "type patterns must not be blank");
        }
    }
}
