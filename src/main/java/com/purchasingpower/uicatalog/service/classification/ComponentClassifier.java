package com.purchasingpower.uicatalog.service.classification;

import com.purchasingpower.uicatalog.model.design.DesignObject;
import com.purchasingpower.uicatalog.model.signature.DesignCategory;

import java.util.Optional;

/**
 * Assigns component types, atomic-design tiers and display names.
 */
public interface ComponentClassifier {

    /**
     * Classifies a group representative.
     *
     * <p>Signatures are scored in registry order as 0.4 for a name-pattern hit plus
     * 0.3 for a type-pattern hit; the first signature reaching its threshold wins.
     * Otherwise a fixed substring cascade applies (button/btn, input/field, card/panel),
     * then the object's own type, then "component".
     *
     * @param representative first object of a candidate group
     * @return component type, never null
     */
    String classify(DesignObject representative);

    /**
     * Classifies a leftover object on its own: the first signature with a name
     * pattern in the object's name, if any.
     *
     * @param object unclaimed object
     * @return signature name, or empty when the object is not a component
     */
    Optional<String> classifyIndividually(DesignObject object);

    DesignCategory categorize(String componentType);

    /**
     * Human-readable component name with version, "component"/"comp" prefixes and
     * trailing numbers removed; falls back to the title-cased type for names under
     * two characters.
     */
    String displayName(String originalName, String componentType);
}
