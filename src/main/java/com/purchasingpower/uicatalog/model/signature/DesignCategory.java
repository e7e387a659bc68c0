package com.purchasingpower.uicatalog.model.signature;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Atomic-design tiers, in hierarchy order.
 */
public enum DesignCategory {
    ATOMS,
    MOLECULES,
    ORGANISMS,
    TEMPLATES,
    PAGES;

    /**
     * Tier assigned when a component type is not listed anywhere.
     */
    public static final DesignCategory DEFAULT = MOLECULES;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return wireName();
    }
}
