package com.purchasingpower.uicatalog.model.catalog;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How often a component recurs across the document.
 */
public enum UsagePattern {
    /** More than 10 instances */
    HEAVILY_REUSED,

    /** 4 to 10 instances */
    MODERATELY_REUSED,

    /** 2 or 3 instances */
    LIGHTLY_REUSED,

    /** One instance */
    SINGLE_USE;

    public static UsagePattern forInstanceCount(int instanceCount) {
        if (instanceCount > 10) {
            return HEAVILY_REUSED;
        } else if (instanceCount > 3) {
            return MODERATELY_REUSED;
        } else if (instanceCount > 1) {
            return LIGHTLY_REUSED;
        }
        return SINGLE_USE;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
