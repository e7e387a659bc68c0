package com.purchasingpower.uicatalog.service.designsystem;

import com.purchasingpower.uicatalog.util.TextCase;

/**
 * Case style of a component name.
 *
 * <p>Detection order is fixed: upper, lower, snake, kebab, camel, unknown. A name is
 * reported under the first style it satisfies, so "a" is lower case and "Nav_Item"
 * is snake case.
 */
public enum CasePattern {
    UPPER_CASE,
    LOWER_CASE,
    SNAKE_CASE,
    KEBAB_CASE,
    CAMEL_CASE,
    UNKNOWN;

    public static CasePattern of(String name) {
        if (TextCase.isAllUpper(name)) {
            return UPPER_CASE;
        } else if (TextCase.isAllLower(name)) {
            return LOWER_CASE;
        } else if (name.contains("_")) {
            return SNAKE_CASE;
        } else if (name.contains("-")) {
            return KEBAB_CASE;
        } else if (TextCase.hasInnerUpper(name)) {
            return CAMEL_CASE;
        }
        return UNKNOWN;
    }
}
