package com.purchasingpower.uicatalog.model.design;

/**
 * A design object paired with where it came from.
 *
 * @param ordinal position in collection order, unique within one run
 */
public record CollectedObject(
        int ordinal,
        DesignObject object,
        ObjectContext context
) {
}
