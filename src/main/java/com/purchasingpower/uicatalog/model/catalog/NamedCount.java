package com.purchasingpower.uicatalog.model.catalog;

/**
 * A key with its occurrence count, used for every ranked list in the catalog.
 */
public record NamedCount(String name, long count) {
}
