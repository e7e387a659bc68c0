package com.purchasingpower.uicatalog.model.catalog;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Most used design tokens per category, as {@code field_value} keys with counts.
 */
@Value
@Builder
public class DesignTokenAggregate {
    List<NamedCount> colors;
    List<NamedCount> typography;
    List<NamedCount> spacing;
    List<NamedCount> effects;

    public static DesignTokenAggregate empty() {
        return DesignTokenAggregate.builder()
                .colors(List.of())
                .typography(List.of())
                .spacing(List.of())
                .effects(List.of())
                .build();
    }
}
