package com.purchasingpower.uicatalog.service.tokens;

import com.purchasingpower.uicatalog.configuration.ComponentDetectionProperties;
import com.purchasingpower.uicatalog.model.catalog.DesignTokenAggregate;
import com.purchasingpower.uicatalog.model.catalog.NamedCount;
import com.purchasingpower.uicatalog.model.design.CollectedObject;
import com.purchasingpower.uicatalog.model.design.DesignObject;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Extracts design tokens from objects and ranks them across the document.
 *
 * <p>Token keys have the form {@code field_value}, e.g. {@code fill_#FF0000} or
 * {@code width_120}. Whole numbers are written without a decimal part.
 */
@Slf4j
@Component
public class DesignTokenExtractor {

    public static final String COLORS = "colors";
    public static final String TYPOGRAPHY = "typography";
    public static final String SPACING = "spacing";
    public static final String EFFECTS = "effects";

    private final int topK;

    public DesignTokenExtractor(ComponentDetectionProperties properties) {
        this.topK = properties.getTokenTopK();
    }

    /**
     * Tokens carried by one object, grouped by category. Spacing is always present;
     * typography only for text objects; colors and effects only when set.
     */
    public Map<String, Map<String, Object>> objectTokens(DesignObject object) {
        Map<String, Map<String, Object>> tokens = new LinkedHashMap<>();

        if (object.getFill() != null || object.getStroke() != null) {
            Map<String, Object> colors = new LinkedHashMap<>();
            if (object.getFill() != null) {
                colors.put("fill", object.getFill());
            }
            if (object.getStroke() != null) {
                colors.put("stroke", object.getStroke());
            }
            tokens.put(COLORS, colors);
        }

        if (object.isText()) {
            Map<String, Object> typography = new LinkedHashMap<>();
            typography.put("font_family", object.getFontFamily());
            typography.put("font_size", object.getFontSize());
            typography.put("font_weight", object.getFontWeight());
            typography.put("line_height", object.getLineHeight());
            tokens.put(TYPOGRAPHY, typography);
        }

        Map<String, Object> spacing = new LinkedHashMap<>();
        spacing.put("width", object.getWidth());
        spacing.put("height", object.getHeight());
        tokens.put(SPACING, spacing);

        if (object.getShadow() != null || object.getBlur() != null) {
            Map<String, Object> effects = new LinkedHashMap<>();
            effects.put("shadow", object.getShadow());
            effects.put("blur", object.getBlur());
            tokens.put(EFFECTS, effects);
        }

        return tokens;
    }

    /**
     * Counts every non-empty token over all objects and keeps the most used per category.
     * Ties keep the order in which tokens were first seen.
     */
    public DesignTokenAggregate aggregate(List<CollectedObject> objects) {
        Map<String, Map<String, Long>> counts = new LinkedHashMap<>();
        for (String category : List.of(COLORS, TYPOGRAPHY, SPACING, EFFECTS)) {
            counts.put(category, new LinkedHashMap<>());
        }

        for (CollectedObject collected : objects) {
            objectTokens(collected.object()).forEach((category, fields) ->
                    fields.forEach((field, value) -> {
                        if (!isEmptyValue(value)) {
                            counts.get(category).merge(field + "_" + formatValue(value), 1L, Long::sum);
                        }
                    }));
        }

        log.debug("Token vocabulary: {} colors, {} typography, {} spacing, {} effects",
                counts.get(COLORS).size(), counts.get(TYPOGRAPHY).size(),
                counts.get(SPACING).size(), counts.get(EFFECTS).size());

        return DesignTokenAggregate.builder()
                .colors(topTokens(counts.get(COLORS)))
                .typography(topTokens(counts.get(TYPOGRAPHY)))
                .spacing(topTokens(counts.get(SPACING)))
                .effects(topTokens(counts.get(EFFECTS)))
                .build();
    }

    private List<NamedCount> topTokens(Map<String, Long> counts) {
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder()))
                .limit(topK)
                .map(entry -> new NamedCount(entry.getKey(), entry.getValue()))
                .toList();
    }

    static boolean isEmptyValue(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof String text) {
            return text.isEmpty();
        }
        if (value instanceof Number number) {
            return number.doubleValue() == 0.0;
        }
        return false;
    }

    static String formatValue(Object value) {
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            if (Double.isFinite(number)) {
                return BigDecimal.valueOf(number).stripTrailingZeros().toPlainString();
            }
        }
        return String.valueOf(value);
    }
}
