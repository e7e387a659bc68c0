package com.purchasingpower.uicatalog.service.tokens;

import com.purchasingpower.uicatalog.configuration.ComponentDetectionProperties;
import com.purchasingpower.uicatalog.model.catalog.DesignTokenAggregate;
import com.purchasingpower.uicatalog.model.catalog.NamedCount;
import com.purchasingpower.uicatalog.model.design.DesignObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.purchasingpower.uicatalog.TestDocuments.collected;
import static com.purchasingpower.uicatalog.TestDocuments.object;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Design Token Extractor Tests")
class DesignTokenExtractorTest {

    private final DesignTokenExtractor extractor = new DesignTokenExtractor(new ComponentDetectionProperties());

    @Test
    @DisplayName("Should extract only the token categories an object carries")
    void objectTokens() {
        DesignObject rectangle = DesignObject.builder()
                .type("rectangle").width(120).height(40).fill("#FFFFFF")
                .build();
        DesignObject text = DesignObject.builder()
                .type("text").fontFamily("Inter").fontSize(14.0).blur(2.0)
                .build();

        Map<String, Map<String, Object>> rectangleTokens = extractor.objectTokens(rectangle);
        Map<String, Map<String, Object>> textTokens = extractor.objectTokens(text);

        assertEquals(List.of("colors", "spacing"), new ArrayList<>(rectangleTokens.keySet()));
        assertEquals(Map.of("fill", "#FFFFFF"), rectangleTokens.get("colors"));
        assertEquals(List.of("typography", "spacing", "effects"), new ArrayList<>(textTokens.keySet()));
        assertNull(textTokens.get("effects").get("shadow"));
    }

    @Test
    @DisplayName("Should skip typography for non-text objects")
    void typographyOnlyForText() {
        DesignObject rectangle = DesignObject.builder().type("rectangle").fontFamily("Inter").build();

        assertFalse(extractor.objectTokens(rectangle).containsKey("typography"));
    }

    @Test
    @DisplayName("Should count tokens across objects and rank by count with first-seen tie order")
    void aggregateRanking() {
        DesignObject red = DesignObject.builder().type("rectangle").fill("#F00").width(10).height(10).build();
        DesignObject blue = DesignObject.builder().type("rectangle").fill("#00F").width(20).height(10).build();
        DesignObject blueAgain = DesignObject.builder().type("rectangle").fill("#00F").stroke("#000").width(30).height(10).build();

        DesignTokenAggregate aggregate = extractor.aggregate(collected(red, blue, blueAgain));

        assertEquals(List.of(
                new NamedCount("fill_#00F", 2),
                new NamedCount("fill_#F00", 1),
                new NamedCount("stroke_#000", 1)), aggregate.getColors());
        assertEquals(new NamedCount("height_10", 3), aggregate.getSpacing().get(0));
        assertEquals(List.of("height_10", "width_10", "width_20", "width_30"),
                aggregate.getSpacing().stream().map(NamedCount::name).toList());
    }

    @Test
    @DisplayName("Should skip empty and zero values and print whole numbers without decimals")
    void formatting() {
        DesignObject text = DesignObject.builder()
                .type("text").fontFamily("").fontSize(16.0).lineHeight(1.5).fontWeight("600")
                .width(0).height(24)
                .build();

        DesignTokenAggregate aggregate = extractor.aggregate(collected(text));

        assertEquals(List.of("font_size_16", "font_weight_600", "line_height_1.5"),
                aggregate.getTypography().stream().map(NamedCount::name).toList());
        assertEquals(List.of("height_24"), aggregate.getSpacing().stream().map(NamedCount::name).toList());
        assertTrue(aggregate.getEffects().isEmpty());
    }

    @Test
    @DisplayName("Should keep only the top 10 tokens per category")
    void topTen() {
        List<DesignObject> objects = new ArrayList<>();
        for (int i = 1; i <= 15; i++) {
            objects.add(object("rectangle", "r" + i, i, 0));
        }

        DesignTokenAggregate aggregate = extractor.aggregate(collected(objects.toArray(DesignObject[]::new)));

        assertEquals(10, aggregate.getSpacing().size());
        assertEquals("width_1", aggregate.getSpacing().get(0).name());
        assertEquals("width_10", aggregate.getSpacing().get(9).name());
    }

    @Test
    @DisplayName("Should return empty categories for no objects")
    void emptyCorpus() {
        assertEquals(DesignTokenAggregate.empty(), extractor.aggregate(List.of()));
    }
}
