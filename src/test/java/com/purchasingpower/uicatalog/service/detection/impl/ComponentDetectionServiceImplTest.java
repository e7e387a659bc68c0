package com.purchasingpower.uicatalog.service.detection.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.uicatalog.TestDocuments;
import com.purchasingpower.uicatalog.model.catalog.ComponentCatalog;
import com.purchasingpower.uicatalog.model.catalog.DetectedComponent;
import com.purchasingpower.uicatalog.model.catalog.QualityGrade;
import com.purchasingpower.uicatalog.model.catalog.UsagePattern;
import com.purchasingpower.uicatalog.model.design.DesignDocument;
import com.purchasingpower.uicatalog.model.design.DesignObject;
import com.purchasingpower.uicatalog.model.design.ObjectContext;
import com.purchasingpower.uicatalog.model.grouping.GroupingResult;
import com.purchasingpower.uicatalog.model.signature.ComponentSignatureRegistry;
import com.purchasingpower.uicatalog.model.signature.DesignCategory;
import com.purchasingpower.uicatalog.service.CatalogJsonWriter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.purchasingpower.uicatalog.TestDocuments.object;
import static com.purchasingpower.uicatalog.TestDocuments.singlePage;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Component Detection Service Tests")
class ComponentDetectionServiceImplTest {

    private final ComponentDetectionServiceImpl detector = TestDocuments.detector();

    @Test
    @DisplayName("Should merge numbered buttons into one lightly reused component")
    void numberedButtonsFormOneComponent() {
        // Given
        DesignDocument document = singlePage(
                object("rectangle", "btn-1", 120, 40),
                object("rectangle", "btn-2", 120, 40));

        // When
        ComponentCatalog catalog = detector.detectComponents(document);

        // Then
        assertEquals(1, catalog.getDetectedComponents().size());
        DetectedComponent button = catalog.getDetectedComponents().get(0);
        assertEquals(2, button.getInstances().size());
        assertEquals("button", button.getComponentType());
        assertEquals(DesignCategory.ATOMS, button.getCategory());
        assertEquals("Btn", button.getName());
        assertEquals(0.2, button.getReusabilityScore(), 1e-9);
        assertEquals(UsagePattern.LIGHTLY_REUSED, button.getUsagePattern());
    }

    @Test
    @DisplayName("Should mark eleven navigation items as heavily reused")
    void elevenNavItemsAreHeavilyReused() {
        List<DesignObject> items = new ArrayList<>();
        for (int i = 1; i <= 11; i++) {
            items.add(object("group", "nav-item-" + i, 40, 40));
        }

        ComponentCatalog catalog = detector.detectComponents(singlePage(items.toArray(DesignObject[]::new)));

        assertEquals(1, catalog.getDetectedComponents().size());
        DetectedComponent navigation = catalog.getDetectedComponents().get(0);
        assertEquals(11, navigation.getInstances().size());
        assertEquals("navigation", navigation.getComponentType());
        assertEquals("Nav Item", navigation.getName());
        assertEquals(1.0, navigation.getReusabilityScore(), 1e-9);
        assertEquals(UsagePattern.HEAVILY_REUSED, navigation.getUsagePattern());
        assertEquals(List.of("Nav Item"), catalog.getReusabilityAnalysis().getHighlyReusable());
    }

    @Test
    @DisplayName("Should produce an empty zero-score catalog for an empty document")
    void emptyDocument() {
        ComponentCatalog catalog = assertDoesNotThrow(() -> detector.detectComponents(new DesignDocument()));

        assertTrue(catalog.getDetectedComponents().isEmpty());
        assertEquals(0.0, catalog.getQualityAssessment().getOverallScore());
        assertEquals(QualityGrade.F, catalog.getQualityAssessment().getQualityGrade());
        assertEquals(0.0, catalog.getDesignSystem().getMaturityScore());
        assertEquals(0.0, catalog.getSummary().getAverageReusability());
        assertEquals(0, catalog.getSummary().getTotalObjectsAnalyzed());
        assertTrue(catalog.getComponentCatalog().isEmpty());
        assertTrue(catalog.getDesignTokens().getSpacing().isEmpty());
        assertFalse(Double.isNaN(catalog.getComponentPatterns().getComplexityAnalysis().getAverageComplexity()));
    }

    @Test
    @DisplayName("Should produce a zero-score catalog for an empty JSON export")
    void emptyJsonExport() {
        DesignDocument document = new CatalogJsonWriter(new ObjectMapper()).readDocument("{}");

        ComponentCatalog catalog = detector.detectComponents(document);

        assertTrue(catalog.getDetectedComponents().isEmpty());
        assertEquals(0.0, catalog.getQualityAssessment().getOverallScore());
        assertEquals(List.of(), catalog.getDesignSystem().getCategoriesFound());
        assertEquals(5, catalog.getDesignSystem().getMissingCategories().size());
    }

    @Test
    @DisplayName("Should hand out components whose collections cannot be changed")
    void componentsAreImmutable() {
        // Given
        ComponentCatalog catalog = detector.detectComponents(singlePage(
                object("rectangle", "focus-btn-1", 120, 40),
                object("rectangle", "focus-btn-2", 120, 40)));
        DetectedComponent button = catalog.getDetectedComponents().get(0);
        assertEquals(List.of("focus_management"), button.getAccessibilityFeatures());

        // When / Then
        assertThrows(UnsupportedOperationException.class, () -> button.getAccessibilityFeatures().clear());
        assertThrows(UnsupportedOperationException.class, () -> button.getDesignTokens().clear());
        assertThrows(UnsupportedOperationException.class,
                () -> button.getDesignTokens().get("spacing").put("width", 1.0));
        assertThrows(UnsupportedOperationException.class, () -> button.getProperties().put("injected", 1));
        assertThrows(UnsupportedOperationException.class, () -> button.getInstances().clear());
        assertThrows(UnsupportedOperationException.class,
                () -> catalog.getComponentCatalog().get("atoms").get(0).getAccessibilityFeatures().clear());

        assertTrue(button.hasAccessibilityFeatures());
        assertEquals(List.of("focus_management"),
                catalog.getComponentCatalog().get("atoms").get(0).getAccessibilityFeatures());
    }

    @Test
    @DisplayName("Should reject a null document")
    void nullDocument() {
        assertThrows(IllegalArgumentException.class, () -> detector.detectComponents(null));
    }

    @Test
    @DisplayName("Should keep a lone object whose name mentions a pattern, typed by fallback")
    void singletonCandidate() {
        // Given: "tab" alone scores 0.4, below the navigation threshold
        DesignDocument document = singlePage(
                object("ellipse", "Settings Tab", 80, 24),
                object("path", "squiggle", 5, 5));

        ComponentCatalog catalog = detector.detectComponents(document);

        // Then: the path matches nothing and is not a component
        assertEquals(1, catalog.getDetectedComponents().size());
        DetectedComponent component = catalog.getDetectedComponents().get(0);
        assertEquals("ellipse", component.getComponentType());
        assertEquals(DesignCategory.MOLECULES, component.getCategory());
        assertEquals("Settings Tab", component.getName());
        assertEquals(0.1, component.getReusabilityScore(), 1e-9);
        assertEquals(UsagePattern.SINGLE_USE, component.getUsagePattern());
        assertEquals(2, catalog.getSummary().getTotalObjectsAnalyzed());
    }

    @Test
    @DisplayName("Should classify unclaimed objects by the first matching name pattern")
    void individualPass() {
        // Given: a grouping stage that claims nothing
        ComponentSignatureRegistry registry = ComponentSignatureRegistry.defaults();
        ComponentDetectionServiceImpl individualOnly =
                TestDocuments.detector(registry, objects -> new GroupingResult(List.of(), objects));

        // When
        List<DetectedComponent> components = individualOnly.detect(TestDocuments.collected(
                object("vector", "Close-Dialog_3", 24, 24),
                object("path", "squiggle", 5, 5)));

        // Then
        assertEquals(1, components.size());
        DetectedComponent dialog = components.get(0);
        assertEquals("modal", dialog.getComponentType());
        assertEquals("Close Dialog", dialog.getName());
        assertEquals(List.of(new ObjectContext("file-1", "page-1", "obj-1")), dialog.getInstances());
        assertEquals(0.1, dialog.getReusabilityScore(), 1e-9);
        assertEquals(UsagePattern.SINGLE_USE, dialog.getUsagePattern());
    }

    @Test
    @DisplayName("Should keep every score in range and every object in at most one component")
    void boundsAndExclusivity() {
        List<DesignObject> objects = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            DesignObject object = object(i % 3 == 0 ? "group" : "rectangle", "item-" + (i % 7) + "-card", 50 + i, 20);
            object.setChildren(List.of("a", "b", "c", "d", "e", "f", "g", "h", "i", "j", "k"));
            objects.add(object);
        }
        objects.add(object("ellipse", "", 1, 1));

        ComponentCatalog catalog = detector.detectComponents(singlePage(objects.toArray(DesignObject[]::new)));

        Set<ObjectContext> claimed = new HashSet<>();
        Set<DesignCategory> tiers = EnumSet.allOf(DesignCategory.class);
        for (DetectedComponent component : catalog.getDetectedComponents()) {
            assertFalse(component.getInstances().isEmpty());
            assertTrue(component.getReusabilityScore() >= 0 && component.getReusabilityScore() <= 1);
            assertTrue(component.getComplexityScore() >= 0 && component.getComplexityScore() <= 1);
            assertTrue(tiers.contains(component.getCategory()));
            component.getInstances().forEach(instance ->
                    assertTrue(claimed.add(instance), "object claimed twice: " + instance));
        }
        assertInRange(catalog.getDesignSystem().getMaturityScore());
        assertInRange(catalog.getDesignSystem().getNamingConsistency());
        assertInRange(catalog.getQualityAssessment().getOverallScore());
    }

    private static void assertInRange(double value) {
        assertTrue(value >= 0.0 && value <= 1.0, "out of [0,1]: " + value);
    }
}
