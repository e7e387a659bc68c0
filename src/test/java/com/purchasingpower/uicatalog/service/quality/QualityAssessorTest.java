package com.purchasingpower.uicatalog.service.quality;

import com.purchasingpower.uicatalog.model.catalog.DesignSystemReport;
import com.purchasingpower.uicatalog.model.catalog.DetectedComponent;
import com.purchasingpower.uicatalog.model.catalog.QualityAssessment;
import com.purchasingpower.uicatalog.model.catalog.QualityGrade;
import com.purchasingpower.uicatalog.model.catalog.UsagePattern;
import com.purchasingpower.uicatalog.model.design.ObjectContext;
import com.purchasingpower.uicatalog.model.signature.DesignCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Quality Assessor Tests")
class QualityAssessorTest {

    private final QualityAssessor assessor = new QualityAssessor();

    private static DetectedComponent component(double reusability, List<String> accessibility) {
        return DetectedComponent.builder()
                .id("id")
                .name("Name")
                .componentType("button")
                .category(DesignCategory.ATOMS)
                .instances(List.of(new ObjectContext("f", "p", "o")))
                .properties(Map.of())
                .usagePattern(UsagePattern.SINGLE_USE)
                .reusabilityScore(reusability)
                .designTokens(Map.of())
                .accessibilityFeatures(accessibility)
                .build();
    }

    private static DesignSystemReport report(double consistency, double maturity, List<String> recommendations) {
        return DesignSystemReport.builder()
                .categoriesFound(List.of())
                .missingCategories(List.of())
                .namingConsistency(consistency)
                .maturityScore(maturity)
                .recommendations(recommendations)
                .build();
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({"0.95, A", "0.9, A", "0.85, B", "0.7, C", "0.65, D", "0.59, F", "0.0, F"})
    @DisplayName("Should map scores to letter grades")
    void grades(double score, QualityGrade expected) {
        assertEquals(expected, QualityGrade.forScore(score));
    }

    @Test
    @DisplayName("Should average reusability, consistency, maturity and accessibility")
    void overallScore() {
        List<DetectedComponent> components = List.of(
                component(1.0, List.of("aria_labels")),
                component(0.6, List.of()));

        QualityAssessment assessment = assessor.assess(components, report(1.0, 0.8, List.of()));

        assertEquals(0.8, assessment.getReusabilityScore(), 1e-9);
        assertEquals(0.5, assessment.getAccessibilityCoverage(), 1e-9);
        assertEquals((0.8 + 1.0 + 0.8 + 0.5) / 4, assessment.getOverallScore(), 1e-9);
        assertEquals(QualityGrade.C, assessment.getQualityGrade());
    }

    @Test
    @DisplayName("Should score an empty corpus as zero without failing")
    void emptyCorpus() {
        QualityAssessment assessment = assessor.assess(List.of(), report(0.0, 0.0, List.of()));

        assertEquals(0.0, assessment.getOverallScore());
        assertEquals(0.0, assessment.getAccessibilityCoverage());
        assertEquals(QualityGrade.F, assessment.getQualityGrade());
    }

    @Test
    @DisplayName("Should list threshold messages in rule order before design-system recommendations")
    void recommendations() {
        DesignSystemReport designSystem = report(0.5, 0.5, List.of("Design system advice"));
        QualityAssessment assessment = QualityAssessment.builder()
                .overallScore(0.5)
                .reusabilityScore(0.5)
                .accessibilityCoverage(0.5)
                .maturityScore(0.5)
                .build();

        List<String> recommendations = assessor.recommendations(assessment, designSystem);

        assertEquals(5, recommendations.size());
        assertTrue(recommendations.get(0).startsWith("Component quality is below"));
        assertTrue(recommendations.get(1).startsWith("Low component reusability"));
        assertTrue(recommendations.get(2).startsWith("Improve accessibility"));
        assertTrue(recommendations.get(3).startsWith("Design system maturity"));
        assertEquals("Design system advice", recommendations.get(4));
    }

    @Test
    @DisplayName("Should only pass design-system recommendations through when all thresholds are met")
    void healthyCatalog() {
        QualityAssessment assessment = QualityAssessment.builder()
                .overallScore(0.95)
                .reusabilityScore(0.9)
                .accessibilityCoverage(1.0)
                .maturityScore(0.9)
                .build();

        assertEquals(List.of("Keep going"),
                assessor.recommendations(assessment, report(1.0, 0.9, List.of("Keep going"))));
    }
}
