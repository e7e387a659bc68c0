package com.purchasingpower.uicatalog.service.quality;

import com.purchasingpower.uicatalog.model.catalog.DesignSystemReport;
import com.purchasingpower.uicatalog.model.catalog.DetectedComponent;
import com.purchasingpower.uicatalog.model.catalog.QualityAssessment;
import com.purchasingpower.uicatalog.model.catalog.QualityGrade;
import com.purchasingpower.uicatalog.util.Ratios;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Folds reusability, naming, maturity and accessibility into one graded score.
 */
@Component
public class QualityAssessor {

    static final double OVERALL_TARGET = 0.7;
    static final double REUSABILITY_TARGET = 0.6;
    static final double ACCESSIBILITY_TARGET = 0.8;
    static final double MATURITY_TARGET = 0.7;

    public QualityAssessment assess(List<DetectedComponent> components, DesignSystemReport designSystem) {
        if (components.isEmpty()) {
            return QualityAssessment.builder()
                    .qualityGrade(QualityGrade.F)
                    .build();
        }

        double reusability = Ratios.average(components, DetectedComponent::getReusabilityScore);
        double consistency = designSystem.getNamingConsistency();
        double maturity = designSystem.getMaturityScore();
        double accessibility = Ratios.ratio(
                components.stream().filter(DetectedComponent::hasAccessibilityFeatures).count(),
                components.size());
        double overall = Ratios.clamp01(Ratios.mean(reusability, consistency, maturity, accessibility));

        return QualityAssessment.builder()
                .overallScore(overall)
                .reusabilityScore(reusability)
                .consistencyScore(consistency)
                .maturityScore(maturity)
                .accessibilityCoverage(accessibility)
                .qualityGrade(QualityGrade.forScore(overall))
                .build();
    }

    /**
     * Threshold messages in fixed order (overall, reusability, accessibility, maturity),
     * followed by the design-system recommendations.
     */
    public List<String> recommendations(QualityAssessment assessment, DesignSystemReport designSystem) {
        List<String> recommendations = new ArrayList<>();

        if (assessment.getOverallScore() < OVERALL_TARGET) {
            recommendations.add("Component quality is below recommended threshold - focus on improving reusability and consistency");
        }
        if (assessment.getReusabilityScore() < REUSABILITY_TARGET) {
            recommendations.add("Low component reusability detected - consider consolidating similar components");
        }
        if (assessment.getAccessibilityCoverage() < ACCESSIBILITY_TARGET) {
            recommendations.add("Improve accessibility features across components - consider adding ARIA labels and semantic roles");
        }
        if (designSystem.getMaturityScore() < MATURITY_TARGET) {
            recommendations.add("Design system maturity is below target - broaden tier coverage and align component naming");
        }

        recommendations.addAll(designSystem.getRecommendations());
        return recommendations;
    }
}
