package com.purchasingpower.uicatalog.model.catalog;

import lombok.Builder;
import lombok.Value;

/**
 * Overall component quality and the sub-scores it is averaged from.
 */
@Value
@Builder
public class QualityAssessment {
    double overallScore;
    double reusabilityScore;
    double consistencyScore;
    double maturityScore;
    double accessibilityCoverage;
    QualityGrade qualityGrade;
}
