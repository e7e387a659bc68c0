package com.purchasingpower.uicatalog.model.catalog;

import com.purchasingpower.uicatalog.model.signature.DesignCategory;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Atomic-design coverage and maturity of the detected component set.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class DesignSystemReport {
    List<DesignCategory> categoriesFound;
    List<DesignCategory> missingCategories;
    double categoryCoverage;
    double maturityScore;
    Map<String, Long> componentDistribution;
    Map<String, Double> designTokenCoverage;
    double namingConsistency;
    List<String> recommendations;
}
