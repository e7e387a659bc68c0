package com.purchasingpower.uicatalog.model.catalog;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CatalogSummary {
    int totalObjectsAnalyzed;
    int componentsDetected;
    int componentTypes;
    int categoriesFound;
    double categoryCoverage;
    double averageReusability;
}
