package com.purchasingpower.uicatalog.model.catalog;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ReusabilityAnalysis {
    double averageReusability;
    List<String> highlyReusable;
    List<String> poorlyReusable;
    List<String> reuseOpportunities;
}
