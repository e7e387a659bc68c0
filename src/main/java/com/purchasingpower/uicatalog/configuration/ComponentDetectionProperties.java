package com.purchasingpower.uicatalog.configuration;

import com.purchasingpower.uicatalog.model.signature.ComponentSignatureDef;
import com.purchasingpower.uicatalog.model.signature.DesignCategory;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for component detection.
 * Binds to uicatalog.component-detection in application.yml.
 *
 * <p>Empty {@code signatures} or {@code categories} fall back to the built-in
 * registry and atomic-design table.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "uicatalog.component-detection")
public class ComponentDetectionProperties {

    /**
     * Ordered signature registry. The first signature over its threshold wins.
     */
    private List<ComponentSignatureDef> signatures = new ArrayList<>();

    /**
     * Component types per atomic-design tier.
     */
    private Map<DesignCategory, List<String>> categories = new LinkedHashMap<>();

    /**
     * How many tokens to keep per design-token category.
     */
    @Min(1)
    private int tokenTopK = 10;

    /**
     * How many entries to keep in the most-common component types list.
     */
    @Min(1)
    private int mostCommonTypesLimit = 5;
}
