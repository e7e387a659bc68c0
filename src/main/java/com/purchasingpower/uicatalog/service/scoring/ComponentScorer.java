package com.purchasingpower.uicatalog.service.scoring;

import com.purchasingpower.uicatalog.model.catalog.UsagePattern;
import com.purchasingpower.uicatalog.model.design.DesignObject;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Per-component scores and heuristics. All scores are in [0, 1].
 */
@Component
public class ComponentScorer {

    /**
     * Reusability given to components found by the individual pass.
     */
    public static final double INDIVIDUAL_REUSABILITY = 0.1;

    private static final double BASE_COMPLEXITY = 0.1;
    private static final double COMPLEXITY_PER_CHILD = 0.1;
    private static final double COMPLEXITY_PER_PROPERTY = 0.05;

    /**
     * One tenth per instance, saturating at ten instances.
     */
    public double reusability(int instanceCount) {
        return Math.min(instanceCount / 10.0, 1.0);
    }

    public double complexity(DesignObject object) {
        double score = BASE_COMPLEXITY
                + object.getChildren().size() * COMPLEXITY_PER_CHILD
                + object.getProperties().size() * COMPLEXITY_PER_PROPERTY;
        return Math.min(score, 1.0);
    }

    public UsagePattern usagePattern(int instanceCount) {
        return UsagePattern.forInstanceCount(instanceCount);
    }

    /**
     * Accessibility hints read from the object name and visibility.
     * A naming heuristic only; it says nothing about real compliance.
     */
    public List<String> accessibilityFeatures(DesignObject object) {
        List<String> features = new ArrayList<>();
        String name = object.getName().toLowerCase(Locale.ROOT);

        if (name.contains("alt") || name.contains("aria")) {
            features.add("aria_labels");
        }
        if (name.contains("role")) {
            features.add("semantic_roles");
        }
        if (name.contains("focus")) {
            features.add("focus_management");
        }
        if (object.isHidden()) {
            features.add("screen_reader_only");
        }
        return features;
    }

    /**
     * Salient fields of the representative object, as stored on the component.
     */
    public Map<String, Object> propertySnapshot(DesignObject object) {
        Map<String, Object> position = new LinkedHashMap<>();
        position.put("x", object.getX());
        position.put("y", object.getY());

        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("type", object.getType());
        snapshot.put("width", object.getWidth());
        snapshot.put("height", object.getHeight());
        snapshot.put("name", object.getName());
        snapshot.put("visible", !object.isHidden());
        snapshot.put("locked", object.isLocked());
        snapshot.put("has_children", !object.getChildren().isEmpty());
        snapshot.put("position", Collections.unmodifiableMap(position));
        return snapshot;
    }
}
