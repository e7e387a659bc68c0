package com.purchasingpower.uicatalog.service.detection;

import com.purchasingpower.uicatalog.model.catalog.ComponentCatalog;
import com.purchasingpower.uicatalog.model.catalog.DetectedComponent;
import com.purchasingpower.uicatalog.model.design.CollectedObject;
import com.purchasingpower.uicatalog.model.design.DesignDocument;

import java.util.List;

/**
 * Entry point of the component catalog engine.
 *
 * <p>Stateless: each call analyzes one document from scratch and shares nothing
 * with other calls.
 */
public interface ComponentDetectionService {

    /**
     * Detects, classifies and scores the components of a design document and
     * derives tokens, design-system metrics and quality from them.
     *
     * @param document design document; an empty document yields an empty catalog
     * @return the complete catalog
     * @throws IllegalArgumentException if document is null
     */
    ComponentCatalog detectComponents(DesignDocument document);

    /**
     * Runs only the detection stages (grouping, classification, scoring).
     * Every collected object ends up in at most one component.
     *
     * @param objects collected objects, in collection order
     * @return detected components, group candidates first, then individual ones
     */
    List<DetectedComponent> detect(List<CollectedObject> objects);
}
