package com.purchasingpower.uicatalog.service.collector;

import com.purchasingpower.uicatalog.model.design.CollectedObject;
import com.purchasingpower.uicatalog.model.design.DesignDocument;

import java.util.List;

/**
 * Flattens a design document into the object stream the detector works on.
 */
public interface ObjectCollector {

    /**
     * Collects every object of every page of every file, in document order,
     * each tagged with its file, page and object id.
     *
     * @param document design document; missing containers count as empty
     * @return collected objects, never null
     */
    List<CollectedObject> collect(DesignDocument document);
}
