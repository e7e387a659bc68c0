package com.purchasingpower.uicatalog.service.detection;

import com.purchasingpower.uicatalog.model.design.CollectedObject;
import com.purchasingpower.uicatalog.model.grouping.GroupingResult;

import java.util.List;

/**
 * Clusters objects by signature and decides which clusters are component candidates.
 */
public interface GroupingEngine {

    /**
     * Groups objects sharing a signature. A group qualifies when it has more than one
     * member or its first member looks like a component. Members of qualifying groups
     * are claimed; everything else is returned as unclaimed.
     *
     * @param objects collected objects, in collection order
     * @return qualifying groups in first-seen order, plus the unclaimed objects
     */
    GroupingResult group(List<CollectedObject> objects);
}
