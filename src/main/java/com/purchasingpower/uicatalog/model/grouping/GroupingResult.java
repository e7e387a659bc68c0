package com.purchasingpower.uicatalog.model.grouping;

import com.purchasingpower.uicatalog.model.design.CollectedObject;

import java.util.List;

/**
 * Outcome of the grouping stage.
 *
 * @param candidates qualifying groups; their members are claimed
 * @param unclaimed  objects left for individual classification, in collection order
 */
public record GroupingResult(
        List<ObjectGroup> candidates,
        List<CollectedObject> unclaimed
) {

    public GroupingResult {
        candidates = List.copyOf(candidates);
        unclaimed = List.copyOf(unclaimed);
    }

    public int claimedCount() {
        return candidates.stream().mapToInt(ObjectGroup::size).sum();
    }
}
