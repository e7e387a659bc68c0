package com.purchasingpower.uicatalog.model.grouping;

import com.purchasingpower.uicatalog.model.design.CollectedObject;

import java.util.List;

/**
 * Objects sharing one signature key, in collection order.
 */
public record ObjectGroup(
        String signature,
        List<CollectedObject> members
) {

    public ObjectGroup {
        members = List.copyOf(members);
    }

    public CollectedObject representative() {
        return members.get(0);
    }

    public int size() {
        return members.size();
    }
}
