package com.purchasingpower.uicatalog.service.detection.impl;

import com.purchasingpower.uicatalog.model.design.CollectedObject;
import com.purchasingpower.uicatalog.model.design.DesignObject;
import com.purchasingpower.uicatalog.model.grouping.GroupingResult;
import com.purchasingpower.uicatalog.model.grouping.ObjectGroup;
import com.purchasingpower.uicatalog.model.signature.ComponentSignatureRegistry;
import com.purchasingpower.uicatalog.service.detection.GroupingEngine;
import com.purchasingpower.uicatalog.service.detection.SignatureGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class GroupingEngineImpl implements GroupingEngine {

    private final SignatureGenerator signatureGenerator;
    private final ComponentSignatureRegistry registry;

    @Override
    public GroupingResult group(List<CollectedObject> objects) {
        Map<String, List<CollectedObject>> bySignature = new LinkedHashMap<>();
        for (CollectedObject collected : objects) {
            String signature = signatureGenerator.signature(collected.object());
            bySignature.computeIfAbsent(signature, key -> new ArrayList<>()).add(collected);
        }

        List<ObjectGroup> candidates = new ArrayList<>();
        Set<Integer> claimed = new HashSet<>();

        for (Map.Entry<String, List<CollectedObject>> entry : bySignature.entrySet()) {
            ObjectGroup group = new ObjectGroup(entry.getKey(), entry.getValue());
            if (group.size() > 1 || hasComponentCharacteristics(group.representative().object())) {
                candidates.add(group);
                group.members().forEach(member -> claimed.add(member.ordinal()));
                log.debug("Signature '{}' qualifies with {} members", group.signature(), group.size());
            }
        }

        List<CollectedObject> unclaimed = objects.stream()
                .filter(collected -> !claimed.contains(collected.ordinal()))
                .toList();

        log.debug("Grouped {} objects into {} signatures, {} candidates, {} unclaimed",
                objects.size(), bySignature.size(), candidates.size(), unclaimed.size());
        return new GroupingResult(candidates, unclaimed);
    }

    /**
     * Name mentions any registered name pattern, or the type is any registered type pattern.
     */
    boolean hasComponentCharacteristics(DesignObject object) {
        return registry.anyNameMatch(object.getName()) || registry.anyTypeMatch(object.getType());
    }
}
