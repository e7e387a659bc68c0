package com.purchasingpower.uicatalog.service.classification.impl;

import com.purchasingpower.uicatalog.model.design.DesignObject;
import com.purchasingpower.uicatalog.model.signature.AtomicDesignTable;
import com.purchasingpower.uicatalog.model.signature.ComponentSignatureDef;
import com.purchasingpower.uicatalog.model.signature.ComponentSignatureRegistry;
import com.purchasingpower.uicatalog.model.signature.DesignCategory;
import com.purchasingpower.uicatalog.service.classification.ComponentClassifier;
import com.purchasingpower.uicatalog.util.TextCase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

@Slf4j
@Service
@RequiredArgsConstructor
public class ComponentClassifierImpl implements ComponentClassifier {

    static final double NAME_MATCH_WEIGHT = 0.4;
    static final double TYPE_MATCH_WEIGHT = 0.3;

    private static final Pattern NAME_PREFIX =
            Pattern.compile("^(v\\d+[-_]?|component[-_]?|comp[-_]?)", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_NUMBER = Pattern.compile("[-_]\\d+$");
    private static final String GENERIC_TYPE = "component";

    private final ComponentSignatureRegistry registry;
    private final AtomicDesignTable atomicDesignTable;

    @Override
    public String classify(DesignObject representative) {
        String name = representative.getName().toLowerCase(Locale.ROOT);
        String type = representative.getType();

        for (ComponentSignatureDef signature : registry.getSignatures()) {
            double score = score(signature, name, type);
            if (score >= signature.getConfidenceThreshold()) {
                log.debug("'{}' matched signature '{}' with score {}", representative.getName(), signature.getName(), score);
                return signature.getName();
            }
        }

        return fallbackType(name, type);
    }

    @Override
    public Optional<String> classifyIndividually(DesignObject object) {
        return registry.firstNameMatch(object.getName())
                .map(ComponentSignatureDef::getName);
    }

    @Override
    public DesignCategory categorize(String componentType) {
        return atomicDesignTable.categorize(componentType);
    }

    @Override
    public String displayName(String originalName, String componentType) {
        String cleaned = NAME_PREFIX.matcher(originalName).replaceFirst("");
        cleaned = TRAILING_NUMBER.matcher(cleaned).replaceFirst("");

        if (cleaned.length() < 2) {
            return TextCase.titleCase(componentType);
        }
        return TextCase.titleCase(cleaned.replace('_', ' ').replace('-', ' '));
    }

    double score(ComponentSignatureDef signature, String lowerName, String type) {
        double score = 0.0;
        if (signature.matchesName(lowerName)) {
            score += NAME_MATCH_WEIGHT;
        }
        if (signature.matchesType(type)) {
            score += TYPE_MATCH_WEIGHT;
        }
        return score;
    }

    private static String fallbackType(String lowerName, String type) {
        if (lowerName.contains("button") || lowerName.contains("btn")) {
            return "button";
        } else if (lowerName.contains("input") || lowerName.contains("field")) {
            return "input";
        } else if (lowerName.contains("card") || lowerName.contains("panel")) {
            return "card";
        }
        return type.isEmpty() ? GENERIC_TYPE : type;
    }
}
