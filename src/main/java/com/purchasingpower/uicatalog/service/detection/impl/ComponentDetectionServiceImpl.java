package com.purchasingpower.uicatalog.service.detection.impl;

import com.purchasingpower.uicatalog.exception.ComponentDetectionException;
import com.purchasingpower.uicatalog.model.catalog.CatalogEntry;
import com.purchasingpower.uicatalog.model.catalog.CatalogSummary;
import com.purchasingpower.uicatalog.model.catalog.ComponentCatalog;
import com.purchasingpower.uicatalog.model.catalog.ComponentPatterns;
import com.purchasingpower.uicatalog.model.catalog.DesignSystemReport;
import com.purchasingpower.uicatalog.model.catalog.DesignTokenAggregate;
import com.purchasingpower.uicatalog.model.catalog.DetectedComponent;
import com.purchasingpower.uicatalog.model.catalog.QualityAssessment;
import com.purchasingpower.uicatalog.model.catalog.ReusabilityAnalysis;
import com.purchasingpower.uicatalog.model.catalog.UsagePattern;
import com.purchasingpower.uicatalog.model.design.CollectedObject;
import com.purchasingpower.uicatalog.model.design.DesignDocument;
import com.purchasingpower.uicatalog.model.design.DesignObject;
import com.purchasingpower.uicatalog.model.design.ObjectContext;
import com.purchasingpower.uicatalog.model.grouping.GroupingResult;
import com.purchasingpower.uicatalog.model.grouping.ObjectGroup;
import com.purchasingpower.uicatalog.service.classification.ComponentClassifier;
import com.purchasingpower.uicatalog.service.collector.ObjectCollector;
import com.purchasingpower.uicatalog.service.detection.ComponentDetectionService;
import com.purchasingpower.uicatalog.service.detection.GroupingEngine;
import com.purchasingpower.uicatalog.service.designsystem.ComponentPatternAnalyzer;
import com.purchasingpower.uicatalog.service.designsystem.DesignSystemAnalyzer;
import com.purchasingpower.uicatalog.service.quality.QualityAssessor;
import com.purchasingpower.uicatalog.service.scoring.ComponentScorer;
import com.purchasingpower.uicatalog.service.tokens.DesignTokenExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class ComponentDetectionServiceImpl implements ComponentDetectionService {

    private final ObjectCollector objectCollector;
    private final GroupingEngine groupingEngine;
    private final ComponentClassifier classifier;
    private final ComponentScorer scorer;
    private final DesignTokenExtractor tokenExtractor;
    private final ComponentPatternAnalyzer patternAnalyzer;
    private final DesignSystemAnalyzer designSystemAnalyzer;
    private final QualityAssessor qualityAssessor;

    @Override
    public ComponentCatalog detectComponents(DesignDocument document) {
        if (document == null) {
            throw new IllegalArgumentException("Design document must not be null");
        }
        log.info("🔍 Starting component detection...");

        try {
            List<CollectedObject> objects = objectCollector.collect(document);
            if (objects.isEmpty()) {
                log.warn("⚠️ Design document contains no objects, producing an empty catalog");
            }

            List<DetectedComponent> components = detect(objects);

            ComponentPatterns patterns = patternAnalyzer.analyze(components);
            DesignSystemReport designSystem = designSystemAnalyzer.analyze(components);
            DesignTokenAggregate tokens = tokenExtractor.aggregate(objects);
            ReusabilityAnalysis reusability = designSystemAnalyzer.analyzeReusability(components);
            Map<String, List<CatalogEntry>> catalog = designSystemAnalyzer.buildCatalog(components, designSystem);
            QualityAssessment quality = qualityAssessor.assess(components, designSystem);

            CatalogSummary summary = CatalogSummary.builder()
                    .totalObjectsAnalyzed(objects.size())
                    .componentsDetected(components.size())
                    .componentTypes((int) components.stream().map(DetectedComponent::getComponentType).distinct().count())
                    .categoriesFound(designSystem.getCategoriesFound().size())
                    .categoryCoverage(designSystem.getCategoryCoverage())
                    .averageReusability(reusability.getAverageReusability())
                    .build();

            log.info("✅ Detected {} components across {} design categories (grade {})",
                    components.size(), designSystem.getCategoriesFound().size(), quality.getQualityGrade());

            return ComponentCatalog.builder()
                    .summary(summary)
                    .detectedComponents(components)
                    .componentPatterns(patterns)
                    .designSystem(designSystem)
                    .designTokens(tokens)
                    .reusabilityAnalysis(reusability)
                    .componentCatalog(catalog)
                    .qualityAssessment(quality)
                    .recommendations(qualityAssessor.recommendations(quality, designSystem))
                    .build();

        } catch (RuntimeException e) {
            log.error("❌ Component detection failed: {}", e.getMessage(), e);
            throw new ComponentDetectionException("Component detection failed", e);
        }
    }

    @Override
    public List<DetectedComponent> detect(List<CollectedObject> objects) {
        GroupingResult grouping = groupingEngine.group(objects);
        List<DetectedComponent> components = new ArrayList<>();

        for (ObjectGroup group : grouping.candidates()) {
            components.add(fromGroup(group));
        }

        for (CollectedObject collected : grouping.unclaimed()) {
            fromIndividual(collected).ifPresent(components::add);
        }

        log.debug("{} group components, {} individual components",
                grouping.candidates().size(), components.size() - grouping.candidates().size());
        return List.copyOf(components);
    }

    private DetectedComponent fromGroup(ObjectGroup group) {
        DesignObject representative = group.representative().object();
        String componentType = classifier.classify(representative);

        return DetectedComponent.builder()
                .id(newComponentId())
                .name(classifier.displayName(representative.getName(), componentType))
                .componentType(componentType)
                .category(classifier.categorize(componentType))
                .instances(group.members().stream().map(CollectedObject::context).toList())
                .properties(scorer.propertySnapshot(representative))
                .usagePattern(scorer.usagePattern(group.size()))
                .reusabilityScore(scorer.reusability(group.size()))
                .complexityScore(scorer.complexity(representative))
                .designTokens(tokenExtractor.objectTokens(representative))
                .accessibilityFeatures(scorer.accessibilityFeatures(representative))
                .build();
    }

    private Optional<DetectedComponent> fromIndividual(CollectedObject collected) {
        DesignObject object = collected.object();
        return classifier.classifyIndividually(object).map(componentType -> DetectedComponent.builder()
                .id(newComponentId())
                .name(classifier.displayName(object.getName().toLowerCase(Locale.ROOT), componentType))
                .componentType(componentType)
                .category(classifier.categorize(componentType))
                .instances(List.<ObjectContext>of(collected.context()))
                .properties(scorer.propertySnapshot(object))
                .usagePattern(UsagePattern.SINGLE_USE)
                .reusabilityScore(ComponentScorer.INDIVIDUAL_REUSABILITY)
                .complexityScore(scorer.complexity(object))
                .designTokens(tokenExtractor.objectTokens(object))
                .accessibilityFeatures(scorer.accessibilityFeatures(object))
                .build());
    }

    private static String newComponentId() {
        return UUID.randomUUID().toString();
    }
}
