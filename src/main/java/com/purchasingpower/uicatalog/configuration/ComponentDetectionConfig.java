package com.purchasingpower.uicatalog.configuration;

import com.purchasingpower.uicatalog.model.signature.AtomicDesignTable;
import com.purchasingpower.uicatalog.model.signature.ComponentSignatureRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the immutable detection lookups from configuration.
 * A malformed registry fails here, while the context starts.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ComponentDetectionProperties.class)
public class ComponentDetectionConfig {

    @Bean
    public ComponentSignatureRegistry componentSignatureRegistry(ComponentDetectionProperties properties) {
        if (properties.getSignatures() == null || properties.getSignatures().isEmpty()) {
            log.info("No component signatures configured, using built-in registry");
            return ComponentSignatureRegistry.defaults();
        }
        ComponentSignatureRegistry registry = new ComponentSignatureRegistry(properties.getSignatures());
        log.info("Initialized component signature registry with {} signatures", registry.size());
        return registry;
    }

    @Bean
    public AtomicDesignTable atomicDesignTable(ComponentDetectionProperties properties) {
        if (properties.getCategories() == null || properties.getCategories().isEmpty()) {
            return AtomicDesignTable.defaults();
        }
        return new AtomicDesignTable(properties.getCategories());
    }
}
