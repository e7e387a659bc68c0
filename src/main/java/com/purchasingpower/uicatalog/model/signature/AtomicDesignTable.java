package com.purchasingpower.uicatalog.model.signature;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Static lookup of component types per atomic-design tier.
 */
public final class AtomicDesignTable {

    private final Map<DesignCategory, List<String>> typesByCategory;

    public AtomicDesignTable(Map<DesignCategory, List<String>> typesByCategory) {
        EnumMap<DesignCategory, List<String>> copy = new EnumMap<>(DesignCategory.class);
        for (DesignCategory category : DesignCategory.values()) {
            List<String> types = typesByCategory != null ? typesByCategory.get(category) : null;
            copy.put(category, types != null ? List.copyOf(types) : List.of());
        }
        this.typesByCategory = Collections.unmodifiableMap(copy);
    }

    /**
     * First tier, in hierarchy order, listing the component type; {@link DesignCategory#DEFAULT} otherwise.
     */
    public DesignCategory categorize(String componentType) {
        for (DesignCategory category : DesignCategory.values()) {
            if (typesByCategory.get(category).contains(componentType)) {
                return category;
            }
        }
        return DesignCategory.DEFAULT;
    }

    public static AtomicDesignTable defaults() {
        Map<DesignCategory, List<String>> table = new EnumMap<>(DesignCategory.class);
        table.put(DesignCategory.ATOMS, List.of("button", "input", "icon", "text", "image", "divider"));
        table.put(DesignCategory.MOLECULES, List.of("search-bar", "form-field", "card-header", "navigation-item"));
        table.put(DesignCategory.ORGANISMS, List.of("header", "footer", "sidebar", "form", "card", "modal", "table"));
        table.put(DesignCategory.TEMPLATES, List.of("layout", "page", "section", "grid"));
        table.put(DesignCategory.PAGES, List.of("dashboard", "profile", "settings", "login"));
        return new AtomicDesignTable(table);
    }
}
