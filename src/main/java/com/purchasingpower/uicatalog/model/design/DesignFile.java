package com.purchasingpower.uicatalog.model.design;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DesignFile {

    private String name;

    @Builder.Default
    private Map<String, DesignPage> pages = new LinkedHashMap<>();

    public Map<String, DesignPage> getPages() {
        return pages != null ? pages : Map.of();
    }
}
