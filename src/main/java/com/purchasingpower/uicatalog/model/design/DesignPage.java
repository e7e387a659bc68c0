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
public class DesignPage {

    private String name;

    @Builder.Default
    private Map<String, DesignObject> objects = new LinkedHashMap<>();

    public Map<String, DesignObject> getObjects() {
        return objects != null ? objects : Map.of();
    }
}
