package com.purchasingpower.uicatalog.model.design;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root of a design-document export: files keyed by file id.
 *
 * <p>Maps are insertion ordered; the order of files, pages and objects is the
 * order in which objects are collected.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DesignDocument {

    @Builder.Default
    private Map<String, DesignFile> files = new LinkedHashMap<>();

    public Map<String, DesignFile> getFiles() {
        return files != null ? files : Map.of();
    }

    public static DesignDocument empty() {
        return new DesignDocument();
    }
}
