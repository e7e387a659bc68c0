package com.purchasingpower.uicatalog.model.design;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A single shape, group or text node from a design page.
 *
 * <p>Absent strings read as empty, absent numbers as 0, absent collections as empty.
 * Style fields stay {@code null} when the export does not carry them, since their
 * presence drives design-token extraction.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DesignObject {

    /**
     * Structural type, e.g. "rectangle", "group", "text".
     */
    private String type;

    private String name;

    private double width;
    private double height;
    private double x;
    private double y;

    private String fill;
    private String stroke;

    @JsonProperty("font_family")
    private String fontFamily;

    @JsonProperty("font_size")
    private Double fontSize;

    @JsonProperty("font_weight")
    private String fontWeight;

    @JsonProperty("line_height")
    private Double lineHeight;

    private String shadow;
    private Double blur;

    /**
     * Ids of child objects, in paint order.
     */
    @Builder.Default
    private List<String> children = new ArrayList<>();

    /**
     * Tri-state so that only an explicit {@code false} marks the object hidden.
     */
    private Boolean visible;

    private boolean locked;

    /**
     * Extra exporter-specific attributes.
     */
    @Builder.Default
    private Map<String, Object> properties = new LinkedHashMap<>();

    public String getType() {
        return type != null ? type : "";
    }

    public String getName() {
        return name != null ? name : "";
    }

    public List<String> getChildren() {
        return children != null ? children : List.of();
    }

    public Map<String, Object> getProperties() {
        return properties != null ? properties : Map.of();
    }

    @JsonIgnore
    public boolean isHidden() {
        return Boolean.FALSE.equals(visible);
    }

    @JsonIgnore
    public boolean isText() {
        return "text".equals(getType());
    }
}
