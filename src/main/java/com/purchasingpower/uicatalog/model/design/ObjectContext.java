package com.purchasingpower.uicatalog.model.design;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Provenance of a collected object within the source document.
 */
public record ObjectContext(
        @JsonProperty("file_id") String fileId,
        @JsonProperty("page_id") String pageId,
        @JsonProperty("object_id") String objectId
) {
}
