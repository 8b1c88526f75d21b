package org.catalogsearch.ingest.mapping.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Electronic access point taken from an 856 field. */
public record Link(
    @JsonProperty("kind") String kind,
    @JsonProperty("text") String text,
    @JsonProperty("url") String url,
    @JsonProperty("restrictions") String restrictions
) {
    public static final String UNKNOWN_KIND = "unknown";
}
