package org.catalogsearch.ingest.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** One row of {@code _cat/indices}. Counts arrive as strings and may be absent for closed indices. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IndexInfo(
    @JsonProperty("index") String name,
    @JsonProperty("health") String health,
    @JsonProperty("status") String status,
    @JsonProperty("uuid") String uuid,
    @JsonProperty("docs.count") String docsCount,
    @JsonProperty("store.size") String storeSize
) {}
