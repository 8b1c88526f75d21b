package org.catalogsearch.ingest.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** One row of {@code _cat/aliases}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AliasInfo(
    @JsonProperty("alias") String alias,
    @JsonProperty("index") String index
) {}
