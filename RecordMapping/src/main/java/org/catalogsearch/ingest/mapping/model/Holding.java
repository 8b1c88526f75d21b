package org.catalogsearch.ingest.mapping.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Holding(
    @JsonProperty("location") String location,
    @JsonProperty("collection") String collection,
    @JsonProperty("call_number") String callNumber,
    @JsonProperty("summary") String summary,
    @JsonProperty("notes") String notes,
    @JsonProperty("format") String format
) {}
