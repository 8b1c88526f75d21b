package org.catalogsearch.ingest.mapping.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Contributor(
    @JsonProperty("kind") String kind,
    @JsonProperty("value") List<String> value
) {
    public Contributor {
        value = List.copyOf(value);
    }
}
