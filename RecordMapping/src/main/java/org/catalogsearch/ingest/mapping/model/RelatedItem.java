package org.catalogsearch.ingest.mapping.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RelatedItem(
    @JsonProperty("kind") String kind,
    @JsonProperty("value") List<String> value
) {
    public RelatedItem {
        value = List.copyOf(value);
    }
}
