package org.catalogsearch.ingest.mapping.rules;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Maps one logical output field ({@code label}) to the record fields it is read from.
 */
public record Rule(
    @JsonProperty("label") String label,
    @JsonProperty("array") boolean array,
    @JsonProperty("fields") List<FieldSpec> fields
) {
    public Rule {
        fields = fields == null ? List.of() : List.copyOf(fields);
    }
}
