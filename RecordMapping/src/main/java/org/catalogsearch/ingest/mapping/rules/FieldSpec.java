package org.catalogsearch.ingest.mapping.rules;

import java.util.Optional;

import org.catalogsearch.ingest.mapping.ConfigurationException;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One source of values for a {@link Rule}: a tag, the subfield codes to join (all of them when
 * empty), an optional byte range over the joined value, and an optional role.
 */
public record FieldSpec(
    @JsonProperty("tag") String tag,
    @JsonProperty("subfields") String subfields,
    @JsonProperty("bytes") String bytes,
    @JsonProperty("kind") String kind
) {
    public FieldSpec {
        if (tag == null || tag.isBlank()) {
            throw new ConfigurationException("Field specification is missing its tag");
        }
        tag = tag.trim();
        subfields = subfields == null ? "" : subfields;
        bytes = bytes == null ? "" : bytes.trim();
        kind = kind == null ? "" : kind;
        if (!bytes.isEmpty()) {
            ByteRange.parse(bytes);
        }
    }

    public static FieldSpec of(String tag, String subfields) {
        return new FieldSpec(tag, subfields, null, null);
    }

    @JsonIgnore
    public Optional<ByteRange> byteRange() {
        return bytes.isEmpty() ? Optional.empty() : Optional.of(ByteRange.parse(bytes));
    }

    public boolean collects(char subfieldCode) {
        return subfields.isEmpty() || subfields.indexOf(subfieldCode) >= 0;
    }
}
