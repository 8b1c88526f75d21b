package org.catalogsearch.ingest.common;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.LinkedHashMap;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One {@code index} action of a bulk request: the action line followed by the document source.
 * A document without an id is indexed under an id the cluster assigns.
 */
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
@ToString(onlyExplicitlyIncluded = true)
public class BulkDocSection {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final String NEWLINE = "\n";

    @EqualsAndHashCode.Include
    @ToString.Include
    @Getter
    private final String docId;
    @EqualsAndHashCode.Include
    @ToString.Include
    @Getter
    private final String indexName;
    private final String source;

    public BulkDocSection(String docId, String indexName, String source) {
        this.docId = docId == null || docId.isBlank() ? null : docId;
        this.indexName = indexName;
        this.source = source;
    }

    public static BulkDocSection fromDocument(String docId, String indexName, Object document) {
        try {
            return new BulkDocSection(docId, indexName, OBJECT_MAPPER.writeValueAsString(document));
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to serialize document " + docId + ": " + e.getMessage(), e);
        }
    }

    public static String convertToBulkRequestBody(Collection<BulkDocSection> bulkSections) {
        var body = new StringBuilder();
        for (var section : bulkSections) {
            body.append(section.asString()).append(NEWLINE);
        }
        return body.toString();
    }

    public String asString() {
        var metadata = new LinkedHashMap<String, String>();
        metadata.put("_index", indexName);
        if (docId != null) {
            metadata.put("_id", docId);
        }
        var action = new LinkedHashMap<String, Object>();
        action.put("index", metadata);
        try {
            return OBJECT_MAPPER.writeValueAsString(action) + NEWLINE + source;
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to write bulk action for " + docId + ": " + e.getMessage(), e);
        }
    }

    public String getSource() {
        return source;
    }

    public long getSerializedLength() {
        return asString().getBytes(StandardCharsets.UTF_8).length + 1L;
    }

    public static class SerializationException extends RuntimeException {
        public SerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
