package org.catalogsearch.ingest.mapping;

import lombok.Getter;

/**
 * A single record could not be turned into a document. The record is skipped; the run goes on.
 */
public class RecordMappingException extends RuntimeException {
    @Getter
    private final String recordIdentifier;

    public RecordMappingException(String recordIdentifier, String message) {
        super(message);
        this.recordIdentifier = recordIdentifier;
    }

    public RecordMappingException(String recordIdentifier, String message, Throwable cause) {
        super(message, cause);
        this.recordIdentifier = recordIdentifier;
    }
}
