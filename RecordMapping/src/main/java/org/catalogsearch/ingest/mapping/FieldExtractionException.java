package org.catalogsearch.ingest.mapping;

public class FieldExtractionException extends RecordMappingException {
    public FieldExtractionException(String recordIdentifier, String message) {
        super(recordIdentifier, message);
    }
}
