package org.catalogsearch.ingest.mapping;

public class MissingTitleException extends RecordMappingException {
    public MissingTitleException(String recordIdentifier) {
        super(recordIdentifier, "Record " + recordIdentifier + " has no title, check validity");
    }
}
