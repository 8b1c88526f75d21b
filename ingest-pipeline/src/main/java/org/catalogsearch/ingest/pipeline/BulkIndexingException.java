package org.catalogsearch.ingest.pipeline;

import lombok.Getter;

/** A batch could not be written; indexing stopped after {@code confirmedDocs} documents. */
public class BulkIndexingException extends IngestException {
    @Getter
    private final long confirmedDocs;

    public BulkIndexingException(long confirmedDocs, Throwable cause) {
        super("Bulk indexing stopped after " + confirmedDocs + " confirmed documents: " + cause.getMessage(), cause);
        this.confirmedDocs = confirmedDocs;
    }
}
