package org.catalogsearch.ingest.pipeline.sink;

import org.catalogsearch.ingest.pipeline.IngestException;

import lombok.Getter;

public class BatchWriteException extends IngestException {
    /** Documents of the failed batch that were written anyway */
    @Getter
    private final int confirmedDocs;

    public BatchWriteException(long batchNumber, int confirmedDocs, Throwable cause) {
        super("Batch " + batchNumber + " failed after " + confirmedDocs + " documents were written", cause);
        this.confirmedDocs = confirmedDocs;
    }
}
