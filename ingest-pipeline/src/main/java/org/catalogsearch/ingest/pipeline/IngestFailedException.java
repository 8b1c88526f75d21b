package org.catalogsearch.ingest.pipeline;

import org.catalogsearch.ingest.pipeline.ir.IngestResult;

import lombok.Getter;

/** An ingest run stopped early.  The partial result says how far it got. */
public class IngestFailedException extends IngestException {
    @Getter
    private final transient IngestResult partialResult;

    public IngestFailedException(String message, IngestResult partialResult, Throwable cause) {
        super(message, cause);
        this.partialResult = partialResult;
    }
}
