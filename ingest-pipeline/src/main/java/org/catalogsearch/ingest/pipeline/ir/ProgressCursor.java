package org.catalogsearch.ingest.pipeline.ir;

/**
 * Emitted by a sink after each batch it has written.
 */
public record ProgressCursor(
    long batchNumber,
    int docsInBatch,
    long bytesInBatch
) {}
