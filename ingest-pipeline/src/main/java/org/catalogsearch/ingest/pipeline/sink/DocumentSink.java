package org.catalogsearch.ingest.pipeline.sink;

import java.io.IOException;
import java.util.List;

import org.catalogsearch.ingest.mapping.model.BibliographicRecord;
import org.catalogsearch.ingest.pipeline.ir.ProgressCursor;

import reactor.core.publisher.Mono;

/**
 * Where mapped documents go: a search cluster, standard output, a test collector.
 */
public interface DocumentSink extends AutoCloseable {

    /**
     * Write a batch of documents.
     * Returns a progress cursor once the whole batch is written.  A batch that is only partly
     * written fails with a {@link BatchWriteException} saying how much of it went through.
     */
    Mono<ProgressCursor> writeBatch(long batchNumber, List<BibliographicRecord> batch);

    @Override
    default void close() throws IOException {
        // Default no-op
    }
}
