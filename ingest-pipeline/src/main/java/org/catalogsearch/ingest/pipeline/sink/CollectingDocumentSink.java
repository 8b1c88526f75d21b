package org.catalogsearch.ingest.pipeline.sink;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.catalogsearch.ingest.mapping.model.BibliographicRecord;
import org.catalogsearch.ingest.pipeline.ir.ProgressCursor;

import reactor.core.publisher.Mono;

/**
 * Keeps every document in memory, for running the pipeline without a cluster.
 */
public class CollectingDocumentSink implements DocumentSink {

    private final List<BibliographicRecord> collectedDocuments = new CopyOnWriteArrayList<>();
    private final List<ProgressCursor> cursors = new CopyOnWriteArrayList<>();
    private volatile boolean closed;

    @Override
    public Mono<ProgressCursor> writeBatch(long batchNumber, List<BibliographicRecord> batch) {
        return Mono.fromCallable(() -> {
            collectedDocuments.addAll(batch);
            var cursor = new ProgressCursor(batchNumber, batch.size(), 0);
            cursors.add(cursor);
            return cursor;
        });
    }

    @Override
    public void close() {
        closed = true;
    }

    public List<BibliographicRecord> getCollectedDocuments() {
        return Collections.unmodifiableList(collectedDocuments);
    }

    public List<ProgressCursor> getCursors() {
        return Collections.unmodifiableList(cursors);
    }

    public boolean isClosed() {
        return closed;
    }
}
