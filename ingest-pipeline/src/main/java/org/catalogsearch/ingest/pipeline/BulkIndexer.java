package org.catalogsearch.ingest.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.catalogsearch.ingest.mapping.model.BibliographicRecord;
import org.catalogsearch.ingest.pipeline.sink.BatchWriteException;
import org.catalogsearch.ingest.pipeline.sink.DocumentSink;

import lombok.extern.slf4j.Slf4j;
import reactor.core.Exceptions;

/**
 * Consumer side of an ingest run.  Drains the queue in batches of at most
 * {@code maxDocsPerBatch} and writes them to the sink one after another, on the calling thread.
 *
 * <p>If a batch fails the queue is abandoned, which stops the producer, and a
 * {@link BulkIndexingException} reports how many documents the sink had confirmed.
 */
@Slf4j
public class BulkIndexer implements Callable<Long> {
    public static final int DEFAULT_MAX_DOCS_PER_BATCH = 1000;

    private final HandoffQueue<BibliographicRecord> queue;
    private final DocumentSink sink;
    private final int maxDocsPerBatch;

    private long confirmed;
    private long batchNumber;

    public BulkIndexer(HandoffQueue<BibliographicRecord> queue, DocumentSink sink, int maxDocsPerBatch) {
        if (maxDocsPerBatch < 1) {
            throw new IllegalArgumentException("Batches must hold at least one document, was " + maxDocsPerBatch);
        }
        this.queue = queue;
        this.sink = sink;
        this.maxDocsPerBatch = maxDocsPerBatch;
    }

    @Override
    public Long call() {
        var batch = new ArrayList<BibliographicRecord>();
        try {
            var next = queue.take();
            while (next.isPresent()) {
                batch.add(next.get());
                if (batch.size() >= maxDocsPerBatch) {
                    write(batch);
                    batch = new ArrayList<>();
                }
                next = queue.take();
            }
            if (!batch.isEmpty()) {
                write(batch);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw stop(e);
        } catch (RuntimeException e) {
            throw stop(Exceptions.unwrap(e));
        }
        log.atInfo().setMessage("Indexing finished, {} documents confirmed in {} batches")
            .addArgument(confirmed)
            .addArgument(batchNumber)
            .log();
        return confirmed;
    }

    private void write(List<BibliographicRecord> batch) {
        batchNumber++;
        var cursor = sink.writeBatch(batchNumber, batch).block();
        if (cursor == null) {
            throw new IllegalStateException("Sink reported no progress for batch " + batchNumber);
        }
        confirmed += cursor.docsInBatch();
        log.atDebug().setMessage("Batch {} confirmed, {} documents so far")
            .addArgument(batchNumber)
            .addArgument(confirmed)
            .log();
    }

    private BulkIndexingException stop(Throwable cause) {
        queue.abandon();
        long total = confirmed;
        if (cause instanceof BatchWriteException) {
            total += ((BatchWriteException) cause).getConfirmedDocs();
        }
        log.atError().setMessage("Indexing stopped at batch {} with {} documents confirmed")
            .addArgument(batchNumber)
            .addArgument(total)
            .setCause(cause)
            .log();
        return new BulkIndexingException(total, cause);
    }
}
