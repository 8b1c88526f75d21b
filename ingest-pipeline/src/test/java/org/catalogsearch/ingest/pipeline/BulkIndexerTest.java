package org.catalogsearch.ingest.pipeline;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.catalogsearch.ingest.mapping.model.BibliographicRecord;
import org.catalogsearch.ingest.pipeline.ir.ProgressCursor;
import org.catalogsearch.ingest.pipeline.sink.BatchWriteException;
import org.catalogsearch.ingest.pipeline.sink.CollectingDocumentSink;
import org.catalogsearch.ingest.pipeline.sink.DocumentSink;

import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import static org.junit.jupiter.api.Assertions.*;

class BulkIndexerTest {

    private static HandoffQueue<BibliographicRecord> closedQueueOf(int documents) throws InterruptedException {
        var queue = new HandoffQueue<BibliographicRecord>(documents + 1);
        for (var doc : TestRecords.documents(documents)) {
            queue.put(doc);
        }
        queue.close();
        return queue;
    }

    @Test
    void documentsAreWrittenInBatchesOfAtMostMaxDocs() throws Exception {
        var sink = new CollectingDocumentSink();

        long indexed = new BulkIndexer(closedQueueOf(12), sink, 5).call();

        assertEquals(12, indexed);
        assertEquals(12, sink.getCollectedDocuments().size());
        assertEquals(List.of(5, 5, 2), sink.getCursors().stream().map(ProgressCursor::docsInBatch).toList());
        assertEquals(List.of(1L, 2L, 3L), sink.getCursors().stream().map(ProgressCursor::batchNumber).toList());
    }

    @Test
    void emptyStreamWritesNothing() throws Exception {
        var sink = new CollectingDocumentSink();

        assertEquals(0L, new BulkIndexer(closedQueueOf(0), sink, 5).call());
        assertTrue(sink.getCursors().isEmpty());
    }

    @Test
    void failedBatchReportsEverythingConfirmedBeforeIt() throws Exception {
        var queue = closedQueueOf(12);
        var sink = new FailingSink(2, new BatchWriteException(2, 3, new RuntimeException("rejected")));

        var exception = assertThrows(BulkIndexingException.class, () -> new BulkIndexer(queue, sink, 5).call());

        assertEquals(8, exception.getConfirmedDocs());
        assertInstanceOf(BatchWriteException.class, exception.getCause());
        assertTrue(queue.isAbandoned());
    }

    @Test
    void unexpectedSinkErrorCountsOnlyEarlierBatches() throws Exception {
        var sink = new FailingSink(1, new IllegalStateException("connection reset"));

        var exception = assertThrows(BulkIndexingException.class, () -> new BulkIndexer(closedQueueOf(3), sink, 5).call());

        assertEquals(0, exception.getConfirmedDocs());
        assertEquals("connection reset", exception.getCause().getMessage());
    }

    @Test
    void batchSizeMustBePositive() {
        var queue = new HandoffQueue<BibliographicRecord>(1);
        var sink = new CollectingDocumentSink();

        assertThrows(IllegalArgumentException.class, () -> new BulkIndexer(queue, sink, 0));
    }

    /** Accepts every batch until the failing one. */
    static class FailingSink implements DocumentSink {
        private final int failingBatch;
        private final RuntimeException error;
        private final AtomicInteger batches = new AtomicInteger();

        FailingSink(int failingBatch, RuntimeException error) {
            this.failingBatch = failingBatch;
            this.error = error;
        }

        @Override
        public Mono<ProgressCursor> writeBatch(long batchNumber, List<BibliographicRecord> batch) {
            if (batches.incrementAndGet() == failingBatch) {
                return Mono.error(error);
            }
            return Mono.just(new ProgressCursor(batchNumber, batch.size(), 0));
        }
    }
}
