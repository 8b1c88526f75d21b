package org.catalogsearch.ingest.pipeline;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.catalogsearch.ingest.mapping.RecordMapper;
import org.catalogsearch.ingest.mapping.marc.RecordDecoder;
import org.catalogsearch.ingest.mapping.model.BibliographicRecord;
import org.catalogsearch.ingest.pipeline.ir.IngestResult;
import org.catalogsearch.ingest.pipeline.ir.StreamStats;
import org.catalogsearch.ingest.pipeline.sink.DocumentSink;

import io.netty.util.concurrent.DefaultThreadFactory;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a {@link RecordStreamer} and a {@link BulkIndexer} on two threads joined by a
 * {@link HandoffQueue}.  It knows nothing about where the records come from or where the
 * documents go.
 */
@Slf4j
public class IngestPipeline {
    private final RecordMapper mapper;
    private final DocumentSink sink;
    private final int queueCapacity;
    private final int maxDocsPerBatch;
    private final int maxConsecutiveDecodeFailures;

    public IngestPipeline(
        RecordMapper mapper,
        DocumentSink sink,
        int queueCapacity,
        int maxDocsPerBatch,
        int maxConsecutiveDecodeFailures
    ) {
        this.mapper = mapper;
        this.sink = sink;
        this.queueCapacity = queueCapacity;
        this.maxDocsPerBatch = maxDocsPerBatch;
        this.maxConsecutiveDecodeFailures = maxConsecutiveDecodeFailures;
    }

    /**
     * Streams every record from the decoder into the sink.
     *
     * @param target name of the index or output the sink writes to, for reporting
     * @throws IngestFailedException if either side stopped early; it carries the partial result
     */
    public IngestResult run(RecordDecoder decoder, String target) {
        var queue = new HandoffQueue<BibliographicRecord>(queueCapacity);
        var streamer = new RecordStreamer(decoder, mapper, queue, maxConsecutiveDecodeFailures);
        var indexer = new BulkIndexer(queue, sink, maxDocsPerBatch);

        var executor = Executors.newFixedThreadPool(2, new DefaultThreadFactory("ingest"));
        try {
            Future<StreamStats> producer = executor.submit(streamer);
            Future<Long> consumer = executor.submit(indexer);

            Throwable failure = null;
            long indexed;
            try {
                indexed = consumer.get();
            } catch (ExecutionException e) {
                failure = e.getCause();
                indexed = failure instanceof BulkIndexingException ? ((BulkIndexingException) failure).getConfirmedDocs() : 0;
            }

            StreamStats stats;
            try {
                stats = producer.get();
            } catch (ExecutionException e) {
                var cause = e.getCause();
                if (failure == null) {
                    failure = cause;
                }
                stats = cause instanceof DecodeFailureLimitExceededException
                    ? ((DecodeFailureLimitExceededException) cause).getStreamStats()
                    : streamer.stats();
            }

            var result = new IngestResult(target, indexed, stats, false);
            log.atInfo().setMessage("Ingested {} documents into {} ({} records read, {} undecodable, {} unmappable)")
                .addArgument(indexed)
                .addArgument(target)
                .addArgument(stats::recordsRead)
                .addArgument(stats::decodeFailures)
                .addArgument(stats::mappingFailures)
                .log();
            if (failure != null) {
                throw new IngestFailedException("Ingest into " + target + " failed: " + failure.getMessage(), result, failure);
            }
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            queue.abandon();
            throw new IngestFailedException("Ingest into " + target + " was interrupted",
                new IngestResult(target, 0, streamer.stats(), false), e);
        } finally {
            executor.shutdownNow();
        }
    }
}
