package org.catalogsearch.ingest.pipeline;

import java.util.concurrent.Callable;

import org.catalogsearch.ingest.mapping.RecordMapper;
import org.catalogsearch.ingest.mapping.RecordMappingException;
import org.catalogsearch.ingest.mapping.marc.DecodedRecord;
import org.catalogsearch.ingest.mapping.marc.RecordDecoder;
import org.catalogsearch.ingest.mapping.model.BibliographicRecord;
import org.catalogsearch.ingest.pipeline.ir.StreamStats;

import lombok.extern.slf4j.Slf4j;

/**
 * Producer side of an ingest run.  Decodes and maps records one at a time and hands each
 * document to the queue.  Records that cannot be decoded or mapped are logged and skipped.
 * The queue is always closed when the streamer stops, whatever the reason.
 */
@Slf4j
public class RecordStreamer implements Callable<StreamStats> {
    private final RecordDecoder decoder;
    private final RecordMapper mapper;
    private final HandoffQueue<BibliographicRecord> queue;
    private final int maxConsecutiveDecodeFailures;

    private long recordsRead;
    private long documentsEmitted;
    private long decodeFailures;
    private long mappingFailures;

    /**
     * @param maxConsecutiveDecodeFailures how many undecodable records in a row end the stream,
     *                                     0 to keep reading regardless
     */
    public RecordStreamer(
        RecordDecoder decoder,
        RecordMapper mapper,
        HandoffQueue<BibliographicRecord> queue,
        int maxConsecutiveDecodeFailures
    ) {
        this.decoder = decoder;
        this.mapper = mapper;
        this.queue = queue;
        this.maxConsecutiveDecodeFailures = maxConsecutiveDecodeFailures;
    }

    @Override
    public StreamStats call() throws InterruptedException {
        int consecutiveDecodeFailures = 0;
        try {
            while (!queue.isAbandoned() && decoder.hasNext()) {
                var decoded = decoder.next();
                recordsRead++;
                if (!decoded.isDecoded()) {
                    decodeFailures++;
                    consecutiveDecodeFailures++;
                    logDecodeFailure(decoded);
                    if (maxConsecutiveDecodeFailures > 0 && consecutiveDecodeFailures >= maxConsecutiveDecodeFailures) {
                        throw new DecodeFailureLimitExceededException(
                            consecutiveDecodeFailures, decoded.position(), stats(), decoded.error());
                    }
                    continue;
                }
                consecutiveDecodeFailures = 0;

                BibliographicRecord document;
                try {
                    document = mapper.map(decoded.record());
                } catch (RecordMappingException e) {
                    mappingFailures++;
                    log.atWarn().setMessage("Skipping record {} at position {}: {}")
                        .addArgument(e::getRecordIdentifier)
                        .addArgument(decoded::position)
                        .addArgument(e::getMessage)
                        .log();
                    continue;
                }

                if (!queue.put(document)) {
                    log.warn("Indexing has stopped, no more records will be read");
                    break;
                }
                documentsEmitted++;
            }
        } finally {
            queue.close();
            log.atInfo().setMessage("Record stream finished: {}").addArgument(this::stats).log();
        }
        return stats();
    }

    private void logDecodeFailure(DecodedRecord decoded) {
        log.atWarn().setMessage("Skipping undecodable record at position {}: {}")
            .addArgument(decoded::position)
            .addArgument(() -> decoded.error().getMessage())
            .setCause(decoded.error())
            .log();
    }

    public StreamStats stats() {
        return new StreamStats(recordsRead, documentsEmitted, decodeFailures, mappingFailures);
    }
}
