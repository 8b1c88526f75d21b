package org.catalogsearch.ingest.pipeline;

import org.catalogsearch.ingest.pipeline.ir.StreamStats;

import lombok.Getter;

public class DecodeFailureLimitExceededException extends IngestException {
    @Getter
    private final transient StreamStats streamStats;

    public DecodeFailureLimitExceededException(int consecutiveFailures, long position, StreamStats streamStats, Throwable lastError) {
        super(consecutiveFailures + " consecutive records could not be decoded, the last at position " + position, lastError);
        this.streamStats = streamStats;
    }
}
