package org.catalogsearch.ingest.pipeline.ir;

/**
 * Counts kept by the record streamer over one input stream.
 */
public record StreamStats(
    long recordsRead,
    long documentsEmitted,
    long decodeFailures,
    long mappingFailures
) {
    public static final StreamStats EMPTY = new StreamStats(0, 0, 0, 0);
}
