package org.catalogsearch.ingest.pipeline.ir;

/**
 * Outcome of an ingest run.
 *
 * @param target the index, or the output, the documents went to
 * @param documentsIndexed documents the sink confirmed
 */
public record IngestResult(
    String target,
    long documentsIndexed,
    StreamStats streamStats,
    boolean promoted
) {
    public IngestResult promotedResult() {
        return new IngestResult(target, documentsIndexed, streamStats, true);
    }
}
