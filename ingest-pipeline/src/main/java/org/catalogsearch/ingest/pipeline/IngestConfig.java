package org.catalogsearch.ingest.pipeline;

import java.util.Arrays;
import java.util.Locale;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Builder;
import lombok.Value;

/**
 * Settings for one ingest run.
 */
@Value
@Builder
public class IngestConfig {
    public static final String DEFAULT_PREFIX = "aleph";

    public enum Consumer {
        /** Bulk index into the cluster */
        ES,
        /** A JSON array of documents on standard output */
        JSON,
        /** One title per line on standard output */
        TITLE;

        public static Consumer fromName(String name) {
            try {
                return valueOf(name.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown consumer '" + name + "', expected one of "
                    + Arrays.toString(values()).toLowerCase(Locale.ROOT), e);
            }
        }
    }

    @Builder.Default
    Consumer consumer = Consumer.ES;
    /** Index to write into; when null a new one is named from the prefix and the start time */
    String indexName;
    @Builder.Default
    String prefix = DEFAULT_PREFIX;
    /** Point the prefix alias at the new index once every record is in */
    boolean promote;
    /** Settings and mappings for the index when it has to be created, may be null */
    ObjectNode indexSettings;
    @Builder.Default
    int maxDocsPerBatch = BulkIndexer.DEFAULT_MAX_DOCS_PER_BATCH;
    @Builder.Default
    int queueCapacity = HandoffQueue.DEFAULT_CAPACITY;
    /** 0 means undecodable records never stop the run */
    int maxConsecutiveDecodeFailures;
}
