package org.catalogsearch.ingest.pipeline;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

import org.catalogsearch.ingest.common.IndexLifecycleManager;
import org.catalogsearch.ingest.common.SearchClient;
import org.catalogsearch.ingest.mapping.RecordMapper;
import org.catalogsearch.ingest.mapping.marc.MarcRecordDecoder;
import org.catalogsearch.ingest.pipeline.ir.IngestResult;
import org.catalogsearch.ingest.pipeline.sink.DocumentSink;
import org.catalogsearch.ingest.pipeline.sink.JsonDocumentSink;
import org.catalogsearch.ingest.pipeline.sink.OpenSearchDocumentSink;
import org.catalogsearch.ingest.pipeline.sink.TitleDocumentSink;

import lombok.extern.slf4j.Slf4j;

/**
 * Entry point for loading a record dump.  Picks the sink, prepares the index, runs the
 * pipeline and, when asked and only after a complete run, promotes the new index.
 */
@Slf4j
public class Ingester {
    static final DateTimeFormatter INDEX_TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyy-MM-dd't'HH-mm-ss").withZone(ZoneOffset.UTC);

    private final RecordMapper mapper;
    private final SearchClient client;
    private final OutputStream out;
    private final Clock clock;

    /**
     * @param client the cluster to write to; only needed by the {@code es} consumer
     * @param out where the {@code json} and {@code title} consumers print
     */
    public Ingester(RecordMapper mapper, SearchClient client, OutputStream out) {
        this(mapper, client, out, Clock.systemUTC());
    }

    Ingester(RecordMapper mapper, SearchClient client, OutputStream out, Clock clock) {
        this.mapper = mapper;
        this.client = client;
        this.out = out;
        this.clock = clock;
    }

    public String defaultIndexName(String prefix) {
        return prefix + "-" + INDEX_TIMESTAMP.format(clock.instant());
    }

    /**
     * @throws IngestFailedException if the run stopped before every record was handled
     */
    public IngestResult ingest(InputStream records, IngestConfig config) {
        var decoder = new MarcRecordDecoder(records);
        if (config.getConsumer() != IngestConfig.Consumer.ES) {
            if (config.isPromote()) {
                log.warn("Nothing to promote when writing to standard output, ignoring promote");
            }
            return run(decoder, openOutputSink(config.getConsumer()), config, "stdout");
        }

        if (client == null) {
            throw new IllegalStateException("A search client is required to index into a cluster");
        }
        var indexName = config.getIndexName() != null ? config.getIndexName() : defaultIndexName(config.getPrefix());
        if (!client.createIndex(indexName, config.getIndexSettings())) {
            log.atInfo().setMessage("Writing into existing index {}").addArgument(indexName).log();
        }

        var result = run(decoder, new OpenSearchDocumentSink(client, indexName), config, indexName);
        var refresh = client.refresh(indexName);
        if (!refresh.isSuccessful()) {
            log.atWarn().setMessage("Refresh of {} answered {}").addArgument(indexName).addArgument(refresh.statusCode).log();
        }
        if (!config.isPromote()) {
            return result;
        }
        var promotion = new IndexLifecycleManager(client).promote(indexName, config.getPrefix());
        log.atInfo().setMessage("Promoted {} to {}, replacing {}")
            .addArgument(promotion::index)
            .addArgument(promotion::alias)
            .addArgument(promotion::previousIndices)
            .log();
        return result.promotedResult();
    }

    private DocumentSink openOutputSink(IngestConfig.Consumer consumer) {
        if (consumer == IngestConfig.Consumer.JSON) {
            return new JsonDocumentSink(out);
        }
        return new TitleDocumentSink(out);
    }

    private IngestResult run(MarcRecordDecoder decoder, DocumentSink sink, IngestConfig config, String target) {
        var pipeline = new IngestPipeline(
            mapper,
            sink,
            config.getQueueCapacity(),
            config.getMaxDocsPerBatch(),
            config.getMaxConsecutiveDecodeFailures()
        );
        IngestResult result;
        try {
            result = pipeline.run(decoder, target);
        } catch (IngestFailedException e) {
            closeAfterFailure(sink, e);
            throw e;
        }
        try {
            sink.close();
        } catch (IOException e) {
            throw new IngestFailedException("Could not finish writing to " + target, result, e);
        }
        return result;
    }

    private static void closeAfterFailure(DocumentSink sink, IngestFailedException failure) {
        try {
            sink.close();
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }
}
