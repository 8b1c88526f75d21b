package org.catalogsearch.ingest.pipeline.sink;

import java.util.List;
import java.util.stream.Collectors;

import org.catalogsearch.ingest.common.BulkDocSection;
import org.catalogsearch.ingest.common.SearchClient;
import org.catalogsearch.ingest.mapping.model.BibliographicRecord;
import org.catalogsearch.ingest.pipeline.ir.ProgressCursor;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Writes documents into one index with the {@code _bulk} API, keyed by record identifier.
 */
@Slf4j
public class OpenSearchDocumentSink implements DocumentSink {

    private final SearchClient client;
    private final String indexName;

    public OpenSearchDocumentSink(SearchClient client, String indexName) {
        this.client = client;
        this.indexName = indexName;
    }

    @Override
    public Mono<ProgressCursor> writeBatch(long batchNumber, List<BibliographicRecord> batch) {
        return Mono.fromCallable(() -> toBulkSections(batch))
            .flatMap(sections -> {
                long bytesInBatch = sections.stream().mapToLong(BulkDocSection::getSerializedLength).sum();
                return client.sendBulkRequest(indexName, sections)
                    .then(Mono.just(new ProgressCursor(batchNumber, batch.size(), bytesInBatch)));
            })
            .onErrorMap(SearchClient.BulkRequestFailed.class,
                e -> new BatchWriteException(batchNumber, e.getConfirmedDocs(), e))
            .doOnNext(cursor -> log.atDebug().setMessage("Batch {} of {} documents written to {}")
                .addArgument(cursor::batchNumber)
                .addArgument(cursor::docsInBatch)
                .addArgument(indexName)
                .log());
    }

    private List<BulkDocSection> toBulkSections(List<BibliographicRecord> batch) {
        return batch.stream()
            .map(doc -> BulkDocSection.fromDocument(doc.getIdentifier(), indexName, doc))
            .collect(Collectors.toList());
    }
}
