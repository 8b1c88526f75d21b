package org.catalogsearch.ingest.pipeline.sink;

import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.catalogsearch.ingest.mapping.model.BibliographicRecord;
import org.catalogsearch.ingest.pipeline.ir.ProgressCursor;

import reactor.core.publisher.Mono;

/** Prints one title per line. */
public class TitleDocumentSink implements DocumentSink {
    private final PrintWriter writer;

    public TitleDocumentSink(OutputStream out) {
        this.writer = new PrintWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
    }

    @Override
    public Mono<ProgressCursor> writeBatch(long batchNumber, List<BibliographicRecord> batch) {
        return Mono.fromCallable(() -> {
            for (var doc : batch) {
                writer.println(doc.getTitle());
            }
            writer.flush();
            return new ProgressCursor(batchNumber, batch.size(), 0);
        });
    }

    @Override
    public void close() {
        writer.flush();
    }
}
