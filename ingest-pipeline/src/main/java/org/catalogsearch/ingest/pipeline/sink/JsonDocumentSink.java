package org.catalogsearch.ingest.pipeline.sink;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.List;

import org.catalogsearch.ingest.mapping.model.BibliographicRecord;
import org.catalogsearch.ingest.pipeline.ir.ProgressCursor;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import reactor.core.publisher.Mono;

/**
 * Writes all documents as one JSON array.  The array is finished when the sink is closed; the
 * output stream itself is left open.
 */
public class JsonDocumentSink implements DocumentSink {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final JsonGenerator generator;
    private boolean started;

    public JsonDocumentSink(OutputStream out) {
        try {
            this.generator = OBJECT_MAPPER.getFactory()
                .createGenerator(out)
                .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                .useDefaultPrettyPrinter();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public Mono<ProgressCursor> writeBatch(long batchNumber, List<BibliographicRecord> batch) {
        return Mono.fromCallable(() -> {
            synchronized (this) {
                startArray();
                for (var doc : batch) {
                    generator.writeObject(doc);
                }
                generator.flush();
            }
            return new ProgressCursor(batchNumber, batch.size(), 0);
        });
    }

    private void startArray() throws IOException {
        if (!started) {
            generator.writeStartArray();
            started = true;
        }
    }

    @Override
    public synchronized void close() throws IOException {
        startArray();
        generator.writeEndArray();
        generator.writeRaw('\n');
        generator.close();
    }
}
