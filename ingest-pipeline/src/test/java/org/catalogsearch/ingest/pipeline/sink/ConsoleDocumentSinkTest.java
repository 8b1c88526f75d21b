package org.catalogsearch.ingest.pipeline.sink;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.catalogsearch.ingest.mapping.model.BibliographicRecord;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleDocumentSinkTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static BibliographicRecord doc(String id, String title) {
        return BibliographicRecord.builder().identifier(id).title(title).build();
    }

    @Test
    void jsonSinkWritesOneArrayAcrossBatches() throws Exception {
        var out = new ByteArrayOutputStream();
        var sink = new JsonDocumentSink(out);

        StepVerifier.create(sink.writeBatch(1, List.of(doc("1", "Moby Dick"), doc("2", "Walden"))))
            .assertNext(cursor -> assertEquals(2, cursor.docsInBatch()))
            .verifyComplete();
        StepVerifier.create(sink.writeBatch(2, List.of(doc("3", "Emma"))))
            .expectNextCount(1)
            .verifyComplete();
        sink.close();

        var array = MAPPER.readTree(out.toString(StandardCharsets.UTF_8));
        assertTrue(array.isArray());
        assertEquals(3, array.size());
        assertEquals("Emma", array.get(2).path("title").asText());
        assertTrue(array.get(0).path("contributors").isMissingNode());
    }

    @Test
    void jsonSinkWithoutDocumentsWritesEmptyArray() throws Exception {
        var out = new ByteArrayOutputStream();

        new JsonDocumentSink(out).close();

        var array = MAPPER.readTree(out.toString(StandardCharsets.UTF_8));
        assertTrue(array.isArray());
        assertEquals(0, array.size());
    }

    @Test
    void titleSinkPrintsOneTitlePerLine() {
        var out = new ByteArrayOutputStream();
        var sink = new TitleDocumentSink(out);

        StepVerifier.create(sink.writeBatch(1, List.of(doc("1", "Moby Dick"), doc("2", "Über Kunst"))))
            .expectNextCount(1)
            .verifyComplete();
        sink.close();

        var lines = out.toString(StandardCharsets.UTF_8).split("\\R");
        assertArrayEquals(new String[] {"Moby Dick", "Über Kunst"}, lines);
    }
}
