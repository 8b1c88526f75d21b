package org.catalogsearch.ingest.pipeline.sink;

import java.util.List;

import org.catalogsearch.ingest.common.BulkDocSection;
import org.catalogsearch.ingest.common.SearchClient;
import org.catalogsearch.ingest.mapping.model.BibliographicRecord;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OpenSearchDocumentSinkTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Mock private SearchClient client;
    @Captor private ArgumentCaptor<List<BulkDocSection>> sectionsCaptor;

    private OpenSearchDocumentSink sink;

    @BeforeEach
    void setUp() {
        sink = new OpenSearchDocumentSink(client, "aleph-1");
    }

    private static BibliographicRecord doc(String id, String title) {
        return BibliographicRecord.builder().identifier(id).title(title).build();
    }

    @Test
    void writeBatchSendsDocumentsKeyedByIdentifier() throws Exception {
        when(client.sendBulkRequest(eq("aleph-1"), anyList())).thenReturn(Mono.empty());

        StepVerifier.create(sink.writeBatch(1, List.of(doc("990001", "Moby Dick"), doc("990002", "Walden"))))
            .assertNext(cursor -> {
                assertEquals(1, cursor.batchNumber());
                assertEquals(2, cursor.docsInBatch());
                assertTrue(cursor.bytesInBatch() > 0);
            })
            .verifyComplete();

        verify(client).sendBulkRequest(eq("aleph-1"), sectionsCaptor.capture());
        var sections = sectionsCaptor.getValue();
        assertEquals(List.of("990001", "990002"), sections.stream().map(BulkDocSection::getDocId).toList());
        var source = MAPPER.readTree(sections.get(0).getSource());
        assertEquals("Moby Dick", source.path("title").asText());
        assertEquals("990001", source.path("identifier").asText());
    }

    @Test
    void blankIdentifierLetsTheClusterAssignOne() {
        when(client.sendBulkRequest(eq("aleph-1"), anyList())).thenReturn(Mono.empty());

        StepVerifier.create(sink.writeBatch(1, List.of(doc("", "Untitled"))))
            .expectNextCount(1)
            .verifyComplete();

        verify(client).sendBulkRequest(eq("aleph-1"), sectionsCaptor.capture());
        assertNull(sectionsCaptor.getValue().get(0).getDocId());
    }

    @Test
    void partialBulkFailureKeepsConfirmedCount() {
        var failure = new SearchClient.BulkRequestFailed("aleph-1", 1, 1, new RuntimeException("rejected"));
        when(client.sendBulkRequest(eq("aleph-1"), anyList())).thenReturn(Mono.error(failure));

        StepVerifier.create(sink.writeBatch(4, List.of(doc("1", "A"), doc("2", "B"))))
            .expectErrorSatisfies(error -> {
                var batchError = assertInstanceOf(BatchWriteException.class, error);
                assertEquals(1, batchError.getConfirmedDocs());
                assertSame(failure, batchError.getCause());
            })
            .verify();
    }
}
