package org.catalogsearch.ingest;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import org.catalogsearch.ingest.common.IndexNotFoundException;
import org.catalogsearch.ingest.common.SearchClient;
import org.catalogsearch.ingest.common.model.IndexInfo;
import org.catalogsearch.ingest.pipeline.IngestConfig;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.marc4j.MarcStreamWriter;
import org.marc4j.marc.MarcFactory;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class CatalogIngestTest {

    @TempDir
    Path tempDir;

    SearchClient client;
    ByteArrayOutputStream output;
    CatalogIngest catalogIngest;

    @BeforeEach
    void setUp() {
        client = mock(SearchClient.class);
        output = new ByteArrayOutputStream();
        catalogIngest = new CatalogIngest(new PrintStream(output, true, StandardCharsets.UTF_8)) {
            @Override
            protected SearchClient createClient() {
                return client;
            }
        };
    }

    private String printed() {
        return output.toString(StandardCharsets.UTF_8);
    }

    @Test
    void globalOptionsAndCommandOptionsAreParsed() {
        when(client.hasIndex("aleph-1")).thenReturn(true);

        catalogIngest.run(new String[] {
            "--url", "https://search.example.org:9200", "--username", "admin", "--password", "secret",
            "--index", "aleph-1", "promote", "--prefix", "catalog"
        });

        assertEquals("https://search.example.org:9200", catalogIngest.catalogArgs.clusterArgs.url);
        assertEquals("admin", catalogIngest.catalogArgs.clusterArgs.username);
        assertEquals("aleph-1", catalogIngest.catalogArgs.index);
        assertEquals("catalog", catalogIngest.promoteArgs.prefix);
    }

    @Test
    void ingestDefaults() {
        var exitCode = catalogIngest.run(new String[] { "ingest", "--help" });

        assertEquals(CatalogIngest.EXIT_OK, exitCode);
        assertEquals(IngestConfig.Consumer.ES, catalogIngest.ingestArgs.consumer);
        assertEquals("aleph", catalogIngest.ingestArgs.prefix);
        assertEquals(1000, catalogIngest.ingestArgs.numDocsPerBulkRequest);
        assertEquals(0, catalogIngest.ingestArgs.maxConsecutiveDecodeFailures);
        assertEquals("http://127.0.0.1:9200", catalogIngest.catalogArgs.clusterArgs.url);
    }

    @Test
    void reindexPrintsCopiedCount() {
        when(client.hasIndex("aleph-1")).thenReturn(true);
        when(client.reindex("aleph-1", "aleph-2")).thenReturn(42L);

        var exitCode = catalogIngest.run(new String[] { "--index", "aleph-1", "reindex", "--destination", "aleph-2" });

        assertEquals(CatalogIngest.EXIT_OK, exitCode);
        assertThat(printed(), containsString("42 documents reindexed"));
    }

    @Test
    void reindexNeedsDestination() {
        var exitCode = catalogIngest.run(new String[] { "--index", "aleph-1", "reindex" });

        assertEquals(CatalogIngest.EXIT_USAGE, exitCode);
        verifyNoInteractions(client);
    }

    @Test
    void promoteMovesPrefixAlias() {
        when(client.hasIndex("aleph-2")).thenReturn(true);
        when(client.aliasTargets("aleph")).thenReturn(Set.of("aleph-1"));

        var exitCode = catalogIngest.run(new String[] { "-i", "aleph-2", "promote" });

        assertEquals(CatalogIngest.EXIT_OK, exitCode);
        verify(client).swapAlias("aleph", Set.of("aleph-1"), "aleph-2");
    }

    @Test
    void deleteNeedsAnIndex() {
        var exitCode = catalogIngest.run(new String[] { "delete" });

        assertEquals(CatalogIngest.EXIT_USAGE, exitCode);
        verifyNoInteractions(client);
    }

    @Test
    void deletingMissingIndexFails() {
        doThrow(new IndexNotFoundException("aleph-9")).when(client).deleteIndex("aleph-9");

        var exitCode = catalogIngest.run(new String[] { "--index", "aleph-9", "delete" });

        assertEquals(CatalogIngest.EXIT_FAILURE, exitCode);
    }

    @Test
    void indexesArePrinted() {
        when(client.listIndices()).thenReturn(List.of(new IndexInfo("aleph-1", "green", "open", "u-1", "1200", "3mb")));

        var exitCode = catalogIngest.run(new String[] { "indexes" });

        assertEquals(CatalogIngest.EXIT_OK, exitCode);
        assertThat(printed(), containsString("Name: aleph-1"));
        assertThat(printed(), containsString("Documents: 1200"));
        assertThat(printed(), containsString("Size: 3mb"));
    }

    @Test
    void unknownConsumerIsUsageError() {
        var exitCode = catalogIngest.run(new String[] { "ingest", "--consumer", "csv", "records.mrc" });

        assertEquals(CatalogIngest.EXIT_USAGE, exitCode);
    }

    @Test
    void missingCommandIsUsageError() {
        assertEquals(CatalogIngest.EXIT_USAGE, catalogIngest.run(new String[0]));
        assertThat(printed(), containsString("Usage: catalog-ingest"));
    }

    @Test
    void titleConsumerPrintsTitlesWithoutTouchingCluster() throws Exception {
        var dump = tempDir.resolve("records.mrc");
        writeRecords(dump);

        var exitCode = catalogIngest.run(new String[] { "ingest", "--consumer", "title", "--debug", dump.toString() });

        assertEquals(CatalogIngest.EXIT_OK, exitCode);
        assertThat(printed(), containsString("Moby Dick"));
        assertThat(printed(), containsString("Walden"));
        assertThat(printed(), containsString("Total records ingested: 2"));
        verifyNoInteractions(client);
    }

    @Test
    void missingRecordFileFails() {
        var exitCode = catalogIngest.run(new String[] {
            "ingest", "--consumer", "json", tempDir.resolve("absent.mrc").toString()
        });

        assertEquals(CatalogIngest.EXIT_FAILURE, exitCode);
    }

    private static void writeRecords(Path path) throws Exception {
        var factory = MarcFactory.newInstance();
        try (OutputStream out = Files.newOutputStream(path)) {
            var writer = new MarcStreamWriter(out, "UTF-8");
            var id = 990001;
            for (var title : List.of("Moby Dick", "Walden")) {
                var record = factory.newRecord("00000nam a2200000 a 4500");
                record.addVariableField(factory.newControlField("001", Integer.toString(id++)));
                var field = factory.newDataField("245", '1', '0');
                field.addSubfield(factory.newSubfield('a', title));
                record.addVariableField(field);
                writer.write(record);
            }
            writer.close();
        }
    }
}
