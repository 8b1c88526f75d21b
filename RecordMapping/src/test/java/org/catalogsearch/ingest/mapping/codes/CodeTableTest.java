package org.catalogsearch.ingest.mapping.codes;

import java.nio.file.Files;
import java.nio.file.Path;

import org.catalogsearch.ingest.mapping.ConfigurationException;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

class CodeTableTest {

    @TempDir
    Path tempDir;

    @Test
    void bundledCodeListsLoad() {
        var languages = CodeTable.loadResource(CodeTable.LANGUAGE, CodeTable.DEFAULT_LANGUAGES_RESOURCE);
        var countries = CodeTable.loadResource(CodeTable.COUNTRY, CodeTable.DEFAULT_COUNTRIES_RESOURCE);

        assertEquals("English", languages.name("eng").orElseThrow());
        assertEquals("Massachusetts", countries.name("mau").orElseThrow());
        assertTrue(languages.name("xyz").isEmpty());
    }

    @Test
    void readsOnlyElementsOfTheRequestedCodeType() throws Exception {
        var file = tempDir.resolve("codes.xml");
        Files.writeString(file, String.join("\n",
            "<codelist>",
            "  <title>Codes</title>",
            "  <languages>",
            "    <language><name>Welsh</name><code>wel</code></language>",
            "    <language><name authorized=\"yes\">Zulu</name><code>zul</code></language>",
            "  </languages>",
            "  <countries>",
            "    <country><name>Wales</name><code>wlk</code></country>",
            "  </countries>",
            "</codelist>"
        ));

        var languages = CodeTable.load(CodeTable.LANGUAGE, file);

        assertEquals(2, languages.size());
        assertEquals("Welsh", languages.name("wel").orElseThrow());
        assertEquals("Zulu", languages.name("zul").orElseThrow());
        assertTrue(languages.name("wlk").isEmpty());
    }

    @Test
    void documentWithoutEntriesIsAConfigurationError() throws Exception {
        var file = tempDir.resolve("empty.xml");
        Files.writeString(file, "<codelist><title>Nothing</title></codelist>");

        assertThrows(ConfigurationException.class, () -> CodeTable.load(CodeTable.COUNTRY, file));
    }

    @Test
    void missingFileIsAConfigurationError() {
        assertThrows(ConfigurationException.class, () -> CodeTable.load(CodeTable.LANGUAGE, tempDir.resolve("nope.xml")));
    }
}
