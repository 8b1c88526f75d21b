package org.catalogsearch.ingest.mapping.codes;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CodeTranslatorTest {

    private final CodeTable languages = CodeTable.of(CodeTable.LANGUAGE, Map.of("eng", "English", "fre", "French"));

    @Test
    void unknownCodesPassThroughInPlace() {
        assertEquals(List.of("English", "xyz"), CodeTranslator.translate(List.of("eng", "xyz"), languages));
    }

    @Test
    void outputKeepsInputCardinality() {
        var translated = CodeTranslator.translate(List.of("fre", "eng", "fre"), languages);

        assertEquals(List.of("French", "English", "French"), translated);
    }

    @Test
    void fillCharactersAreTrimmedBeforeLookup() {
        assertEquals("English", CodeTranslator.translate(" |eng| ", languages));
        assertEquals("xx", CodeTranslator.translate("xx ", languages));
        assertEquals("", CodeTranslator.translate("|||", languages));
    }
}
