package org.catalogsearch.ingest.mapping.lookup;

import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ContentTypesTest {

    private static final Map<Character, String> MAPPED = Map.ofEntries(
        Map.entry('c', "Musical score"),
        Map.entry('d', "Musical score"),
        Map.entry('e', "Cartographic material"),
        Map.entry('f', "Cartographic material"),
        Map.entry('g', "Moving image"),
        Map.entry('i', "Sound recording"),
        Map.entry('j', "Sound recording"),
        Map.entry('k', "Still image"),
        Map.entry('m', "Computer file"),
        Map.entry('o', "Kit"),
        Map.entry('p', "Mixed materials"),
        Map.entry('r', "Object")
    );

    @Test
    void everyByteValueHasAContentType() {
        for (int value = 0; value < 256; value++) {
            var typeOfRecord = (char) value;
            var expected = MAPPED.getOrDefault(typeOfRecord, ContentTypes.TEXT);
            assertEquals(expected, ContentTypes.forTypeOfRecord(typeOfRecord), "byte " + value);
        }
    }

    @Test
    void charactersAboveOneByteWrapToTheirLowByte() {
        assertEquals("Musical score", ContentTypes.forTypeOfRecord((char) (0x100 + 'c')));
    }
}
