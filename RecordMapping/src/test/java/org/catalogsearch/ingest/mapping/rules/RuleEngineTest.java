package org.catalogsearch.ingest.mapping.rules;

import java.util.List;

import org.catalogsearch.ingest.mapping.ConfigurationException;
import org.catalogsearch.ingest.mapping.FieldExtractionException;
import org.catalogsearch.ingest.mapping.MarcTestRecords;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RuleEngineTest {

    private static RuleEngine engineWith(String label, FieldSpec... specs) {
        return new RuleEngine(Ruleset.of(List.of(new Rule(label, true, List.of(specs)))));
    }

    @Test
    void valuesAcrossFieldSpecsAreDeduplicatedInFirstSeenOrder() {
        var record = MarcTestRecords.book("1")
            .data("650", "a", "a")
            .data("650", "a", "b")
            .data("651", "a", "a")
            .build();
        var engine = engineWith("subjects", FieldSpec.of("650", "a"), FieldSpec.of("651", "a"));

        assertEquals(List.of("a", "b"), engine.apply(record, "subjects"));
    }

    @Test
    void ruleMatchingNothingYieldsEmptyList() {
        var record = MarcTestRecords.book("1").data("245", "a", "Title").build();
        var engine = engineWith("isbns", FieldSpec.of("020", "a"));

        assertTrue(engine.apply(record, "isbns").isEmpty());
        assertTrue(engine.first(record, "isbns").isEmpty());
    }

    @Test
    void requestedSubfieldsAreJoinedWithSpacesInRecordOrder() {
        var record = MarcTestRecords.book("1")
            .data("245", "a", "Structure and interpretation", "c", "Abelson", "b", "of computer programs")
            .build();
        var engine = engineWith("title", FieldSpec.of("245", "ab"));

        assertEquals(List.of("Structure and interpretation of computer programs"), engine.apply(record, "title"));
    }

    @Test
    void emptySubfieldSelectionTakesEverySubfield() {
        var record = MarcTestRecords.book("1").data("300", "a", "xv, 657 p.", "c", "24 cm").build();
        var engine = engineWith("physical_description", FieldSpec.of("300", ""));

        assertEquals(List.of("xv, 657 p. 24 cm"), engine.apply(record, "physical_description"));
    }

    @Test
    void occurrenceWithoutRequestedSubfieldsIsSkipped() {
        var record = MarcTestRecords.book("1")
            .data("020", "z", "cancelled")
            .data("020", "a", "0262510871")
            .build();
        var spec = FieldSpec.of("020", "a");

        assertEquals(List.of("0262510871"), engineWith("isbns", spec).extract(record, spec));
    }

    @Test
    void extractKeepsOneValuePerOccurrenceWithoutDeduplication() {
        var record = MarcTestRecords.book("1")
            .data("700", "a", "Sussman, Gerald Jay")
            .data("700", "a", "Sussman, Gerald Jay")
            .build();
        var spec = new FieldSpec("700", "a", null, "contributor");

        assertEquals(2, engineWith("contributors", spec).extract(record, spec).size());
    }

    @Test
    void byteRangeIsAppliedToControlFieldData() {
        var record = MarcTestRecords.book("1")
            .control("008", MarcTestRecords.fixedLengthData("1985", "mau", '0', "eng"))
            .build();
        var engine = engineWith(
            "languages",
            new FieldSpec("008", null, "35:3", null)
        );

        assertEquals(List.of("eng"), engine.apply(record, "languages"));
    }

    @Test
    void byteRangePastEndOfValueFailsTheRecord() {
        var record = MarcTestRecords.book("42").control("008", "850101s1985").build();
        var engine = engineWith("languages", new FieldSpec("008", null, "35:3", null));

        var exception = assertThrows(FieldExtractionException.class, () -> engine.apply(record, "languages"));
        assertEquals("42", exception.getRecordIdentifier());
    }

    @Test
    void byteRangeNearTheLargestOffsetFailsTheRecord() {
        var record = MarcTestRecords.book("43")
            .control("008", MarcTestRecords.fixedLengthData("1985", "mau", '0', "eng"))
            .build();
        var engine = engineWith("languages", new FieldSpec("008", null, "2147483600:40", null));

        assertThrows(FieldExtractionException.class, () -> engine.apply(record, "languages"));
    }

    @Test
    void unknownLabelIsAConfigurationError() {
        var record = MarcTestRecords.book("1").build();
        var engine = engineWith("title", FieldSpec.of("245", "a"));

        assertThrows(ConfigurationException.class, () -> engine.apply(record, "subjects"));
    }
}
