package org.catalogsearch.ingest.mapping;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.function.BiFunction;

import org.catalogsearch.ingest.mapping.codes.CodeTable;
import org.catalogsearch.ingest.mapping.codes.CodeTranslator;
import org.catalogsearch.ingest.mapping.lookup.ContentTypes;
import org.catalogsearch.ingest.mapping.lookup.HoldingsTables;
import org.catalogsearch.ingest.mapping.lookup.LiteraryForms;
import org.catalogsearch.ingest.mapping.model.BibliographicRecord;
import org.catalogsearch.ingest.mapping.model.Contributor;
import org.catalogsearch.ingest.mapping.model.Holding;
import org.catalogsearch.ingest.mapping.model.Link;
import org.catalogsearch.ingest.mapping.model.RelatedItem;
import org.catalogsearch.ingest.mapping.rules.RuleEngine;
import org.catalogsearch.ingest.mapping.rules.Ruleset;
import org.marc4j.marc.DataField;
import org.marc4j.marc.Record;
import org.marc4j.marc.Subfield;
import org.marc4j.marc.VariableField;

import lombok.extern.slf4j.Slf4j;

/**
 * Builds a {@link BibliographicRecord} from a decoded catalog record.
 *
 * <p>Most fields come straight from the ruleset. Country and languages are translated through
 * their code tables; content type, literary form, links, holdings and format are derived here.
 * A record without a title is rejected with {@link MissingTitleException}.
 */
@Slf4j
public class RecordMapper {
    public static final String DEFAULT_SOURCE = "MIT Aleph";
    public static final String DEFAULT_SOURCE_LINK_PREFIX = "https://library.mit.edu/item/";

    public static final List<String> RULE_LABELS = List.of(
        "oclc_number",
        "lccn",
        "title",
        "alternate_titles",
        "creators",
        "contributors",
        "related_place",
        "related_items",
        "in_bibliography",
        "subjects",
        "isbns",
        "issns",
        "dois",
        "place_of_publication",
        "languages",
        "call_numbers",
        "edition",
        "imprint",
        "physical_description",
        "publication_frequency",
        "publication_date",
        "numbering",
        "notes",
        "contents",
        "summary",
        "literary_form"
    );

    private static final String[] HOLDINGS_866_SUBFIELDS = { "b", "c", "h", "a", "z" };
    private static final String[] HOLDINGS_852_SUBFIELDS = { "b", "c", "h", "a", "z", "k" };

    private final RuleEngine ruleEngine;
    private final CodeTable languageCodes;
    private final CodeTable countryCodes;
    private final String source;
    private final String sourceLinkPrefix;

    public RecordMapper(Ruleset ruleset, CodeTable languageCodes, CodeTable countryCodes) {
        this(ruleset, languageCodes, countryCodes, DEFAULT_SOURCE, DEFAULT_SOURCE_LINK_PREFIX);
    }

    public RecordMapper(
        Ruleset ruleset,
        CodeTable languageCodes,
        CodeTable countryCodes,
        String source,
        String sourceLinkPrefix
    ) {
        ruleset.requireLabels(RULE_LABELS);
        this.ruleEngine = new RuleEngine(ruleset);
        this.languageCodes = languageCodes;
        this.countryCodes = countryCodes;
        this.source = source;
        this.sourceLinkPrefix = sourceLinkPrefix;
    }

    /** Uses the bundled ruleset and code lists. */
    public static RecordMapper withDefaults() {
        return new RecordMapper(
            Ruleset.loadDefault(),
            CodeTable.loadResource(CodeTable.LANGUAGE, CodeTable.DEFAULT_LANGUAGES_RESOURCE),
            CodeTable.loadResource(CodeTable.COUNTRY, CodeTable.DEFAULT_COUNTRIES_RESOURCE)
        );
    }

    public BibliographicRecord map(Record record) {
        var identifier = record.getControlNumber() == null ? "" : record.getControlNumber().trim();
        var builder = BibliographicRecord.builder()
            .identifier(identifier)
            .source(source)
            .sourceLink(sourceLinkPrefix + identifier)
            .oclcs(apply(record, "oclc_number"));

        ruleEngine.first(record, "lccn").ifPresent(lccn -> builder.lccn(lccn.trim()));

        var title = ruleEngine.first(record, "title").orElseThrow(() -> new MissingTitleException(identifier));
        builder.title(title)
            .alternateTitles(apply(record, "alternate_titles"))
            .creators(apply(record, "creators"))
            .contributors(fanOut(record, "contributors", Contributor::new))
            .relatedPlace(apply(record, "related_place"))
            .relatedItems(fanOut(record, "related_items", RelatedItem::new))
            .inBibliography(apply(record, "in_bibliography"))
            .subjects(apply(record, "subjects"))
            .isbns(apply(record, "isbns"))
            .issns(apply(record, "issns"))
            .dois(apply(record, "dois"));

        ruleEngine.first(record, "place_of_publication")
            .ifPresent(code -> builder.countryOfPublication(CodeTranslator.translate(code, countryCodes)));

        builder.languages(CodeTranslator.translate(apply(record, "languages"), languageCodes))
            .callNumbers(apply(record, "call_numbers"));
        ruleEngine.first(record, "edition").ifPresent(builder::edition);
        builder.imprint(apply(record, "imprint"));
        ruleEngine.first(record, "physical_description").ifPresent(builder::physicalDescription);
        builder.publicationFrequency(apply(record, "publication_frequency"));
        ruleEngine.first(record, "publication_date").ifPresent(builder::publicationDate);
        ruleEngine.first(record, "numbering").ifPresent(builder::numbering);
        builder.notes(apply(record, "notes"))
            .contents(apply(record, "contents"))
            .summary(apply(record, "summary"))
            .contentType(ContentTypes.forTypeOfRecord(record.getLeader().getTypeOfRecord()))
            .literaryForm(LiteraryForms.classify(apply(record, "literary_form")))
            .links(links(record));

        var holdings = holdings(record);
        builder.holdings(holdings).format(formats(holdings));

        return builder.build();
    }

    private List<String> apply(Record record, String label) {
        return ruleEngine.apply(record, label);
    }

    // One entry per field spec that matched anything, labelled with the spec's kind
    private <T> List<T> fanOut(Record record, String label, BiFunction<String, List<String>, T> entryFactory) {
        var entries = new ArrayList<T>();
        for (var spec : ruleEngine.getRuleset().rule(label).fields()) {
            var values = ruleEngine.extract(record, spec);
            if (!values.isEmpty()) {
                entries.add(entryFactory.apply(spec.kind(), values));
            }
        }
        return entries;
    }

    static List<Link> links(Record record) {
        var links = new ArrayList<Link>();
        for (var field : dataFields(record, "856")) {
            var secondIndicator = field.getIndicator2();
            if (field.getIndicator1() != '4' || (secondIndicator != '0' && secondIndicator != '1')) {
                continue;
            }
            var kind = subfieldValue(field, "3");
            links.add(new Link(
                kind.isEmpty() ? Link.UNKNOWN_KIND : kind,
                subfieldValue(field, "y"),
                subfieldValue(field, "u"),
                subfieldValue(field, "z")
            ));
        }
        return links;
    }

    static List<Holding> holdings(Record record) {
        var holdings = holdings(record, "866", HOLDINGS_866_SUBFIELDS);
        if (holdings.isEmpty()) {
            holdings = holdings(record, "852", HOLDINGS_852_SUBFIELDS);
        }
        return holdings;
    }

    private static List<Holding> holdings(Record record, String tag, String[] codes) {
        var holdings = new ArrayList<Holding>();
        for (var field : dataFields(record, tag)) {
            var locationCode = subfieldValue(field, codes[0]);
            var location = HoldingsTables.location(locationCode);
            var format = "866".equals(tag)
                ? HoldingsTables.PRINT_VOLUME
                : HoldingsTables.format(location, subfieldValue(field, codes[5]));
            holdings.add(new Holding(
                location,
                HoldingsTables.collection(subfieldValue(field, codes[1]), locationCode),
                subfieldValue(field, codes[2]),
                subfieldValue(field, codes[3]),
                subfieldValue(field, codes[4]),
                format
            ));
        }
        return holdings;
    }

    private static List<String> formats(List<Holding> holdings) {
        var formats = new LinkedHashSet<String>();
        for (var holding : holdings) {
            // Holdings with no known format, such as NET, add nothing to the format facet
            if (!holding.format().isBlank()) {
                formats.add(holding.format());
            }
        }
        return List.copyOf(formats);
    }

    private static List<DataField> dataFields(Record record, String tag) {
        var fields = new ArrayList<DataField>();
        for (VariableField field : record.getVariableFields(tag)) {
            if (field instanceof DataField) {
                fields.add((DataField) field);
            }
        }
        return fields;
    }

    private static String subfieldValue(DataField field, String code) {
        Subfield subfield = field.getSubfield(code.charAt(0));
        return subfield == null || subfield.getData() == null ? "" : subfield.getData();
    }
}
