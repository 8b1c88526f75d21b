package org.catalogsearch.ingest.mapping.rules;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

import org.catalogsearch.ingest.mapping.FieldExtractionException;
import org.marc4j.marc.ControlField;
import org.marc4j.marc.DataField;
import org.marc4j.marc.Record;
import org.marc4j.marc.Subfield;
import org.marc4j.marc.VariableField;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Evaluates {@link Rule}s against a decoded record.
 *
 * <p>A control field contributes its data. A data field contributes the values of its selected
 * subfields joined by a single space, and contributes nothing when none of them are present.
 * A byte range is applied to whatever value the field contributed.
 */
@RequiredArgsConstructor
public class RuleEngine {
    @Getter
    private final Ruleset ruleset;

    /**
     * The union of every field spec's values for {@code label}, duplicates removed, in first-seen
     * order.
     */
    public List<String> apply(Record record, String label) {
        var rule = ruleset.rule(label);
        var values = new LinkedHashSet<String>();
        for (var spec : rule.fields()) {
            values.addAll(extract(record, spec));
        }
        return List.copyOf(values);
    }

    public Optional<String> first(Record record, String label) {
        var values = apply(record, label);
        return values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    public List<String> extract(Record record, FieldSpec spec) {
        var range = spec.byteRange();
        var values = new ArrayList<String>();
        for (VariableField field : record.getVariableFields(spec.tag())) {
            String value;
            if (field instanceof ControlField) {
                var data = ((ControlField) field).getData();
                value = data == null ? "" : data;
            } else if (field instanceof DataField) {
                value = joinSubfields((DataField) field, spec);
                if (value == null) {
                    continue;
                }
            } else {
                continue;
            }
            if (range.isPresent()) {
                value = slice(record, spec, range.get(), value);
            }
            values.add(value);
        }
        return values;
    }

    private static String joinSubfields(DataField field, FieldSpec spec) {
        var parts = new ArrayList<String>();
        for (Subfield subfield : field.getSubfields()) {
            if (spec.collects(subfield.getCode()) && subfield.getData() != null) {
                parts.add(subfield.getData());
            }
        }
        return parts.isEmpty() ? null : String.join(" ", parts);
    }

    private static String slice(Record record, FieldSpec spec, ByteRange range, String value) {
        if (!range.fitsWithin(value)) {
            throw new FieldExtractionException(
                record.getControlNumber(),
                "Byte range " + range + " is outside field " + spec.tag() + " of length " + value.length()
                    + " in record " + record.getControlNumber()
            );
        }
        return range.slice(value);
    }
}
