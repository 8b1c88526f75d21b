package org.catalogsearch.ingest.mapping.codes;

import java.util.ArrayList;
import java.util.List;

import lombok.experimental.UtilityClass;

/**
 * Replaces codes with display names. Fill characters (space and {@code |}) are trimmed from both
 * ends first; a code with no entry is kept as given.
 */
@UtilityClass
public class CodeTranslator {
    private static final String FILL_CHARACTERS = " |";

    public List<String> translate(List<String> codes, CodeTable table) {
        var translated = new ArrayList<String>(codes.size());
        for (var code : codes) {
            translated.add(translate(code, table));
        }
        return translated;
    }

    public String translate(String code, CodeTable table) {
        var trimmed = trimFill(code);
        return table.name(trimmed).orElse(trimmed);
    }

    String trimFill(String code) {
        int start = 0;
        int end = code.length();
        while (start < end && FILL_CHARACTERS.indexOf(code.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && FILL_CHARACTERS.indexOf(code.charAt(end - 1)) >= 0) {
            end--;
        }
        return code.substring(start, end);
    }
}
