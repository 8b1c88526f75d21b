package org.catalogsearch.ingest.mapping.lookup;

import java.util.List;
import java.util.Set;

import lombok.experimental.UtilityClass;

@UtilityClass
public class LiteraryForms {
    public static final String FICTION = "fiction";
    public static final String NONFICTION = "nonfiction";

    private static final Set<String> NONFICTION_CODES = Set.of("0", "s", "e");

    /** Classifies by the first literary form code; no codes means no literary form. */
    public String classify(List<String> codes) {
        if (codes.isEmpty()) {
            return "";
        }
        return NONFICTION_CODES.contains(codes.get(0)) ? NONFICTION : FICTION;
    }
}
