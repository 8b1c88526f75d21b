package org.catalogsearch.ingest.mapping.lookup;

import java.util.Arrays;

import lombok.experimental.UtilityClass;

/** Content type by leader position 06 (type of record). */
@UtilityClass
public class ContentTypes {
    public static final String TEXT = "Text";

    private static final String[] BY_TYPE_OF_RECORD = new String[256];

    static {
        Arrays.fill(BY_TYPE_OF_RECORD, TEXT);
        BY_TYPE_OF_RECORD['c'] = "Musical score";
        BY_TYPE_OF_RECORD['d'] = "Musical score";
        BY_TYPE_OF_RECORD['e'] = "Cartographic material";
        BY_TYPE_OF_RECORD['f'] = "Cartographic material";
        BY_TYPE_OF_RECORD['g'] = "Moving image";
        BY_TYPE_OF_RECORD['i'] = "Sound recording";
        BY_TYPE_OF_RECORD['j'] = "Sound recording";
        BY_TYPE_OF_RECORD['k'] = "Still image";
        BY_TYPE_OF_RECORD['m'] = "Computer file";
        BY_TYPE_OF_RECORD['o'] = "Kit";
        BY_TYPE_OF_RECORD['p'] = "Mixed materials";
        BY_TYPE_OF_RECORD['r'] = "Object";
    }

    public String forTypeOfRecord(char typeOfRecord) {
        return BY_TYPE_OF_RECORD[typeOfRecord & 0xFF];
    }
}
