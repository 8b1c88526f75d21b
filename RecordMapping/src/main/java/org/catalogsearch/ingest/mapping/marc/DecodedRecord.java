package org.catalogsearch.ingest.mapping.marc;

import org.marc4j.marc.Record;

/**
 * Outcome of decoding one record from a stream: either the record or the reason it could not be
 * decoded. {@code position} counts records from 1.
 */
public record DecodedRecord(long position, Record record, RuntimeException error) {

    public static DecodedRecord decoded(long position, Record record) {
        return new DecodedRecord(position, record, null);
    }

    public static DecodedRecord failed(long position, RuntimeException error) {
        return new DecodedRecord(position, null, error);
    }

    public boolean isDecoded() {
        return error == null;
    }
}
