package org.catalogsearch.ingest.mapping.marc;

import java.util.Iterator;

/**
 * Reads records one at a time. A record that cannot be decoded is returned as a failed
 * {@link DecodedRecord} so that reading can continue with the next one.
 */
public interface RecordDecoder extends Iterator<DecodedRecord> {
}
