package org.catalogsearch.ingest.mapping.marc;

import java.io.BufferedInputStream;
import java.io.InputStream;
import java.util.NoSuchElementException;

import org.marc4j.MarcReader;
import org.marc4j.MarcStreamReader;

import lombok.extern.slf4j.Slf4j;

/**
 * Decodes ISO 2709 records with marc4j's {@link MarcStreamReader}. The reader consumes a whole
 * record before parsing it, so a record that fails to parse is reported and the next one is read.
 */
@Slf4j
public class MarcRecordDecoder implements RecordDecoder {
    public static final String DEFAULT_ENCODING = "UTF-8";

    private final MarcReader reader;
    private long position;

    public MarcRecordDecoder(InputStream input) {
        this(input, DEFAULT_ENCODING);
    }

    public MarcRecordDecoder(InputStream input, String encoding) {
        var buffered = input instanceof BufferedInputStream ? input : new BufferedInputStream(input);
        this.reader = new MarcStreamReader(buffered, encoding);
    }

    @Override
    public boolean hasNext() {
        return reader.hasNext();
    }

    @Override
    public DecodedRecord next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No records left in stream after position " + position);
        }
        position++;
        try {
            return DecodedRecord.decoded(position, reader.next());
        } catch (RuntimeException e) {
            // MarcException for most damage, NumberFormatException for a damaged directory entry
            log.atDebug().setMessage("Unable to decode record at position {}").addArgument(position).setCause(e).log();
            return DecodedRecord.failed(position, e);
        }
    }
}
