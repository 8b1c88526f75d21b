package org.catalogsearch.ingest.io;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;

/**
 * Read access to the files that hold record dumps, wherever they are stored.
 */
public interface BlobSource extends Closeable {

    /**
     * Opens a blob for streaming.  The caller closes the returned stream.
     * @param path the path/key of the blob, relative to the root of this source
     * @throws IOException if the blob cannot be accessed or doesn't exist
     */
    InputStream getBlob(String path) throws IOException;

    boolean exists(String path);

    /**
     * @return the size of the blob in bytes
     * @throws IOException if the blob cannot be accessed or doesn't exist
     */
    long getBlobSize(String path) throws IOException;

    @Override
    default void close() throws IOException {
    }
}
