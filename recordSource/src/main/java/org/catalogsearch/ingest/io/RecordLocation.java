package org.catalogsearch.ingest.io;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.catalogsearch.ingest.io.s3.S3BlobSource;
import org.catalogsearch.ingest.io.s3.S3Uri;

import lombok.extern.slf4j.Slf4j;

/**
 * Where a record dump lives: a local file, or an object named by an {@code s3://bucket/key} URI.
 */
@Slf4j
public final class RecordLocation {
    private final String location;
    private final S3Uri s3Uri;
    private final Path file;

    private RecordLocation(String location, S3Uri s3Uri, Path file) {
        this.location = location;
        this.s3Uri = s3Uri;
        this.file = file;
    }

    public static RecordLocation parse(String location) {
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("No record location was given");
        }
        if (S3Uri.isS3Uri(location)) {
            var uri = S3Uri.parse(location);
            if (!uri.hasKey()) {
                throw new IllegalArgumentException("S3 location names no object: " + location);
            }
            return new RecordLocation(location, uri, null);
        }
        return new RecordLocation(location, null, Paths.get(location).toAbsolutePath().normalize());
    }

    public boolean isS3() {
        return s3Uri != null;
    }

    /** The name of the dump within the source returned by {@link #toBlobSource}. */
    public String getBlobName() {
        return isS3() ? s3Uri.key() : file.getFileName().toString();
    }

    /** The source holding this location; for S3 it is rooted at the bucket. */
    public BlobSource toBlobSource(String s3Region) {
        if (isS3()) {
            return new S3BlobSource(s3Uri.bucketOnly(), s3Region, null);
        }
        var directory = file.getParent();
        return new FileBlobSource(directory == null ? file.getRoot() : directory);
    }

    /**
     * Opens the record stream.  Closing the returned stream also closes the underlying source.
     */
    public InputStream open(String s3Region) throws IOException {
        return open(toBlobSource(s3Region));
    }

    InputStream open(BlobSource source) throws IOException {
        var blobName = getBlobName();
        InputStream blob;
        try {
            if (!source.exists(blobName)) {
                throw new IOException("No records found at " + location);
            }
            long size = source.getBlobSize(blobName);
            log.atInfo().setMessage("Reading records from {} ({} bytes)")
                .addArgument(location)
                .addArgument(size)
                .log();
            blob = source.getBlob(blobName);
        } catch (IOException | RuntimeException e) {
            source.close();
            throw e;
        }
        return new FilterInputStream(blob) {
            @Override
            public void close() throws IOException {
                try {
                    super.close();
                } finally {
                    source.close();
                }
            }
        };
    }

    @Override
    public String toString() {
        return location;
    }
}
