package org.catalogsearch.ingest.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import lombok.extern.slf4j.Slf4j;

/**
 * Record dumps in a local directory. Names are resolved against that directory and may not
 * point outside it.
 */
@Slf4j
public class FileBlobSource implements BlobSource {
    private final Path directory;

    public FileBlobSource(Path directory) {
        this.directory = directory.toAbsolutePath().normalize();
    }

    @Override
    public InputStream getBlob(String name) throws IOException {
        var file = regularFile(name);
        log.atDebug().setMessage("Opening {}").addArgument(file).log();
        return Files.newInputStream(file);
    }

    @Override
    public boolean exists(String name) {
        return Files.isRegularFile(resolve(name));
    }

    @Override
    public long getBlobSize(String name) throws IOException {
        return Files.size(regularFile(name));
    }

    private Path regularFile(String name) throws IOException {
        var file = resolve(name);
        if (!Files.exists(file)) {
            throw new NoSuchFileException(file.toString());
        }
        if (!Files.isRegularFile(file)) {
            throw new IOException(file + " is not a regular file");
        }
        return file;
    }

    private Path resolve(String name) {
        var file = directory.resolve(name).normalize();
        if (!file.startsWith(directory)) {
            throw new IllegalArgumentException(name + " is outside of " + directory);
        }
        return file;
    }
}
