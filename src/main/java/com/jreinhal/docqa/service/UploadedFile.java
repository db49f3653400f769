package com.jreinhal.docqa.service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Temporary copy of an upload on disk, deleted on {@link #close()}. Open it in a
 * try-with-resources block so the file is removed on every exit path.
 */
public final class UploadedFile implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(UploadedFile.class);
    private final Path path;

    private UploadedFile(Path path) {
        this.path = path;
    }

    public static UploadedFile write(Path directory, InputStream content) throws IOException {
        Files.createDirectories(directory);
        Path target = Files.createTempFile(directory, "upload-", ".tmp");
        try {
            Files.copy(content, target, StandardCopyOption.REPLACE_EXISTING);
        }
        catch (IOException e) {
            Files.deleteIfExists(target);
            throw e;
        }
        return new UploadedFile(target);
    }

    public Path path() {
        return this.path;
    }

    @Override
    public void close() {
        try {
            Files.deleteIfExists(this.path);
        }
        catch (IOException e) {
            log.warn("Could not delete temporary upload {}: {}", this.path.getFileName(), e.getMessage());
        }
    }
}
