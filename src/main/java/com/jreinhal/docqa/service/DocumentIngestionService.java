package com.jreinhal.docqa.service;

import com.jreinhal.docqa.dto.UploadResult;
import com.jreinhal.docqa.exception.DocumentLoadException;
import com.jreinhal.docqa.model.Chunk;
import com.jreinhal.docqa.model.TextSegment;
import com.jreinhal.docqa.session.SessionStore;
import com.jreinhal.docqa.util.LogSanitizer;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

@Service
public class DocumentIngestionService {
    private static final Logger log = LoggerFactory.getLogger(DocumentIngestionService.class);
    static final String DEFAULT_FILENAME = "document";
    private final DocumentLoader documentLoader;
    private final TextSplitter textSplitter;
    private final SessionStore sessionStore;
    @Value("${docqa.ingest.chunk-size:1000}")
    private int chunkSize;
    @Value("${docqa.ingest.chunk-overlap:100}")
    private int chunkOverlap;
    @Value("${docqa.ingest.upload-dir:${java.io.tmpdir}/docqa-uploads}")
    private String uploadDir;
    @Value("${docqa.ingest.max-file-bytes:52428800}")
    private long maxFileBytes;

    public DocumentIngestionService(DocumentLoader documentLoader, TextSplitter textSplitter, SessionStore sessionStore) {
        this.documentLoader = documentLoader;
        this.textSplitter = textSplitter;
        this.sessionStore = sessionStore;
    }

    /**
     * Loads, splits and indexes an upload into a new session.
     *
     * @param label display label; the file name is used when blank
     */
    public UploadResult ingest(MultipartFile file, String label) {
        PreparedUpload upload = this.prepare(file);
        String effectiveLabel = label == null || label.isBlank() ? upload.filename() : label.strip();
        String sessionId = this.sessionStore.createSession(upload.chunks(), effectiveLabel);
        log.info("Ingested {} into session {} (chunks={}, pages={})", LogSanitizer.sanitize(upload.filename()), sessionId, upload.chunks().size(), upload.pageCount());
        return new UploadResult(sessionId, upload.filename(), upload.chunks().size(), upload.pageCount());
    }

    /**
     * Indexes an upload as an additional document of an existing session.
     *
     * @return empty when the session has expired or never existed
     */
    public Optional<UploadResult> attach(String sessionId, MultipartFile file) {
        PreparedUpload upload = this.prepare(file);
        if (!this.sessionStore.attachIndex(sessionId, upload.chunks())) {
            return Optional.empty();
        }
        return Optional.of(new UploadResult(sessionId, upload.filename(), upload.chunks().size(), upload.pageCount()));
    }

    private PreparedUpload prepare(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("No file uploaded");
        }
        if (file.getSize() > this.maxFileBytes) {
            throw new IllegalArgumentException("File exceeds the maximum upload size of " + this.maxFileBytes + " bytes");
        }
        String filename = safeFilename(file.getOriginalFilename());
        List<TextSegment> segments;
        try (InputStream in = file.getInputStream();
             UploadedFile stored = UploadedFile.write(Path.of(this.uploadDir), in)) {
            segments = this.documentLoader.load(stored.path(), filename);
        }
        catch (IOException e) {
            throw new DocumentLoadException("Unable to store upload", e);
        }
        List<Chunk> chunks = this.textSplitter.split(segments, this.chunkSize, this.chunkOverlap, filename);
        int pageCount = (int) segments.stream().map(TextSegment::page).filter(Objects::nonNull).distinct().count();
        return new PreparedUpload(filename, chunks, pageCount);
    }

    static String safeFilename(String original) {
        if (original == null || original.isBlank()) {
            return DEFAULT_FILENAME;
        }
        String name = original.substring(Math.max(original.lastIndexOf('/'), original.lastIndexOf('\\')) + 1);
        name = LogSanitizer.sanitize(name).strip();
        return name.isEmpty() ? DEFAULT_FILENAME : name;
    }

    private record PreparedUpload(String filename, List<Chunk> chunks, int pageCount) {
    }
}
