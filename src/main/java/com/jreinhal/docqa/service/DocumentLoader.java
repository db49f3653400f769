package com.jreinhal.docqa.service;

import com.jreinhal.docqa.model.TextSegment;
import java.nio.file.Path;
import java.util.List;

/**
 * Extracts raw text from an uploaded file.
 */
public interface DocumentLoader {

    /**
     * @param path     readable file holding the upload
     * @param filename name the client gave the file, used for type detection
     * @return non-empty list of non-blank segments
     * @throws com.jreinhal.docqa.exception.DocumentLoadException when the type is unsupported or no text is found
     */
    List<TextSegment> load(Path path, String filename);
}
