package com.jreinhal.docqa.service;

import com.jreinhal.docqa.exception.DocumentLoadException;
import com.jreinhal.docqa.model.TextSegment;
import com.jreinhal.docqa.util.LogSanitizer;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParserFactory;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.tika.Tika;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.xml.sax.SAXException;

/**
 * Detects the upload type from its magic bytes, reads PDFs page by page with PDFBox and
 * everything else in one pass with Tika.
 */
@Component
public class TikaDocumentLoader implements DocumentLoader {
    private static final Logger log = LoggerFactory.getLogger(TikaDocumentLoader.class);
    static final String PDF_MIME_TYPE = "application/pdf";
    private static final int MAX_TIKA_CHARS = 10_000_000;
    private static final Set<String> BLOCKED_MIME_TYPES = Set.of(
        "application/x-executable", "application/x-msdownload", "application/x-dosexec",
        "application/x-sh", "application/x-shellscript", "text/x-shellscript",
        "application/java-archive", "application/java-vm",
        "application/zip", "application/x-rar-compressed", "application/x-7z-compressed",
        "application/vnd.rar", "application/x-tar", "application/gzip",
        "application/x-bzip2", "application/x-xz"
    );
    private final Tika tika = new Tika();

    @Override
    public List<TextSegment> load(Path path, String filename) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        }
        catch (IOException e) {
            throw new DocumentLoadException("Unable to read uploaded file", e);
        }
        if (bytes.length == 0) {
            throw new DocumentLoadException("Uploaded file is empty");
        }
        String mimeType = this.tika.detect(bytes, filename);
        log.info("Detected {} for {}", mimeType, LogSanitizer.sanitize(filename));
        if (BLOCKED_MIME_TYPES.contains(mimeType) || mimeType.startsWith("image/")
                || mimeType.startsWith("audio/") || mimeType.startsWith("video/")) {
            throw new DocumentLoadException("Unsupported file type: " + mimeType);
        }
        List<TextSegment> segments = PDF_MIME_TYPE.equals(mimeType) ? this.loadPdfPages(bytes) : this.loadWithTika(bytes, filename, mimeType);
        if (segments.isEmpty()) {
            throw new DocumentLoadException("No extractable text found in document");
        }
        return segments;
    }

    private List<TextSegment> loadPdfPages(byte[] bytes) {
        try (PDDocument document = Loader.loadPDF(bytes)) {
            PDFTextStripper stripper = new PDFTextStripper();
            int pageCount = document.getNumberOfPages();
            List<TextSegment> pages = new ArrayList<>(pageCount);
            for (int page = 1; page <= pageCount; ++page) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                String text = stripper.getText(document);
                if (text != null && !text.isBlank()) {
                    pages.add(new TextSegment(text, page - 1));
                }
            }
            log.debug("PDF pages with text: {} of {}", pages.size(), pageCount);
            return pages;
        }
        catch (IOException e) {
            throw new DocumentLoadException("Unable to read PDF document", e);
        }
    }

    private List<TextSegment> loadWithTika(byte[] bytes, String filename, String mimeType) {
        String extracted = this.extractTextWithTika(bytes, filename);
        if ((extracted == null || extracted.isBlank()) && mimeType.startsWith("text/")) {
            extracted = new String(bytes, StandardCharsets.UTF_8);
        }
        if (extracted == null || extracted.isBlank()) {
            return List.of();
        }
        return List.of(new TextSegment(extracted, null));
    }

    private String extractTextWithTika(byte[] bytes, String filename) {
        try {
            AutoDetectParser parser = new AutoDetectParser();
            ParseContext context = new ParseContext();
            SAXParserFactory spf = SAXParserFactory.newInstance();
            spf.setFeature("http://xml.org/sax/features/external-general-entities", false);
            spf.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            spf.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            context.set(SAXParserFactory.class, spf);
            Metadata metadata = new Metadata();
            if (filename != null) {
                metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, filename);
            }
            BodyContentHandler handler = new BodyContentHandler(MAX_TIKA_CHARS);
            parser.parse(new ByteArrayInputStream(bytes), handler, metadata, context);
            return handler.toString();
        }
        catch (IOException | SAXException | TikaException | ParserConfigurationException e) {
            log.warn("Tika extraction failed for {}: {}", LogSanitizer.sanitize(filename), e.getMessage());
            return "";
        }
    }
}
