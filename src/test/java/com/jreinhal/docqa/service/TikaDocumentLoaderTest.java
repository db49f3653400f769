package com.jreinhal.docqa.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.jreinhal.docqa.exception.DocumentLoadException;
import com.jreinhal.docqa.model.TextSegment;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TikaDocumentLoaderTest {

    private final TikaDocumentLoader loader = new TikaDocumentLoader();

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should read plain text as a single unpaged segment")
    void plainText() throws IOException {
        Path file = Files.writeString(this.tempDir.resolve("upload.tmp"), "Hello plain text document", StandardCharsets.UTF_8);

        List<TextSegment> segments = loader.load(file, "notes.txt");

        assertThat(segments).hasSize(1);
        assertThat(segments.get(0).text()).contains("Hello plain text document");
        assertThat(segments.get(0).page()).isNull();
    }

    @Test
    @DisplayName("Should read PDFs page by page and skip pages without text")
    void pdfPages() throws IOException {
        Path file = this.tempDir.resolve("upload.tmp");
        try (PDDocument document = new PDDocument()) {
            for (String text : new String[]{"First page text", null, "Third page text"}) {
                PDPage page = new PDPage();
                document.addPage(page);
                if (text == null) {
                    continue;
                }
                try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                    content.beginText();
                    content.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
                    content.newLineAtOffset(72, 700);
                    content.showText(text);
                    content.endText();
                }
            }
            document.save(file.toFile());
        }

        List<TextSegment> segments = loader.load(file, "report.pdf");

        assertThat(segments).extracting(TextSegment::page).containsExactly(0, 2);
        assertThat(segments.get(0).text()).contains("First page text");
        assertThat(segments.get(1).text()).contains("Third page text");
    }

    @Test
    void emptyFileRejected() throws IOException {
        Path file = Files.createFile(this.tempDir.resolve("empty.tmp"));

        assertThatThrownBy(() -> loader.load(file, "empty.txt"))
                .isInstanceOf(DocumentLoadException.class)
                .hasMessageContaining("empty");
    }

    @Test
    void whitespaceOnlyFileRejected() throws IOException {
        Path file = Files.writeString(this.tempDir.resolve("blank.tmp"), "   \n   \n");

        assertThatThrownBy(() -> loader.load(file, "blank.txt")).isInstanceOf(DocumentLoadException.class);
    }

    @Test
    @DisplayName("Should reject images regardless of the claimed file name")
    void imageRejected() throws IOException {
        byte[] png = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n', 0, 0, 0, 0x0D, 'I', 'H', 'D', 'R'};
        Path file = Files.write(this.tempDir.resolve("image.tmp"), png);

        assertThatThrownBy(() -> loader.load(file, "picture.png"))
                .isInstanceOf(DocumentLoadException.class)
                .hasMessageContaining("Unsupported file type");
    }

    @Test
    void missingFileRejected() {
        assertThatThrownBy(() -> loader.load(this.tempDir.resolve("missing.tmp"), "missing.txt"))
                .isInstanceOf(DocumentLoadException.class)
                .hasCauseInstanceOf(IOException.class);
    }
}
