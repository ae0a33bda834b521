package com.scholary.narrator.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PdfTextExtractorTest {

  @TempDir Path tempDir;

  private final PdfTextExtractor extractor = new PdfTextExtractor();

  @Test
  void supports_shouldMatchPdfExtensionIgnoringCase() {
    assertThat(extractor.supports("book.pdf")).isTrue();
    assertThat(extractor.supports("BOOK.PDF")).isTrue();
    assertThat(extractor.supports("book.epub")).isFalse();
    assertThat(extractor.supports(null)).isFalse();
  }

  @Test
  void extract_shouldSeparatePagesWithBlankLine() throws Exception {
    Path pdf = writePdf("two-pages.pdf", "Hello from page one", "", "Goodbye from page three");

    String text = extractor.extract(pdf);

    assertThat(text).startsWith("Hello from page one").endsWith("Goodbye from page three");
    assertThat(text).containsOnlyOnce("\n\n");
  }

  @Test
  void extract_shouldReturnEmptyTextForBlankPdf() throws Exception {
    Path pdf = writePdf("blank.pdf", "");

    assertThat(extractor.extract(pdf)).isEmpty();
  }

  @Test
  void extract_shouldWrapCorruptFile() throws Exception {
    Path corrupt = Files.writeString(tempDir.resolve("corrupt.pdf"), "this is not a pdf");

    assertThatThrownBy(() -> extractor.extract(corrupt))
        .isInstanceOf(DocumentParseException.class)
        .hasMessageContaining("corrupt.pdf")
        .hasCauseInstanceOf(IOException.class);
  }

  private Path writePdf(String name, String... pages) throws IOException {
    Path file = tempDir.resolve(name);
    try (PDDocument document = new PDDocument()) {
      PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
      for (String pageText : pages) {
        PDPage page = new PDPage();
        document.addPage(page);
        if (pageText.isEmpty()) {
          continue;
        }
        try (PDPageContentStream content = new PDPageContentStream(document, page)) {
          content.beginText();
          content.setFont(font, 12);
          content.newLineAtOffset(72, 700);
          content.showText(pageText);
          content.endText();
        }
      }
      document.save(file.toFile());
    }
    return file;
  }
}
