package com.scholary.narrator.extraction;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Extracts text from PDF files using Apache PDFBox.
 *
 * <p>Pages are extracted one by one and separated by a paragraph break so that page boundaries
 * become natural pauses in the narration.
 */
@Component
public class PdfTextExtractor implements TextExtractor {

  private static final Logger LOGGER = LoggerFactory.getLogger(PdfTextExtractor.class);

  @Override
  public boolean supports(String filename) {
    return filename != null && filename.toLowerCase(Locale.ROOT).endsWith(".pdf");
  }

  @Override
  public String extract(Path file) {
    LOGGER.info("Extracting text from PDF: {}", file.getFileName());

    try (PDDocument document = Loader.loadPDF(file.toFile())) {
      int pageCount = document.getNumberOfPages();
      PDFTextStripper stripper = new PDFTextStripper();
      StringBuilder text = new StringBuilder();

      for (int page = 1; page <= pageCount; page++) {
        stripper.setStartPage(page);
        stripper.setEndPage(page);
        String pageText = stripper.getText(document).strip();
        if (!pageText.isEmpty()) {
          text.append(pageText).append("\n\n");
        }
      }

      LOGGER.info("Extracted {} characters from {} pages", text.length(), pageCount);
      return text.toString().strip();

    } catch (IOException e) {
      throw new DocumentParseException("Failed to read PDF: " + file.getFileName(), e);
    }
  }
}
