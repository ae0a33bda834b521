package com.scholary.narrator.extraction;

import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Picks the extractor for a document by its file name and runs it.
 *
 * <p>Supported formats are whatever {@link TextExtractor} beans are registered: PDF and EPUB.
 */
@Component
public class DocumentTextExtractor {

  private static final Logger LOGGER = LoggerFactory.getLogger(DocumentTextExtractor.class);

  private final List<TextExtractor> extractors;

  public DocumentTextExtractor(List<TextExtractor> extractors) {
    this.extractors = extractors;
  }

  /** Whether any registered extractor handles this file name. */
  public boolean isSupported(String filename) {
    return extractors.stream().anyMatch(extractor -> extractor.supports(filename));
  }

  /**
   * Extract text from a document.
   *
   * @param file the document on disk
   * @param filename the original file name, used to pick the format
   * @return the extracted text
   * @throws UnsupportedDocumentException if no extractor handles the file name
   * @throws DocumentParseException if the document cannot be read, including runtime failures
   *     raised by the parsing libraries on malformed input
   */
  public String extract(Path file, String filename) {
    TextExtractor extractor =
        extractors.stream()
            .filter(candidate -> candidate.supports(filename))
            .findFirst()
            .orElseThrow(
                () ->
                    new UnsupportedDocumentException(
                        "Unsupported file type: "
                            + filename
                            + ". Only .pdf and .epub are supported"));

    LOGGER.debug("Using {} for {}", extractor.getClass().getSimpleName(), filename);
    try {
      return extractor.extract(file);
    } catch (DocumentParseException e) {
      throw e;
    } catch (RuntimeException e) {
      LOGGER.warn("Extractor failed on {}: {}", filename, e.toString());
      throw new DocumentParseException(
          "Failed to read " + filename + ": " + e.getMessage(), e);
    }
  }
}
