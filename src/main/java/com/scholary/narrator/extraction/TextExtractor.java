package com.scholary.narrator.extraction;

import java.nio.file.Path;

/**
 * Interface for document text extraction.
 *
 * <p>Each implementation handles one document format, chosen by file extension.
 */
public interface TextExtractor {

  /**
   * Whether this extractor handles the given file name.
   *
   * @param filename the original file name, as uploaded
   */
  boolean supports(String filename);

  /**
   * Extract the readable text of a document.
   *
   * <p>Paragraph and page boundaries are kept as blank lines ({@code "\n\n"}).
   *
   * @param file the document on disk
   * @return the extracted text, possibly empty
   * @throws DocumentParseException if the document cannot be read
   */
  String extract(Path file);
}
