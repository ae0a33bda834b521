package com.scholary.narrator.extraction;

/**
 * Exception thrown when a document cannot be read or yields no text.
 *
 * <p>Corrupt archives, encrypted PDFs and documents without any text all end up here.
 */
public class DocumentParseException extends RuntimeException {

  public DocumentParseException(String message) {
    super(message);
  }

  public DocumentParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
