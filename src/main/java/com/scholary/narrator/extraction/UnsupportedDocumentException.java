package com.scholary.narrator.extraction;

/** Exception thrown when an upload is not a document type we can convert. */
public class UnsupportedDocumentException extends RuntimeException {

  public UnsupportedDocumentException(String message) {
    super(message);
  }
}
