package com.scholary.narrator.chunking;

/**
 * A bounded span of document text with its position in reading order.
 *
 * <p>{@code sequenceIndex} is the only property used to order synthesized audio when merging.
 */
public record TextChunk(int sequenceIndex, String text, String voice) {

  public TextChunk {
    if (sequenceIndex < 0) {
      throw new IllegalArgumentException("Sequence index cannot be negative");
    }
    if (text == null) {
      throw new IllegalArgumentException("Chunk text cannot be null");
    }
  }

  /** One-based chunk number, as shown in progress messages and segment file names. */
  public int chunkNumber() {
    return sequenceIndex + 1;
  }

  public int length() {
    return text.length();
  }
}
