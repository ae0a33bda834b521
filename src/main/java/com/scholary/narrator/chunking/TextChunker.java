package com.scholary.narrator.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Splits document text into chunks the TTS service accepts.
 *
 * <p>Boundaries are chosen in order of preference:
 *
 * <ol>
 *   <li>Paragraph breaks: whole paragraphs are packed into a chunk while they fit
 *   <li>Sentence breaks: a paragraph longer than the limit is packed sentence by sentence
 *   <li>Word breaks, then hard cuts: a sentence longer than the limit is cut at the last whitespace
 *       inside the window, or at the window edge when there is none
 * </ol>
 *
 * <p>No chunk ever exceeds {@code maxChunkChars}. Chunking is a pure function of its inputs, so
 * the same text always yields the same chunks with the same indices.
 */
@Component
public class TextChunker {

  private static final Logger LOGGER = LoggerFactory.getLogger(TextChunker.class);

  private static final Pattern PARAGRAPH_SPLIT = Pattern.compile("\\n\\s*\\n");
  private static final Pattern SENTENCE_SPLIT = Pattern.compile("(?<=[.!?])\\s+");
  private static final String PARAGRAPH_SEPARATOR = "\n\n";
  private static final String SENTENCE_SEPARATOR = " ";

  private final int maxChunks;

  public TextChunker(@Value("${narrator.chunking.maxChunks}") int maxChunks) {
    this.maxChunks = maxChunks;
  }

  /**
   * Split text into ordered chunks no longer than {@code maxChunkChars}.
   *
   * @param text the normalized document text
   * @param maxChunkChars the TTS service's input limit
   * @param voice the voice every chunk is synthesized with
   * @return chunks with contiguous indices starting at 0; a single empty chunk for empty text
   * @throws ChunkLimitException if the limit is not positive or the text needs more than the
   *     configured maximum number of chunks
   */
  public List<TextChunk> chunk(String text, int maxChunkChars, String voice) {
    if (maxChunkChars <= 0) {
      throw new ChunkLimitException(
          String.format("Maximum chunk size must be positive, got %d", maxChunkChars));
    }

    String trimmed = text == null ? "" : text.strip();
    if (trimmed.isEmpty()) {
      return List.of(new TextChunk(0, "", voice));
    }

    List<String> pieces = new ArrayList<>();
    StringBuilder current = new StringBuilder();

    for (String rawParagraph : PARAGRAPH_SPLIT.split(trimmed)) {
      String paragraph = rawParagraph.strip();
      if (paragraph.isEmpty()) {
        continue;
      }

      if (fits(current, paragraph, PARAGRAPH_SEPARATOR, maxChunkChars)) {
        append(current, paragraph, PARAGRAPH_SEPARATOR);
        continue;
      }

      flush(current, pieces);
      if (paragraph.length() <= maxChunkChars) {
        current.append(paragraph);
      } else {
        splitParagraph(paragraph, maxChunkChars, current, pieces);
      }
    }
    flush(current, pieces);

    List<TextChunk> chunks = new ArrayList<>(pieces.size());
    for (int i = 0; i < pieces.size(); i++) {
      chunks.add(new TextChunk(i, pieces.get(i), voice));
    }

    LOGGER.info(
        "Split {} characters into {} chunks (maxChunkChars={})",
        trimmed.length(),
        chunks.size(),
        maxChunkChars);
    return chunks;
  }

  /**
   * Pass the whole text through as one chunk.
   *
   * <p>Used when chunking is disabled. The TTS service may reject or truncate an oversized input;
   * that failure is reported by synthesis rather than hidden here.
   */
  public List<TextChunk> singleChunk(String text, String voice) {
    String verbatim = text == null ? "" : text;
    LOGGER.info("Chunking disabled, passing {} characters as a single chunk", verbatim.length());
    return List.of(new TextChunk(0, verbatim, voice));
  }

  private void splitParagraph(
      String paragraph, int maxChunkChars, StringBuilder current, List<String> pieces) {
    for (String rawSentence : SENTENCE_SPLIT.split(paragraph)) {
      String sentence = rawSentence.strip();
      if (sentence.isEmpty()) {
        continue;
      }

      if (fits(current, sentence, SENTENCE_SEPARATOR, maxChunkChars)) {
        append(current, sentence, SENTENCE_SEPARATOR);
        continue;
      }

      flush(current, pieces);
      if (sentence.length() <= maxChunkChars) {
        current.append(sentence);
      } else {
        LOGGER.warn(
            "Sentence of {} characters exceeds max chunk size ({}), cutting it",
            sentence.length(),
            maxChunkChars);
        cutSentence(sentence, maxChunkChars, current, pieces);
      }
    }
  }

  /** Cut an oversized sentence into full windows; the remainder is left in {@code current}. */
  private void cutSentence(
      String sentence, int maxChunkChars, StringBuilder current, List<String> pieces) {
    int start = 0;
    while (sentence.length() - start > maxChunkChars) {
      int end = start + maxChunkChars;
      int cut = lastWhitespace(sentence, start, end);
      int next;

      if (cut > start) {
        next = cut + 1;
      } else {
        cut = end;
        // Keep surrogate pairs together
        if (Character.isHighSurrogate(sentence.charAt(cut - 1)) && cut - 1 > start) {
          cut--;
        }
        next = cut;
      }

      addPiece(sentence.substring(start, cut).strip(), pieces);
      start = skipWhitespace(sentence, next);
    }

    if (start < sentence.length()) {
      current.append(sentence.substring(start));
    }
  }

  private static int lastWhitespace(String text, int start, int end) {
    for (int i = end; i > start; i--) {
      if (Character.isWhitespace(text.charAt(i))) {
        return i;
      }
    }
    return -1;
  }

  private static int skipWhitespace(String text, int from) {
    int i = from;
    while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
      i++;
    }
    return i;
  }

  private static boolean fits(StringBuilder current, String next, String separator, int limit) {
    if (current.length() == 0) {
      return next.length() <= limit;
    }
    return current.length() + separator.length() + next.length() <= limit;
  }

  private static void append(StringBuilder current, String next, String separator) {
    if (current.length() > 0) {
      current.append(separator);
    }
    current.append(next);
  }

  private void flush(StringBuilder current, List<String> pieces) {
    if (current.length() > 0) {
      addPiece(current.toString().strip(), pieces);
      current.setLength(0);
    }
  }

  private void addPiece(String piece, List<String> pieces) {
    if (piece.isEmpty()) {
      return;
    }
    pieces.add(piece);
    if (pieces.size() > maxChunks) {
      throw new ChunkLimitException(
          String.format("Text requires more than %d chunks", maxChunks));
    }
  }
}
