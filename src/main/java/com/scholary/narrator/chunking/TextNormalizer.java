package com.scholary.narrator.chunking;

import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Cleans extracted document text before chunking.
 *
 * <p>Extractors return text with layout artefacts: hard-wrapped lines, runs of spaces, blank lines
 * padded with tabs. The normalizer keeps paragraph breaks (as a single {@code "\n\n"}) and turns
 * everything else into single spaces, which is what the chunker splits on.
 */
@Component
public class TextNormalizer {

  private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[ \\t\\x0B\\f\\u00A0]+");
  private static final Pattern PARAGRAPH_BREAK = Pattern.compile("(\\r?\\n[ \\t]*){2,}");
  private static final Pattern SINGLE_LINE_BREAK = Pattern.compile("(?<!\\n)\\r?\\n(?!\\n)");
  private static final Pattern MULTIPLE_SPACES = Pattern.compile(" {2,}");

  /**
   * Normalize whitespace in extracted text.
   *
   * @param text raw text, may be null
   * @return normalized text, never null
   */
  public String normalize(String text) {
    if (text == null) {
      return "";
    }

    String result = text.strip();
    result = HORIZONTAL_WHITESPACE.matcher(result).replaceAll(" ");
    result = PARAGRAPH_BREAK.matcher(result).replaceAll("\n\n");
    result = SINGLE_LINE_BREAK.matcher(result).replaceAll(" ");
    result = MULTIPLE_SPACES.matcher(result).replaceAll(" ");

    // Spaces left hugging a paragraph break by the single-line pass
    result = result.replace(" \n\n", "\n\n").replace("\n\n ", "\n\n");
    return result.strip();
  }
}
