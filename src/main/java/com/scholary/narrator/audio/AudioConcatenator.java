package com.scholary.narrator.audio;

import java.nio.file.Path;
import java.util.List;

/**
 * Interface for joining audio segments into one file.
 *
 * <p>Segments are joined in list order; callers pass them sorted by chunk index.
 */
public interface AudioConcatenator {

  /**
   * Concatenate segments into a single output file.
   *
   * @param orderedSegments segment files, in playback order
   * @param output the file to create or overwrite
   * @throws MergeException if the output cannot be produced
   */
  void concat(List<Path> orderedSegments, Path output);
}
