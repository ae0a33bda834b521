package com.scholary.narrator.synthesis;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of synthesizing every chunk of a document.
 *
 * @param segments every segment the sequencer got to, in ascending index order
 * @param failures the failed segments, in ascending index order
 */
public record SequenceResult(List<SynthesizedSegment> segments, List<SynthesizedSegment> failures) {

  public SequenceResult {
    segments = List.copyOf(segments);
    failures = List.copyOf(failures);
  }

  public boolean succeeded() {
    return failures.isEmpty();
  }

  /** Audio files in merge order. Only meaningful when {@link #succeeded()}. */
  public List<Path> audioPaths() {
    return segments.stream().map(SynthesizedSegment::audioPath).toList();
  }

  public List<Integer> failedIndices() {
    return failures.stream().map(SynthesizedSegment::sequenceIndex).toList();
  }
}
