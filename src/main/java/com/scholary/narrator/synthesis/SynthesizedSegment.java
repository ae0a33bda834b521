package com.scholary.narrator.synthesis;

import java.nio.file.Path;

/**
 * The audio produced for one chunk, or the reason there is none.
 *
 * <p>{@code audioPath} is set only when {@code status} is {@link SegmentStatus#SUCCEEDED};
 * {@code failure} only when it is {@link SegmentStatus#FAILED}.
 */
public record SynthesizedSegment(
    int sequenceIndex,
    Path audioPath,
    SegmentStatus status,
    SynthesisFailure failure,
    int attempts) {

  public static SynthesizedSegment succeeded(int sequenceIndex, Path audioPath, int attempts) {
    return new SynthesizedSegment(
        sequenceIndex, audioPath, SegmentStatus.SUCCEEDED, null, attempts);
  }

  public static SynthesizedSegment failed(
      int sequenceIndex, SynthesisFailure failure, int attempts) {
    return new SynthesizedSegment(sequenceIndex, null, SegmentStatus.FAILED, failure, attempts);
  }

  public boolean isSucceeded() {
    return status == SegmentStatus.SUCCEEDED;
  }

  public boolean isFailed() {
    return status == SegmentStatus.FAILED;
  }
}
