package com.scholary.narrator.synthesis;

/**
 * Receives sequencer progress, always in ascending chunk order.
 *
 * <p>Called from the thread running the sequencer.
 */
public interface SequenceProgressListener {

  SequenceProgressListener NONE = new SequenceProgressListener() {};

  /** Chunk {@code sequenceIndex} is the next one the sequencer waits for. */
  default void onChunkStarted(int sequenceIndex, int totalChunks) {}

  /** Chunk {@code segment.sequenceIndex()} finished; {@code completed} chunks are now done. */
  default void onSegmentCompleted(SynthesizedSegment segment, int completed, int totalChunks) {}
}
