package com.scholary.narrator.job;

/** The pipeline stage a failed job stopped in. */
public enum FailureStage {
  EXTRACTION,
  CHUNKING,
  SYNTHESIS,
  MERGE,
  CANCELLED,
  INTERNAL
}
