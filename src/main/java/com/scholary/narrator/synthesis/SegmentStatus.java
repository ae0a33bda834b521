package com.scholary.narrator.synthesis;

public enum SegmentStatus {
  PENDING,
  SUCCEEDED,
  FAILED
}
