package com.scholary.narrator.job;

public enum ProgressStage {
  EXTRACTING,
  SYNTHESIZING,
  MERGING
}
