package com.scholary.narrator.synthesis;

/** Why a chunk could not be synthesized. */
public enum FailureKind {
  SERVICE_ERROR,
  TIMEOUT,
  EMPTY_AUDIO,
  CANCELLED
}
