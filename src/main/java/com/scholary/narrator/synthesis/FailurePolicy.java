package com.scholary.narrator.synthesis;

/** What the sequencer does when a chunk fails. */
public enum FailurePolicy {
  /** Stop at the first failed chunk and cancel everything still outstanding. */
  FAIL_FAST,
  /** Let every chunk finish, then report all failed chunks together. */
  FAIL_COMPLETE
}
