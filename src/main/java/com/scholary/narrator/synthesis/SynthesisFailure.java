package com.scholary.narrator.synthesis;

public record SynthesisFailure(FailureKind kind, String reason) {

  @Override
  public String toString() {
    return kind + " (" + reason + ")";
  }
}
