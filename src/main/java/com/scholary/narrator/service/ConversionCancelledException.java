package com.scholary.narrator.service;

/** Thrown inside the pipeline when its thread has been interrupted by a cancellation. */
class ConversionCancelledException extends RuntimeException {

  ConversionCancelledException() {
    super("Conversion cancelled");
  }
}
