package com.scholary.narrator.tts;

/**
 * Interface for text-to-speech services.
 *
 * <p>This abstraction keeps the pipeline independent of the TTS provider. Implementations make a
 * single attempt; timeouts and retries are applied by the caller.
 */
public interface SpeechSynthesizer {

  /**
   * Synthesize speech for a piece of text.
   *
   * @param text the text to speak
   * @param voice the provider's voice identifier
   * @return encoded MP3 audio, possibly empty if the service produced nothing
   * @throws TtsServiceException if the service call fails
   */
  byte[] synthesize(String text, String voice);
}
