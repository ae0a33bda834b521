package com.scholary.narrator.tts;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.narrator.config.NarratorProperties.Voice;
import com.scholary.narrator.testutil.TestProperties;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class VoiceCatalogTest {

  private final VoiceCatalog catalog = new VoiceCatalog(TestProperties.narrator(Path.of("build")));

  @Test
  void resolve_shouldKeepKnownVoice() {
    assertThat(catalog.resolve(TestProperties.OTHER_VOICE)).isEqualTo(TestProperties.OTHER_VOICE);
    assertThat(catalog.resolve("  " + TestProperties.OTHER_VOICE + " "))
        .isEqualTo(TestProperties.OTHER_VOICE);
  }

  @Test
  void resolve_shouldFallBackToDefaultForBlankOrUnknown() {
    assertThat(catalog.resolve(null)).isEqualTo(TestProperties.DEFAULT_VOICE);
    assertThat(catalog.resolve("")).isEqualTo(TestProperties.DEFAULT_VOICE);
    assertThat(catalog.resolve("xx-XX-NobodyNeural")).isEqualTo(TestProperties.DEFAULT_VOICE);
  }

  @Test
  void voices_shouldListConfiguredVoices() {
    assertThat(catalog.defaultVoice()).isEqualTo(TestProperties.DEFAULT_VOICE);
    assertThat(catalog.voices())
        .extracting(Voice::shortName)
        .containsExactly(TestProperties.DEFAULT_VOICE, TestProperties.OTHER_VOICE);
    assertThat(catalog.isKnown("en-us-arianeural")).isFalse();
  }
}
