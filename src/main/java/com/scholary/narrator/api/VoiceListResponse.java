package com.scholary.narrator.api;

import java.util.List;

/** Voices a client can pick from. */
public record VoiceListResponse(String defaultVoice, List<VoiceInfo> voices) {

  public record VoiceInfo(String displayName, String shortName) {}
}
