package com.flamingo.ai.voicetutor.domain.model;

import com.flamingo.ai.voicetutor.domain.enums.LanguageHint;
import com.flamingo.ai.voicetutor.domain.enums.ResponseStyle;
import java.util.List;
import java.util.UUID;

/** A single voice question entering the pipeline. */
public record VoiceRequest(
    String requestId,
    AudioPayload audio,
    LanguageHint languageHint,
    String videoId,
    List<ConversationTurn> history,
    boolean synthesizeSpeech,
    ResponseStyle responseStyle) {

  public VoiceRequest {
    if (requestId == null || requestId.isBlank()) {
      requestId = newRequestId();
    }
    languageHint = languageHint == null ? LanguageHint.AUTO : languageHint;
    responseStyle = responseStyle == null ? ResponseStyle.VOICE : responseStyle;
    history = history == null ? List.of() : List.copyOf(history);
    videoId = videoId == null || videoId.isBlank() ? null : videoId.trim();
  }

  public boolean hasVideo() {
    return videoId != null;
  }

  /** Short id printed in every pipeline log line. */
  public static String newRequestId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
