package com.flamingo.ai.voicetutor.domain.enums;

import com.flamingo.ai.voicetutor.exception.InvalidVoiceRequestException;
import java.util.Locale;

/**
 * Length/register of the generated answer. VOICE answers are kept to a few sentences so they can be
 * spoken quickly; TEXT answers may be longer because they are read on screen.
 */
public enum ResponseStyle {
  VOICE,
  TEXT;

  public static ResponseStyle fromCode(String code) {
    if (code == null || code.isBlank()) {
      return VOICE;
    }
    try {
      return valueOf(code.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new InvalidVoiceRequestException(
          "Unsupported response style '" + code.trim() + "' (expected voice or text)");
    }
  }
}
