package com.flamingo.ai.voicetutor.domain.enums;

import com.flamingo.ai.voicetutor.exception.InvalidVoiceRequestException;
import java.util.Locale;

/** Language hint supplied with a voice question. */
public enum LanguageHint {
  AUTO("auto"),
  HEBREW("he"),
  ENGLISH("en");

  private final String code;

  LanguageHint(String code) {
    this.code = code;
  }

  public String getCode() {
    return code;
  }

  public boolean isAuto() {
    return this == AUTO;
  }

  /**
   * Resolves a hint from its wire code. Blank input means {@link #AUTO}.
   *
   * @param code the language code sent by the client
   * @return the matching hint
   * @throws InvalidVoiceRequestException if the code is not supported
   */
  public static LanguageHint fromCode(String code) {
    if (code == null || code.isBlank()) {
      return AUTO;
    }
    String normalized = code.trim().toLowerCase(Locale.ROOT);
    for (LanguageHint hint : values()) {
      if (hint.code.equals(normalized)) {
        return hint;
      }
    }
    throw new InvalidVoiceRequestException(
        "Unsupported language '" + code.trim() + "' (expected auto, he or en)");
  }
}
