package com.flamingo.ai.voicetutor.domain.model;

import java.util.Base64;
import java.util.Objects;

/**
 * Result of a speech synthesis attempt: either encoded audio or a marker telling the client to use
 * its own voice synthesis.
 */
public final class SynthesisResult {

  private final byte[] audio;
  private final String mimeType;
  private final String fallbackReason;

  private SynthesisResult(byte[] audio, String mimeType, String fallbackReason) {
    this.audio = audio;
    this.mimeType = mimeType;
    this.fallbackReason = fallbackReason;
  }

  public static SynthesisResult audio(byte[] audio, String mimeType) {
    Objects.requireNonNull(audio, "audio");
    if (audio.length == 0) {
      throw new IllegalArgumentException("Synthesized audio must not be empty");
    }
    return new SynthesisResult(audio, Objects.requireNonNull(mimeType, "mimeType"), null);
  }

  public static SynthesisResult fallback(String reason) {
    return new SynthesisResult(null, null, Objects.requireNonNull(reason, "reason"));
  }

  public boolean isAudio() {
    return audio != null;
  }

  public byte[] getAudio() {
    return audio;
  }

  public String getMimeType() {
    return mimeType;
  }

  public String getFallbackReason() {
    return fallbackReason;
  }

  /** Audio encoded as a {@code data:} URL, or {@code null} for a fallback. */
  public String toDataUrl() {
    if (audio == null) {
      return null;
    }
    return "data:" + mimeType + ";base64," + Base64.getEncoder().encodeToString(audio);
  }
}
