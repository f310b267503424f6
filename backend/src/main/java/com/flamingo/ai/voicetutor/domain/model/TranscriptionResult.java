package com.flamingo.ai.voicetutor.domain.model;

/**
 * Output of the speech-to-text provider.
 *
 * @param text transcribed question
 * @param language detected (or hinted) language code
 * @param durationSeconds audio duration, if reported
 */
public record TranscriptionResult(String text, String language, Double durationSeconds) {

  public boolean hasSpeech() {
    return text != null && !text.isBlank();
  }
}
