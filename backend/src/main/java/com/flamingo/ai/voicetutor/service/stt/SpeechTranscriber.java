package com.flamingo.ai.voicetutor.service.stt;

import com.flamingo.ai.voicetutor.domain.enums.LanguageHint;
import com.flamingo.ai.voicetutor.domain.model.AudioPayload;
import com.flamingo.ai.voicetutor.domain.model.TranscriptionResult;
import reactor.core.publisher.Mono;

/** Speech-to-text adapter. */
public interface SpeechTranscriber {

  /**
   * Transcribes one audio clip.
   *
   * @param audio validated audio
   * @param languageHint client language hint; {@code AUTO} lets the provider detect
   * @return the transcription; fails with {@code NoSpeechDetectedException} when the audio holds no
   *     speech and with {@code TranscriptionException} when the provider fails
   */
  Mono<TranscriptionResult> transcribe(AudioPayload audio, LanguageHint languageHint);

  boolean isConfigured();
}
