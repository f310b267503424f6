package com.flamingo.ai.voicetutor.service.validation;

import com.flamingo.ai.voicetutor.config.VoiceConfig;
import com.flamingo.ai.voicetutor.domain.model.AudioPayload;
import com.flamingo.ai.voicetutor.exception.InvalidVoiceRequestException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Rejects unusable audio before any provider is called. */
@Component
@RequiredArgsConstructor
public class AudioIntakeValidator {

  private final VoiceConfig voiceConfig;

  /**
   * Validates uploaded audio.
   *
   * @param audio the uploaded audio, may be {@code null}
   * @throws InvalidVoiceRequestException if audio is missing, empty or too large
   */
  public void validate(AudioPayload audio) {
    if (audio == null || !audio.isPresent()) {
      throw new InvalidVoiceRequestException("Audio file is required");
    }
    if (audio.size() == 0) {
      throw new InvalidVoiceRequestException("Audio file is empty");
    }
    long maxBytes = voiceConfig.getAudio().getMaxSize().toBytes();
    if (audio.size() > maxBytes) {
      throw new InvalidVoiceRequestException(
          "Audio file too large (max " + voiceConfig.getAudio().getMaxSize().toMegabytes() + "MB)");
    }
  }
}
