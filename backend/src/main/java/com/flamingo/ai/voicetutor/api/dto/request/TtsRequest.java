package com.flamingo.ai.voicetutor.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for standalone text-to-speech. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TtsRequest {

  @NotBlank(message = "Text is required")
  private String text;

  /** {@code browser} (default) or {@code elevenlabs}. */
  private String provider;

  private String voiceId;

  private String language;

  public boolean wantsElevenLabs() {
    return "elevenlabs".equalsIgnoreCase(provider);
  }
}
