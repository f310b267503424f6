package com.flamingo.ai.voicetutor.service.health;

import lombok.Builder;
import lombok.Value;

/** Availability of the voice pipeline and its providers. */
@Value
@Builder
public class VoiceServiceStatus {

  String status;
  Services services;
  String message;
  String targetLatency;

  /** Which providers are configured. */
  @Value
  @Builder
  public static class Services {
    boolean whisper;
    boolean llm;
    boolean tts;
    boolean rag;
  }
}
