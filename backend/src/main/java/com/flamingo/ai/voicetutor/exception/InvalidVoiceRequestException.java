package com.flamingo.ai.voicetutor.exception;

/** Exception thrown when a voice request fails intake validation. */
public class InvalidVoiceRequestException extends RuntimeException {

  public InvalidVoiceRequestException(String message) {
    super(message);
  }

  /** Validation messages describe the caller's own input and are safe to return as-is. */
  public String getUserMessage() {
    return getMessage();
  }
}
