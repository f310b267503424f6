package com.flamingo.ai.voicetutor.exception;

/** Exception thrown when the speech-to-text provider fails. */
public class TranscriptionException extends RuntimeException {

  private final String userMessage;

  public TranscriptionException(String message) {
    super(message);
    this.userMessage = "Failed to transcribe audio. Please try again.";
  }

  public TranscriptionException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Failed to transcribe audio. Please try again.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
