package com.flamingo.ai.voicetutor.exception;

/** Exception thrown when answer generation fails. */
public class GenerationException extends RuntimeException {

  public GenerationException(String message) {
    super(message);
  }

  public GenerationException(String message, Throwable cause) {
    super(message, cause);
  }
}
