package com.flamingo.ai.voicetutor.exception;

/** Exception thrown when transcript search fails. */
public class SearchException extends RuntimeException {

  public SearchException(String message) {
    super(message);
  }

  public SearchException(String message, Throwable cause) {
    super(message, cause);
  }
}
