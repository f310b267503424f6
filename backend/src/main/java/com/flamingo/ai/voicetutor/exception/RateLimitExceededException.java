package com.flamingo.ai.voicetutor.exception;

/** Exception thrown when a client exceeds its voice request allowance. */
public class RateLimitExceededException extends RuntimeException {

  private final String clientKey;
  private final long retryAfterSeconds;

  public RateLimitExceededException(String clientKey, long retryAfterSeconds) {
    super("Rate limit exceeded for client " + clientKey);
    this.clientKey = clientKey;
    this.retryAfterSeconds = retryAfterSeconds;
  }

  public String getClientKey() {
    return clientKey;
  }

  public long getRetryAfterSeconds() {
    return retryAfterSeconds;
  }

  public String getUserMessage() {
    return "Too many requests. Please wait before asking another question.";
  }
}
