package com.flamingo.ai.voicetutor.service.ratelimit;

/** Decides whether a client may start another voice request. */
public interface AdmissionGate {

  /**
   * Admits one request for the client or rejects it.
   *
   * @param clientKey identifies the caller, usually its IP address
   * @throws com.flamingo.ai.voicetutor.exception.RateLimitExceededException when over the limit
   */
  void admit(String clientKey);
}
