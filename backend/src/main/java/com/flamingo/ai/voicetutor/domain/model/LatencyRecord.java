package com.flamingo.ai.voicetutor.domain.model;

/**
 * Per-request latency breakdown in milliseconds. {@code llm} is time to first token.
 *
 * @param stt transcription time
 * @param rag retrieval time
 * @param llm generation time to first token
 * @param total wall time from intake to completion
 */
public record LatencyRecord(int stt, int rag, int llm, int total) {

  public LatencyRecord {
    if (stt < 0 || rag < 0 || llm < 0 || total < 0) {
      throw new IllegalArgumentException("Latency values must be non-negative");
    }
  }
}
