package com.flamingo.ai.voicetutor.domain.model;

import java.util.Comparator;
import java.util.Objects;

/** A time-stamped piece of a video transcript used to ground an answer. */
public record ContextChunk(
    String chunkId,
    String videoId,
    String text,
    double startTime,
    double endTime,
    Double relevanceScore) {

  /** Ascending start time, then ascending chunk id. */
  public static final Comparator<ContextChunk> TIMELINE_ORDER =
      Comparator.comparingDouble(ContextChunk::startTime).thenComparing(ContextChunk::chunkId);

  public ContextChunk {
    Objects.requireNonNull(chunkId, "chunkId");
    Objects.requireNonNull(videoId, "videoId");
    Objects.requireNonNull(text, "text");
    if (startTime < 0 || endTime <= startTime) {
      throw new IllegalArgumentException(
          "Chunk " + chunkId + " has invalid time range " + startTime + "-" + endTime);
    }
  }
}
