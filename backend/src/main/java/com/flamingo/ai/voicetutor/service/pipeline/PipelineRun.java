package com.flamingo.ai.voicetutor.service.pipeline;

import com.flamingo.ai.voicetutor.domain.enums.PipelineStage;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * State machine for one voice pipeline run. Every transition also stamps the {@link
 * LatencyTracker}: the stage being left is closed and the stage being entered is opened.
 */
public class PipelineRun {

  private static final Map<PipelineStage, Set<PipelineStage>> TRANSITIONS =
      new EnumMap<>(PipelineStage.class);

  static {
    TRANSITIONS.put(
        PipelineStage.VALIDATING, EnumSet.of(PipelineStage.TRANSCRIBING, PipelineStage.FAILED));
    TRANSITIONS.put(
        PipelineStage.TRANSCRIBING, EnumSet.of(PipelineStage.RETRIEVING, PipelineStage.FAILED));
    TRANSITIONS.put(PipelineStage.RETRIEVING, EnumSet.of(PipelineStage.GENERATING));
    TRANSITIONS.put(
        PipelineStage.GENERATING,
        EnumSet.of(PipelineStage.SYNTHESIZING, PipelineStage.DONE, PipelineStage.FAILED));
    TRANSITIONS.put(PipelineStage.SYNTHESIZING, EnumSet.of(PipelineStage.DONE));
    TRANSITIONS.put(PipelineStage.DONE, EnumSet.noneOf(PipelineStage.class));
    TRANSITIONS.put(PipelineStage.FAILED, EnumSet.noneOf(PipelineStage.class));
  }

  private final String requestId;
  private final LatencyTracker tracker;
  private PipelineStage stage;
  private PipelineStage failedStage;

  public PipelineRun(String requestId, LatencyTracker tracker) {
    this.requestId = requestId;
    this.tracker = tracker;
    this.stage = PipelineStage.VALIDATING;
    tracker.stageStarted(PipelineStage.VALIDATING);
  }

  /**
   * Moves to the next stage.
   *
   * @throws IllegalStateException if the transition is not allowed from the current stage
   */
  public synchronized void advance(PipelineStage next) {
    if (next == PipelineStage.FAILED) {
      throw new IllegalStateException("Use fail() to enter FAILED");
    }
    checkTransition(next);
    tracker.stageFinished(stage);
    stage = next;
    if (!next.isTerminal()) {
      tracker.stageStarted(next);
    }
  }

  /**
   * Marks the run as failed in its current stage.
   *
   * @throws IllegalStateException if the current stage cannot fail
   */
  public synchronized void fail() {
    checkTransition(PipelineStage.FAILED);
    tracker.stageFinished(stage);
    failedStage = stage;
    stage = PipelineStage.FAILED;
  }

  public synchronized boolean canFail() {
    return TRANSITIONS.get(stage).contains(PipelineStage.FAILED);
  }

  public synchronized PipelineStage getStage() {
    return stage;
  }

  /** Stage the run failed in, or {@code null} if it has not failed. */
  public synchronized PipelineStage getFailedStage() {
    return failedStage;
  }

  public String getRequestId() {
    return requestId;
  }

  public LatencyTracker getTracker() {
    return tracker;
  }

  private void checkTransition(PipelineStage next) {
    if (!TRANSITIONS.get(stage).contains(next)) {
      throw new IllegalStateException(
          "Illegal pipeline transition " + stage + " -> " + next + " for request " + requestId);
    }
  }
}
