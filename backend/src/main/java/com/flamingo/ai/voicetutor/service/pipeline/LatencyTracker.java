package com.flamingo.ai.voicetutor.service.pipeline;

import com.flamingo.ai.voicetutor.domain.enums.PipelineStage;
import com.flamingo.ai.voicetutor.domain.model.LatencyRecord;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ticker;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Stage timer for a single pipeline run.
 *
 * <p>Elapsed times are kept in nanoseconds and floored to whole milliseconds only when a {@link
 * LatencyRecord} is produced, so the reported total is never smaller than the sum of the reported
 * stages. Reactor may deliver stage signals on different threads, hence the synchronization.
 */
public class LatencyTracker {

  private final Ticker ticker;
  private final long startNanos;
  private final Map<PipelineStage, Long> stageStartNanos = new EnumMap<>(PipelineStage.class);
  private final Map<PipelineStage, Long> stageElapsedNanos = new EnumMap<>(PipelineStage.class);
  private long firstTokenNanos = -1;
  private long finishedNanos = -1;

  public LatencyTracker() {
    this(Ticker.systemTicker());
  }

  @VisibleForTesting
  public LatencyTracker(Ticker ticker) {
    this.ticker = ticker;
    this.startNanos = ticker.read();
  }

  public synchronized void stageStarted(PipelineStage stage) {
    stageStartNanos.put(stage, ticker.read());
  }

  /** Closes a stage. Closing a stage that never started is a no-op. */
  public synchronized void stageFinished(PipelineStage stage) {
    Long started = stageStartNanos.get(stage);
    if (started == null || stageElapsedNanos.containsKey(stage)) {
      return;
    }
    stageElapsedNanos.put(stage, ticker.read() - started);
  }

  /** Marks the first generated token. Later calls are ignored. */
  public synchronized void firstTokenReceived() {
    if (firstTokenNanos < 0 && stageStartNanos.containsKey(PipelineStage.GENERATING)) {
      firstTokenNanos = ticker.read();
    }
  }

  /** Elapsed milliseconds for a finished stage, or 0. */
  public synchronized long stageMillis(PipelineStage stage) {
    return TimeUnit.NANOSECONDS.toMillis(stageElapsedNanos.getOrDefault(stage, 0L));
  }

  /**
   * Produces the latency breakdown. The first call fixes the total; later calls return the same
   * total.
   */
  public synchronized LatencyRecord finish() {
    if (finishedNanos < 0) {
      finishedNanos = ticker.read();
    }
    long total = finishedNanos - startNanos;
    return new LatencyRecord(
        toMillis(stageElapsedNanos.getOrDefault(PipelineStage.TRANSCRIBING, 0L)),
        toMillis(stageElapsedNanos.getOrDefault(PipelineStage.RETRIEVING, 0L)),
        toMillis(llmNanos()),
        toMillis(total));
  }

  private long llmNanos() {
    Long generationStart = stageStartNanos.get(PipelineStage.GENERATING);
    if (generationStart == null) {
      return 0L;
    }
    if (firstTokenNanos >= 0) {
      return firstTokenNanos - generationStart;
    }
    return stageElapsedNanos.getOrDefault(PipelineStage.GENERATING, 0L);
  }

  private static int toMillis(long nanos) {
    long millis = TimeUnit.NANOSECONDS.toMillis(Math.max(0L, nanos));
    return (int) Math.min(Integer.MAX_VALUE, millis);
  }
}
