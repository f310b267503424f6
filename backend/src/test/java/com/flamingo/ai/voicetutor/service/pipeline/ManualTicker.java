package com.flamingo.ai.voicetutor.service.pipeline;

import com.google.common.base.Ticker;
import java.util.concurrent.TimeUnit;

/** Test ticker that only moves when told to, optionally by a fixed step on every read. */
public class ManualTicker extends Ticker {

  private long nanos;
  private final long autoIncrementNanos;

  public ManualTicker() {
    this(0);
  }

  public ManualTicker(long autoIncrementMillis) {
    this.autoIncrementNanos = TimeUnit.MILLISECONDS.toNanos(autoIncrementMillis);
  }

  public synchronized void advanceMillis(long millis) {
    nanos += TimeUnit.MILLISECONDS.toNanos(millis);
  }

  public synchronized void advanceNanos(long delta) {
    nanos += delta;
  }

  @Override
  public synchronized long read() {
    long current = nanos;
    nanos += autoIncrementNanos;
    return current;
  }
}
