package com.flamingo.ai.voicetutor.domain.enums;

import java.util.Locale;

/**
 * States of a single voice pipeline run.
 *
 * <p>Only {@link #VALIDATING}, {@link #TRANSCRIBING} and {@link #GENERATING} may move to {@link
 * #FAILED}. Retrieval and synthesis degrade instead of failing.
 */
public enum PipelineStage {
  VALIDATING(true),
  TRANSCRIBING(true),
  RETRIEVING(false),
  GENERATING(true),
  SYNTHESIZING(false),
  DONE(false),
  FAILED(false);

  private final boolean fatalOnFailure;

  PipelineStage(boolean fatalOnFailure) {
    this.fatalOnFailure = fatalOnFailure;
  }

  public boolean isFatalOnFailure() {
    return fatalOnFailure;
  }

  public boolean isTerminal() {
    return this == DONE || this == FAILED;
  }

  /** Lower-case name used for metric tags and log lines. */
  public String tag() {
    return name().toLowerCase(Locale.ROOT);
  }
}
