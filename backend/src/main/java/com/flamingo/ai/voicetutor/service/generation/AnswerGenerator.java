package com.flamingo.ai.voicetutor.service.generation;

import reactor.core.publisher.Flux;

/** Streams a grounded answer. */
public interface AnswerGenerator {

  /**
   * Generates an answer as text deltas in arrival order. Cancelling the subscription stops
   * forwarding. Failures surface as {@code GenerationException}.
   */
  Flux<String> generate(GenerationPrompt prompt);

  boolean isConfigured();
}
