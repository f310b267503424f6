package com.flamingo.ai.voicetutor.service.tts;

import com.flamingo.ai.voicetutor.domain.model.SynthesisResult;
import reactor.core.publisher.Mono;

/** Text-to-speech adapter. Implementations never fail; they fall back to client-side voice. */
public interface SpeechSynthesizer {

  Mono<SynthesisResult> synthesize(String text, String language);

  Mono<SynthesisResult> synthesize(String text, String language, String voiceId);

  boolean isConfigured();
}
