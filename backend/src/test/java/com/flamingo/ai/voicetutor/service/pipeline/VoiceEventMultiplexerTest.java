package com.flamingo.ai.voicetutor.service.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.voicetutor.api.dto.response.VoiceStreamEvent;
import com.flamingo.ai.voicetutor.domain.model.LatencyRecord;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiFunction;
import java.util.function.Function;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

@DisplayName("VoiceEventMultiplexer Tests")
class VoiceEventMultiplexerTest {

  private static final LatencyRecord LATENCY = new LatencyRecord(1, 2, 3, 10);

  private final VoiceEventMultiplexer multiplexer = new VoiceEventMultiplexer();

  private static final Function<String, VoiceStreamEvent> DONE =
      answer -> VoiceStreamEvent.done(answer, LATENCY);
  private static final BiFunction<Throwable, String, VoiceStreamEvent> FAILURE =
      (error, partial) -> VoiceStreamEvent.error("failed after '" + partial + "'");

  @Test
  @DisplayName("Should emit transcription, content, audio and done in order")
  void shouldEmitEventsInOrder() {
    AtomicReference<String> synthesizedText = new AtomicReference<>();

    Flux<VoiceStreamEvent> events =
        multiplexer.multiplex(
            VoiceStreamEvent.transcription("question", "en"),
            Flux.just("The answer ", "is 42."),
            answer -> {
              synthesizedText.set(answer);
              return Mono.just(VoiceStreamEvent.audio("data:audio/mpeg;base64,AA=="));
            },
            DONE,
            FAILURE);

    StepVerifier.create(events)
        .assertNext(e -> assertThat(e.getType()).isEqualTo("transcription"))
        .assertNext(e -> assertThat(e.getContent()).isEqualTo("The answer "))
        .assertNext(e -> assertThat(e.getContent()).isEqualTo("is 42."))
        .assertNext(e -> assertThat(e.getType()).isEqualTo("audio"))
        .assertNext(
            e -> {
              assertThat(e.getType()).isEqualTo("done");
              assertThat(e.getFullContent()).isEqualTo("The answer is 42.");
              assertThat(e.isTerminal()).isTrue();
            })
        .verifyComplete();

    assertThat(synthesizedText.get()).isEqualTo("The answer is 42.");
  }

  @Test
  @DisplayName("Should omit audio when the audio stage yields nothing")
  void shouldOmitAudioWhenStageIsEmpty() {
    Flux<VoiceStreamEvent> events =
        multiplexer.multiplex(
            VoiceStreamEvent.transcription("q", "he"),
            Flux.just("answer"),
            answer -> Mono.empty(),
            DONE,
            FAILURE);

    StepVerifier.create(events.map(VoiceStreamEvent::getType))
        .expectNext("transcription", "content", "done")
        .verifyComplete();
  }

  @Test
  @DisplayName("Should replace the remainder with one error carrying the partial answer")
  void shouldReplaceRemainderWithError() {
    AtomicBoolean audioCalled = new AtomicBoolean();

    Flux<VoiceStreamEvent> events =
        multiplexer.multiplex(
            VoiceStreamEvent.transcription("q", "en"),
            Flux.just("Hello", " there").concatWith(Flux.error(new IllegalStateException("x"))),
            answer -> {
              audioCalled.set(true);
              return Mono.empty();
            },
            DONE,
            FAILURE);

    StepVerifier.create(events)
        .expectNextMatches(e -> e.getType().equals("transcription"))
        .expectNextMatches(e -> e.getContent().equals("Hello"))
        .expectNextMatches(e -> e.getContent().equals(" there"))
        .assertNext(e -> assertThat(e.getError()).isEqualTo("failed after 'Hello there'"))
        .verifyComplete();

    assertThat(audioCalled).isFalse();
  }

  @Test
  @DisplayName("Should not subscribe to the answer before the stream is consumed")
  void shouldBeLazy() {
    AtomicBoolean subscribed = new AtomicBoolean();

    Flux<VoiceStreamEvent> events =
        multiplexer.multiplex(
            VoiceStreamEvent.transcription("q", "en"),
            Flux.just("a").doOnSubscribe(s -> subscribed.set(true)),
            answer -> Mono.empty(),
            DONE,
            FAILURE);

    assertThat(subscribed).isFalse();
    StepVerifier.create(events).expectNextCount(3).verifyComplete();
    assertThat(subscribed).isTrue();
  }
}
