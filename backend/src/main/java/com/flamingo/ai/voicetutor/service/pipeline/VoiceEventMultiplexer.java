package com.flamingo.ai.voicetutor.service.pipeline;

import com.flamingo.ai.voicetutor.api.dto.response.VoiceStreamEvent;
import java.util.function.BiFunction;
import java.util.function.Function;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Merges the outputs of the pipeline stages into one ordered event stream.
 *
 * <p>Order: exactly one {@code transcription}, then {@code content} deltas in arrival order, then
 * at most one {@code audio}, then exactly one {@code done}. A failure while answering replaces the
 * remainder of the stream with a single terminal {@code error}.
 */
@Component
public class VoiceEventMultiplexer {

  /**
   * Builds the event stream for one request. Nothing downstream of the transcription runs until
   * the stream is subscribed.
   *
   * @param transcription the transcription event, emitted first
   * @param answerDeltas answer text deltas; subscribed once, after the transcription is emitted
   * @param audioStage given the full answer, yields at most one audio event
   * @param doneStage given the full answer, builds the done event
   * @param failureStage given the failure and the text streamed so far, builds the error event
   * @return the ordered event stream
   */
  public Flux<VoiceStreamEvent> multiplex(
      VoiceStreamEvent transcription,
      Flux<String> answerDeltas,
      Function<String, Mono<VoiceStreamEvent>> audioStage,
      Function<String, VoiceStreamEvent> doneStage,
      BiFunction<Throwable, String, VoiceStreamEvent> failureStage) {

    return Flux.defer(
        () -> {
          StringBuilder fullAnswer = new StringBuilder();

          Flux<VoiceStreamEvent> content =
              answerDeltas.doOnNext(fullAnswer::append).map(VoiceStreamEvent::content);

          Flux<VoiceStreamEvent> tail =
              Flux.defer(
                  () -> {
                    String answer = fullAnswer.toString();
                    return audioStage
                        .apply(answer)
                        .flux()
                        .concatWith(Mono.fromSupplier(() -> doneStage.apply(answer)));
                  });

          Flux<VoiceStreamEvent> answer =
              content
                  .concatWith(tail)
                  .onErrorResume(
                      e ->
                          Mono.fromSupplier(
                              () -> failureStage.apply(e, fullAnswer.toString())));

          return Flux.concat(Mono.just(transcription), answer);
        });
  }
}
