package com.flamingo.ai.voicetutor.service.pipeline;

import com.flamingo.ai.voicetutor.api.dto.response.VoiceStreamEvent;
import com.flamingo.ai.voicetutor.domain.enums.PipelineStage;
import com.flamingo.ai.voicetutor.domain.model.LatencyRecord;
import com.flamingo.ai.voicetutor.domain.model.SynthesisResult;
import com.flamingo.ai.voicetutor.domain.model.TranscriptionResult;
import com.flamingo.ai.voicetutor.domain.model.VoiceRequest;
import com.flamingo.ai.voicetutor.exception.InvalidVoiceRequestException;
import com.flamingo.ai.voicetutor.exception.NoSpeechDetectedException;
import com.flamingo.ai.voicetutor.exception.TranscriptionException;
import com.flamingo.ai.voicetutor.service.generation.AnswerGenerator;
import com.flamingo.ai.voicetutor.service.generation.GenerationPrompt;
import com.flamingo.ai.voicetutor.service.rag.ContextRetriever;
import com.flamingo.ai.voicetutor.service.stt.SpeechTranscriber;
import com.flamingo.ai.voicetutor.service.tts.SpeechSynthesizer;
import com.flamingo.ai.voicetutor.service.validation.AudioIntakeValidator;
import com.flamingo.ai.voicetutor.util.LogSanitizer;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ticker;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Orchestrates one voice question: validation, transcription, retrieval, streaming generation and
 * optional speech synthesis.
 *
 * <p>Validation, no-speech and transcription failures fail the returned {@link Mono} so the
 * caller can answer with an HTTP error before any event is sent. Once the event stream exists,
 * retrieval and synthesis failures degrade silently and generation failures end the stream with a
 * single {@code error} event.
 */
@Service
@Slf4j
public class VoicePipelineService {

  static final String GENERATION_UNAVAILABLE =
      "AI service is temporarily unavailable. Please try again later.";
  static final String GENERATION_INTERRUPTED =
      "The answer was interrupted and may be incomplete. Please ask your question again.";

  private final AudioIntakeValidator audioIntakeValidator;
  private final SpeechTranscriber speechTranscriber;
  private final ContextRetriever contextRetriever;
  private final AnswerGenerator answerGenerator;
  private final SpeechSynthesizer speechSynthesizer;
  private final VoiceEventMultiplexer eventMultiplexer;
  private final MeterRegistry meterRegistry;
  private final Ticker ticker;

  @Autowired
  public VoicePipelineService(
      AudioIntakeValidator audioIntakeValidator,
      SpeechTranscriber speechTranscriber,
      ContextRetriever contextRetriever,
      AnswerGenerator answerGenerator,
      SpeechSynthesizer speechSynthesizer,
      VoiceEventMultiplexer eventMultiplexer,
      MeterRegistry meterRegistry) {
    this(
        audioIntakeValidator,
        speechTranscriber,
        contextRetriever,
        answerGenerator,
        speechSynthesizer,
        eventMultiplexer,
        meterRegistry,
        Ticker.systemTicker());
  }

  @VisibleForTesting
  VoicePipelineService(
      AudioIntakeValidator audioIntakeValidator,
      SpeechTranscriber speechTranscriber,
      ContextRetriever contextRetriever,
      AnswerGenerator answerGenerator,
      SpeechSynthesizer speechSynthesizer,
      VoiceEventMultiplexer eventMultiplexer,
      MeterRegistry meterRegistry,
      Ticker ticker) {
    this.audioIntakeValidator = audioIntakeValidator;
    this.speechTranscriber = speechTranscriber;
    this.contextRetriever = contextRetriever;
    this.answerGenerator = answerGenerator;
    this.speechSynthesizer = speechSynthesizer;
    this.eventMultiplexer = eventMultiplexer;
    this.meterRegistry = meterRegistry;
    this.ticker = ticker;
  }

  /**
   * Answers a voice question.
   *
   * @param request the question
   * @return a Mono that completes with the event stream once the question has been transcribed
   * @throws InvalidVoiceRequestException synchronously, if the audio fails validation
   */
  public Mono<Flux<VoiceStreamEvent>> answer(VoiceRequest request) {
    PipelineRun run = new PipelineRun(request.requestId(), new LatencyTracker(ticker));

    try {
      audioIntakeValidator.validate(request.audio());
    } catch (InvalidVoiceRequestException e) {
      run.fail();
      recordOutcome("invalid");
      log.info("[{}] Voice request rejected: {}", run.getRequestId(), e.getMessage());
      throw e;
    }

    run.advance(PipelineStage.TRANSCRIBING);
    log.info(
        "[{}] Voice request accepted: bytes={}, language={}, video={}, history={}, tts={}",
        run.getRequestId(),
        request.audio().size(),
        request.languageHint().getCode(),
        request.videoId(),
        request.history().size(),
        request.synthesizeSpeech());

    return speechTranscriber
        .transcribe(request.audio(), request.languageHint())
        .onErrorMap(
            e -> !(e instanceof NoSpeechDetectedException || e instanceof TranscriptionException),
            e -> new TranscriptionException("Transcription failed", e))
        .switchIfEmpty(Mono.error(NoSpeechDetectedException::new))
        .flatMap(
            transcription ->
                transcription.hasSpeech()
                    ? Mono.just(transcription)
                    : Mono.<TranscriptionResult>error(new NoSpeechDetectedException()))
        .doOnError(e -> failBeforeStream(run, e))
        .doOnCancel(
            () -> log.info("[{}] Client disconnected during transcription", run.getRequestId()))
        .map(transcription -> streamAnswer(run, request, transcription));
  }

  private Flux<VoiceStreamEvent> streamAnswer(
      PipelineRun run, VoiceRequest request, TranscriptionResult transcription) {
    String question = transcription.text();
    String language =
        transcription.language() != null
            ? transcription.language()
            : request.languageHint().getCode();

    log.info(
        "[{}] Transcribed in {}ms (language={}): '{}'",
        run.getRequestId(),
        run.getTracker().stageMillis(PipelineStage.TRANSCRIBING),
        language,
        LogSanitizer.preview(question));

    Flux<String> answerDeltas =
        Mono.defer(
                () -> {
                  run.advance(PipelineStage.RETRIEVING);
                  return contextRetriever.retrieve(question, request.videoId());
                })
            .onErrorResume(
                e -> {
                  log.warn(
                      "[{}] Retrieval failed, continuing without context: {}",
                      run.getRequestId(),
                      e.getMessage());
                  meterRegistry.counter("voice.retrieval.fallback", "reason", "error").increment();
                  return Mono.just(List.of());
                })
            .defaultIfEmpty(List.of())
            .flatMapMany(
                context -> {
                  run.advance(PipelineStage.GENERATING);
                  log.debug(
                      "[{}] Generating answer with {} context chunks",
                      run.getRequestId(),
                      context.size());
                  return answerGenerator.generate(
                      new GenerationPrompt(
                          request.responseStyle(),
                          context,
                          request.history(),
                          question,
                          run.getRequestId()));
                })
            .doOnNext(delta -> run.getTracker().firstTokenReceived());

    return eventMultiplexer
        .multiplex(
            VoiceStreamEvent.transcription(question, language),
            answerDeltas,
            answer -> synthesize(run, request, answer, language),
            answer -> complete(run, answer),
            (error, partialAnswer) -> failGeneration(run, error, partialAnswer))
        .doOnCancel(
            () -> {
              log.info(
                  "[{}] Client disconnected during {}", run.getRequestId(), run.getStage().tag());
              recordOutcome("cancelled");
            });
  }

  private Mono<VoiceStreamEvent> synthesize(
      PipelineRun run, VoiceRequest request, String answer, String language) {
    if (!request.synthesizeSpeech() || answer.isBlank()) {
      return Mono.empty();
    }
    run.advance(PipelineStage.SYNTHESIZING);
    return speechSynthesizer
        .synthesize(answer, language)
        .onErrorResume(
            e -> {
              log.warn("[{}] Synthesis failed: {}", run.getRequestId(), e.getMessage());
              return Mono.just(SynthesisResult.fallback("Synthesis failed"));
            })
        .flatMap(
            result -> {
              if (result.isAudio()) {
                return Mono.just(VoiceStreamEvent.audio(result.toDataUrl()));
              }
              log.info(
                  "[{}] No server audio, client voice will be used: {}",
                  run.getRequestId(),
                  result.getFallbackReason());
              return Mono.empty();
            });
  }

  private VoiceStreamEvent complete(PipelineRun run, String answer) {
    run.advance(PipelineStage.DONE);
    LatencyTracker tracker = run.getTracker();
    LatencyRecord latency = tracker.finish();
    long synthesisMillis = tracker.stageMillis(PipelineStage.SYNTHESIZING);

    recordLatency("stt", latency.stt());
    recordLatency("rag", latency.rag());
    recordLatency("llm", latency.llm());
    recordLatency("total", latency.total());
    if (synthesisMillis > 0) {
      recordLatency("tts", synthesisMillis);
    }
    recordOutcome("completed");

    log.info(
        "[{}] Voice answer completed: stt={}ms rag={}ms llm={}ms tts={}ms total={}ms chars={}",
        run.getRequestId(),
        latency.stt(),
        latency.rag(),
        latency.llm(),
        synthesisMillis,
        latency.total(),
        answer.length());
    return VoiceStreamEvent.done(answer, latency);
  }

  private VoiceStreamEvent failGeneration(PipelineRun run, Throwable error, String partialAnswer) {
    if (run.canFail()) {
      run.fail();
    }
    PipelineStage stage = run.getFailedStage() != null ? run.getFailedStage() : run.getStage();
    boolean interrupted = !partialAnswer.isEmpty();
    meterRegistry
        .counter(
            "voice.generation.errors", "phase", interrupted ? "mid_stream" : "before_first_token")
        .increment();
    recordOutcome("generation_error");
    log.error(
        "[{}] Answer failed during {} after {} chars: {}",
        run.getRequestId(),
        stage.tag(),
        partialAnswer.length(),
        error.getMessage(),
        error);
    return VoiceStreamEvent.error(interrupted ? GENERATION_INTERRUPTED : GENERATION_UNAVAILABLE);
  }

  private void failBeforeStream(PipelineRun run, Throwable error) {
    if (run.canFail()) {
      run.fail();
    }
    if (error instanceof NoSpeechDetectedException) {
      recordOutcome("no_speech");
      log.info("[{}] No speech detected in audio", run.getRequestId());
    } else {
      recordOutcome("transcription_error");
      log.error(
          "[{}] Failed during {}: {}",
          run.getRequestId(),
          run.getFailedStage() != null ? run.getFailedStage().tag() : run.getStage().tag(),
          error.getMessage(),
          error);
    }
  }

  private void recordLatency(String stage, long millis) {
    meterRegistry
        .timer("voice.stage.latency", "stage", stage)
        .record(millis, TimeUnit.MILLISECONDS);
  }

  private void recordOutcome(String outcome) {
    meterRegistry.counter("voice.requests", "outcome", outcome).increment();
  }
}
