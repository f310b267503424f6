package com.flamingo.ai.voicetutor.api.sse;

import com.flamingo.ai.voicetutor.api.ClientKeyResolver;
import com.flamingo.ai.voicetutor.api.dto.response.VoiceStreamEvent;
import com.flamingo.ai.voicetutor.domain.enums.LanguageHint;
import com.flamingo.ai.voicetutor.domain.enums.ResponseStyle;
import com.flamingo.ai.voicetutor.domain.model.AudioPayload;
import com.flamingo.ai.voicetutor.domain.model.VoiceRequest;
import com.flamingo.ai.voicetutor.exception.InvalidVoiceRequestException;
import com.flamingo.ai.voicetutor.service.health.VoiceHealthService;
import com.flamingo.ai.voicetutor.service.health.VoiceServiceStatus;
import com.flamingo.ai.voicetutor.service.pipeline.VoicePipelineService;
import com.flamingo.ai.voicetutor.service.ratelimit.AdmissionGate;
import com.flamingo.ai.voicetutor.service.validation.ConversationHistoryParser;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.servlet.http.HttpServletRequest;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/** Controller for voice questions answered over Server-Sent Events. */
@RestController
@RequestMapping("/api/v1/voice")
@RequiredArgsConstructor
@Slf4j
public class VoiceChatController {

  private final VoicePipelineService voicePipelineService;
  private final AdmissionGate admissionGate;
  private final ConversationHistoryParser historyParser;
  private final ClientKeyResolver clientKeyResolver;
  private final VoiceHealthService voiceHealthService;
  private final MeterRegistry meterRegistry;

  private final AtomicInteger activeConnections = new AtomicInteger(0);

  @PostConstruct
  void registerGauges() {
    meterRegistry.gauge("sse.connections.active", activeConnections);
  }

  /**
   * Answers a spoken question as a stream of events.
   *
   * <p>Rate limiting and request validation happen before anything is streamed. If transcription
   * fails or finds no speech the response is a JSON error instead of a stream.
   *
   * @param audio the recorded question
   * @param language language hint: auto, he or en
   * @param videoId the video the question is about
   * @param conversationHistory JSON array of prior {@code {role, content}} turns
   * @param enableTts whether to synthesize the answer
   * @param responseStyle voice (short) or text (longer) answers
   * @return the event stream, once the question has been transcribed
   */
  @PostMapping(
      value = "/chat",
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
      produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public Mono<ResponseEntity<Flux<VoiceStreamEvent>>> chat(
      @RequestPart(value = "audio", required = false) MultipartFile audio,
      @RequestParam(value = "language", required = false) String language,
      @RequestParam(value = "videoId", required = false) String videoId,
      @RequestParam(value = "conversationHistory", required = false) String conversationHistory,
      @RequestParam(value = "enableTTS", defaultValue = "false") boolean enableTts,
      @RequestParam(value = "responseStyle", required = false) String responseStyle,
      HttpServletRequest httpRequest) {

    admissionGate.admit(clientKeyResolver.resolve(httpRequest));

    VoiceRequest request =
        new VoiceRequest(
            VoiceRequest.newRequestId(),
            toPayload(audio),
            LanguageHint.fromCode(language),
            videoId,
            historyParser.parse(conversationHistory),
            enableTts,
            ResponseStyle.fromCode(responseStyle));

    return voicePipelineService
        .answer(request)
        .map(
            events ->
                ResponseEntity.ok()
                    .cacheControl(CacheControl.noCache())
                    .header("X-Accel-Buffering", "no")
                    .body(trackConnection(request.requestId(), events)));
  }

  /** Reports whether the voice pipeline and its providers are available. */
  @GetMapping("/chat")
  public ResponseEntity<VoiceServiceStatus> status() {
    return ResponseEntity.ok(voiceHealthService.getVoiceStatus());
  }

  private Flux<VoiceStreamEvent> trackConnection(String requestId, Flux<VoiceStreamEvent> events) {
    return events
        .doOnSubscribe(subscription -> activeConnections.incrementAndGet())
        .doOnNext(
            event -> {
              if (event.isTerminal()) {
                meterRegistry.counter("sse.streams.ended", "type", event.getType()).increment();
              }
            })
        .doOnComplete(
            () -> {
              activeConnections.decrementAndGet();
              log.debug("[{}] Voice stream completed", requestId);
            })
        .doOnError(
            e -> {
              activeConnections.decrementAndGet();
              log.error("[{}] Voice stream error: {}", requestId, e.getMessage());
              meterRegistry.counter("sse.errors").increment();
            })
        .doOnCancel(
            () -> {
              activeConnections.decrementAndGet();
              log.debug("[{}] Voice stream cancelled", requestId);
            });
  }

  private static AudioPayload toPayload(MultipartFile audio) {
    if (audio == null) {
      return null;
    }
    try {
      return new AudioPayload(
          audio.getBytes(), audio.getSize(), audio.getContentType(), audio.getOriginalFilename());
    } catch (IOException e) {
      log.warn("Failed to read uploaded audio: {}", e.getMessage());
      throw new InvalidVoiceRequestException("Audio file could not be read");
    }
  }
}
