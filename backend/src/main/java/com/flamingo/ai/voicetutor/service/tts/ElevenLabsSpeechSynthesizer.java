package com.flamingo.ai.voicetutor.service.tts;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.voicetutor.config.VoiceConfig;
import com.flamingo.ai.voicetutor.domain.model.SynthesisResult;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/** Synthesizes answers with the ElevenLabs streaming text-to-speech endpoint. */
@Component
@Slf4j
public class ElevenLabsSpeechSynthesizer implements SpeechSynthesizer {

  static final String AUDIO_MPEG = "audio/mpeg";
  static final String BROWSER_FALLBACK = "Using browser voice synthesis";

  private static final int MAX_AUDIO_BYTES = 16 * 1024 * 1024;

  private final WebClient webClient;
  private final VoiceConfig.Synthesis settings;
  private final MeterRegistry meterRegistry;

  @Autowired
  public ElevenLabsSpeechSynthesizer(VoiceConfig voiceConfig, MeterRegistry meterRegistry) {
    this(
        WebClient.builder()
            .baseUrl(voiceConfig.getSynthesis().getBaseUrl())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(MAX_AUDIO_BYTES))
            .build(),
        voiceConfig,
        meterRegistry);
    log.info(
        "ElevenLabs synthesizer initialized: voiceId={}, model={}, configured={}",
        settings.getVoiceId(),
        settings.getModelId(),
        isConfigured());
  }

  @VisibleForTesting
  ElevenLabsSpeechSynthesizer(
      WebClient webClient, VoiceConfig voiceConfig, MeterRegistry meterRegistry) {
    this.webClient = webClient;
    this.settings = voiceConfig.getSynthesis();
    this.meterRegistry = meterRegistry;
  }

  @Override
  public boolean isConfigured() {
    return settings.getApiKey() != null && !settings.getApiKey().isBlank();
  }

  @Override
  public Mono<SynthesisResult> synthesize(String text, String language) {
    return synthesize(text, language, null);
  }

  @Override
  public Mono<SynthesisResult> synthesize(String text, String language, String voiceId) {
    if (!isConfigured()) {
      return Mono.just(fallback("not_configured", "ElevenLabs is not configured"));
    }
    String sanitized = sanitize(text, settings.getMaxTextLength());
    if (sanitized.isEmpty()) {
      return Mono.just(fallback("empty_text", "Nothing to synthesize"));
    }
    String voice = voiceId == null || voiceId.isBlank() ? settings.getVoiceId() : voiceId.trim();

    log.debug(
        "ElevenLabs TTS request: language={}, voiceId={}, chars={}",
        language,
        voice,
        sanitized.length());

    ElevenLabsRequest request =
        new ElevenLabsRequest(
            sanitized,
            settings.getModelId(),
            new VoiceSettings(settings.getStability(), settings.getSimilarityBoost(), 0.0, true));

    return webClient
        .post()
        .uri(
            uriBuilder ->
                uriBuilder
                    .path("/v1/text-to-speech/{voiceId}/stream")
                    .queryParam("output_format", settings.getOutputFormat())
                    .build(voice))
        .header("xi-api-key", settings.getApiKey())
        .contentType(MediaType.APPLICATION_JSON)
        .accept(MediaType.valueOf(AUDIO_MPEG))
        .bodyValue(request)
        .retrieve()
        .bodyToMono(byte[].class)
        .timeout(settings.getTimeout())
        .map(
            audio ->
                audio.length == 0
                    ? fallback("empty_audio", "ElevenLabs returned no audio")
                    : SynthesisResult.audio(audio, AUDIO_MPEG))
        .switchIfEmpty(
            Mono.fromSupplier(() -> fallback("empty_audio", "ElevenLabs returned no audio")))
        .onErrorResume(
            e -> {
              String reason = classify(e);
              log.warn("ElevenLabs synthesis failed ({}): {}", reason, e.getMessage());
              return Mono.just(fallback(reason, "ElevenLabs synthesis failed"));
            });
  }

  /** Trims, strips control characters and caps the length. */
  @VisibleForTesting
  static String sanitize(String text, int maxLength) {
    if (text == null) {
      return "";
    }
    String cleaned = text.replaceAll("[\\p{Cntrl}&&[^\\n\\t]]", "").trim();
    return cleaned.length() > maxLength ? cleaned.substring(0, maxLength) : cleaned;
  }

  private SynthesisResult fallback(String reason, String detail) {
    meterRegistry.counter("voice.synthesis.fallback", "reason", reason).increment();
    log.debug("Synthesis falling back to browser voice: {}", detail);
    return SynthesisResult.fallback(BROWSER_FALLBACK);
  }

  private static String classify(Throwable e) {
    if (e instanceof TimeoutException) {
      return "timeout";
    }
    if (e instanceof WebClientResponseException responseException) {
      return "http_" + responseException.getStatusCode().value();
    }
    return "error";
  }

  record ElevenLabsRequest(
      String text,
      @JsonProperty("model_id") String modelId,
      @JsonProperty("voice_settings") VoiceSettings voiceSettings) {}

  record VoiceSettings(
      double stability,
      @JsonProperty("similarity_boost") double similarityBoost,
      double style,
      @JsonProperty("use_speaker_boost") boolean useSpeakerBoost) {}
}
