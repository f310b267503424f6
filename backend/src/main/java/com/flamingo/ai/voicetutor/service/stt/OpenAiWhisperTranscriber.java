package com.flamingo.ai.voicetutor.service.stt;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.flamingo.ai.voicetutor.config.VoiceConfig;
import com.flamingo.ai.voicetutor.domain.enums.LanguageHint;
import com.flamingo.ai.voicetutor.domain.model.AudioPayload;
import com.flamingo.ai.voicetutor.domain.model.TranscriptionResult;
import com.flamingo.ai.voicetutor.exception.NoSpeechDetectedException;
import com.flamingo.ai.voicetutor.exception.TranscriptionException;
import com.google.common.annotations.VisibleForTesting;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/** Transcribes questions with the OpenAI Whisper {@code /audio/transcriptions} endpoint. */
@Component
@Slf4j
public class OpenAiWhisperTranscriber implements SpeechTranscriber {

  private static final String RESPONSE_FORMAT = "verbose_json";

  /** Whisper reports full language names in verbose responses. */
  private static final Map<String, String> LANGUAGE_CODES =
      Map.of("hebrew", "he", "english", "en", "he", "he", "en", "en", "iw", "he");

  private final WebClient webClient;
  private final VoiceConfig.Transcription settings;

  @Autowired
  public OpenAiWhisperTranscriber(VoiceConfig voiceConfig) {
    this(
        WebClient.builder().baseUrl(voiceConfig.getTranscription().getBaseUrl()).build(),
        voiceConfig);
    log.info(
        "Whisper transcriber initialized: baseUrl={}, model={}, configured={}",
        settings.getBaseUrl(),
        settings.getModel(),
        isConfigured());
  }

  @VisibleForTesting
  OpenAiWhisperTranscriber(WebClient webClient, VoiceConfig voiceConfig) {
    this.webClient = webClient;
    this.settings = voiceConfig.getTranscription();
  }

  @Override
  public boolean isConfigured() {
    return settings.getApiKey() != null && !settings.getApiKey().isBlank();
  }

  @Override
  public Mono<TranscriptionResult> transcribe(AudioPayload audio, LanguageHint languageHint) {
    if (!isConfigured()) {
      return Mono.error(new TranscriptionException("OpenAI API key is not configured"));
    }

    String requestedLanguage = resolveRequestedLanguage(languageHint);

    MultipartBodyBuilder body = new MultipartBodyBuilder();
    body.part("file", asResource(audio)).contentType(parseMediaType(audio.contentType()));
    body.part("model", settings.getModel());
    body.part("response_format", RESPONSE_FORMAT);
    if (requestedLanguage != null) {
      body.part("language", requestedLanguage);
    }

    log.debug(
        "Sending {} bytes to Whisper (language={})",
        audio.size(),
        requestedLanguage == null ? "auto" : requestedLanguage);

    return webClient
        .post()
        .uri("/audio/transcriptions")
        .headers(headers -> headers.setBearerAuth(settings.getApiKey()))
        .contentType(MediaType.MULTIPART_FORM_DATA)
        .body(BodyInserters.fromMultipartData(body.build()))
        .retrieve()
        .bodyToMono(WhisperResponse.class)
        .timeout(settings.getTimeout())
        .onErrorMap(
            e -> !(e instanceof TranscriptionException),
            e -> new TranscriptionException("Whisper transcription failed: " + e.getMessage(), e))
        .switchIfEmpty(Mono.error(() -> new TranscriptionException("Whisper returned no body")))
        .flatMap(response -> toResult(response, languageHint));
  }

  private Mono<TranscriptionResult> toResult(WhisperResponse response, LanguageHint languageHint) {
    if (response.text() == null || response.text().isBlank()) {
      return Mono.error(new NoSpeechDetectedException());
    }
    String language = normalizeLanguage(response.language(), languageHint);
    return Mono.just(
        new TranscriptionResult(response.text().trim(), language, response.duration()));
  }

  private String resolveRequestedLanguage(LanguageHint languageHint) {
    if (languageHint != null && !languageHint.isAuto()) {
      return languageHint.getCode();
    }
    String expected = settings.getExpectedLanguage();
    return expected == null || expected.isBlank() ? null : expected.trim();
  }

  /**
   * Maps the provider's language to a short code. Unknown names are passed through lower-cased;
   * a missing value falls back to the hint.
   */
  @VisibleForTesting
  static String normalizeLanguage(String providerLanguage, LanguageHint languageHint) {
    if (providerLanguage == null || providerLanguage.isBlank()) {
      return languageHint == null ? LanguageHint.AUTO.getCode() : languageHint.getCode();
    }
    String lower = providerLanguage.trim().toLowerCase(Locale.ROOT);
    return LANGUAGE_CODES.getOrDefault(lower, lower);
  }

  private static ByteArrayResource asResource(AudioPayload audio) {
    return new ByteArrayResource(audio.data()) {
      @Override
      public String getFilename() {
        return audio.fileName();
      }
    };
  }

  private static MediaType parseMediaType(String contentType) {
    try {
      return MediaType.parseMediaType(contentType);
    } catch (IllegalArgumentException e) {
      log.debug("Unparseable audio content type '{}', sending as octet-stream", contentType);
      return MediaType.APPLICATION_OCTET_STREAM;
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record WhisperResponse(String text, String language, Double duration) {}
}
