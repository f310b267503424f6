package com.flamingo.ai.voicetutor.api.rest;

import com.flamingo.ai.voicetutor.api.ClientKeyResolver;
import com.flamingo.ai.voicetutor.api.dto.request.TtsRequest;
import com.flamingo.ai.voicetutor.api.dto.response.TtsFallbackResponse;
import com.flamingo.ai.voicetutor.service.health.VoiceHealthService;
import com.flamingo.ai.voicetutor.service.ratelimit.AdmissionGate;
import com.flamingo.ai.voicetutor.service.tts.SpeechSynthesizer;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/** REST controller for standalone text-to-speech of arbitrary answer text. */
@RestController
@RequestMapping("/api/v1/voice/tts")
@RequiredArgsConstructor
@Slf4j
public class VoiceTtsController {

  static final String PROVIDER_HEADER = "X-TTS-Provider";

  private final SpeechSynthesizer speechSynthesizer;
  private final AdmissionGate admissionGate;
  private final ClientKeyResolver clientKeyResolver;
  private final VoiceHealthService voiceHealthService;

  /**
   * Synthesizes text. Returns MP3 bytes from ElevenLabs, or a JSON marker telling the client to
   * use browser voice synthesis.
   */
  @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
  public Mono<ResponseEntity<Object>> synthesize(
      @Valid @RequestBody TtsRequest request, HttpServletRequest httpRequest) {

    admissionGate.admit(clientKeyResolver.resolve(httpRequest));

    if (!request.wantsElevenLabs()) {
      Object body = TtsFallbackResponse.browser("Use browser Web Speech API");
      return Mono.just(ResponseEntity.ok().body(body));
    }

    return speechSynthesizer
        .synthesize(request.getText(), request.getLanguage(), request.getVoiceId())
        .map(
            result -> {
              if (result.isAudio()) {
                log.debug("ElevenLabs returned {} bytes", result.getAudio().length);
                return ResponseEntity.ok()
                    .contentType(MediaType.parseMediaType(result.getMimeType()))
                    .header(PROVIDER_HEADER, "elevenlabs")
                    .body((Object) result.getAudio());
              }
              return ResponseEntity.ok()
                  .contentType(MediaType.APPLICATION_JSON)
                  .body((Object) TtsFallbackResponse.browser(result.getFallbackReason()));
            });
  }

  /** Reports which text-to-speech providers are available. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> status() {
    return ResponseEntity.ok(voiceHealthService.getTtsStatus());
  }
}
