package com.flamingo.ai.voicetutor.service.health;

import com.flamingo.ai.voicetutor.config.VoiceConfig;
import com.flamingo.ai.voicetutor.service.generation.AnswerGenerator;
import com.flamingo.ai.voicetutor.service.rag.ContextRetriever;
import com.flamingo.ai.voicetutor.service.stt.SpeechTranscriber;
import com.flamingo.ai.voicetutor.service.tts.SpeechSynthesizer;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/** Reports provider availability without doing any pipeline work. */
@Service
@RequiredArgsConstructor
public class VoiceHealthService {

  private final SpeechTranscriber speechTranscriber;
  private final AnswerGenerator answerGenerator;
  private final SpeechSynthesizer speechSynthesizer;
  private final ContextRetriever contextRetriever;
  private final VoiceConfig voiceConfig;

  public VoiceServiceStatus getVoiceStatus() {
    return VoiceServiceStatus.builder()
        .status("ok")
        .services(
            VoiceServiceStatus.Services.builder()
                .whisper(speechTranscriber.isConfigured())
                .llm(answerGenerator.isConfigured())
                .tts(speechSynthesizer.isConfigured())
                .rag(contextRetriever.isConfigured())
                .build())
        .message("Voice chat API is running")
        .targetLatency(voiceConfig.getTargetLatency())
        .build();
  }

  public Map<String, Object> getTtsStatus() {
    boolean elevenLabs = speechSynthesizer.isConfigured();
    Map<String, Boolean> providers = new LinkedHashMap<>();
    providers.put("browser", true);
    providers.put("elevenlabs", elevenLabs);

    Map<String, Object> status = new LinkedHashMap<>();
    status.put("status", "ok");
    status.put("providers", providers);
    status.put(
        "message",
        elevenLabs
            ? "ElevenLabs text-to-speech is available"
            : "Only browser text-to-speech is available");
    return status;
  }
}
