package com.flamingo.ai.voicetutor.api.sse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.voicetutor.api.ClientKeyResolver;
import com.flamingo.ai.voicetutor.config.VoiceConfig;
import com.flamingo.ai.voicetutor.domain.enums.LanguageHint;
import com.flamingo.ai.voicetutor.domain.model.AudioPayload;
import com.flamingo.ai.voicetutor.domain.model.TranscriptionResult;
import com.flamingo.ai.voicetutor.exception.GenerationException;
import com.flamingo.ai.voicetutor.exception.GlobalExceptionHandler;
import com.flamingo.ai.voicetutor.exception.NoSpeechDetectedException;
import com.flamingo.ai.voicetutor.exception.RateLimitExceededException;
import com.flamingo.ai.voicetutor.service.generation.AnswerGenerator;
import com.flamingo.ai.voicetutor.service.generation.GenerationPrompt;
import com.flamingo.ai.voicetutor.service.health.VoiceHealthService;
import com.flamingo.ai.voicetutor.service.health.VoiceServiceStatus;
import com.flamingo.ai.voicetutor.service.pipeline.VoiceEventMultiplexer;
import com.flamingo.ai.voicetutor.service.pipeline.VoicePipelineService;
import com.flamingo.ai.voicetutor.service.rag.ContextRetriever;
import com.flamingo.ai.voicetutor.service.ratelimit.AdmissionGate;
import com.flamingo.ai.voicetutor.service.stt.SpeechTranscriber;
import com.flamingo.ai.voicetutor.service.tts.SpeechSynthesizer;
import com.flamingo.ai.voicetutor.service.validation.AudioIntakeValidator;
import com.flamingo.ai.voicetutor.service.validation.ConversationHistoryParser;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.util.unit.DataSize;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@ExtendWith(MockitoExtension.class)
@DisplayName("VoiceChatController Tests")
class VoiceChatControllerTest {

  private static final String CHAT_URL = "/api/v1/voice/chat";

  @Mock private SpeechTranscriber speechTranscriber;
  @Mock private ContextRetriever contextRetriever;
  @Mock private AnswerGenerator answerGenerator;
  @Mock private SpeechSynthesizer speechSynthesizer;
  @Mock private AdmissionGate admissionGate;
  @Mock private VoiceHealthService voiceHealthService;

  private VoiceConfig voiceConfig;
  private SimpleMeterRegistry meterRegistry;
  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    voiceConfig = new VoiceConfig();
    meterRegistry = new SimpleMeterRegistry();
    VoicePipelineService pipeline =
        new VoicePipelineService(
            new AudioIntakeValidator(voiceConfig),
            speechTranscriber,
            contextRetriever,
            answerGenerator,
            speechSynthesizer,
            new VoiceEventMultiplexer(),
            meterRegistry);
    VoiceChatController controller =
        new VoiceChatController(
            pipeline,
            admissionGate,
            new ConversationHistoryParser(new ObjectMapper(), voiceConfig),
            new ClientKeyResolver(),
            voiceHealthService,
            meterRegistry);
    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler(meterRegistry))
            .build();
  }

  private static MockMultipartFile audio(int size) {
    return new MockMultipartFile("audio", "question.webm", "audio/webm", new byte[size]);
  }

  @Nested
  @DisplayName("POST /api/v1/voice/chat rejections")
  class RejectionTests {

    @Test
    @DisplayName("should return 400 when audio is missing")
    void shouldReturn400WhenAudioMissing() throws Exception {
      mockMvc
          .perform(multipart(CHAT_URL).param("language", "en"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value("VALIDATION_001"))
          .andExpect(jsonPath("$.message").value("Audio file is required"));

      verifyNoInteractions(speechTranscriber);
    }

    @Test
    @DisplayName("should return 400 when audio exceeds the size limit")
    void shouldReturn400WhenAudioTooLarge() throws Exception {
      voiceConfig.getAudio().setMaxSize(DataSize.ofMegabytes(1));

      mockMvc
          .perform(multipart(CHAT_URL).file(audio(1024 * 1024 + 1)))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.message").value("Audio file too large (max 1MB)"));

      verifyNoInteractions(speechTranscriber);
    }

    @Test
    @DisplayName("should return 400 for an unknown language hint")
    void shouldReturn400ForUnknownLanguage() throws Exception {
      mockMvc
          .perform(multipart(CHAT_URL).file(audio(16)).param("language", "fr"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value("VALIDATION_001"));

      verifyNoInteractions(speechTranscriber);
    }

    @Test
    @DisplayName("should return 400 for malformed conversation history")
    void shouldReturn400ForMalformedHistory() throws Exception {
      mockMvc
          .perform(
              multipart(CHAT_URL).file(audio(16)).param("conversationHistory", "not json"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.message").value("Conversation history must be a JSON array"));
    }

    @Test
    @DisplayName("should return 429 with Retry-After and never touch the pipeline")
    void shouldReturn429WhenRateLimited() throws Exception {
      doThrow(new RateLimitExceededException("203.0.113.9", 60))
          .when(admissionGate)
          .admit("203.0.113.9");

      mockMvc
          .perform(
              multipart(CHAT_URL).file(audio(16)).header("X-Forwarded-For", "203.0.113.9"))
          .andExpect(status().isTooManyRequests())
          .andExpect(header().string("Retry-After", "60"))
          .andExpect(jsonPath("$.code").value("RATE_001"))
          .andExpect(jsonPath("$.retryAfter").value(60));

      verifyNoInteractions(speechTranscriber, contextRetriever, answerGenerator);
    }

    @Test
    @DisplayName("should return 400 when no speech is detected")
    void shouldReturn400WhenNoSpeech() throws Exception {
      when(speechTranscriber.transcribe(any(AudioPayload.class), any(LanguageHint.class)))
          .thenReturn(Mono.error(new NoSpeechDetectedException()));

      MvcResult result =
          mockMvc
              .perform(multipart(CHAT_URL).file(audio(16)))
              .andExpect(request().asyncStarted())
              .andReturn();

      mockMvc
          .perform(asyncDispatch(result))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value("VOICE_001"))
          .andExpect(
              jsonPath("$.message")
                  .value("Could not detect any speech in the audio. Please try again."));

      verifyNoInteractions(answerGenerator);
    }
  }

  @Nested
  @DisplayName("POST /api/v1/voice/chat streaming")
  class StreamingTests {

    private MvcResult startStream() throws Exception {
      MvcResult result =
          mockMvc
              .perform(
                  multipart(CHAT_URL)
                      .file(audio(16))
                      .param("language", "en")
                      .param("videoId", "vid1")
                      .param(
                          "conversationHistory",
                          "[{\"role\":\"user\",\"content\":\"hi\"}]"))
              .andExpect(request().asyncStarted())
              .andReturn();

      return mockMvc.perform(asyncDispatch(result)).andExpect(status().isOk()).andReturn();
    }

    private String awaitBody(MvcResult result, String terminalType) throws Exception {
      String marker = "\"type\":\"" + terminalType + "\"";
      Awaitility.await()
          .atMost(5, TimeUnit.SECONDS)
          .until(() -> result.getResponse().getContentAsString().contains(marker));
      return result.getResponse().getContentAsString();
    }

    @Test
    @DisplayName("should stream transcription, content and done as SSE data lines")
    void shouldStreamEventsInOrder() throws Exception {
      when(speechTranscriber.transcribe(any(AudioPayload.class), any(LanguageHint.class)))
          .thenReturn(Mono.just(new TranscriptionResult("What is a closure?", "en", 1.0)));
      // the stream is drained on the async executor, possibly after the test returns
      lenient()
          .when(contextRetriever.retrieve(anyString(), anyString()))
          .thenReturn(Mono.just(List.of()));
      lenient()
          .when(answerGenerator.generate(any(GenerationPrompt.class)))
          .thenReturn(Flux.just("A closure ", "captures scope."));

      MvcResult dispatched = startStream();
      String body = awaitBody(dispatched, "done");

      assertThat(dispatched.getResponse().getContentType()).startsWith("text/event-stream");
      assertThat(body)
          .containsSubsequence(
              "data:{\"type\":\"transcription\"",
              "\"text\":\"What is a closure?\"",
              "data:{\"type\":\"content\",\"content\":\"A closure \"}",
              "data:{\"type\":\"content\",\"content\":\"captures scope.\"}",
              "data:{\"type\":\"done\"",
              "\"fullContent\":\"A closure captures scope.\"",
              "\"latency\":{",
              "\"total\":");
      assertThat(body).doesNotContain("\"type\":\"audio\"", "\"type\":\"error\"");
      assertThat(meterRegistry.counter("sse.streams.ended", "type", "done").count())
          .isEqualTo(1.0);

      verify(admissionGate).admit(anyString());
      verify(speechTranscriber).transcribe(any(AudioPayload.class), any(LanguageHint.class));
    }

    @Test
    @DisplayName("should report a mid-stream generation failure in-band with status 200")
    void shouldReportGenerationFailureInBand() throws Exception {
      when(speechTranscriber.transcribe(any(AudioPayload.class), any(LanguageHint.class)))
          .thenReturn(Mono.just(new TranscriptionResult("What is a closure?", "en", 1.0)));
      lenient()
          .when(contextRetriever.retrieve(anyString(), anyString()))
          .thenReturn(Mono.just(List.of()));
      lenient()
          .when(answerGenerator.generate(any(GenerationPrompt.class)))
          .thenReturn(
              Flux.just("A closure ").concatWith(Flux.error(new GenerationException("reset"))));

      MvcResult dispatched = startStream();
      String body = awaitBody(dispatched, "error");

      assertThat(dispatched.getResponse().getStatus()).isEqualTo(200);
      assertThat(body)
          .containsSubsequence(
              "data:{\"type\":\"transcription\"",
              "data:{\"type\":\"content\",\"content\":\"A closure \"}",
              "data:{\"type\":\"error\"",
              "Please ask your question again.");
      assertThat(body).doesNotContain("\"type\":\"done\"", "reset", "LLM_001");
      assertThat(meterRegistry.counter("sse.streams.ended", "type", "error").count())
          .isEqualTo(1.0);
    }
  }

  @Nested
  @DisplayName("GET /api/v1/voice/chat")
  class StatusTests {

    @Test
    @DisplayName("should report provider availability")
    void shouldReportProviderAvailability() throws Exception {
      when(voiceHealthService.getVoiceStatus())
          .thenReturn(
              VoiceServiceStatus.builder()
                  .status("ok")
                  .services(
                      VoiceServiceStatus.Services.builder()
                          .whisper(true)
                          .llm(true)
                          .tts(false)
                          .rag(true)
                          .build())
                  .message("Voice chat API is running")
                  .targetLatency("< 2 seconds")
                  .build());

      mockMvc
          .perform(get(CHAT_URL))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.status").value("ok"))
          .andExpect(jsonPath("$.services.whisper").value(true))
          .andExpect(jsonPath("$.services.tts").value(false))
          .andExpect(jsonPath("$.targetLatency").value(containsString("2 seconds")));
    }
  }
}
