package com.flamingo.ai.voicetutor.service.generation;

import com.flamingo.ai.voicetutor.config.VoiceConfig;
import com.flamingo.ai.voicetutor.domain.enums.ResponseStyle;
import com.flamingo.ai.voicetutor.exception.GenerationException;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.PartialResponse;
import dev.langchain4j.model.chat.response.PartialResponseContext;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import dev.langchain4j.model.chat.response.StreamingHandle;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

/** Streams grounded answers from a LangChain4j {@link StreamingChatModel}. */
@Service
@Slf4j
public class LangChain4jAnswerGenerator implements AnswerGenerator {

  private final StreamingChatModel streamingChatModel;
  private final GroundedPromptBuilder promptBuilder;
  private final VoiceConfig voiceConfig;
  private final MeterRegistry meterRegistry;

  public LangChain4jAnswerGenerator(
      @Nullable StreamingChatModel streamingChatModel,
      GroundedPromptBuilder promptBuilder,
      VoiceConfig voiceConfig,
      MeterRegistry meterRegistry) {
    this.streamingChatModel = streamingChatModel;
    this.promptBuilder = promptBuilder;
    this.voiceConfig = voiceConfig;
    this.meterRegistry = meterRegistry;
  }

  @Override
  public boolean isConfigured() {
    return streamingChatModel != null;
  }

  @Override
  public Flux<String> generate(GenerationPrompt prompt) {
    if (streamingChatModel == null) {
      return Flux.error(new GenerationException("Streaming chat model is not configured"));
    }

    List<ChatMessage> messages = promptBuilder.build(prompt);
    VoiceConfig.Generation settings = voiceConfig.getGeneration();
    ChatRequest request =
        ChatRequest.builder()
            .messages(messages)
            .maxOutputTokens(
                prompt.style() == ResponseStyle.TEXT
                    ? settings.getTextMaxOutputTokens()
                    : settings.getVoiceMaxOutputTokens())
            .temperature(settings.getTemperature())
            .build();

    return Flux.create(
        sink -> {
          AtomicBoolean cancelled = new AtomicBoolean(false);
          AtomicInteger deltaCount = new AtomicInteger(0);
          AtomicReference<StreamingHandle> streamingHandle = new AtomicReference<>();
          sink.onCancel(
              () -> {
                cancelled.set(true);
                StreamingHandle handle = streamingHandle.get();
                if (handle != null) {
                  log.debug("[{}] Cancelling provider stream", prompt.requestId());
                  handle.cancel();
                }
              });

          StreamingChatResponseHandler handler =
              new StreamingChatResponseHandler() {
                @Override
                public void onPartialResponse(
                    PartialResponse partialResponse, PartialResponseContext context) {
                  StreamingHandle handle = context.streamingHandle();
                  streamingHandle.compareAndSet(null, handle);
                  // subscriber left before the provider handed out its handle
                  if (cancelled.get()) {
                    handle.cancel();
                    return;
                  }
                  onPartialResponse(partialResponse.text());
                }

                @Override
                public void onPartialResponse(String partialResponse) {
                  if (cancelled.get() || partialResponse == null || partialResponse.isEmpty()) {
                    return;
                  }
                  deltaCount.incrementAndGet();
                  sink.next(partialResponse);
                }

                @Override
                public void onCompleteResponse(ChatResponse completeResponse) {
                  log.debug(
                      "[{}] Generation completed with {} deltas",
                      prompt.requestId(),
                      deltaCount.get());
                  meterRegistry.counter("voice.generation.completed").increment();
                  sink.complete();
                }

                @Override
                public void onError(Throwable error) {
                  if (cancelled.get()) {
                    log.debug(
                        "[{}] Generation error after cancel: {}",
                        prompt.requestId(),
                        error.getMessage());
                    return;
                  }
                  sink.error(new GenerationException("Streaming generation failed", error));
                }
              };

          try {
            streamingChatModel.chat(request, handler);
          } catch (RuntimeException e) {
            sink.error(new GenerationException("Failed to start streaming generation", e));
          }
        },
        FluxSink.OverflowStrategy.BUFFER);
  }
}
