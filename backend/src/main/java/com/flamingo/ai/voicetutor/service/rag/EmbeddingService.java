package com.flamingo.ai.voicetutor.service.rag;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

/** Embeds learner questions for vector search over transcript chunks. */
@Service
@Slf4j
public class EmbeddingService {

  // Spoken questions are short; anything longer is almost certainly a transcription artifact
  private static final int MAX_QUERY_CHARS = 2000;

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;

  public EmbeddingService(@Nullable EmbeddingModel embeddingModel, MeterRegistry meterRegistry) {
    this.embeddingModel = embeddingModel;
    this.meterRegistry = meterRegistry;
    if (embeddingModel == null) {
      log.warn("No embedding model configured, transcript search will use keywords only");
    }
  }

  /**
   * Embeds a question.
   *
   * @param query the question text
   * @return embedding vector, or an empty list when no model is configured or embedding failed
   */
  @Timed(value = "embedding.embedQuery", description = "Time to embed query")
  @CircuitBreaker(name = "openai", fallbackMethod = "embedQueryFallback")
  @Retry(name = "openai")
  public List<Float> embedQuery(String query) {
    if (embeddingModel == null) {
      return List.of();
    }
    String text = query.length() > MAX_QUERY_CHARS ? query.substring(0, MAX_QUERY_CHARS) : query;
    Response<Embedding> response = embeddingModel.embed(text);
    meterRegistry.counter("embedding.requests.success", "type", "query").increment();
    return toFloatList(response.content().vector());
  }

  private List<Float> toFloatList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }

  @SuppressWarnings("unused")
  private List<Float> embedQueryFallback(String query, Throwable t) {
    log.error("Query embedding failed, circuit breaker engaged: {}", t.getMessage());
    meterRegistry.counter("embedding.requests.failure").increment();
    return List.of();
  }
}
