package com.flamingo.ai.voicetutor.service.rag;

import com.flamingo.ai.voicetutor.config.VoiceConfig;
import com.flamingo.ai.voicetutor.domain.model.ContextChunk;
import com.flamingo.ai.voicetutor.elasticsearch.TranscriptChunk;
import com.flamingo.ai.voicetutor.elasticsearch.TranscriptChunkSearchService;
import com.flamingo.ai.voicetutor.util.LogSanitizer;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Hybrid transcript retrieval combining vector search and BM25 keyword search with Reciprocal Rank
 * Fusion (RRF).
 *
 * <p>Retrieval is best-effort. Errors and timeouts are logged, counted and turned into an empty
 * context so the answer can still be generated.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HybridTranscriptRetriever implements ContextRetriever {

  private final TranscriptChunkSearchService searchService;
  private final EmbeddingService embeddingService;
  private final VoiceConfig voiceConfig;
  private final MeterRegistry meterRegistry;

  @Override
  public boolean isConfigured() {
    return true;
  }

  @Override
  public Mono<List<ContextChunk>> retrieve(String queryText, String videoId) {
    if (videoId == null || videoId.isBlank() || queryText == null || queryText.isBlank()) {
      return Mono.just(List.of());
    }
    VoiceConfig.Retrieval settings = voiceConfig.getRetrieval();
    return Mono.fromCallable(() -> search(queryText, videoId))
        .subscribeOn(Schedulers.boundedElastic())
        .timeout(settings.getTimeout())
        .onErrorResume(
            e -> {
              String reason = e instanceof TimeoutException ? "timeout" : "error";
              log.warn(
                  "Transcript retrieval {} for video {} (query='{}'): {}",
                  reason,
                  videoId,
                  LogSanitizer.preview(queryText),
                  e.getMessage());
              meterRegistry.counter("voice.retrieval.fallback", "reason", reason).increment();
              return Mono.just(List.of());
            });
  }

  /**
   * Runs the hybrid search synchronously.
   *
   * @param query the question
   * @param videoId the video to search
   * @return top chunks in timeline order
   */
  List<ContextChunk> search(String query, String videoId) {
    VoiceConfig.Retrieval settings = voiceConfig.getRetrieval();
    int topK = settings.getTopK();
    int candidates = topK * settings.getCandidatesMultiplier();

    List<Float> queryEmbedding = embeddingService.embedQuery(query);
    List<TranscriptChunk> fused;
    if (queryEmbedding.isEmpty()) {
      log.debug("No query embedding, using keyword search only for video {}", videoId);
      fused = searchService.keywordSearch(videoId, query, topK);
    } else {
      List<TranscriptChunk> vectorResults =
          searchService.vectorSearch(videoId, queryEmbedding, candidates);
      List<TranscriptChunk> keywordResults =
          searchService.keywordSearch(videoId, query, candidates);
      fused = applyRrf(vectorResults, keywordResults, topK);
    }

    List<ContextChunk> chunks = new ArrayList<>(fused.size());
    for (TranscriptChunk chunk : fused) {
      ContextChunk converted = toContextChunk(chunk, videoId);
      if (converted != null) {
        chunks.add(converted);
      }
    }
    chunks.sort(ContextChunk.TIMELINE_ORDER);

    log.debug("Retrieved {} transcript chunks for video {}", chunks.size(), videoId);
    meterRegistry.counter("voice.retrieval.success").increment();
    return chunks;
  }

  /** RRF score = sum over retrievers of 1/(k + rank + 1). Ties keep first-seen order. */
  private List<TranscriptChunk> applyRrf(
      List<TranscriptChunk> vectorResults, List<TranscriptChunk> keywordResults, int topK) {
    int rrfK = voiceConfig.getRetrieval().getRrfK();
    Map<String, Double> rrfScores = new LinkedHashMap<>();
    Map<String, TranscriptChunk> chunkMap = new HashMap<>();

    for (int i = 0; i < vectorResults.size(); i++) {
      TranscriptChunk chunk = vectorResults.get(i);
      rrfScores.merge(chunk.getId(), 1.0 / (rrfK + i + 1), Double::sum);
      chunkMap.put(chunk.getId(), chunk);
    }
    for (int i = 0; i < keywordResults.size(); i++) {
      TranscriptChunk chunk = keywordResults.get(i);
      rrfScores.merge(chunk.getId(), 1.0 / (rrfK + i + 1), Double::sum);
      chunkMap.putIfAbsent(chunk.getId(), chunk);
    }

    return rrfScores.entrySet().stream()
        .sorted(Map.Entry.<String, Double>comparingByValue().reversed())
        .limit(topK)
        .map(
            entry -> {
              TranscriptChunk chunk = chunkMap.get(entry.getKey());
              chunk.setRelevanceScore(entry.getValue());
              return chunk;
            })
        .toList();
  }

  private ContextChunk toContextChunk(TranscriptChunk chunk, String videoId) {
    if (chunk.getId() == null
        || chunk.getContent() == null
        || chunk.getStartTime() == null
        || chunk.getEndTime() == null
        || chunk.getStartTime() < 0
        || chunk.getEndTime() <= chunk.getStartTime()) {
      log.warn("Skipping malformed transcript chunk {} for video {}", chunk.getId(), videoId);
      return null;
    }
    return new ContextChunk(
        chunk.getId(),
        chunk.getVideoId() != null ? chunk.getVideoId() : videoId,
        chunk.getContent(),
        chunk.getStartTime(),
        chunk.getEndTime(),
        chunk.getRelevanceScore());
  }
}
