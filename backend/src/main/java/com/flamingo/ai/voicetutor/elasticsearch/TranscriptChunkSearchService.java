package com.flamingo.ai.voicetutor.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.query_dsl.TextQueryType;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import com.flamingo.ai.voicetutor.config.VoiceConfig;
import com.flamingo.ai.voicetutor.exception.SearchException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Read-only search over the transcript chunk index. Every query is filtered to a single video.
 *
 * <p>Index fields: {@code videoId} (keyword), {@code chunkIndex} (integer), {@code content}
 * (text), {@code startTime}/{@code endTime} (seconds), {@code embedding} (dense_vector).
 */
@Service
@Slf4j
public class TranscriptChunkSearchService {

  static final String EMBEDDING_FIELD = "embedding";

  private final ElasticsearchClient elasticsearchClient;
  private final MeterRegistry meterRegistry;
  private final String indexName;

  public TranscriptChunkSearchService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry, VoiceConfig config) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
    this.indexName = config.getRetrieval().getIndexName();
  }

  /**
   * kNN search over chunk embeddings of one video.
   *
   * @param videoId the video to search within
   * @param queryEmbedding the query embedding
   * @param topK the number of results
   * @return matching chunks, best first
   */
  @Timed(value = "elasticsearch.vector_search", description = "Time for vector search")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "vectorSearchFallback")
  public List<TranscriptChunk> vectorSearch(String videoId, List<Float> queryEmbedding, int topK) {
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(indexName)
                    .knn(
                        k ->
                            k.field(EMBEDDING_FIELD)
                                .queryVector(queryEmbedding)
                                .k(topK)
                                .numCandidates(topK * 2)
                                .filter(f -> f.term(t -> t.field("videoId").value(videoId))))
                    .size(topK));
    List<TranscriptChunk> results = execute("vectorSearch", videoId, request);
    meterRegistry.counter("transcript_chunks.vector_search").increment();
    return results;
  }

  /**
   * BM25 search over chunk text of one video.
   *
   * @param videoId the video to search within
   * @param query the learner's question
   * @param topK the number of results
   * @return matching chunks, best first
   */
  @Timed(value = "elasticsearch.keyword_search", description = "Time for keyword search")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "keywordSearchFallback")
  public List<TranscriptChunk> keywordSearch(String videoId, String query, int topK) {
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(indexName)
                    .query(
                        q ->
                            q.bool(
                                b ->
                                    b.filter(f -> f.term(t -> t.field("videoId").value(videoId)))
                                        .must(
                                            m ->
                                                m.multiMatch(
                                                    mm ->
                                                        mm.fields("content")
                                                            .query(query)
                                                            .type(TextQueryType.BestFields)))))
                    .size(topK));
    List<TranscriptChunk> results = execute("keywordSearch", videoId, request);
    meterRegistry.counter("transcript_chunks.keyword_search").increment();
    return results;
  }

  @SuppressWarnings("unused")
  private List<TranscriptChunk> vectorSearchFallback(
      String videoId, List<Float> queryEmbedding, int topK, Throwable t) {
    log.warn("{} vector search fallback triggered: {}", indexName, t.getMessage());
    meterRegistry.counter("transcript_chunks.vector_search.fallback").increment();
    return List.of();
  }

  @SuppressWarnings("unused")
  private List<TranscriptChunk> keywordSearchFallback(
      String videoId, String query, int topK, Throwable t) {
    log.warn("{} keyword search fallback triggered: {}", indexName, t.getMessage());
    meterRegistry.counter("transcript_chunks.keyword_search.fallback").increment();
    return List.of();
  }

  @SuppressWarnings("rawtypes")
  private List<TranscriptChunk> execute(String searchType, String videoId, SearchRequest request) {
    try {
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      List<Hit<Map>> hits = response.hits().hits();
      log.debug(
          "[{}] index={} video={} returned={}", searchType, indexName, videoId, hits.size());
      return mapHits(hits);
    } catch (IOException e) {
      log.error("{} failed for {}: {}", searchType, indexName, e.getMessage(), e);
      throw new SearchException(searchType + " failed", e);
    }
  }

  @SuppressWarnings({"rawtypes", "unchecked"})
  private List<TranscriptChunk> mapHits(List<Hit<Map>> hits) {
    List<TranscriptChunk> chunks = new ArrayList<>(hits.size());
    for (Hit<Map> hit : hits) {
      Map<String, Object> source = hit.source();
      if (source == null) {
        continue;
      }
      chunks.add(
          TranscriptChunk.builder()
              .id(hit.id())
              .videoId(asString(source.get("videoId")))
              .chunkIndex(source.get("chunkIndex") instanceof Number n ? n.intValue() : null)
              .content(asString(source.get("content")))
              .startTime(asDouble(source.get("startTime")))
              .endTime(asDouble(source.get("endTime")))
              .relevanceScore(hit.score())
              .build());
    }
    return chunks;
  }

  private static String asString(Object value) {
    return value == null ? null : value.toString();
  }

  private static Double asDouble(Object value) {
    return value instanceof Number n ? n.doubleValue() : null;
  }
}
