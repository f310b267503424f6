package com.flamingo.ai.voicetutor.elasticsearch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import com.flamingo.ai.voicetutor.config.VoiceConfig;
import com.flamingo.ai.voicetutor.exception.SearchException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("TranscriptChunkSearchService Tests")
@SuppressWarnings({"rawtypes", "unchecked"})
class TranscriptChunkSearchServiceTest {

  @Mock private ElasticsearchClient elasticsearchClient;

  private SimpleMeterRegistry meterRegistry;
  private TranscriptChunkSearchService searchService;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    searchService =
        new TranscriptChunkSearchService(elasticsearchClient, meterRegistry, new VoiceConfig());
  }

  private static SearchResponse<Map> responseWith(List<Hit<Map>> hits) {
    return SearchResponse.of(
        r ->
            r.took(3)
                .timedOut(false)
                .shards(s -> s.total(1).successful(1).failed(0))
                .hits(h -> h.hits(hits)));
  }

  private static Hit<Map> hit(String id, double score, Map<String, Object> source) {
    return Hit.of(h -> h.index("voice-transcript-chunks").id(id).score(score).source(source));
  }

  @Test
  @DisplayName("Should map keyword hits to transcript chunks")
  void shouldMapKeywordHitsToChunks() throws IOException {
    Map<String, Object> source =
        Map.of(
            "videoId", "vid1",
            "chunkIndex", 3,
            "content", "A closure captures variables.",
            "startTime", 12.5,
            "endTime", 20);
    when(elasticsearchClient.search(any(SearchRequest.class), eq(Map.class)))
        .thenReturn(responseWith(List.of(hit("vid1_3", 4.2, source))));

    List<TranscriptChunk> chunks = searchService.keywordSearch("vid1", "closure", 5);

    assertThat(chunks).hasSize(1);
    TranscriptChunk chunk = chunks.get(0);
    assertThat(chunk.getId()).isEqualTo("vid1_3");
    assertThat(chunk.getVideoId()).isEqualTo("vid1");
    assertThat(chunk.getChunkIndex()).isEqualTo(3);
    assertThat(chunk.getStartTime()).isEqualTo(12.5);
    assertThat(chunk.getEndTime()).isEqualTo(20.0);
    assertThat(chunk.getRelevanceScore()).isEqualTo(4.2);

    ArgumentCaptor<SearchRequest> captor = ArgumentCaptor.forClass(SearchRequest.class);
    verify(elasticsearchClient).search(captor.capture(), eq(Map.class));
    assertThat(captor.getValue().index()).containsExactly("voice-transcript-chunks");
    assertThat(captor.getValue().size()).isEqualTo(5);
    assertThat(meterRegistry.counter("transcript_chunks.keyword_search").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should build a filtered kNN request for vector search")
  void shouldBuildFilteredKnnRequest() throws IOException {
    when(elasticsearchClient.search(any(SearchRequest.class), eq(Map.class)))
        .thenReturn(responseWith(List.of()));

    List<TranscriptChunk> chunks = searchService.vectorSearch("vid1", List.of(0.1f, 0.2f), 4);

    assertThat(chunks).isEmpty();
    ArgumentCaptor<SearchRequest> captor = ArgumentCaptor.forClass(SearchRequest.class);
    verify(elasticsearchClient).search(captor.capture(), eq(Map.class));
    SearchRequest request = captor.getValue();
    assertThat(request.knn()).hasSize(1);
    assertThat(request.knn().get(0).field()).isEqualTo("embedding");
    assertThat(request.knn().get(0).k()).isEqualTo(4);
    assertThat(request.knn().get(0).filter()).hasSize(1);
  }

  @Test
  @DisplayName("Should wrap transport failures in SearchException")
  void shouldWrapTransportFailures() throws IOException {
    when(elasticsearchClient.search(any(SearchRequest.class), eq(Map.class)))
        .thenThrow(new IOException("connection refused"));

    assertThatThrownBy(() -> searchService.keywordSearch("vid1", "closure", 5))
        .isInstanceOf(SearchException.class)
        .hasMessage("keywordSearch failed")
        .hasCauseInstanceOf(IOException.class);
  }
}
