package com.flamingo.ai.voicetutor.service.rag;

import com.flamingo.ai.voicetutor.domain.model.ContextChunk;
import java.util.List;
import reactor.core.publisher.Mono;

/** Best-effort lookup of transcript context for a question. */
public interface ContextRetriever {

  /**
   * Finds transcript chunks relevant to a question. Never fails: any error or timeout yields an
   * empty list.
   *
   * @param queryText the transcribed question
   * @param videoId the video to search, or {@code null}
   * @return chunks in ascending start time order
   */
  Mono<List<ContextChunk>> retrieve(String queryText, String videoId);

  boolean isConfigured();
}
