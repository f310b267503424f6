package com.flamingo.ai.voicetutor.elasticsearch;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Transcript chunk document as stored in the transcript index. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TranscriptChunk {

  private String id;
  private String videoId;
  private Integer chunkIndex;
  private String content;
  private Double startTime;
  private Double endTime;

  /** Score of the hit that produced this chunk; not stored. */
  private Double relevanceScore;
}
