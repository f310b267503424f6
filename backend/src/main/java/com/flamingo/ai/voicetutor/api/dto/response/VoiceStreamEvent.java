package com.flamingo.ai.voicetutor.api.dto.response;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.voicetutor.domain.model.LatencyRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One event of the voice answer stream, sent as a single SSE {@code data:} line. Only the fields
 * belonging to the event type are serialized.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VoiceStreamEvent {

  public static final String TRANSCRIPTION = "transcription";
  public static final String CONTENT = "content";
  public static final String AUDIO = "audio";
  public static final String ERROR = "error";
  public static final String DONE = "done";

  /** Event type: transcription, content, audio, error, done. */
  private String type;

  private String text;
  private String language;
  private String content;
  private String audioUrl;
  private String error;
  private String fullContent;
  private LatencyRecord latency;

  public static VoiceStreamEvent transcription(String text, String language) {
    return VoiceStreamEvent.builder().type(TRANSCRIPTION).text(text).language(language).build();
  }

  public static VoiceStreamEvent content(String delta) {
    return VoiceStreamEvent.builder().type(CONTENT).content(delta).build();
  }

  public static VoiceStreamEvent audio(String audioUrl) {
    return VoiceStreamEvent.builder().type(AUDIO).audioUrl(audioUrl).build();
  }

  public static VoiceStreamEvent error(String message) {
    return VoiceStreamEvent.builder().type(ERROR).error(message).build();
  }

  public static VoiceStreamEvent done(String fullContent, LatencyRecord latency) {
    return VoiceStreamEvent.builder().type(DONE).fullContent(fullContent).latency(latency).build();
  }

  /** Whether this event ends the stream. */
  @JsonIgnore
  public boolean isTerminal() {
    return DONE.equals(type) || ERROR.equals(type);
  }
}
