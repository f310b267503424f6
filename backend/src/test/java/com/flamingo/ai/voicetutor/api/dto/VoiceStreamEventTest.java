package com.flamingo.ai.voicetutor.api.dto;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.voicetutor.api.dto.response.VoiceStreamEvent;
import com.flamingo.ai.voicetutor.domain.model.LatencyRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("VoiceStreamEvent Tests")
class VoiceStreamEventTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  private JsonNode json(Object value) throws Exception {
    return objectMapper.readTree(objectMapper.writeValueAsString(value));
  }

  private JsonNode parse(String expected) throws Exception {
    return objectMapper.readTree(expected);
  }

  @Test
  @DisplayName("Should serialize only the fields of the event type")
  void shouldSerializeOnlyEventFields() throws Exception {
    assertThat(json(VoiceStreamEvent.content("Hi")))
        .isEqualTo(parse("{\"type\":\"content\",\"content\":\"Hi\"}"));
    assertThat(json(VoiceStreamEvent.transcription("q", "he")))
        .isEqualTo(parse("{\"type\":\"transcription\",\"text\":\"q\",\"language\":\"he\"}"));
    assertThat(json(VoiceStreamEvent.error("boom")))
        .isEqualTo(parse("{\"type\":\"error\",\"error\":\"boom\"}"));
  }

  @Test
  @DisplayName("Should carry latency on the done event")
  void shouldCarryLatencyOnDone() throws Exception {
    JsonNode done = json(VoiceStreamEvent.done("answer", new LatencyRecord(400, 120, 300, 900)));

    assertThat(done)
        .isEqualTo(
            parse(
                "{\"type\":\"done\",\"fullContent\":\"answer\","
                    + "\"latency\":{\"stt\":400,\"rag\":120,\"llm\":300,\"total\":900}}"));
  }

  @Test
  @DisplayName("Should mark done and error as terminal")
  void shouldMarkTerminalEvents() {
    assertThat(VoiceStreamEvent.done("a", new LatencyRecord(0, 0, 0, 0)).isTerminal()).isTrue();
    assertThat(VoiceStreamEvent.error("e").isTerminal()).isTrue();
    assertThat(VoiceStreamEvent.content("c").isTerminal()).isFalse();
  }
}
