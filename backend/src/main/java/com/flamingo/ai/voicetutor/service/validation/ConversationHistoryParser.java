package com.flamingo.ai.voicetutor.service.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.voicetutor.config.VoiceConfig;
import com.flamingo.ai.voicetutor.domain.enums.TurnRole;
import com.flamingo.ai.voicetutor.domain.model.ConversationTurn;
import com.flamingo.ai.voicetutor.exception.InvalidVoiceRequestException;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Parses the {@code conversationHistory} form field: a JSON array of {@code {role, content}}
 * objects. Only the most recent turns are kept.
 */
@Component
@RequiredArgsConstructor
public class ConversationHistoryParser {

  private final ObjectMapper objectMapper;
  private final VoiceConfig voiceConfig;

  public List<ConversationTurn> parse(String json) {
    if (json == null || json.isBlank()) {
      return List.of();
    }

    JsonNode root;
    try {
      root = objectMapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new InvalidVoiceRequestException("Conversation history must be a JSON array");
    }
    if (root == null || !root.isArray()) {
      throw new InvalidVoiceRequestException("Conversation history must be a JSON array");
    }

    List<ConversationTurn> turns = new ArrayList<>(root.size());
    for (JsonNode node : root) {
      JsonNode roleNode = node.get("role");
      JsonNode contentNode = node.get("content");
      TurnRole role =
          roleNode != null && roleNode.isTextual()
              ? TurnRole.fromWireName(roleNode.asText())
              : null;
      if (role == null) {
        throw new InvalidVoiceRequestException(
            "Conversation history role must be 'user' or 'assistant'");
      }
      if (contentNode == null || !contentNode.isTextual()) {
        throw new InvalidVoiceRequestException("Conversation history content must be a string");
      }
      turns.add(new ConversationTurn(role, contentNode.asText()));
    }

    int maxTurns = voiceConfig.getGeneration().getMaxHistoryTurns();
    if (turns.size() > maxTurns) {
      return List.copyOf(turns.subList(turns.size() - maxTurns, turns.size()));
    }
    return List.copyOf(turns);
  }
}
