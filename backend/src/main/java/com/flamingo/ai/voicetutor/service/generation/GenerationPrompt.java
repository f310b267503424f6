package com.flamingo.ai.voicetutor.service.generation;

import com.flamingo.ai.voicetutor.domain.enums.ResponseStyle;
import com.flamingo.ai.voicetutor.domain.model.ContextChunk;
import com.flamingo.ai.voicetutor.domain.model.ConversationTurn;
import java.util.List;

/** Everything the generator needs to answer one question. */
public record GenerationPrompt(
    ResponseStyle style,
    List<ContextChunk> context,
    List<ConversationTurn> history,
    String question,
    String requestId) {

  public GenerationPrompt {
    style = style == null ? ResponseStyle.VOICE : style;
    context = context == null ? List.of() : List.copyOf(context);
    history = history == null ? List.of() : List.copyOf(history);
  }
}
