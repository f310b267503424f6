package com.flamingo.ai.voicetutor.domain.model;

import com.flamingo.ai.voicetutor.domain.enums.TurnRole;
import java.util.Objects;

/** One prior turn of the learner's conversation, supplied by the caller. */
public record ConversationTurn(TurnRole role, String content) {

  public ConversationTurn {
    Objects.requireNonNull(role, "role");
    Objects.requireNonNull(content, "content");
  }

  public static ConversationTurn user(String content) {
    return new ConversationTurn(TurnRole.USER, content);
  }

  public static ConversationTurn assistant(String content) {
    return new ConversationTurn(TurnRole.ASSISTANT, content);
  }
}
