package com.flamingo.ai.voicetutor.service.generation;

import com.flamingo.ai.voicetutor.domain.enums.ResponseStyle;
import com.flamingo.ai.voicetutor.domain.enums.TurnRole;
import com.flamingo.ai.voicetutor.domain.model.ConversationTurn;
import com.flamingo.ai.voicetutor.service.rag.TranscriptContextFormatter;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Builds the message list for a grounded answer: system prompt with transcript context, prior
 * turns, then the live question.
 */
@Component
@RequiredArgsConstructor
public class GroundedPromptBuilder {

  static final String NOT_IN_MATERIAL = "I don't have that information in this course material";

  private static final String VOICE_INSTRUCTIONS =
      "You are an AI tutor answering spoken questions about a video course. Answer using ONLY "
          + "the transcript context provided below.\n\n"
          + "RULES:\n"
          + "1. Be concise - this is a voice conversation, keep answers to 2-3 sentences\n"
          + "2. Only use information from the transcript context\n"
          + "3. If the answer is not in the context, say: \""
          + NOT_IN_MATERIAL
          + "\"\n"
          + "4. Cite timestamps when you use the context, "
          + "for example: \"At 2:34 in the video...\"\n"
          + "5. Respond in the same language as the question (Hebrew or English)\n"
          + "6. Do not use markdown, lists or emoji; the answer will be read aloud";

  private static final String TEXT_INSTRUCTIONS =
      "You are an AI tutor answering questions about a video course. Answer using ONLY the "
          + "transcript context provided below.\n\n"
          + "RULES:\n"
          + "1. Give a complete explanation in a few short paragraphs\n"
          + "2. Only use information from the transcript context\n"
          + "3. If the answer is not in the context, say: \""
          + NOT_IN_MATERIAL
          + "\"\n"
          + "4. Cite the timestamps you rely on in the form [M:SS]\n"
          + "5. Respond in the same language as the question (Hebrew or English)";

  private final TranscriptContextFormatter contextFormatter;

  public List<ChatMessage> build(GenerationPrompt prompt) {
    List<ChatMessage> messages = new ArrayList<>(prompt.history().size() + 2);
    messages.add(SystemMessage.from(buildSystemPrompt(prompt)));

    for (ConversationTurn turn : prompt.history()) {
      if (turn.role() == TurnRole.USER) {
        messages.add(UserMessage.from(turn.content()));
      } else {
        messages.add(AiMessage.from(turn.content()));
      }
    }

    messages.add(UserMessage.from(prompt.question()));
    return messages;
  }

  String buildSystemPrompt(GenerationPrompt prompt) {
    StringBuilder system = new StringBuilder();
    system.append(
        prompt.style() == ResponseStyle.TEXT ? TEXT_INSTRUCTIONS : VOICE_INSTRUCTIONS);

    String context = contextFormatter.format(prompt.context());
    if (context.isEmpty()) {
      system.append(
          "\n\nNo transcript context was found for this question. Do not answer from general "
              + "knowledge; say \""
              + NOT_IN_MATERIAL
              + "\".");
    } else {
      system.append("\n\nRELEVANT TRANSCRIPT CONTEXT:\n").append(context);
    }
    return system.toString();
  }
}
