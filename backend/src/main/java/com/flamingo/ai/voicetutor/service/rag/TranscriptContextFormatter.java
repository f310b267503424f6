package com.flamingo.ai.voicetutor.service.rag;

import com.flamingo.ai.voicetutor.domain.model.ContextChunk;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Renders retrieved chunks as the context block of the system prompt. Chunks are grouped per video
 * in first-seen order; within a video they are listed by ascending start time.
 */
@Component
public class TranscriptContextFormatter {

  public String format(List<ContextChunk> chunks) {
    if (chunks == null || chunks.isEmpty()) {
      return "";
    }

    Map<String, List<ContextChunk>> byVideo =
        chunks.stream()
            .collect(
                Collectors.groupingBy(
                    ContextChunk::videoId, LinkedHashMap::new, Collectors.toList()));

    StringBuilder context = new StringBuilder();
    for (Map.Entry<String, List<ContextChunk>> entry : byVideo.entrySet()) {
      if (context.length() > 0) {
        context.append("\n\n");
      }
      context.append("Video ").append(entry.getKey()).append(":\n");
      String lines =
          entry.getValue().stream()
              .sorted(ContextChunk.TIMELINE_ORDER)
              .map(chunk -> "[" + formatTimestamp(chunk.startTime()) + "] " + chunk.text().trim())
              .collect(Collectors.joining("\n\n"));
      context.append(lines);
    }
    return context.toString();
  }

  /** {@code M:SS} below one hour, {@code H:MM:SS} from one hour on. */
  public static String formatTimestamp(double seconds) {
    long total = (long) Math.floor(Math.max(0, seconds));
    long hours = total / 3600;
    long minutes = (total % 3600) / 60;
    long secs = total % 60;
    if (hours > 0) {
      return String.format("%d:%02d:%02d", hours, minutes, secs);
    }
    return String.format("%d:%02d", minutes, secs);
  }
}
