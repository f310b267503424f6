package com.flamingo.ai.voicetutor.api;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

/** Derives the rate-limit key: the first {@code X-Forwarded-For} hop, else the remote address. */
@Component
public class ClientKeyResolver {

  static final String FORWARDED_FOR = "X-Forwarded-For";

  public String resolve(HttpServletRequest request) {
    String forwarded = request.getHeader(FORWARDED_FOR);
    if (forwarded != null && !forwarded.isBlank()) {
      String first = forwarded.split(",")[0].trim();
      if (!first.isEmpty()) {
        return first;
      }
    }
    String remote = request.getRemoteAddr();
    return remote == null || remote.isBlank() ? "unknown" : remote;
  }
}
