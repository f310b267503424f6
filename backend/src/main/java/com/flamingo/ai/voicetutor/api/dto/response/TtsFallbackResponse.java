package com.flamingo.ai.voicetutor.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Tells the client to speak the text with its own voice synthesis. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TtsFallbackResponse {

  private boolean success;
  private String provider;
  private String message;

  public static TtsFallbackResponse browser(String message) {
    return new TtsFallbackResponse(true, "browser", message);
  }
}
