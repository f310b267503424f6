package com.flamingo.ai.voicetutor.util;

/** Utility for privacy-safe logging of learner questions and answers. */
public final class LogSanitizer {

  /** Default preview length for question and answer text in log lines. */
  public static final int PREVIEW_LENGTH = 60;

  private LogSanitizer() {}

  /** Truncates to at most {@code max} characters with an ellipsis; returns "" for null. */
  public static String truncate(String s, int max) {
    if (s == null || max <= 0) {
      return "";
    }
    String singleLine = s.replace('\n', ' ').replace('\r', ' ');
    return singleLine.length() <= max ? singleLine : singleLine.substring(0, max) + "...";
  }

  public static String preview(String s) {
    return truncate(s, PREVIEW_LENGTH);
  }
}
