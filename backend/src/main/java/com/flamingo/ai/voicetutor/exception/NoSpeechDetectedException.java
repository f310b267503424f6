package com.flamingo.ai.voicetutor.exception;

/** Exception thrown when transcription succeeds but yields no speech. */
public class NoSpeechDetectedException extends RuntimeException {

  private static final String USER_MESSAGE =
      "Could not detect any speech in the audio. Please try again.";

  public NoSpeechDetectedException() {
    super("No speech detected");
  }

  public String getUserMessage() {
    return USER_MESSAGE;
  }
}
