package com.flamingo.ai.voicetutor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the voice tutor backend. */
@SpringBootApplication
public class VoiceTutorApplication {

  public static void main(String[] args) {
    SpringApplication.run(VoiceTutorApplication.class, args);
  }
}
