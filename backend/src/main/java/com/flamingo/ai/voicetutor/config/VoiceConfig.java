package com.flamingo.ai.voicetutor.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.unit.DataSize;

/** Configuration properties for the voice question-answering pipeline. */
@Configuration
@ConfigurationProperties(prefix = "voice")
@Getter
@Setter
public class VoiceConfig {

  private Audio audio = new Audio();
  private Transcription transcription = new Transcription();
  private Retrieval retrieval = new Retrieval();
  private Generation generation = new Generation();
  private Synthesis synthesis = new Synthesis();
  private RateLimit rateLimit = new RateLimit();

  /** Latency goal advertised by the status endpoint. */
  private String targetLatency = "< 2 seconds";

  @Getter
  @Setter
  public static class Audio {
    private DataSize maxSize = DataSize.ofMegabytes(25);
  }

  @Getter
  @Setter
  public static class Transcription {
    private String baseUrl = "https://api.openai.com/v1";
    private String apiKey = "";
    private String model = "whisper-1";

    /** Language sent to the provider when the client hint is {@code auto}. Empty means none. */
    private String expectedLanguage = "";

    private Duration timeout = Duration.ofSeconds(30);
  }

  @Getter
  @Setter
  public static class Retrieval {
    private String indexName = "voice-transcript-chunks";
    private int topK = 5;
    private int rrfK = 60;
    private int candidatesMultiplier = 2;
    private Duration timeout = Duration.ofMillis(750);
  }

  @Getter
  @Setter
  public static class Generation {
    private int voiceMaxOutputTokens = 500;
    private int textMaxOutputTokens = 2048;
    private double temperature = 0.7;
    private int maxHistoryTurns = 10;
  }

  @Getter
  @Setter
  public static class Synthesis {
    private String baseUrl = "https://api.elevenlabs.io";
    private String apiKey = "";
    private String voiceId = "pNInz6obpgDQGcFmaJgB";
    private String modelId = "eleven_multilingual_v2";
    private String outputFormat = "mp3_44100_128";
    private Duration timeout = Duration.ofSeconds(10);
    private int maxTextLength = 5000;
    private double stability = 0.5;
    private double similarityBoost = 0.75;
  }

  @Getter
  @Setter
  public static class RateLimit {
    private boolean enabled = true;
    private int maxRequests = 5;
    private Duration window = Duration.ofSeconds(60);
    private long maxTrackedClients = 10_000;
  }
}
