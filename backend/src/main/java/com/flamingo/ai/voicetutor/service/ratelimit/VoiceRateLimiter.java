package com.flamingo.ai.voicetutor.service.ratelimit;

import com.flamingo.ai.voicetutor.config.VoiceConfig;
import com.flamingo.ai.voicetutor.exception.RateLimitExceededException;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Per-client admission gate backed by one Resilience4j {@link RateLimiter} per client key. Idle
 * limiters are evicted once their window has passed, so the map stays bounded.
 */
@Component
@Slf4j
public class VoiceRateLimiter implements AdmissionGate {

  private final VoiceConfig.RateLimit settings;
  private final RateLimiterConfig limiterConfig;
  private final Cache<String, RateLimiter> limiters;
  private final MeterRegistry meterRegistry;

  public VoiceRateLimiter(VoiceConfig voiceConfig, MeterRegistry meterRegistry) {
    this.settings = voiceConfig.getRateLimit();
    this.meterRegistry = meterRegistry;
    this.limiterConfig =
        RateLimiterConfig.custom()
            .limitForPeriod(settings.getMaxRequests())
            .limitRefreshPeriod(settings.getWindow())
            .timeoutDuration(Duration.ZERO)
            .build();
    this.limiters =
        CacheBuilder.newBuilder()
            .maximumSize(settings.getMaxTrackedClients())
            .expireAfterAccess(settings.getWindow().multipliedBy(2))
            .build();
  }

  @Override
  public void admit(String clientKey) {
    if (!settings.isEnabled()) {
      return;
    }
    String key = clientKey == null || clientKey.isBlank() ? "unknown" : clientKey;
    RateLimiter limiter =
        limiters.asMap().computeIfAbsent(key, k -> RateLimiter.of("voice-" + k, limiterConfig));
    if (!limiter.acquirePermission()) {
      meterRegistry.counter("voice.requests", "outcome", "rate_limited").increment();
      log.warn("Voice rate limit exceeded for client {}", key);
      throw new RateLimitExceededException(key, settings.getWindow().toSeconds());
    }
  }
}
