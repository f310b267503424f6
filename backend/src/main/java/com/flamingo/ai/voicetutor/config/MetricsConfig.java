package com.flamingo.ai.voicetutor.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.distribution.DistributionStatisticConfig;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for application metrics. */
@Configuration
public class MetricsConfig {

  /**
   * Enables the @Timed annotation for method-level timing metrics.
   *
   * @param registry the meter registry
   * @return the timed aspect bean
   */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  /** Publishes latency percentiles for the per-stage pipeline timers. */
  @Bean
  public MeterFilter voiceStageLatencyPercentiles() {
    return new MeterFilter() {
      @Override
      public DistributionStatisticConfig configure(
          Meter.Id id, DistributionStatisticConfig config) {
        if (id.getName().equals("voice.stage.latency")) {
          return DistributionStatisticConfig.builder()
              .percentiles(0.5, 0.95, 0.99)
              .expiry(Duration.ofMinutes(5))
              .build()
              .merge(config);
        }
        return config;
      }
    };
  }
}
