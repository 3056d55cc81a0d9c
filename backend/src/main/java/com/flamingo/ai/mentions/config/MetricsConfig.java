package com.flamingo.ai.mentions.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for pipeline metrics. */
@Configuration
public class MetricsConfig {

  /** Enables @Timed on chunking, archive reconstruction and batch processing. */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }
}
