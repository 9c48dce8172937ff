package com.flamingo.ai.memoryengine.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for engine metrics. */
@Configuration
public class MetricsConfig {

  /** Enables {@code @Timed} on ingest, search and store entry points. */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  /** Tags every meter with the engine instance, so several instances can share one backend. */
  @Bean
  public MeterRegistryCustomizer<MeterRegistry> commonTags(
      @Value("${spring.application.name:memory-engine}") String application,
      @Value("${memory.instance-id:${HOSTNAME:local}}") String instance) {
    return registry ->
        registry.config().commonTags("application", application, "instance", instance);
  }
}
