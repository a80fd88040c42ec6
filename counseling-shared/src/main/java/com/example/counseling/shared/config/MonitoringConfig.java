package com.example.counseling.shared.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics and tracing for the session and notification layer.
 */
@Configuration
@EnableAspectJAutoProxy
public class MonitoringConfig {

    /**
     * Meters that should exist from startup, before the first connection or session arrives.
     */
    @Bean
    public MeterBinder counselingMetrics() {
        return registry -> {
            registry.counter("counseling.sessions.transitions", "to", "waiting");
            registry.counter("counseling.sessions.transitions", "to", "active");
            registry.counter("counseling.sessions.transitions", "to", "completed");
            registry.counter("counseling.frames.rejected");
        };
    }

    /**
     * Tags every meter with the instance name; connection gauges are per instance.
     */
    @Bean
    public MeterRegistryCustomizer<MeterRegistry> instanceTagCustomizer(AppProperties appProperties) {
        return registry -> registry.config().commonTags("instance", appProperties.getPodName());
    }

    @Bean
    public CounselingMetricsCollector counselingMetricsCollector(MeterRegistry registry) {
        return new CounselingMetricsCollector(registry);
    }

    /**
     * Lazily registers counters, timers and gauges keyed by name and tags.
     */
    public static class CounselingMetricsCollector {
        private final MeterRegistry registry;
        private final ConcurrentHashMap<String, io.micrometer.core.instrument.Counter> counters = new ConcurrentHashMap<>();
        private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();
        private final ConcurrentHashMap<String, AtomicLong> gauges = new ConcurrentHashMap<>();

        public CounselingMetricsCollector(MeterRegistry registry) {
            this.registry = registry;
        }

        public void incrementCounter(String name, String... tags) {
            String key = name + "_" + String.join("_", tags);
            counters.computeIfAbsent(key, k -> registry.counter(name, tags)).increment();
        }

        public void recordTimer(String name, long duration, String... tags) {
            String key = name + "_" + String.join("_", tags);
            timers.computeIfAbsent(key, k ->
                Timer.builder(name).tags(tags).register(registry))
                  .record(duration, TimeUnit.MILLISECONDS);
        }

        public void setGauge(String name, double value, String... tags) {
            String key = name + "_" + String.join("_", tags);
            AtomicLong gauge = gauges.computeIfAbsent(key, k -> {
                AtomicLong newGauge = new AtomicLong();
                registry.gauge(name, Tags.of(tags), newGauge);
                return newGauge;
            });
            gauge.set((long) value);
        }
    }
}
