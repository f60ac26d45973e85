package com.example.chat.shared.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Metrics for the chat core. Timers and counters are recorded by
 * {@link com.example.chat.shared.aspect.MonitoringAspect}; the router and relay
 * update delivery counters directly through {@link ChatMetricsCollector}.
 */
@Configuration
@EnableAspectJAutoProxy
public class MonitoringConfig {

    @Bean
    public MeterBinder chatMetrics() {
        return registry -> {
            registry.counter("chat.messages.persisted", "type", "channel");
            registry.counter("chat.messages.persisted", "type", "dm");

            registry.counter("chat.frames.enqueued", "status", "accepted");
            registry.counter("chat.frames.enqueued", "status", "evicted");
            registry.counter("chat.frames.enqueued", "status", "dropped");

            registry.counter("chat.connections.closed", "reason", "SlowConsumer");
            registry.counter("chat.commands.rejected", "kind", "RateLimited");

            Timer.builder("chat.delivery.latency")
                    .description("Time taken to persist and fan out one chat message")
                    .register(registry);
        };
    }

    @Bean
    public ChatMetricsCollector chatMetricsCollector(MeterRegistry registry) {
        return new ChatMetricsCollector(registry);
    }

    public static class ChatMetricsCollector {
        private final MeterRegistry registry;
        private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
        private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();

        public ChatMetricsCollector(MeterRegistry registry) {
            this.registry = registry;
        }

        public void incrementCounter(String name, String... tags) {
            String key = name + "_" + String.join("_", tags);
            counters.computeIfAbsent(key, k -> registry.counter(name, tags)).increment();
        }

        public void recordTimer(String name, long durationMillis, String... tags) {
            String key = name + "_" + String.join("_", tags);
            timers.computeIfAbsent(key, k ->
                    Timer.builder(name).tags(tags).register(registry))
                    .record(durationMillis, TimeUnit.MILLISECONDS);
        }
    }
}
