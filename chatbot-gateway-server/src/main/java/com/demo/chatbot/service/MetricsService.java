package com.demo.chatbot.service;

import com.demo.chatbot.domain.ResponseSource;
import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Log-based metrics for the gateway.
 *
 * Counters and gauges live in memory and every update is written at debug level. Tagged counters
 * are kept under {@code name[key=value,...]} so each tag combination gets its own count.
 */
@Service
@Slf4j
public class MetricsService {

    private final ConcurrentHashMap<String, AtomicLong> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicInteger> gauges = new ConcurrentHashMap<>();

    public MetricsService() {
        log.info("MetricsService initialized (log-only mode)");
    }

    // ===== Counters =====

    public void incrementCounter(String name) {
        long count = counters.computeIfAbsent(name, k -> new AtomicLong(0)).incrementAndGet();
        log.debug("[METRIC] Counter: {} = {}", name, count);
    }

    public void incrementCounter(String name, Tags tags) {
        incrementCounter(name);
        incrementCounter(taggedName(name, tags));
    }

    // ===== Timers =====

    public TimerSample startTimer() {
        return new TimerSample();
    }

    public void stopTimer(TimerSample sample, String name) {
        recordTimer(name, sample.stop());
    }

    public void recordTimer(String name, Duration duration) {
        log.debug("[METRIC] Timer: {} = {}ms", name, duration.toMillis());
    }

    // ===== Gauges =====

    public void setGaugeValue(String name, int value) {
        gauges.computeIfAbsent(name, k -> new AtomicInteger(0)).set(value);
        log.debug("[METRIC] Gauge: {} = {}", name, value);
    }

    public void incrementGauge(String name) {
        int value = gauges.computeIfAbsent(name, k -> new AtomicInteger(0)).incrementAndGet();
        log.debug("[METRIC] Gauge: {} = {}", name, value);
    }

    public void decrementGauge(String name) {
        int value = gauges.computeIfAbsent(name, k -> new AtomicInteger(0)).decrementAndGet();
        log.debug("[METRIC] Gauge: {} = {}", name, value);
    }

    // ===== Gateway metrics =====

    public void recordWebSocketConnection(String clientId) {
        incrementCounter("websocket.connections");
        incrementGauge("active_connections");
        log.debug("WebSocket connection recorded: clientId={}", clientId);
    }

    public void recordWebSocketDisconnection(String clientId) {
        incrementCounter("websocket.disconnections");
        decrementGauge("active_connections");
        log.debug("WebSocket disconnection recorded: clientId={}", clientId);
    }

    public void recordMessageReceived(String channel) {
        incrementCounter("messages.received", Tags.of("channel", channel));
    }

    public void recordMessageSent(String frameType) {
        incrementCounter("messages.sent", Tags.of("type", frameType));
    }

    public void recordDispatch(ResponseSource source, Duration latency) {
        incrementCounter("dispatch.responses", Tags.of("source", source.wireName()));
        recordTimer("dispatch.latency", latency);
        if (source == ResponseSource.FALLBACK) {
            incrementCounter("dispatch.fallbacks");
        }
    }

    public void recordInactiveCleanup(int removed) {
        incrementCounter("connections.sweeps");
        if (removed > 0) {
            log.info("Inactive connections removed: count={}", removed);
        }
    }

    public void recordError(String errorType, String component) {
        incrementCounter("errors", Tags.of("type", errorType, "component", component));
        log.warn("Error recorded: type={}, component={}", errorType, component);
    }

    // ===== Inspection =====

    public long getCounterValue(String name) {
        AtomicLong counter = counters.get(name);
        return counter != null ? counter.get() : 0;
    }

    public long getCounterValue(String name, Tags tags) {
        return getCounterValue(taggedName(name, tags));
    }

    public int getGaugeValue(String name) {
        AtomicInteger gauge = gauges.get(name);
        return gauge != null ? gauge.get() : 0;
    }

    /**
     * Print summary of all metrics (for debugging)
     */
    public void printSummary() {
        log.info("=== Metrics Summary ===");
        counters.forEach((name, value) -> log.info("  {} = {}", name, value.get()));
        gauges.forEach((name, value) -> log.info("  {} = {}", name, value.get()));
    }

    private static String taggedName(String name, Tags tags) {
        String rendered = tags.stream()
                .map(tag -> tag.getKey() + "=" + tag.getValue())
                .collect(Collectors.joining(","));
        return rendered.isEmpty() ? name : name + "[" + rendered + "]";
    }

    public static class TimerSample {
        private final long startTime = System.nanoTime();

        public Duration stop() {
            return Duration.ofNanos(System.nanoTime() - startTime);
        }
    }
}
