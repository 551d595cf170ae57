package com.demo.chatbot.service;

import com.demo.chatbot.infrastructure.ConnectionRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Owns the background work of the gateway: the initial backend probe, the recurring idle
 * connection sweep and, when configured, periodic backend re-probes.
 */
@Slf4j
@Component
public class MaintenanceScheduler {

    private final ConnectionRegistry connectionRegistry;
    private final BackendDispatcher backendDispatcher;
    private final MetricsService metricsService;
    private final Duration inactiveTimeout;
    private final long sweepIntervalSeconds;
    private final long reprobeIntervalSeconds;
    private final ScheduledExecutorService executor;

    public MaintenanceScheduler(ConnectionRegistry connectionRegistry,
                                BackendDispatcher backendDispatcher,
                                MetricsService metricsService,
                                @Value("${chatbot.connections.inactive-timeout-minutes:30}") long inactiveTimeoutMinutes,
                                @Value("${chatbot.connections.sweep-interval-seconds:300}") long sweepIntervalSeconds,
                                @Value("${chatbot.backend.reprobe-interval-seconds:0}") long reprobeIntervalSeconds) {
        this.connectionRegistry = connectionRegistry;
        this.backendDispatcher = backendDispatcher;
        this.metricsService = metricsService;
        this.inactiveTimeout = Duration.ofMinutes(inactiveTimeoutMinutes);
        this.sweepIntervalSeconds = sweepIntervalSeconds;
        this.reprobeIntervalSeconds = reprobeIntervalSeconds;
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "gateway-maintenance");
            thread.setDaemon(true);
            return thread;
        });
    }

    @PostConstruct
    public void start() {
        backendDispatcher.initialize();

        executor.scheduleAtFixedRate(this::sweepInactiveConnections,
                sweepIntervalSeconds, sweepIntervalSeconds, TimeUnit.SECONDS);

        if (reprobeIntervalSeconds > 0) {
            executor.scheduleWithFixedDelay(this::reprobeBackend,
                    reprobeIntervalSeconds, reprobeIntervalSeconds, TimeUnit.SECONDS);
        }
        log.info("Maintenance scheduled: sweepEvery={}s, inactiveTimeout={}m, reprobeEvery={}s",
                sweepIntervalSeconds, inactiveTimeout.toMinutes(), reprobeIntervalSeconds);
    }

    void sweepInactiveConnections() {
        try {
            List<String> removed = connectionRegistry.cleanupInactive(inactiveTimeout);
            log.debug("Inactive sweep finished: removed={}", removed);
        } catch (Exception e) {
            log.error("Error in connection cleanup task", e);
        }
    }

    void reprobeBackend() {
        try {
            backendDispatcher.reprobe();
        } catch (Exception e) {
            log.error("Error re-probing NLU backend", e);
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down MaintenanceScheduler...");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        metricsService.printSummary();
    }
}
