package com.demo.chatbot.controller;

import com.demo.chatbot.infrastructure.ContextCache;
import com.demo.chatbot.repository.CourseRepository;
import com.demo.chatbot.service.BackendDispatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
public class HealthController {

    private final BackendDispatcher backendDispatcher;
    private final CourseRepository courseRepository;
    private final ContextCache contextCache;
    private final String version;

    public HealthController(BackendDispatcher backendDispatcher,
                            CourseRepository courseRepository,
                            ContextCache contextCache,
                            @Value("${app.version:1.0.0}") String version) {
        this.backendDispatcher = backendDispatcher;
        this.courseRepository = courseRepository;
        this.contextCache = contextCache;
        this.version = version;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> services = new LinkedHashMap<>();
        services.put("rasa", backendDispatcher.isReady());
        services.put("database", databaseReachable());
        services.put("redis", contextCache.isAvailable());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "healthy");
        response.put("timestamp", Instant.now());
        response.put("version", version);
        response.put("services", services);
        return response;
    }

    private boolean databaseReachable() {
        try {
            courseRepository.count();
            return true;
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }
}
