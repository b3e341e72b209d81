package com.studyapp.api.controller;

import com.studyapp.core.service.QuestionCorpusService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Health endpoints for load balancers and monitoring.
 *
 * The detailed variant also reports how many corpus slices are currently cached.
 */
@RestController
@RequestMapping("/api/v1/health")
@RequiredArgsConstructor
public class HealthController {

    private static final String SERVICE_NAME = "studyapp-search";

    private final QuestionCorpusService questionCorpusService;

    private final AtomicLong requestCount = new AtomicLong();
    private final Instant startTime = Instant.now();

    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        requestCount.incrementAndGet();

        Map<String, Object> response = new HashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());
        response.put("service", SERVICE_NAME);

        return ResponseEntity.ok(response);
    }

    @GetMapping("/detailed")
    public ResponseEntity<Map<String, Object>> detailedHealth() {
        long count = requestCount.incrementAndGet();

        Map<String, Object> response = new HashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());
        response.put("service", SERVICE_NAME);
        response.put("uptime", getUptime());
        response.put("requestCount", count);

        // In-process map, its size is the whole check
        Map<String, Object> cacheHealth = new HashMap<>();
        cacheHealth.put("status", "UP");
        cacheHealth.put("entries", questionCorpusService.cachedEntries());
        response.put("cache", cacheHealth);

        return ResponseEntity.ok(response);
    }

    @GetMapping("/ping")
    public ResponseEntity<String> ping() {
        requestCount.incrementAndGet();
        return ResponseEntity.ok("pong");
    }

    private String getUptime() {
        long seconds = Instant.now().getEpochSecond() - startTime.getEpochSecond();
        long days = seconds / 86400;
        long hours = (seconds % 86400) / 3600;
        long minutes = (seconds % 3600) / 60;
        long secs = seconds % 60;

        if (days > 0) {
            return String.format("%dd %dh %dm %ds", days, hours, minutes, secs);
        } else if (hours > 0) {
            return String.format("%dh %dm %ds", hours, minutes, secs);
        } else if (minutes > 0) {
            return String.format("%dm %ds", minutes, secs);
        }
        return String.format("%ds", secs);
    }
}
