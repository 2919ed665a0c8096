package com.bikerly.config;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness endpoints. Not authenticated and not rate limited.
 */
@RestController
@Tag(name = "Health", description = "Liveness endpoints")
public class HealthController {

    static final String SERVICE_NAME = "bikerly-api";
    static final String VERSION = "1.0.0";

    @GetMapping("/")
    @Operation(summary = "Root liveness check")
    public ResponseEntity<Map<String, Object>> root() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("message", "Hello from bikerly-api!");
        response.put("status", "healthy");
        response.put("version", VERSION);
        return ResponseEntity.ok(response);
    }

    @GetMapping("/health")
    @Operation(summary = "Detailed liveness check")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "healthy");
        response.put("service", SERVICE_NAME);
        response.put("version", VERSION);
        response.put("timestamp", Instant.now().toString());
        return ResponseEntity.ok(response);
    }
}
