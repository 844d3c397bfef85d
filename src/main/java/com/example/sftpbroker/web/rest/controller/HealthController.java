package com.example.sftpbroker.web.rest.controller;

import com.example.sftpbroker.domain.entity.SessionStats;
import com.example.sftpbroker.service.SessionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * Health Check Controller
 *
 * Note: Health endpoints don't throw exceptions to GlobalErrorHandler
 * as they need to return specific status codes for monitoring tools.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class HealthController implements HealthAPI {

  private static final double MEMORY_USAGE_CRITICAL_PERCENT = 90.0;
  private static final String STATUS_UP = "UP";
  private static final String STATUS_LIVE = "LIVE";
  private static final String STATUS_DEAD = "DEAD";

  private final SessionRegistry sessionRegistry;

  @Override
  public ResponseEntity<Map<String, Object>> health() {
    return ResponseEntity.ok(Map.of(
        "status", STATUS_UP,
        "timestamp", System.currentTimeMillis()
                                   ));
  }

  @Override
  public ResponseEntity<Map<String, Object>> liveness() {
    Runtime runtime = Runtime.getRuntime();
    long usedMemory = runtime.totalMemory() - runtime.freeMemory();
    double memoryUsagePercent = (double) usedMemory / runtime.maxMemory() * 100;

    Map<String, Object> response = new HashMap<>();
    response.put("memoryUsagePercent", String.format("%.2f", memoryUsagePercent));

    if (memoryUsagePercent < MEMORY_USAGE_CRITICAL_PERCENT) {
      response.put("status", STATUS_LIVE);
      return ResponseEntity.ok(response);
    }

    log.warn("Liveness check failed: memory usage {}%", memoryUsagePercent);
    response.put("status", STATUS_DEAD);
    return ResponseEntity.status(503).body(response);
  }

  @Override
  public ResponseEntity<Map<String, Object>> readiness() {
    Map<String, Object> status = new HashMap<>();
    SessionStats stats;
    try {
      stats = sessionRegistry.stats();
    } catch (RuntimeException e) {
      log.error("Session registry health check failed", e);
      status.put("ready", false);
      status.put("error", e.getMessage());
      status.put("timestamp", System.currentTimeMillis());
      return ResponseEntity.status(503).body(status);
    }

    boolean isReady = stats.activeSessions() < stats.maxSessions();
    if (!isReady) {
      log.warn("Readiness check failed: session registry full ({}/{})",
               stats.activeSessions(), stats.maxSessions());
    }

    status.put("sessions", Map.of(
        "active", stats.activeSessions(),
        "total", stats.totalSessions(),
        "max", stats.maxSessions()
                                 ));
    status.put("ready", isReady);
    status.put("timestamp", System.currentTimeMillis());

    return ResponseEntity.status(isReady ? 200 : 503).body(status);
  }
}
