package com.example.sftpbroker.security;

import com.example.sftpbroker.properties.ApplicationProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Authentication Failure Tracker for brute force protection on the SFTP login endpoint
 */
@Slf4j
@Component
public class AuthenticationFailureTracker {

  private static final Duration FAILURE_WINDOW = Duration.ofMinutes(5);
  private static final int MAX_TRACKED_CLIENTS = 10_000;

  private final int maxFailures;
  private final Duration blockDuration;
  private final Cache<String, AtomicInteger> failureCounts;
  private final Cache<String, Long> blockedClients;

  public AuthenticationFailureTracker(ApplicationProperties properties) {
    this.maxFailures = properties.security().auth().maxFailures();
    this.blockDuration = properties.security().auth().blockDuration();
    this.failureCounts = Caffeine.newBuilder()
        .maximumSize(MAX_TRACKED_CLIENTS)
        .expireAfterWrite(FAILURE_WINDOW)
        .build();
    this.blockedClients = Caffeine.newBuilder()
        .maximumSize(MAX_TRACKED_CLIENTS)
        .expireAfterWrite(blockDuration)
        .build();
  }

  /**
   * Record authentication failure
   */
  public void recordFailure(String clientIp) {
    int failureCount = failureCounts.get(clientIp, ip -> new AtomicInteger()).incrementAndGet();
    log.info("Authentication failure recorded for IP: {} (count: {})", maskIpAddress(clientIp), failureCount);

    if (failureCount >= maxFailures) {
      blockedClients.put(clientIp, System.currentTimeMillis());
      failureCounts.invalidate(clientIp);
      log.warn("Blocked IP {} for {} due to repeated failures", maskIpAddress(clientIp), blockDuration);
    }
  }

  /**
   * Check if IP is blocked
   */
  public boolean isBlocked(String clientIp) {
    return blockedClients.getIfPresent(clientIp) != null;
  }

  /**
   * Clear failure history
   */
  public void clearFailures(String clientIp) {
    failureCounts.invalidate(clientIp);
    blockedClients.invalidate(clientIp);
    log.debug("Cleared failure history for IP: {}", maskIpAddress(clientIp));
  }

  private String maskIpAddress(String ip) {
    if (ip == null || !ip.contains(".")) {
      return "***";
    }
    String[] parts = ip.split("\\.");
    if (parts.length == 4) {
      return parts[0] + "." + parts[1] + ".***." + parts[3];
    }
    return "***";
  }
}
