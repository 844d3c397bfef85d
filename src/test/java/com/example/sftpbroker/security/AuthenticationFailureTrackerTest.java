package com.example.sftpbroker.security;

import com.example.sftpbroker.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class AuthenticationFailureTrackerTest {

  private AuthenticationFailureTracker tracker;

  @BeforeEach
  void setUp() {
    tracker = new AuthenticationFailureTracker(
        TestProperties.builder().loginBlocking(3, Duration.ofMinutes(15)).build());
  }

  @Test
  void blocksAfterMaxFailures() {
    tracker.recordFailure("10.0.0.1");
    tracker.recordFailure("10.0.0.1");
    assertThat(tracker.isBlocked("10.0.0.1")).isFalse();

    tracker.recordFailure("10.0.0.1");

    assertThat(tracker.isBlocked("10.0.0.1")).isTrue();
    assertThat(tracker.isBlocked("10.0.0.2")).isFalse();
  }

  @Test
  void clearingResetsCountAndBlock() {
    for (int i = 0; i < 3; i++) {
      tracker.recordFailure("10.0.0.1");
    }

    tracker.clearFailures("10.0.0.1");

    assertThat(tracker.isBlocked("10.0.0.1")).isFalse();
    tracker.recordFailure("10.0.0.1");
    assertThat(tracker.isBlocked("10.0.0.1")).isFalse();
  }
}
