package com.example.sftpbroker.service;

import com.example.sftpbroker.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExpirySweeperTest {

  @Mock
  private SessionRegistry sessionRegistry;
  @Mock
  private TaskScheduler taskScheduler;
  @Mock
  private ScheduledFuture<Object> scheduledFuture;

  private ExpirySweeper sweeper;

  @BeforeEach
  void setUp() {
    sweeper = new ExpirySweeper(sessionRegistry, taskScheduler,
                                TestProperties.builder().cleanupInterval(Duration.ofMinutes(2)).build());
  }

  @Test
  void schedulesSweepAtCleanupInterval() {
    doReturn(scheduledFuture).when(taskScheduler).scheduleWithFixedDelay(any(Runnable.class), any(Duration.class));

    sweeper.afterPropertiesSet();

    ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
    verify(taskScheduler).scheduleWithFixedDelay(task.capture(), eq(Duration.ofMinutes(2)));

    when(sessionRegistry.evictExpired()).thenReturn(0);
    task.getValue().run();
    verify(sessionRegistry).evictExpired();
  }

  @Test
  void sweepReturnsEvictionCount() {
    when(sessionRegistry.evictExpired()).thenReturn(3);

    assertThat(sweeper.sweep()).isEqualTo(3);
  }

  @Test
  void failingSweepDoesNotStopLaterRuns() {
    when(sessionRegistry.evictExpired())
        .thenThrow(new IllegalStateException("boom"))
        .thenReturn(1);

    assertThat(sweeper.sweep()).isZero();
    assertThat(sweeper.sweep()).isEqualTo(1);
    verify(sessionRegistry, times(2)).evictExpired();
  }

  @Test
  void destroyCancelsScheduledSweep() {
    doReturn(scheduledFuture).when(taskScheduler).scheduleWithFixedDelay(any(Runnable.class), any(Duration.class));
    sweeper.afterPropertiesSet();

    sweeper.destroy();

    verify(scheduledFuture).cancel(false);
  }
}
