package com.example.sftpbroker.service;

import com.example.sftpbroker.properties.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * Periodically evicts idle sessions from the {@link SessionRegistry}.
 * Runs on its own fixed delay, independent of the session timeout, and is cancelled on shutdown.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExpirySweeper implements InitializingBean, DisposableBean {

  private final SessionRegistry sessionRegistry;
  private final TaskScheduler taskScheduler;
  private final ApplicationProperties properties;

  private ScheduledFuture<?> scheduledSweep;

  @Override
  public void afterPropertiesSet() {
    Duration interval = properties.session().cleanupInterval();
    log.info("Scheduling session expiry sweep every {} (timeout {})", interval, properties.session().timeout());
    scheduledSweep = taskScheduler.scheduleWithFixedDelay(this::sweep, interval);
  }

  /**
   * One sweep run. Never throws; a failing run is logged and the next run proceeds.
   *
   * @return number of sessions evicted
   */
  public int sweep() {
    try {
      int evicted = sessionRegistry.evictExpired();
      if (evicted > 0) {
        log.info("Cleaned up {} expired session(s)", evicted);
      } else {
        log.debug("Session sweep found no expired sessions");
      }
      return evicted;
    } catch (RuntimeException e) {
      log.error("Session expiry sweep failed", e);
      return 0;
    }
  }

  @Override
  public void destroy() {
    if (scheduledSweep != null) {
      scheduledSweep.cancel(false);
      log.info("Session expiry sweep stopped");
    }
  }
}
