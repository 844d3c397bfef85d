package com.example.sftpbroker.config;

import com.example.sftpbroker.properties.ApplicationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Threads and time source for work that runs outside the request thread.
 *
 * <p>The scheduler runs the session expiry sweep. Declaring it replaces Boot's default executor,
 * so {@code applicationTaskExecutor} is declared here too: Spring MVC streams downloads and
 * archives on it. At most one stream per session can hold a connection, so the pool is sized by
 * the session limit.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
public class SchedulingConfig {

  private static final String SCHEDULER_THREAD_PREFIX = "session-sweeper-";
  private static final String STREAM_THREAD_PREFIX = "transfer-stream-";
  private static final int STREAM_QUEUE_FACTOR = 2;

  @Bean
  public ThreadPoolTaskScheduler taskScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(1);
    scheduler.setThreadNamePrefix(SCHEDULER_THREAD_PREFIX);
    scheduler.setWaitForTasksToCompleteOnShutdown(false);
    return scheduler;
  }

  /**
   * Bounded executor for streaming response bodies and any other async MVC work.
   */
  @Bean
  public ThreadPoolTaskExecutor applicationTaskExecutor(ApplicationProperties properties) {
    int maxStreams = properties.session().maxSessions();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(maxStreams);
    executor.setMaxPoolSize(maxStreams);
    executor.setAllowCoreThreadTimeOut(true);
    executor.setQueueCapacity(maxStreams * STREAM_QUEUE_FACTOR);
    executor.setThreadNamePrefix(STREAM_THREAD_PREFIX);
    log.info("Transfer stream executor: {} thread(s), queue {}", maxStreams, maxStreams * STREAM_QUEUE_FACTOR);
    return executor;
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
