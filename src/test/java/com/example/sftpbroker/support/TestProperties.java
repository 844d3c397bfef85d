package com.example.sftpbroker.support;

import com.example.sftpbroker.properties.ApplicationProperties;
import com.example.sftpbroker.properties.ApplicationProperties.SecurityProperties;
import com.example.sftpbroker.properties.ApplicationProperties.SecurityProperties.AuthSecurityProperties;
import com.example.sftpbroker.properties.ApplicationProperties.SessionProperties;
import com.example.sftpbroker.properties.ApplicationProperties.SftpProperties;
import com.example.sftpbroker.properties.ApplicationProperties.TransferProperties;
import org.springframework.util.unit.DataSize;

import java.time.Duration;

/**
 * Builds {@link ApplicationProperties} with the same defaults as application.yml.
 */
public final class TestProperties {

  private Duration timeout = Duration.ofMinutes(30);
  private Duration cleanupInterval = Duration.ofMinutes(5);
  private int maxSessions = 100;
  private boolean strictHostKeyChecking = false;
  private String knownHostsFile;
  private DataSize maxPreviewSize = DataSize.ofMegabytes(1);
  private DataSize maxUploadSize = DataSize.ofMegabytes(100);
  private DataSize bufferSize = DataSize.ofKilobytes(32);
  private int maxFailures = 5;
  private Duration blockDuration = Duration.ofMinutes(15);

  private TestProperties() {}

  public static TestProperties builder() {
    return new TestProperties();
  }

  public static ApplicationProperties defaults() {
    return builder().build();
  }

  public TestProperties timeout(Duration timeout) {
    this.timeout = timeout;
    return this;
  }

  public TestProperties cleanupInterval(Duration cleanupInterval) {
    this.cleanupInterval = cleanupInterval;
    return this;
  }

  public TestProperties maxSessions(int maxSessions) {
    this.maxSessions = maxSessions;
    return this;
  }

  public TestProperties strictHostKeyChecking(boolean strict, String knownHostsFile) {
    this.strictHostKeyChecking = strict;
    this.knownHostsFile = knownHostsFile;
    return this;
  }

  public TestProperties maxPreviewSize(DataSize maxPreviewSize) {
    this.maxPreviewSize = maxPreviewSize;
    return this;
  }

  public TestProperties maxUploadSize(DataSize maxUploadSize) {
    this.maxUploadSize = maxUploadSize;
    return this;
  }

  public TestProperties bufferSize(DataSize bufferSize) {
    this.bufferSize = bufferSize;
    return this;
  }

  public TestProperties loginBlocking(int maxFailures, Duration blockDuration) {
    this.maxFailures = maxFailures;
    this.blockDuration = blockDuration;
    return this;
  }

  public ApplicationProperties build() {
    return new ApplicationProperties(
        new SessionProperties(timeout, cleanupInterval, maxSessions, "SFTP_SESSION", false),
        new SftpProperties(Duration.ofSeconds(30), Duration.ofSeconds(30), strictHostKeyChecking, knownHostsFile),
        new TransferProperties(maxPreviewSize, maxUploadSize, bufferSize, "download.zip"),
        new SecurityProperties(new AuthSecurityProperties(maxFailures, blockDuration)));
  }
}
