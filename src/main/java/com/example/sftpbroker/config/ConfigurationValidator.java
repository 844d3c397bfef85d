package com.example.sftpbroker.config;

import com.example.sftpbroker.properties.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration validator that enforces cross-field rules beyond basic JSR-303 validation.
 * Fails startup with every violation listed at once.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfigurationValidator implements InitializingBean {

  private static final String ERROR_MIN_DURATION = "%s must be at least %s.";
  private static final Duration MIN_SESSION_TIMEOUT = Duration.ofMinutes(1);
  private static final Duration MIN_CLEANUP_INTERVAL = Duration.ofSeconds(1);

  private final ApplicationProperties properties;

  @Override
  public void afterPropertiesSet() {
    log.info("Validating application configuration business rules...");
    List<String> errors = new ArrayList<>();

    validateSessionConfig(errors);
    validateSftpConfig(errors);
    validateTransferConfig(errors);
    validateSecurityConfig(errors);

    if (!errors.isEmpty()) {
      String errorMessage = String.format("Configuration validation failed with %d error(s):\n- %s",
                                          errors.size(), String.join("\n- ", errors));
      log.error(errorMessage);
      throw new IllegalStateException(errorMessage);
    }
    log.info("Configuration validated successfully.");
  }

  private void validateSessionConfig(List<String> errors) {
    ApplicationProperties.SessionProperties session = properties.session();
    if (session.timeout().compareTo(MIN_SESSION_TIMEOUT) < 0) {
      errors.add(ERROR_MIN_DURATION.formatted("Session timeout", "1 minute"));
    }
    if (session.cleanupInterval().compareTo(MIN_CLEANUP_INTERVAL) < 0) {
      errors.add(ERROR_MIN_DURATION.formatted("Session cleanup interval", "1 second"));
    }
    if (session.cleanupInterval().compareTo(session.timeout()) > 0) {
      errors.add("Cleanup interval (%s) must not exceed the session timeout (%s)"
                     .formatted(session.cleanupInterval(), session.timeout()));
    }
  }

  private void validateSftpConfig(List<String> errors) {
    ApplicationProperties.SftpProperties sftp = properties.sftp();
    if (sftp.connectTimeout().isZero() || sftp.connectTimeout().isNegative()) {
      errors.add("SFTP connect timeout must be positive.");
    }
    if (sftp.authTimeout().isZero() || sftp.authTimeout().isNegative()) {
      errors.add("SFTP auth timeout must be positive.");
    }
    if (sftp.strictHostKeyChecking()) {
      if (!StringUtils.hasText(sftp.knownHostsFile())) {
        errors.add("'app.sftp.known-hosts-file' is required when strict host key checking is enabled.");
      } else if (!isReadableFile(sftp.knownHostsFile())) {
        errors.add("Known hosts file is not readable: " + sftp.knownHostsFile());
      }
    }
  }

  private void validateTransferConfig(List<String> errors) {
    ApplicationProperties.TransferProperties transfer = properties.transfer();
    if (transfer.bufferSize().toBytes() < 1024) {
      errors.add("Transfer buffer size must be at least 1KB.");
    }
    if (transfer.bufferSize().toBytes() > Integer.MAX_VALUE) {
      errors.add("Transfer buffer size is too large: " + transfer.bufferSize());
    }
    if (transfer.maxPreviewSize().compareTo(transfer.maxUploadSize()) > 0) {
      errors.add("Max preview size (%s) must not exceed max upload size (%s)"
                     .formatted(transfer.maxPreviewSize(), transfer.maxUploadSize()));
    }
    if (transfer.archiveFileName().contains("/") || transfer.archiveFileName().contains("\\")) {
      errors.add("Archive file name must not contain path separators: " + transfer.archiveFileName());
    }
  }

  private void validateSecurityConfig(List<String> errors) {
    if (properties.security().auth().blockDuration().compareTo(Duration.ofSeconds(1)) < 0) {
      errors.add(ERROR_MIN_DURATION.formatted("Login block duration", "1 second"));
    }
  }

  private boolean isReadableFile(String file) {
    try {
      Path path = Path.of(file);
      return Files.isRegularFile(path) && Files.isReadable(path);
    } catch (InvalidPathException e) {
      return false;
    }
  }
}
