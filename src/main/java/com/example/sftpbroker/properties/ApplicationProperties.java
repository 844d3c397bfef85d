package com.example.sftpbroker.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.boot.convert.DataSizeUnit;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.util.unit.DataSize;
import org.springframework.util.unit.DataUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Centralized configuration properties for the SFTP broker.
 * Uses records for immutability and type safety.
 */
@Validated
@ConfigurationProperties(prefix = "app")
public record ApplicationProperties(
    @NotNull @Valid SessionProperties session,
    @NotNull @Valid SftpProperties sftp,
    @NotNull @Valid TransferProperties transfer,
    @NotNull @Valid SecurityProperties security
) {

  /**
   * Session lifecycle configuration
   */
  public record SessionProperties(
      @DefaultValue("30m") @DurationUnit(ChronoUnit.MINUTES) Duration timeout,
      @DefaultValue("5m") @DurationUnit(ChronoUnit.MINUTES) Duration cleanupInterval,
      @DefaultValue("100") @Positive int maxSessions,
      @DefaultValue("SFTP_SESSION") @NotBlank String cookieName,
      @DefaultValue("false") boolean cookieSecure
  ) {}

  /**
   * SSH/SFTP transport configuration
   */
  public record SftpProperties(
      @DefaultValue("30s") @DurationUnit(ChronoUnit.SECONDS) Duration connectTimeout,
      @DefaultValue("30s") @DurationUnit(ChronoUnit.SECONDS) Duration authTimeout,
      @DefaultValue("false") boolean strictHostKeyChecking,
      String knownHostsFile
  ) {}

  /**
   * File transfer limits
   */
  public record TransferProperties(
      @DefaultValue("1MB") @DataSizeUnit(DataUnit.BYTES) DataSize maxPreviewSize,
      @DefaultValue("100MB") @DataSizeUnit(DataUnit.BYTES) DataSize maxUploadSize,
      @DefaultValue("32KB") @DataSizeUnit(DataUnit.BYTES) DataSize bufferSize,
      @DefaultValue("download.zip") @NotBlank String archiveFileName
  ) {}

  /**
   * Security configuration
   */
  public record SecurityProperties(
      @NotNull @Valid AuthSecurityProperties auth
  ) {
    public record AuthSecurityProperties(
        @DefaultValue("5") @Positive int maxFailures,
        @DefaultValue("15m") @DurationUnit(ChronoUnit.MINUTES) Duration blockDuration
    ) {}
  }
}
