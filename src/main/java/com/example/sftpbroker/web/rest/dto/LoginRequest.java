package com.example.sftpbroker.web.rest.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * SFTP login form. The password is used once to authenticate and is never stored.
 */
public record LoginRequest(
    @Schema(example = "sftp.example.com") @NotBlank(message = "Host is required") String host,
    @Schema(example = "22", defaultValue = "22")
    @Min(value = 1, message = "Port must be between 1 and 65535")
    @Max(value = 65535, message = "Port must be between 1 and 65535") Integer port,
    @NotBlank(message = "Username is required") String username,
    @NotBlank(message = "Password is required") String password
) {

  public static final int DEFAULT_SSH_PORT = 22;

  public int portOrDefault() {
    return port == null ? DEFAULT_SSH_PORT : port;
  }

  @Override
  public String toString() {
    return "LoginRequest[host=" + host + ", port=" + port + ", username=" + username + "]";
  }
}
