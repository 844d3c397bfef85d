package com.example.sftpbroker.domain.entity;

/**
 * Where and as whom to connect. The credential never leaves the login request.
 */
public record ConnectionTarget(
    String host,
    int port,
    String username
) {
  @Override
  public String toString() {
    return username + "@" + host + ":" + port;
  }
}
