package com.example.sftpbroker.web.rest.dto;

import com.example.sftpbroker.domain.entity.SftpSession;

import java.time.Instant;

/**
 * Client-facing view of a session. The id is always masked.
 */
public record SessionSummary(
    String id,
    String username,
    String host,
    int port,
    String homeDirectory,
    Instant createdAt,
    Instant lastAccessAt,
    boolean current
) {

  public static SessionSummary of(SftpSession session, boolean current) {
    return new SessionSummary(
        session.maskedId(),
        session.getUsername(),
        session.getHost(),
        session.getPort(),
        session.getHomeDirectory(),
        session.getCreatedAt(),
        session.getLastAccessAt(),
        current);
  }
}
