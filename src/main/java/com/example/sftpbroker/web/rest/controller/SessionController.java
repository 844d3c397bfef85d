package com.example.sftpbroker.web.rest.controller;

import com.example.sftpbroker.domain.entity.SftpSession;
import com.example.sftpbroker.properties.ApplicationProperties;
import com.example.sftpbroker.service.SessionRegistry;
import com.example.sftpbroker.web.rest.dto.SessionSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Session management REST controller.
 */
@RestController
@Slf4j
@RequiredArgsConstructor
public class SessionController implements SessionAPI {

  private final SessionRegistry sessionRegistry;
  private final ApplicationProperties properties;
  private final Clock clock;

  @Override
  public ResponseEntity<Map<String, Object>> getSessionInfo(SftpSession session) {
    Duration timeout = properties.session().timeout();
    return ResponseEntity.ok(Map.of(
        "session", SessionSummary.of(session, true),
        "timeoutSeconds", timeout.toSeconds(),
        "expiresAt", session.getLastAccessAt().plus(timeout),
        "timestamp", clock.millis()
                                   ));
  }

  @Override
  public ResponseEntity<List<SessionSummary>> listSessions(SftpSession session) {
    List<SessionSummary> sessions = sessionRegistry.list().stream()
        .map(other -> SessionSummary.of(other, other.getId().equals(session.getId())))
        .toList();
    log.debug("Session {} listed {} live session(s)", session.maskedId(), sessions.size());
    return ResponseEntity.ok(sessions);
  }
}
