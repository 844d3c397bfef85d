package com.example.sftpbroker.web.rest.controller;

import com.example.sftpbroker.domain.entity.ConnectionTarget;
import com.example.sftpbroker.domain.entity.SftpSession;
import com.example.sftpbroker.exception.ConnectionException;
import com.example.sftpbroker.exception.LoginBlockedException;
import com.example.sftpbroker.exception.SessionNotFoundException;
import com.example.sftpbroker.properties.ApplicationProperties;
import com.example.sftpbroker.security.AuthenticationFailureTracker;
import com.example.sftpbroker.service.SessionRegistry;
import com.example.sftpbroker.util.CookieUtil;
import com.example.sftpbroker.web.rest.dto.LoginRequest;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Optional;

/**
 * REST controller for SFTP login and logout.
 * A successful login opens the remote connection and binds it to a new session cookie.
 */
@RestController
@Slf4j
@RequiredArgsConstructor
public class AuthController implements AuthAPI {

  private final SessionRegistry sessionRegistry;
  private final AuthenticationFailureTracker failureTracker;
  private final ApplicationProperties properties;

  @Override
  public ResponseEntity<Map<String, Object>> login(LoginRequest loginRequest,
                                                   HttpServletRequest request,
                                                   HttpServletResponse response) {
    String clientIp = extractClientIp(request);
    if (failureTracker.isBlocked(clientIp)) {
      throw new LoginBlockedException("Too many failed login attempts. Try again later.");
    }

    ConnectionTarget target = new ConnectionTarget(
        loginRequest.host().trim(), loginRequest.portOrDefault(), loginRequest.username().trim());
    log.debug("Login request for {}", target);

    // replacing a still-open session from the same browser
    extractSessionId(request).ifPresent(this::closePreviousSession);

    SftpSession session;
    try {
      session = sessionRegistry.create(target, loginRequest.password());
    } catch (ConnectionException e) {
      failureTracker.recordFailure(clientIp);
      throw e;
    }
    failureTracker.clearFailures(clientIp);

    CookieUtil.setSessionCookie(response, properties.session().cookieName(), session.getId(),
                                properties.session().cookieSecure(), properties.session().timeout());
    log.info("Login succeeded for {}, session {}", target, session.maskedId());

    return ResponseEntity.ok(Map.of(
        "username", session.getUsername(),
        "host", session.getHost(),
        "port", session.getPort(),
        "homeDirectory", session.getHomeDirectory()
                                   ));
  }

  @Override
  public ResponseEntity<Map<String, Object>> logout(HttpServletRequest request, HttpServletResponse response) {
    extractSessionId(request).ifPresent(sessionId -> {
      try {
        sessionRegistry.delete(sessionId);
      } catch (SessionNotFoundException e) {
        log.debug("Logout for unknown session {}", SftpSession.mask(sessionId));
      }
    });
    CookieUtil.clearSessionCookie(response, properties.session().cookieName(), properties.session().cookieSecure());

    return ResponseEntity.ok(Map.of(
        "message", "Logged out",
        "timestamp", System.currentTimeMillis()
                                   ));
  }

  private void closePreviousSession(String sessionId) {
    try {
      sessionRegistry.delete(sessionId);
      log.debug("Closed previous session {} before login", SftpSession.mask(sessionId));
    } catch (SessionNotFoundException e) {
      log.trace("No previous session to close");
    }
  }

  private Optional<String> extractSessionId(HttpServletRequest request) {
    return CookieUtil.getCookieValue(request, properties.session().cookieName());
  }

  private String extractClientIp(HttpServletRequest request) {
    // Check forwarded headers first (for proxies/load balancers)
    String xForwardedFor = request.getHeader("X-Forwarded-For");
    if (xForwardedFor != null && !xForwardedFor.isEmpty()) {
      return xForwardedFor.split(",")[0].trim();
    }

    String xRealIp = request.getHeader("X-Real-IP");
    if (xRealIp != null && !xRealIp.isEmpty()) {
      return xRealIp;
    }

    return request.getRemoteAddr();
  }
}
