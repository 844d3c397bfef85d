package com.example.sftpbroker.util;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.web.util.WebUtils;

import java.time.Duration;
import java.util.Optional;

/**
 * Cookie Utility for the session cookie
 * Uses Spring's ResponseCookie builder for proper cookie handling
 */
@Slf4j
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class CookieUtil {

  private static final String COOKIE_PATH = "/";
  private static final String SAME_SITE_STRICT = "Strict";
  private static final String SESSION_ID_PATTERN = "^[A-Za-z0-9_-]{32,256}$";

  /**
   * Extract a non-blank cookie value by name using Spring's WebUtils
   */
  public static Optional<String> getCookieValue(HttpServletRequest request, String name) {
    if (request == null || name == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(WebUtils.getCookie(request, name))
        .map(Cookie::getValue)
        .filter(value -> !value.isBlank());
  }

  /**
   * Set the HttpOnly session cookie
   *
   * @param maxAge cookie lifetime; the server-side idle timeout still applies
   */
  public static void setSessionCookie(HttpServletResponse response, String name, String sessionId,
                                      boolean secure, Duration maxAge) {
    if (sessionId == null || sessionId.isBlank()) {
      throw new IllegalArgumentException("Session ID cannot be null or empty");
    }
    ResponseCookie cookie = ResponseCookie.from(name, sessionId)
        .httpOnly(true)
        .secure(secure)
        .path(COOKIE_PATH)
        .maxAge(maxAge)
        .sameSite(SAME_SITE_STRICT)
        .build();
    response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
    log.debug("Set session cookie: name={}, secure={}, maxAge={}", name, secure, maxAge);
  }

  /**
   * Clear the session cookie
   */
  public static void clearSessionCookie(HttpServletResponse response, String name, boolean secure) {
    ResponseCookie cookie = ResponseCookie.from(name, "")
        .httpOnly(true)
        .secure(secure)
        .path(COOKIE_PATH)
        .maxAge(0)
        .sameSite(SAME_SITE_STRICT)
        .build();
    response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
    log.debug("Cleared session cookie: name={}", name);
  }

  /**
   * Basic session id format check, done before any registry lookup
   */
  public static boolean isValidSessionId(String sessionId) {
    return sessionId != null && sessionId.matches(SESSION_ID_PATTERN);
  }
}
