package com.example.sftpbroker.util;

import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CookieUtilTest {

  @Test
  void setsHttpOnlyStrictCookie() {
    MockHttpServletResponse response = new MockHttpServletResponse();

    CookieUtil.setSessionCookie(response, "SFTP_SESSION", "abc123", true, Duration.ofMinutes(30));

    String header = response.getHeader(HttpHeaders.SET_COOKIE);
    assertThat(header)
        .startsWith("SFTP_SESSION=abc123")
        .contains("Max-Age=1800", "HttpOnly", "Secure", "SameSite=Strict", "Path=/");
  }

  @Test
  void clearingExpiresCookie() {
    MockHttpServletResponse response = new MockHttpServletResponse();

    CookieUtil.clearSessionCookie(response, "SFTP_SESSION", false);

    assertThat(response.getHeader(HttpHeaders.SET_COOKIE))
        .startsWith("SFTP_SESSION=")
        .contains("Max-Age=0")
        .doesNotContain("Secure");
  }

  @Test
  void readsNonBlankCookieValue() {
    MockHttpServletRequest request = new MockHttpServletRequest();
    request.setCookies(new Cookie("SFTP_SESSION", "value"), new Cookie("OTHER", ""));

    assertThat(CookieUtil.getCookieValue(request, "SFTP_SESSION")).contains("value");
    assertThat(CookieUtil.getCookieValue(request, "OTHER")).isEmpty();
    assertThat(CookieUtil.getCookieValue(request, "MISSING")).isEmpty();
  }

  @Test
  void rejectsBlankSessionId() {
    assertThatThrownBy(() -> CookieUtil.setSessionCookie(
        new MockHttpServletResponse(), "SFTP_SESSION", " ", false, Duration.ofMinutes(1)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void sessionIdFormat() {
    assertThat(CookieUtil.isValidSessionId("0123456789abcdef0123456789abcdef")).isTrue();
    assertThat(CookieUtil.isValidSessionId("short")).isFalse();
    assertThat(CookieUtil.isValidSessionId("0123456789abcdef0123456789abcde;")).isFalse();
  }
}
