package com.example.sftpbroker.security.filter;

import com.example.sftpbroker.domain.entity.SftpSession;
import com.example.sftpbroker.exception.SessionException;
import com.example.sftpbroker.properties.ApplicationProperties;
import com.example.sftpbroker.service.SessionRegistry;
import com.example.sftpbroker.util.CookieUtil;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Collections;
import java.util.Optional;

/**
 * Authenticates requests by the session cookie. A valid cookie resolves to a live
 * {@link SftpSession} (refreshing its last access), which becomes the authentication principal.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionAuthenticationFilter extends OncePerRequestFilter {

  private final SessionRegistry sessionRegistry;
  private final ApplicationProperties properties;

  @Override
  protected void doFilterInternal(
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain
                                 ) throws ServletException, IOException {

    String cookieName = properties.session().cookieName();
    Optional<String> sessionId = CookieUtil.getCookieValue(request, cookieName);

    if (sessionId.isPresent()) {
      try {
        if (!CookieUtil.isValidSessionId(sessionId.get())) {
          throw new SessionException("Malformed session id");
        }
        SftpSession session = sessionRegistry.get(sessionId.get());
        UsernamePasswordAuthenticationToken authentication =
            new UsernamePasswordAuthenticationToken(session, null, Collections.emptyList());
        SecurityContextHolder.getContext().setAuthentication(authentication);
        log.trace("SessionAuthenticationFilter: Successfully authenticated session {}", session.maskedId());
      } catch (SessionException e) {
        log.debug("SessionAuthenticationFilter: {} for {}. Clearing cookie.",
                  e.getMessage(), SftpSession.mask(sessionId.get()));
        CookieUtil.clearSessionCookie(response, cookieName, properties.session().cookieSecure());
      } catch (Exception e) {
        log.error("An unexpected error occurred during session authentication.", e);
        CookieUtil.clearSessionCookie(response, cookieName, properties.session().cookieSecure());
      }
    }

    filterChain.doFilter(request, response);
  }
}
