package com.example.sftpbroker.config;

import com.example.sftpbroker.security.filter.SessionAuthenticationFilter;
import com.example.sftpbroker.web.rest.errors.DelegatedAuthenticationEntryPoint;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.annotation.web.configurers.HeadersConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.security.web.header.writers.ReferrerPolicyHeaderWriter.ReferrerPolicy;

import static com.example.sftpbroker.web.rest.ApiConstants.ApiPath.API_BASE;
import static com.example.sftpbroker.web.rest.ApiConstants.ApiPath.AUTH_BASE;
import static com.example.sftpbroker.web.rest.ApiConstants.ApiPath.HEALTH_BASE;

/**
 * HTTP security for the broker.
 *
 * <p>Login, logout, health probes and API docs are open. Everything under {@code /api} needs a
 * session cookie that {@link SessionAuthenticationFilter} resolves against the session registry.
 * Any other path is denied.
 */
@Configuration(proxyBeanMethods = false)
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

  private static final String ALL = "/**";
  private static final String[] OPEN_PATHS = {
      AUTH_BASE + ALL,
      HEALTH_BASE + ALL,
      "/v3/api-docs/**",
      "/swagger-ui/**",
      "/swagger-ui.html"
  };
  private static final String PERMISSIONS_POLICY = "camera=(), microphone=(), geolocation=(), payment=()";

  private final SessionAuthenticationFilter sessionAuthenticationFilter;
  private final DelegatedAuthenticationEntryPoint delegatedAuthenticationEntryPoint;

  @Bean
  @Order(1)
  public SecurityFilterChain openEndpointsFilterChain(HttpSecurity http) throws Exception {
    return statelessDefaults(http)
        .securityMatcher(OPEN_PATHS)
        .authorizeHttpRequests(authorize -> authorize.anyRequest().permitAll())
        .build();
  }

  @Bean
  @Order(2)
  public SecurityFilterChain sessionEndpointsFilterChain(HttpSecurity http) throws Exception {
    return statelessDefaults(http)
        .securityMatcher(API_BASE + ALL)
        .addFilterBefore(sessionAuthenticationFilter, UsernamePasswordAuthenticationFilter.class)
        .authorizeHttpRequests(authorize -> authorize.anyRequest().authenticated())
        .exceptionHandling(exceptions -> exceptions.authenticationEntryPoint(delegatedAuthenticationEntryPoint))
        .build();
  }

  @Bean
  @Order(3)
  public SecurityFilterChain denyEverythingElseFilterChain(HttpSecurity http) throws Exception {
    return statelessDefaults(http)
        .authorizeHttpRequests(authorize -> authorize.anyRequest().denyAll())
        .build();
  }

  /**
   * The filter is a bean; only the security chain may run it.
   */
  @Bean
  public FilterRegistrationBean<SessionAuthenticationFilter> sessionAuthenticationFilterRegistration() {
    FilterRegistrationBean<SessionAuthenticationFilter> registration =
        new FilterRegistrationBean<>(sessionAuthenticationFilter);
    registration.setEnabled(false);
    return registration;
  }

  private static HttpSecurity statelessDefaults(HttpSecurity http) throws Exception {
    return http
        // cookie is HttpOnly and SameSite=Strict
        .csrf(AbstractHttpConfigurer::disable)
        .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .headers(SecurityConfig::hardenedHeaders);
  }

  private static void hardenedHeaders(HeadersConfigurer<HttpSecurity> headers) {
    headers
        .frameOptions(HeadersConfigurer.FrameOptionsConfig::deny)
        .contentTypeOptions(Customizer.withDefaults())
        // listings and previews must never be cached
        .cacheControl(Customizer.withDefaults())
        .referrerPolicy(referrer -> referrer.policy(ReferrerPolicy.STRICT_ORIGIN_WHEN_CROSS_ORIGIN))
        .permissionsPolicy(permissions -> permissions.policy(PERMISSIONS_POLICY));
  }
}
