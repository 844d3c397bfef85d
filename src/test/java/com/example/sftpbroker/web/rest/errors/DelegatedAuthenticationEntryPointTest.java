package com.example.sftpbroker.web.rest.errors;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.authentication.InsufficientAuthenticationException;

import static org.assertj.core.api.Assertions.assertThat;

class DelegatedAuthenticationEntryPointTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final DelegatedAuthenticationEntryPoint entryPoint = new DelegatedAuthenticationEntryPoint(objectMapper);

  @Test
  void writesJsonUnauthorized() throws Exception {
    MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/files");
    MockHttpServletResponse response = new MockHttpServletResponse();

    entryPoint.commence(request, response, new InsufficientAuthenticationException("no session"));

    assertThat(response.getStatus()).isEqualTo(401);
    assertThat(response.getContentType()).startsWith("application/json");
    JsonNode body = objectMapper.readTree(response.getContentAsByteArray());
    assertThat(body.get("error").asText()).isEqualTo("invalid_session");
    assertThat(body.get("status").asInt()).isEqualTo(401);
    assertThat(body.get("path").asText()).isEqualTo("/api/files");
    assertThat(body.has("timestamp")).isTrue();
  }
}
