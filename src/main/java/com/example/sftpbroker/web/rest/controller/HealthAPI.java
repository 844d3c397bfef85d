package com.example.sftpbroker.web.rest.controller;

import static com.example.sftpbroker.web.rest.ApiConstants.ApiPath.*;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@Tag(
    name = "Health",
    description = "Health check endpoints for monitoring and orchestration"
)
@RequestMapping(
    value = HEALTH_BASE,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface HealthAPI {

  @Operation(
      summary = "Basic health check",
      description = "Simple health check for load balancers"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Service is up")
  })
  @GetMapping
  ResponseEntity<Map<String, Object>> health();

  @Operation(
      summary = "Liveness probe",
      description = "Checks JVM memory pressure"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Service is live"),
      @ApiResponse(responseCode = "503", description = "Memory usage critical")
  })
  @GetMapping(LIVE)
  ResponseEntity<Map<String, Object>> liveness();

  @Operation(
      summary = "Readiness probe",
      description = "Reports session registry usage; not ready while the registry is full"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Ready to accept logins"),
      @ApiResponse(responseCode = "503", description = "Session limit reached")
  })
  @GetMapping(READY)
  ResponseEntity<Map<String, Object>> readiness();
}
