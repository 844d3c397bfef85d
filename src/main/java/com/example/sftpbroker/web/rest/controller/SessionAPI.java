package com.example.sftpbroker.web.rest.controller;

import static com.example.sftpbroker.web.rest.ApiConstants.ApiPath.*;

import com.example.sftpbroker.domain.entity.SftpSession;
import com.example.sftpbroker.web.rest.dto.SessionSummary;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Session information for the browser UI.
 */
@Tag(
    name = "Session Management",
    description = "Information about the current and other live SFTP sessions"
)
@RequestMapping(
    value = API_BASE + SESSION,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface SessionAPI {

  @Operation(
      summary = "Current session",
      description = "Connection details and timing of the session bound to the cookie"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Session info returned"),
      @ApiResponse(responseCode = "401", description = "Session invalid or expired")
  })
  @GetMapping(value = INFO)
  ResponseEntity<Map<String, Object>> getSessionInfo(
      @Parameter(hidden = true) @AuthenticationPrincipal SftpSession session
                                                    );

  @Operation(
      summary = "Live sessions",
      description = "Every session that is not idle past the timeout, with masked ids"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Sessions returned"),
      @ApiResponse(responseCode = "401", description = "Session invalid or expired")
  })
  @GetMapping(value = LIST)
  ResponseEntity<List<SessionSummary>> listSessions(
      @Parameter(hidden = true) @AuthenticationPrincipal SftpSession session
                                                   );
}
