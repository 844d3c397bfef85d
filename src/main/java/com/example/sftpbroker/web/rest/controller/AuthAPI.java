package com.example.sftpbroker.web.rest.controller;

import static com.example.sftpbroker.web.rest.ApiConstants.ApiPath.*;

import com.example.sftpbroker.web.rest.dto.LoginRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@Tag(
    name = "Authentication",
    description = "Open and close SFTP sessions"
)
@RequestMapping(
    value = AUTH_BASE,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface AuthAPI {

  @Operation(
      summary = "Log in to an SFTP server",
      description = "Connects and authenticates to the server, registers a session and sets the session cookie"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Session created, cookie set"),
      @ApiResponse(responseCode = "400", description = "Invalid login form"),
      @ApiResponse(responseCode = "429", description = "Too many failed attempts"),
      @ApiResponse(responseCode = "502", description = "SFTP server unreachable or credentials rejected"),
      @ApiResponse(responseCode = "503", description = "Session limit reached")
  })
  @PostMapping(value = LOGIN, consumes = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<Map<String, Object>> login(
      @Valid @RequestBody LoginRequest loginRequest,
      HttpServletRequest request,
      HttpServletResponse response
                                           );

  @Operation(
      summary = "Log out",
      description = "Closes the SFTP session and clears the session cookie"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Successfully logged out")
  })
  @PostMapping(value = LOGOUT)
  ResponseEntity<Map<String, Object>> logout(
      HttpServletRequest request,
      HttpServletResponse response
                                            );
}
