package com.example.sftpbroker.web.rest.errors;

import com.example.sftpbroker.exception.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.nio.file.NoSuchFileException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global Error Handler
 *
 * Provides consistent error responses without exposing sensitive information
 */
@Slf4j
@RestControllerAdvice
@RequestMapping(produces = MediaType.APPLICATION_JSON_VALUE)
public class GlobalErrorHandler {

  // Session and connection exceptions
  @ExceptionHandler(SessionException.class)
  public ResponseEntity<Map<String, Object>> handleSessionException(
      SessionException ex, WebRequest request) {
    log.debug("Session error: {}", ex.getMessage());

    Map<String, Object> body = createErrorBody(
        HttpStatus.UNAUTHORIZED,
        "invalid_session",
        "Session is invalid or expired",
        request
                                              );

    return new ResponseEntity<>(body, HttpStatus.UNAUTHORIZED);
  }

  @ExceptionHandler(ConnectionException.class)
  public ResponseEntity<Map<String, Object>> handleConnectionException(
      ConnectionException ex, WebRequest request) {
    log.warn("SFTP connection failed: {}", ex.getMessage());

    Map<String, Object> body = createErrorBody(
        HttpStatus.BAD_GATEWAY,
        "connection_failed",
        ex.getMessage(),
        request
                                              );

    return new ResponseEntity<>(body, HttpStatus.BAD_GATEWAY);
  }

  @ExceptionHandler(CapacityExceededException.class)
  public ResponseEntity<Map<String, Object>> handleCapacityExceeded(
      CapacityExceededException ex, WebRequest request) {

    Map<String, Object> body = createErrorBody(
        HttpStatus.SERVICE_UNAVAILABLE,
        "capacity_exceeded",
        ex.getMessage(),
        request
                                              );

    return new ResponseEntity<>(body, HttpStatus.SERVICE_UNAVAILABLE);
  }

  @ExceptionHandler(LoginBlockedException.class)
  public ResponseEntity<Map<String, Object>> handleLoginBlocked(
      LoginBlockedException ex, WebRequest request) {

    Map<String, Object> body = createErrorBody(
        HttpStatus.TOO_MANY_REQUESTS,
        "too_many_attempts",
        ex.getMessage(),
        request
                                              );

    return new ResponseEntity<>(body, HttpStatus.TOO_MANY_REQUESTS);
  }

  // Remote file exceptions
  @ExceptionHandler(RemoteIOException.class)
  public ResponseEntity<Map<String, Object>> handleRemoteIOException(
      RemoteIOException ex, WebRequest request) {
    if (ex.getCause() instanceof NoSuchFileException) {
      log.debug("Remote path not found: {}", ex.getPath());

      Map<String, Object> body = createErrorBody(
          HttpStatus.NOT_FOUND,
          "not_found",
          "No such file or directory: " + ex.getPath(),
          request
                                                );

      return new ResponseEntity<>(body, HttpStatus.NOT_FOUND);
    }
    log.error("Remote I/O error on {}", ex.getPath(), ex);

    Map<String, Object> body = createErrorBody(
        HttpStatus.INTERNAL_SERVER_ERROR,
        "remote_io_error",
        ex.getMessage(),
        request
                                              );

    return new ResponseEntity<>(body, HttpStatus.INTERNAL_SERVER_ERROR);
  }

  @ExceptionHandler(NotAFileException.class)
  public ResponseEntity<Map<String, Object>> handleNotAFile(
      NotAFileException ex, WebRequest request) {

    Map<String, Object> body = createErrorBody(
        HttpStatus.BAD_REQUEST,
        "not_a_file",
        ex.getMessage(),
        request
                                              );

    return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
  }

  @ExceptionHandler(FileTooLargeException.class)
  public ResponseEntity<Map<String, Object>> handleFileTooLarge(
      FileTooLargeException ex, WebRequest request) {

    Map<String, Object> body = createErrorBody(
        HttpStatus.PAYLOAD_TOO_LARGE,
        "file_too_large",
        ex.getMessage(),
        request
                                              );

    return new ResponseEntity<>(body, HttpStatus.PAYLOAD_TOO_LARGE);
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<Map<String, Object>> handleMaxUploadSize(
      MaxUploadSizeExceededException ex, WebRequest request) {

    Map<String, Object> body = createErrorBody(
        HttpStatus.PAYLOAD_TOO_LARGE,
        "file_too_large",
        "Upload exceeds the maximum allowed size",
        request
                                              );

    return new ResponseEntity<>(body, HttpStatus.PAYLOAD_TOO_LARGE);
  }

  @ExceptionHandler(AlreadyExistsException.class)
  public ResponseEntity<Map<String, Object>> handleAlreadyExists(
      AlreadyExistsException ex, WebRequest request) {

    Map<String, Object> body = createErrorBody(
        HttpStatus.CONFLICT,
        "already_exists",
        "File already exists: " + ex.getPath(),
        request
                                              );

    return new ResponseEntity<>(body, HttpStatus.CONFLICT);
  }

  // Request validation
  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<Map<String, Object>> handleValidationException(
      MethodArgumentNotValidException ex, WebRequest request) {

    String errors = ex.getBindingResult().getFieldErrors().stream()
        .map(FieldError::getDefaultMessage)
        .collect(Collectors.joining(", "));

    Map<String, Object> body = createErrorBody(
        HttpStatus.BAD_REQUEST,
        "validation_error",
        errors,
        request
                                              );

    return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, Object>> handleIllegalArgument(
      IllegalArgumentException ex, WebRequest request) {

    Map<String, Object> body = createErrorBody(
        HttpStatus.BAD_REQUEST,
        "invalid_request",
        ex.getMessage(),
        request
                                              );

    return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, Object>> handleUnreadableBody(
      HttpMessageNotReadableException ex, WebRequest request) {

    Map<String, Object> body = createErrorBody(
        HttpStatus.BAD_REQUEST,
        "invalid_request",
        "Malformed request body",
        request
                                              );

    return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<Map<String, Object>> handleMissingParams(
      MissingServletRequestParameterException ex, WebRequest request) {

    Map<String, Object> body = createErrorBody(
        HttpStatus.BAD_REQUEST,
        "missing_parameter",
        String.format("Missing required parameter: %s", ex.getParameterName()),
        request
                                              );

    return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
  }

  @ExceptionHandler(MissingServletRequestPartException.class)
  public ResponseEntity<Map<String, Object>> handleMissingPart(
      MissingServletRequestPartException ex, WebRequest request) {

    Map<String, Object> body = createErrorBody(
        HttpStatus.BAD_REQUEST,
        "missing_parameter",
        String.format("Missing required part: %s", ex.getRequestPartName()),
        request
                                              );

    return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<Map<String, Object>> handleMethodNotSupported(
      HttpRequestMethodNotSupportedException ex, WebRequest request) {

    Map<String, Object> body = createErrorBody(
        HttpStatus.METHOD_NOT_ALLOWED,
        "method_not_allowed",
        String.format("Method %s not supported", ex.getMethod()),
        request
                                              );

    return new ResponseEntity<>(body, HttpStatus.METHOD_NOT_ALLOWED);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleGenericException(
      Exception ex, WebRequest request) {
    log.error("Unexpected error", ex);

    Map<String, Object> body = createErrorBody(
        HttpStatus.INTERNAL_SERVER_ERROR,
        "internal_error",
        "An error occurred processing your request",
        request
                                              );

    return new ResponseEntity<>(body, HttpStatus.INTERNAL_SERVER_ERROR);
  }

  private Map<String, Object> createErrorBody(
      HttpStatus status, String error, String message, WebRequest request) {

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("timestamp", Instant.now());
    body.put("status", status.value());
    body.put("error", error);
    body.put("message", message);
    body.put("path", extractPath(request));

    return body;
  }

  private String extractPath(WebRequest request) {
    String description = request.getDescription(false);
    return description.replace("uri=", "");
  }
}
