package com.example.sftpbroker.exception;

/**
 * A session id could not be resolved to a live session. Always answered with 401.
 */
public class SessionException extends RuntimeException {
  public SessionException(String message) {
    super(message);
  }
}
