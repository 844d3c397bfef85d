package com.example.sftpbroker.exception;

/**
 * Failure to open or authenticate a remote connection
 */
public class ConnectionException extends RuntimeException {
  public ConnectionException(String message) {
    super(message);
  }

  public ConnectionException(String message, Throwable cause) {
    super(message, cause);
  }
}
