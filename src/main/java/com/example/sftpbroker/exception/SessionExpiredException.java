package com.example.sftpbroker.exception;

/**
 * Session idle past its timeout
 */
public class SessionExpiredException extends SessionException {
  public SessionExpiredException(String message) {
    super(message);
  }
}
