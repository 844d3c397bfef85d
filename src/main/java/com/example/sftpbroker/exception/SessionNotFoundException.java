package com.example.sftpbroker.exception;

/**
 * Unknown or already removed session
 */
public class SessionNotFoundException extends SessionException {
  public SessionNotFoundException(String message) {
    super(message);
  }
}
