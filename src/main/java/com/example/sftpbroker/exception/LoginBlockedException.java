package com.example.sftpbroker.exception;

/**
 * Too many failed logins from one client
 */
public class LoginBlockedException extends RuntimeException {
  public LoginBlockedException(String message) {
    super(message);
  }
}
