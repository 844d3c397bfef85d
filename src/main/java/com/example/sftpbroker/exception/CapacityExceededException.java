package com.example.sftpbroker.exception;

/**
 * Session registry is full
 */
public class CapacityExceededException extends RuntimeException {
  public CapacityExceededException(String message) {
    super(message);
  }
}
