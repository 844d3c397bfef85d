package com.example.sftpbroker.exception;

import lombok.Getter;

/**
 * Destination exists and overwrite was not requested
 */
@Getter
public class AlreadyExistsException extends RuntimeException {

  private final String path;

  public AlreadyExistsException(String path, String message) {
    super(message + ": " + path);
    this.path = path;
  }
}
