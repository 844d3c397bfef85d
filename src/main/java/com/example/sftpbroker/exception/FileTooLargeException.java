package com.example.sftpbroker.exception;

import lombok.Getter;

/**
 * File exceeds the allowed size for the operation
 */
@Getter
public class FileTooLargeException extends RuntimeException {

  private final String path;

  public FileTooLargeException(String path, String message) {
    super(message + ": " + path);
    this.path = path;
  }
}
