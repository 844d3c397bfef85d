package com.example.sftpbroker.exception;

import lombok.Getter;

/**
 * Path is a directory where a regular file is required
 */
@Getter
public class NotAFileException extends RuntimeException {

  private final String path;

  public NotAFileException(String path, String message) {
    super(message + ": " + path);
    this.path = path;
  }
}
