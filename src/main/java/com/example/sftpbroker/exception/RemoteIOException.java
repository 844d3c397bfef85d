package com.example.sftpbroker.exception;

import lombok.Getter;

/**
 * Any failure reported by a remote connection while operating on a path.
 */
@Getter
public class RemoteIOException extends RuntimeException {

  private final String path;

  public RemoteIOException(String path, String message) {
    super(message + ": " + path);
    this.path = path;
  }

  public RemoteIOException(String path, String message, Throwable cause) {
    super(message + ": " + path, cause);
    this.path = path;
  }
}
