package com.example.sftpbroker.exception;

import java.io.IOException;

/**
 * The client-side output stream failed, typically because the client went away.
 * Distinguishes local sink failures from remote read failures during a streamed transfer.
 */
public class SinkWriteException extends IOException {
  public SinkWriteException(String message, Throwable cause) {
    super(message, cause);
  }
}
