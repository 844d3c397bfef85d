package com.example.sftpbroker.service;

import com.example.sftpbroker.exception.SinkWriteException;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;

/**
 * Wraps a client sink so that its write failures surface as {@link SinkWriteException}.
 * Once failed, every further write fails immediately without touching the delegate.
 */
class SinkOutputStream extends FilterOutputStream {

  private IOException failure;

  SinkOutputStream(OutputStream delegate) {
    super(delegate);
  }

  @Override
  public void write(int b) throws IOException {
    ensureOpen();
    try {
      out.write(b);
    } catch (IOException e) {
      throw fail(e);
    }
  }

  @Override
  public void write(byte[] b, int off, int len) throws IOException {
    ensureOpen();
    try {
      out.write(b, off, len);
    } catch (IOException e) {
      throw fail(e);
    }
  }

  @Override
  public void flush() throws IOException {
    ensureOpen();
    try {
      out.flush();
    } catch (IOException e) {
      throw fail(e);
    }
  }

  /**
   * Does not close the client's stream; the web container owns it.
   */
  @Override
  public void close() throws IOException {
    flush();
  }

  boolean hasFailed() {
    return failure != null;
  }

  private void ensureOpen() throws SinkWriteException {
    if (failure != null) {
      throw new SinkWriteException("Output sink already failed", failure);
    }
  }

  private SinkWriteException fail(IOException cause) {
    failure = cause;
    return new SinkWriteException("Output sink write failed", cause);
  }
}
