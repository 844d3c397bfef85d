package com.example.sftpbroker.adapter.sftp;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;

/**
 * An open, authenticated handle to a remote filesystem.
 *
 * Implementations are not required to be thread-safe; callers serialize access per session.
 * A missing path is reported as {@link java.nio.file.NoSuchFileException}.
 */
public interface RemoteConnection extends Closeable {

  RemoteAttributes stat(String path) throws IOException;

  /**
   * Lists the direct children of a directory, excluding {@code .} and {@code ..}.
   */
  List<RemoteDirEntry> list(String path) throws IOException;

  InputStream openRead(String path) throws IOException;

  /**
   * Creates or truncates the file at {@code path} for writing.
   */
  OutputStream createWrite(String path) throws IOException;

  void removeFile(String path) throws IOException;

  /**
   * Removes a directory; fails unless the directory is empty.
   */
  void removeDirectory(String path) throws IOException;

  void makeDirectory(String path) throws IOException;

  String workingDirectory() throws IOException;
}
