package com.example.sftpbroker.service;

import com.example.sftpbroker.adapter.sftp.ConnectionCallback;
import com.example.sftpbroker.adapter.sftp.RemoteAttributes;
import com.example.sftpbroker.adapter.sftp.RemoteConnection;
import com.example.sftpbroker.adapter.sftp.RemoteDirEntry;
import com.example.sftpbroker.domain.entity.BatchDeleteResult;
import com.example.sftpbroker.domain.entity.FileEntry;
import com.example.sftpbroker.domain.entity.PreviewResult;
import com.example.sftpbroker.domain.entity.SftpSession;
import com.example.sftpbroker.exception.AlreadyExistsException;
import com.example.sftpbroker.exception.FileTooLargeException;
import com.example.sftpbroker.exception.NotAFileException;
import com.example.sftpbroker.exception.RemoteIOException;
import com.example.sftpbroker.exception.SinkWriteException;
import com.example.sftpbroker.util.FileModes;
import com.example.sftpbroker.util.FileTypes;
import com.example.sftpbroker.util.RemotePaths;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

/**
 * Single-path file operations against a session's connection.
 *
 * <p>Every operation runs inside {@link SftpSession#withConnection}, so concurrent requests on the
 * same session are serialized. Remote failures surface as {@link RemoteIOException} naming the path.
 */
@Slf4j
@Service
public class TransferService {

  private static final String HIDDEN_PREFIX = ".";
  private static final int MAX_PREVIEW_ARRAY = Integer.MAX_VALUE - 8;

  private static final Comparator<FileEntry> DIRECTORIES_FIRST =
      Comparator.comparing((FileEntry entry) -> !entry.directory())
          .thenComparing(FileEntry::name, String.CASE_INSENSITIVE_ORDER);

  /**
   * Lists a directory with one listing call. A blank path lists the session's home directory.
   * Directories sort before files, then names compare case-insensitively.
   */
  public List<FileEntry> listDirectory(SftpSession session, String path, boolean includeHidden,
                                       Predicate<FileEntry> filter) {
    String directory = RemotePaths.normalize(path, session.getHomeDirectory());
    List<RemoteDirEntry> children =
        execute(session, directory, "Failed to read directory", connection -> connection.list(directory));

    return children.stream()
        .filter(child -> includeHidden || !child.name().startsWith(HIDDEN_PREFIX))
        .map(child -> toFileEntry(RemotePaths.join(directory, child.name()), child.name(), child.attributes()))
        .filter(filter)
        .sorted(DIRECTORIES_FIRST)
        .toList();
  }

  public FileEntry stat(SftpSession session, String path) {
    String target = requirePath(path);
    RemoteAttributes attributes = execute(session, target, "Failed to stat", connection -> connection.stat(target));
    return toFileEntry(target, RemotePaths.baseName(target), attributes);
  }

  /**
   * Opens a regular file and hands its content to {@code callback}. The remote stream is closed
   * when the callback returns, and the session stays locked for the whole read.
   *
   * @throws NotAFileException if the path is a directory
   */
  public <T> T openFile(SftpSession session, String path, RemoteStreamCallback<T> callback) {
    String filePath = requirePath(path);
    return execute(session, filePath, "Failed to read file",
                   connection -> readFile(connection, filePath, callback));
  }

  /**
   * Streams a regular file into {@code sink}.
   *
   * @return number of bytes copied
   * @throws SinkWriteException if writing to the sink fails
   */
  public long download(SftpSession session, String path, OutputStream sink) throws SinkWriteException {
    String filePath = requirePath(path);
    SinkOutputStream guardedSink = new SinkOutputStream(sink);
    try {
      return session.withConnection(connection -> readFile(connection, filePath, in -> in.transferTo(guardedSink)));
    } catch (SinkWriteException e) {
      throw e;
    } catch (IOException e) {
      throw new RemoteIOException(filePath, "Failed to download file", e);
    }
  }

  /**
   * Writes {@code source} to {@code path}. Without {@code overwrite}, an existing path is left
   * untouched. The existence check and the create are separate remote calls.
   *
   * @throws AlreadyExistsException if the path exists and overwrite is false
   */
  public void uploadFile(SftpSession session, String path, InputStream source, boolean overwrite) {
    String destination = requirePath(path);
    execute(session, destination, "Failed to upload file", connection -> {
      if (!overwrite && exists(connection, destination)) {
        throw new AlreadyExistsException(destination, "File already exists");
      }
      try (OutputStream out = connection.createWrite(destination)) {
        long written = source.transferTo(out);
        log.debug("Uploaded {} bytes to {}", written, destination);
      }
      return null;
    });
  }

  /**
   * Deletes a file, or an empty directory. Non-empty directories fail; there is no recursive delete.
   */
  public void deleteEntry(SftpSession session, String path) {
    String target = requirePath(path);
    execute(session, target, "Failed to delete", connection -> {
      if (connection.stat(target).directory()) {
        connection.removeDirectory(target);
      } else {
        connection.removeFile(target);
      }
      return null;
    });
  }

  /**
   * Deletes each path independently; one failure never stops the rest.
   */
  public BatchDeleteResult deleteEntries(SftpSession session, List<String> paths) {
    List<String> deleted = new ArrayList<>();
    List<String> failed = new ArrayList<>();
    for (String path : paths) {
      try {
        deleteEntry(session, path);
        deleted.add(path);
      } catch (RemoteIOException | IllegalArgumentException e) {
        log.warn("Batch delete skipped {}: {}", path, e.getMessage());
        failed.add(path);
      }
    }
    return new BatchDeleteResult(List.copyOf(deleted), List.copyOf(failed));
  }

  public void createDirectory(SftpSession session, String path) {
    String target = requirePath(path);
    execute(session, target, "Failed to create directory", connection -> {
      connection.makeDirectory(target);
      return null;
    });
  }

  /**
   * Reads a small text file for display. The size is checked before any content is read, and
   * at most {@code maxBytes} are read.
   *
   * @throws NotAFileException     if the path is a directory
   * @throws FileTooLargeException if the file is larger than {@code maxBytes}
   */
  public PreviewResult previewFile(SftpSession session, String path, long maxBytes) {
    if (maxBytes < 0) {
      throw new IllegalArgumentException("maxBytes must not be negative");
    }
    String filePath = requirePath(path);
    return execute(session, filePath, "Failed to preview file", connection -> {
      RemoteAttributes attributes = connection.stat(filePath);
      if (attributes.directory()) {
        throw new NotAFileException(filePath, "Cannot preview a directory");
      }
      if (attributes.size() > maxBytes) {
        throw new FileTooLargeException(filePath,
            "File too large for preview (%d > %d bytes)".formatted(attributes.size(), maxBytes));
      }
      byte[] content;
      try (InputStream in = connection.openRead(filePath)) {
        content = in.readNBytes((int) Math.min(maxBytes, MAX_PREVIEW_ARRAY));
      }
      return new PreviewResult(filePath, new String(content, StandardCharsets.UTF_8), FileTypes.languageOf(filePath));
    });
  }

  static FileEntry toFileEntry(String fullPath, String name, RemoteAttributes attributes) {
    return new FileEntry(
        name,
        attributes.size(),
        FileModes.format(attributes.permissions(), attributes.directory()),
        attributes.modifiedAt(),
        attributes.directory(),
        fullPath);
  }

  private <T> T readFile(RemoteConnection connection, String filePath, RemoteStreamCallback<T> callback)
      throws IOException {
    if (connection.stat(filePath).directory()) {
      throw new NotAFileException(filePath, "Path is a directory");
    }
    try (InputStream in = connection.openRead(filePath)) {
      return callback.doWithStream(in);
    }
  }

  private boolean exists(RemoteConnection connection, String path) throws IOException {
    try {
      connection.stat(path);
      return true;
    } catch (NoSuchFileException e) {
      return false;
    }
  }

  private <T> T execute(SftpSession session, String path, String failureMessage, ConnectionCallback<T> callback) {
    try {
      return session.withConnection(callback);
    } catch (IOException e) {
      throw new RemoteIOException(path, failureMessage, e);
    }
  }

  private static String requirePath(String path) {
    if (!StringUtils.hasText(path)) {
      throw new IllegalArgumentException("Path is required");
    }
    return RemotePaths.normalize(path);
  }
}
