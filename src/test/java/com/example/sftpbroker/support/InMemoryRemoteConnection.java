package com.example.sftpbroker.support;

import com.example.sftpbroker.adapter.sftp.RemoteAttributes;
import com.example.sftpbroker.adapter.sftp.RemoteConnection;
import com.example.sftpbroker.adapter.sftp.RemoteDirEntry;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Remote filesystem held in memory, with per-path failure injection.
 *
 * <pre>{@code
 * InMemoryRemoteConnection remote = new InMemoryRemoteConnection();
 * remote.addFile("/data/a.txt", "hello");
 * remote.failOn("/data/a.txt", Operation.READ);
 * }</pre>
 *
 * Every call after {@link #close()} fails, so use of a closed connection is visible to tests.
 */
public class InMemoryRemoteConnection implements RemoteConnection {

  public static final Instant MODIFIED_AT = Instant.parse("2024-05-01T10:15:30Z");
  public static final int FILE_PERMISSIONS = 0100644;
  public static final int DIRECTORY_PERMISSIONS = 040755;

  /**
   * Operations that can be made to fail for a given path.
   */
  public enum Operation {
    STAT,
    LIST,
    OPEN,
    /** openRead succeeds, the stream fails after the first half of the content */
    READ,
    WRITE,
    REMOVE,
    RMDIR,
    MKDIR
  }

  private final NavigableMap<String, Node> nodes = new ConcurrentSkipListMap<>();
  private final Map<String, Set<Operation>> failures = new ConcurrentHashMap<>();
  private final List<String> openedPaths = new CopyOnWriteArrayList<>();
  private final List<String> usedAfterClose = new CopyOnWriteArrayList<>();
  private final AtomicInteger closeCount = new AtomicInteger();
  private volatile String workingDirectory;
  private volatile boolean closed;

  public InMemoryRemoteConnection() {
    nodes.put("/", Node.directory());
  }

  // ==================== Setup ====================

  public InMemoryRemoteConnection addDirectory(String path) {
    String parent = parentOf(path);
    if (parent != null && !nodes.containsKey(parent)) {
      addDirectory(parent);
    }
    nodes.putIfAbsent(path, Node.directory());
    return this;
  }

  public InMemoryRemoteConnection addFile(String path, byte[] content) {
    String parent = parentOf(path);
    if (parent != null) {
      addDirectory(parent);
    }
    nodes.put(path, Node.file(content));
    return this;
  }

  public InMemoryRemoteConnection addFile(String path, String content) {
    return addFile(path, content.getBytes(StandardCharsets.UTF_8));
  }

  public InMemoryRemoteConnection failOn(String path, Operation operation) {
    failures.computeIfAbsent(path, p -> EnumSet.noneOf(Operation.class)).add(operation);
    return this;
  }

  public InMemoryRemoteConnection withWorkingDirectory(String workingDirectory) {
    this.workingDirectory = workingDirectory;
    return this;
  }

  // ==================== Inspection ====================

  public boolean exists(String path) {
    return nodes.containsKey(path);
  }

  public byte[] content(String path) {
    Node node = nodes.get(path);
    return node == null ? null : node.content;
  }

  public String contentAsString(String path) {
    byte[] content = content(path);
    return content == null ? null : new String(content, StandardCharsets.UTF_8);
  }

  public List<String> openedPaths() {
    return List.copyOf(openedPaths);
  }

  /**
   * Operations attempted after the connection was closed.
   */
  public List<String> usedAfterClose() {
    return List.copyOf(usedAfterClose);
  }

  public int closeCount() {
    return closeCount.get();
  }

  public boolean isClosed() {
    return closed;
  }

  // ==================== RemoteConnection ====================

  @Override
  public RemoteAttributes stat(String path) throws IOException {
    check(path, Operation.STAT);
    return require(path).attributes();
  }

  @Override
  public List<RemoteDirEntry> list(String path) throws IOException {
    check(path, Operation.LIST);
    Node directory = require(path);
    if (!directory.isDirectory) {
      throw new IOException("Not a directory: " + path);
    }
    List<RemoteDirEntry> children = new ArrayList<>();
    for (Map.Entry<String, Node> entry : nodes.tailMap(path, false).entrySet()) {
      String candidate = entry.getKey();
      if (path.equals(parentOf(candidate))) {
        children.add(new RemoteDirEntry(candidate.substring(candidate.lastIndexOf('/') + 1),
                                        entry.getValue().attributes()));
      }
    }
    return children;
  }

  @Override
  public InputStream openRead(String path) throws IOException {
    check(path, Operation.OPEN);
    Node file = require(path);
    if (file.isDirectory) {
      throw new IOException("Is a directory: " + path);
    }
    openedPaths.add(path);
    if (failing(path, Operation.READ)) {
      return new FailingInputStream(file.content, file.content.length / 2);
    }
    return new ByteArrayInputStream(file.content);
  }

  @Override
  public OutputStream createWrite(String path) throws IOException {
    check(path, Operation.WRITE);
    String parent = parentOf(path);
    if (parent != null && !nodes.containsKey(parent)) {
      throw new NoSuchFileException(parent);
    }
    return new ByteArrayOutputStream() {
      @Override
      public void close() throws IOException {
        super.close();
        nodes.put(path, Node.file(toByteArray()));
      }
    };
  }

  @Override
  public void removeFile(String path) throws IOException {
    check(path, Operation.REMOVE);
    if (require(path).isDirectory) {
      throw new IOException("Is a directory: " + path);
    }
    nodes.remove(path);
  }

  @Override
  public void removeDirectory(String path) throws IOException {
    check(path, Operation.RMDIR);
    if (!require(path).isDirectory) {
      throw new IOException("Not a directory: " + path);
    }
    if (!list(path).isEmpty()) {
      throw new IOException("Directory not empty: " + path);
    }
    nodes.remove(path);
  }

  @Override
  public void makeDirectory(String path) throws IOException {
    check(path, Operation.MKDIR);
    if (nodes.containsKey(path)) {
      throw new IOException("File exists: " + path);
    }
    String parent = parentOf(path);
    if (parent != null && !nodes.containsKey(parent)) {
      throw new NoSuchFileException(parent);
    }
    nodes.put(path, Node.directory());
  }

  @Override
  public String workingDirectory() throws IOException {
    checkOpen("pwd");
    if (workingDirectory == null) {
      throw new IOException("realpath not supported");
    }
    return workingDirectory;
  }

  @Override
  public void close() {
    closed = true;
    closeCount.incrementAndGet();
  }

  // ==================== Internals ====================

  private void check(String path, Operation operation) throws IOException {
    checkOpen(operation + " " + path);
    if (operation != Operation.READ && failing(path, operation)) {
      throw new IOException("Injected " + operation + " failure");
    }
  }

  private void checkOpen(String operation) throws IOException {
    if (closed) {
      usedAfterClose.add(operation);
      throw new IOException("Connection closed");
    }
  }

  private boolean failing(String path, Operation operation) {
    Set<Operation> injected = failures.get(path);
    return injected != null && injected.contains(operation);
  }

  private Node require(String path) throws NoSuchFileException {
    Node node = nodes.get(path);
    if (node == null) {
      throw new NoSuchFileException(path);
    }
    return node;
  }

  private static String parentOf(String path) {
    if ("/".equals(path)) {
      return null;
    }
    int slash = path.lastIndexOf('/');
    return slash <= 0 ? "/" : path.substring(0, slash);
  }

  private static final class Node {
    private final boolean isDirectory;
    private final byte[] content;

    private Node(boolean isDirectory, byte[] content) {
      this.isDirectory = isDirectory;
      this.content = content;
    }

    static Node directory() {
      return new Node(true, new byte[0]);
    }

    static Node file(byte[] content) {
      return new Node(false, content.clone());
    }

    RemoteAttributes attributes() {
      return new RemoteAttributes(
          isDirectory ? 4096 : content.length,
          isDirectory ? DIRECTORY_PERMISSIONS : FILE_PERMISSIONS,
          MODIFIED_AT,
          isDirectory);
    }
  }

  private static final class FailingInputStream extends InputStream {
    private final ByteArrayInputStream delegate;
    private int remaining;

    FailingInputStream(byte[] content, int failAfter) {
      this.delegate = new ByteArrayInputStream(content);
      this.remaining = failAfter;
    }

    @Override
    public int read() throws IOException {
      if (remaining <= 0) {
        throw new IOException("Injected READ failure");
      }
      remaining--;
      return delegate.read();
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
      if (remaining <= 0) {
        throw new IOException("Injected READ failure");
      }
      int read = delegate.read(b, off, Math.min(len, remaining));
      remaining -= read;
      return read;
    }
  }
}
