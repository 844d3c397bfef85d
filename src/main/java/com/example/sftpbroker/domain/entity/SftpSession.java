package com.example.sftpbroker.domain.entity;

import com.example.sftpbroker.adapter.sftp.ConnectionCallback;
import com.example.sftpbroker.adapter.sftp.RemoteConnection;
import com.example.sftpbroker.exception.SessionExpiredException;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A bound, time-limited ownership record for one remote connection.
 *
 * <p>The connection is exclusively owned by this session. Every use goes through
 * {@link #withConnection(ConnectionCallback)}, which serializes callers on a per-session lock;
 * {@link #close()} takes the same lock, so a close never interrupts an operation in flight and
 * runs at most once.
 */
@Slf4j
@Getter
public class SftpSession {

  private final String id;
  private final String username;
  private final String host;
  private final int port;
  private final Instant createdAt;
  private final String homeDirectory;

  @Getter(AccessLevel.NONE)
  private final RemoteConnection connection;
  @Getter(AccessLevel.NONE)
  private final AtomicLong lastAccessMillis;
  @Getter(AccessLevel.NONE)
  private final AtomicBoolean closed = new AtomicBoolean();
  @Getter(AccessLevel.NONE)
  private final ReentrantLock connectionLock = new ReentrantLock();

  private volatile boolean active = true;

  public SftpSession(String id, ConnectionTarget target, RemoteConnection connection,
                     String homeDirectory, Instant createdAt) {
    this.id = id;
    this.username = target.username();
    this.host = target.host();
    this.port = target.port();
    this.connection = connection;
    this.homeDirectory = homeDirectory;
    this.createdAt = createdAt;
    this.lastAccessMillis = new AtomicLong(createdAt.toEpochMilli());
  }

  public Instant getLastAccessAt() {
    return Instant.ofEpochMilli(lastAccessMillis.get());
  }

  /**
   * Refreshes the last-access time. Never moves it backwards under concurrent refreshes.
   */
  public void touch(Instant now) {
    lastAccessMillis.accumulateAndGet(now.toEpochMilli(), Math::max);
  }

  public Duration idleTime(Instant now) {
    return Duration.ofMillis(Math.max(0, now.toEpochMilli() - lastAccessMillis.get()));
  }

  public boolean isExpired(Instant now, Duration timeout) {
    return idleTime(now).compareTo(timeout) >= 0;
  }

  /**
   * Runs {@code callback} with exclusive use of the connection.
   *
   * @throws SessionExpiredException if the session was closed before the lock was acquired
   */
  public <T> T withConnection(ConnectionCallback<T> callback) throws IOException {
    connectionLock.lock();
    try {
      if (!active) {
        throw new SessionExpiredException("Session has been closed");
      }
      return callback.doWithConnection(connection);
    } finally {
      connectionLock.unlock();
    }
  }

  /**
   * Marks the session inactive and closes its connection, waiting for any in-flight operation.
   * Close failures are logged, not thrown.
   *
   * @return false if the session had already been closed
   */
  public boolean close() {
    if (!closed.compareAndSet(false, true)) {
      return false;
    }
    connectionLock.lock();
    try {
      active = false;
      connection.close();
    } catch (IOException | RuntimeException e) {
      log.warn("Error closing connection for session {}", maskedId(), e);
    } finally {
      connectionLock.unlock();
    }
    return true;
  }

  public String maskedId() {
    return mask(id);
  }

  public static String mask(String sessionId) {
    if (sessionId == null || sessionId.length() < 8) return "INVALID";
    return sessionId.substring(0, 8) + "...";
  }
}
