package com.example.sftpbroker.service;

import com.example.sftpbroker.adapter.sftp.ConnectionFactory;
import com.example.sftpbroker.adapter.sftp.RemoteAttributes;
import com.example.sftpbroker.adapter.sftp.RemoteConnection;
import com.example.sftpbroker.domain.entity.ConnectionTarget;
import com.example.sftpbroker.domain.entity.SessionStats;
import com.example.sftpbroker.domain.entity.SftpSession;
import com.example.sftpbroker.exception.CapacityExceededException;
import com.example.sftpbroker.exception.SessionExpiredException;
import com.example.sftpbroker.exception.SessionNotFoundException;
import com.example.sftpbroker.properties.ApplicationProperties;
import com.example.sftpbroker.util.RemotePaths;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Process-wide registry of live SFTP sessions.
 *
 * <p>The id map is guarded by a single read/write lock. Lookups and access refreshes run under the
 * read lock; inserts, deletes and expiry eviction run under the write lock, so an eviction decision
 * and a concurrent refresh are strictly ordered. Connections are always closed after the lock is
 * released.
 */
@Slf4j
@Service
public class SessionRegistry implements DisposableBean {

  private static final int SESSION_ID_ENTROPY_BYTES = 16;
  private static final SecureRandom SECURE_RANDOM = new SecureRandom();
  private static final HexFormat HEX = HexFormat.of();

  private final ConnectionFactory connectionFactory;
  private final ApplicationProperties properties;
  private final Clock clock;
  private final Supplier<String> idGenerator;

  private final Map<String, SftpSession> sessions = new HashMap<>();
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

  @Autowired
  public SessionRegistry(ConnectionFactory connectionFactory, ApplicationProperties properties, Clock clock) {
    this(connectionFactory, properties, clock, SessionRegistry::generateSecureSessionId);
  }

  SessionRegistry(ConnectionFactory connectionFactory, ApplicationProperties properties, Clock clock,
                  Supplier<String> idGenerator) {
    this.connectionFactory = connectionFactory;
    this.properties = properties;
    this.clock = clock;
    this.idGenerator = idGenerator;
  }

  /**
   * Opens a connection and registers a new session for it.
   *
   * @throws CapacityExceededException if the registry is full, before or after connecting
   * @throws com.example.sftpbroker.exception.ConnectionException if the connection cannot be opened
   */
  public SftpSession create(ConnectionTarget target, String credential) {
    if (liveCount() >= maxSessions()) {
      log.warn("Rejecting session for {}: registry is full ({} sessions)", target, maxSessions());
      throw new CapacityExceededException("Maximum number of sessions reached");
    }

    RemoteConnection connection = connectionFactory.connect(
        target.host(), target.port(), target.username(), credential, properties.sftp().connectTimeout());
    String homeDirectory = resolveHomeDirectory(connection, target.username());

    List<SftpSession> evicted = new ArrayList<>();
    SftpSession session = null;
    lock.writeLock().lock();
    try {
      Instant now = clock.instant();
      if (sessions.size() >= maxSessions()) {
        evicted.addAll(removeExpiredLocked(now));
      }
      if (sessions.size() < maxSessions()) {
        String sessionId = nextUniqueIdLocked();
        session = new SftpSession(sessionId, target, connection, homeDirectory, now);
        sessions.put(sessionId, session);
      }
    } finally {
      lock.writeLock().unlock();
    }

    closeAll(evicted, "evicted on overflow");
    if (session == null) {
      closeQuietly(connection, target);
      log.warn("Rejecting session for {}: registry filled up while connecting", target);
      throw new CapacityExceededException("Maximum number of sessions reached");
    }

    log.info("Session {} created for {} (home: {})", session.maskedId(), target, homeDirectory);
    return session;
  }

  /**
   * Returns a live session and refreshes its last-access time.
   *
   * @throws SessionNotFoundException if no session has this id
   * @throws SessionExpiredException  if the session is idle past the timeout, even if not yet swept
   */
  public SftpSession get(String sessionId) {
    lock.readLock().lock();
    try {
      SftpSession session = sessions.get(sessionId);
      if (session == null) {
        throw new SessionNotFoundException("Session not found");
      }
      Instant now = clock.instant();
      if (session.isExpired(now, timeout())) {
        throw new SessionExpiredException("Session has expired");
      }
      session.touch(now);
      return session;
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Removes a session and closes its connection. A second delete of the same id fails.
   *
   * @throws SessionNotFoundException if no session has this id
   */
  public void delete(String sessionId) {
    SftpSession removed;
    lock.writeLock().lock();
    try {
      removed = sessions.remove(sessionId);
    } finally {
      lock.writeLock().unlock();
    }
    if (removed == null) {
      throw new SessionNotFoundException("Session not found");
    }
    removed.close();
    log.info("Session {} deleted", removed.maskedId());
  }

  /**
   * Sessions that are not idle past the timeout.
   */
  public List<SftpSession> list() {
    lock.readLock().lock();
    try {
      Instant now = clock.instant();
      return sessions.values().stream()
          .filter(session -> !session.isExpired(now, timeout()))
          .toList();
    } finally {
      lock.readLock().unlock();
    }
  }

  public SessionStats stats() {
    lock.readLock().lock();
    try {
      Instant now = clock.instant();
      int active = (int) sessions.values().stream()
          .filter(session -> session.isActive() && !session.isExpired(now, timeout()))
          .count();
      return new SessionStats(active, sessions.size(), maxSessions());
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Removes every session idle past the timeout, as of one instant read under the write lock,
   * then closes their connections.
   *
   * @return number of sessions evicted
   */
  public int evictExpired() {
    List<SftpSession> expired;
    lock.writeLock().lock();
    try {
      expired = removeExpiredLocked(clock.instant());
    } finally {
      lock.writeLock().unlock();
    }
    closeAll(expired, "expired");
    return expired.size();
  }

  /**
   * Closes every session. Called once at shutdown.
   */
  @Override
  public void destroy() {
    List<SftpSession> all;
    lock.writeLock().lock();
    try {
      all = new ArrayList<>(sessions.values());
      sessions.clear();
    } finally {
      lock.writeLock().unlock();
    }
    log.info("Closing {} session(s) on shutdown", all.size());
    closeAll(all, "shut down");
  }

  private List<SftpSession> removeExpiredLocked(Instant now) {
    List<SftpSession> expired = new ArrayList<>();
    Iterator<SftpSession> iterator = sessions.values().iterator();
    while (iterator.hasNext()) {
      SftpSession session = iterator.next();
      if (session.isExpired(now, timeout())) {
        iterator.remove();
        expired.add(session);
      }
    }
    return expired;
  }

  private String nextUniqueIdLocked() {
    String sessionId = idGenerator.get();
    while (sessions.containsKey(sessionId)) {
      log.warn("Session id collision detected; generating a new id");
      sessionId = idGenerator.get();
    }
    return sessionId;
  }

  /**
   * Reported working directory, else the first conventional home directory that exists,
   * else the root.
   */
  private String resolveHomeDirectory(RemoteConnection connection, String username) {
    try {
      String workingDirectory = connection.workingDirectory();
      if (StringUtils.hasText(workingDirectory)) {
        return RemotePaths.normalize(workingDirectory);
      }
    } catch (IOException e) {
      log.debug("Working directory not reported for {}: {}", username, e.getMessage());
    }

    for (String candidate : homeDirectoryCandidates(username)) {
      try {
        RemoteAttributes attributes = connection.stat(candidate);
        if (attributes.directory()) {
          return candidate;
        }
      } catch (IOException e) {
        log.trace("Home directory candidate {} not usable: {}", candidate, e.getMessage());
      }
    }
    return RemotePaths.ROOT;
  }

  private List<String> homeDirectoryCandidates(String username) {
    if ("root".equals(username)) {
      return List.of("/root");
    }
    return List.of("/home/" + username, "/Users/" + username);
  }

  private void closeAll(List<SftpSession> toClose, String reason) {
    for (SftpSession session : toClose) {
      session.close();
      log.info("Session {} closed ({})", session.maskedId(), reason);
    }
  }

  private void closeQuietly(RemoteConnection connection, ConnectionTarget target) {
    try {
      connection.close();
    } catch (IOException e) {
      log.warn("Error closing rejected connection to {}", target, e);
    }
  }

  /**
   * Sessions not idle past the timeout; expired ones can still be evicted to make room.
   */
  private long liveCount() {
    lock.readLock().lock();
    try {
      Instant now = clock.instant();
      return sessions.values().stream()
          .filter(session -> !session.isExpired(now, timeout()))
          .count();
    } finally {
      lock.readLock().unlock();
    }
  }

  private int maxSessions() {
    return properties.session().maxSessions();
  }

  private Duration timeout() {
    return properties.session().timeout();
  }

  private static String generateSecureSessionId() {
    byte[] randomBytes = new byte[SESSION_ID_ENTROPY_BYTES];
    SECURE_RANDOM.nextBytes(randomBytes);
    return HEX.formatHex(randomBytes);
  }
}
