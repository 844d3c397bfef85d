package com.example.sftpbroker.service;

import com.example.sftpbroker.adapter.sftp.RemoteAttributes;
import com.example.sftpbroker.adapter.sftp.RemoteConnection;
import com.example.sftpbroker.adapter.sftp.RemoteDirEntry;
import com.example.sftpbroker.domain.entity.ArchiveReport;
import com.example.sftpbroker.domain.entity.ArchiveReport.SkippedEntry;
import com.example.sftpbroker.domain.entity.SftpSession;
import com.example.sftpbroker.exception.SessionExpiredException;
import com.example.sftpbroker.exception.SinkWriteException;
import com.example.sftpbroker.properties.ApplicationProperties;
import com.example.sftpbroker.util.RemotePaths;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Streams a ZIP archive of remote files and directory trees into an output sink.
 *
 * <p>File content flows from the remote read stream straight into its ZIP entry; nothing is
 * buffered beyond one copy buffer. A path that cannot be stat'ed, listed, opened or read is
 * skipped and recorded, and the walk continues. Only a failing sink stops the walk. The archive
 * trailer is written once, after every requested path has been handled, so an archive in which
 * every path failed is still a valid empty ZIP.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ArchiveService {

  private static final String ZIP_SEPARATOR = "/";
  private static final String ROOT_ENTRY_NAME = "root";

  private final ApplicationProperties properties;

  public ArchiveReport streamArchive(SftpSession session, List<String> paths, OutputStream sink) {
    SinkOutputStream guardedSink = new SinkOutputStream(sink);
    ZipOutputStream zip = new ZipOutputStream(guardedSink);
    ArchiveWalk walk = new ArchiveWalk(zip, (int) properties.transfer().bufferSize().toBytes());

    EntryResult total = EntryResult.EMPTY;
    boolean aborted = false;
    try {
      total = session.withConnection(connection -> walk.addAll(connection, paths));
    } catch (SinkWriteException e) {
      log.info("Archive for session {} aborted: client sink failed ({})", session.maskedId(), e.getCause().getMessage());
      aborted = true;
    } catch (SessionExpiredException e) {
      log.warn("Archive for session {} produced no entries: session closed before the walk started",
               session.maskedId());
      paths.forEach(path -> walk.skip(path, "session closed"));
    } catch (IOException e) {
      // callbacks only let sink failures escape; anything else is a bug in the walk
      throw new IllegalStateException("Unexpected archive failure", e);
    }

    if (!aborted) {
      try {
        zip.finish();
        guardedSink.flush();
      } catch (IOException e) {
        log.info("Archive for session {} aborted while writing the trailer: {}", session.maskedId(), e.getMessage());
        aborted = true;
      }
    }

    ArchiveReport report = new ArchiveReport(
        total.files(), total.directories(), List.copyOf(walk.skipped), aborted);
    log.info("Archive for session {}: {} file(s), {} directory(ies), {} skipped{}",
             session.maskedId(), report.filesAdded(), report.directoriesAdded(), report.skipped().size(),
             aborted ? ", aborted" : "");
    return report;
  }

  /**
   * Per-entry outcome counts; the walk adds these up instead of throwing.
   */
  record EntryResult(int files, int directories, int skipped) {
    static final EntryResult EMPTY = new EntryResult(0, 0, 0);
    static final EntryResult FILE = new EntryResult(1, 0, 0);
    static final EntryResult DIRECTORY = new EntryResult(0, 1, 0);
    static final EntryResult SKIPPED = new EntryResult(0, 0, 1);

    EntryResult plus(EntryResult other) {
      return new EntryResult(files + other.files, directories + other.directories, skipped + other.skipped);
    }
  }

  /**
   * State of one archive request: the ZIP writer, the copy buffer and the skip log.
   */
  private static final class ArchiveWalk {

    private final ZipOutputStream zip;
    private final byte[] buffer;
    private final List<SkippedEntry> skipped = new ArrayList<>();
    private RemoteConnection connection;

    ArchiveWalk(ZipOutputStream zip, int bufferSize) {
      this.zip = zip;
      this.buffer = new byte[bufferSize];
    }

    EntryResult addAll(RemoteConnection connection, List<String> paths) throws SinkWriteException {
      this.connection = connection;
      EntryResult total = EntryResult.EMPTY;
      for (String path : paths) {
        total = total.plus(addRequested(path));
      }
      return total;
    }

    private EntryResult addRequested(String requestedPath) throws SinkWriteException {
      String remotePath = RemotePaths.normalize(requestedPath);
      RemoteAttributes attributes;
      try {
        attributes = connection.stat(remotePath);
      } catch (IOException e) {
        return skip(remotePath, "cannot stat: " + e.getMessage());
      }

      String entryName = RemotePaths.baseName(remotePath);
      if (RemotePaths.ROOT.equals(entryName)) {
        entryName = ROOT_ENTRY_NAME;
      }
      if (attributes.directory()) {
        return addDirectory(remotePath, entryName, attributes);
      }
      return addFile(remotePath, entryName, attributes);
    }

    private EntryResult addDirectory(String remoteDir, String zipPath, RemoteAttributes attributes)
        throws SinkWriteException {
      List<RemoteDirEntry> children;
      try {
        children = connection.list(remoteDir);
      } catch (IOException e) {
        return skip(remoteDir, "cannot list: " + e.getMessage());
      }

      if (!putEntry(zipPath + ZIP_SEPARATOR, attributes, remoteDir)) {
        return EntryResult.SKIPPED;
      }
      closeEntry();

      EntryResult result = EntryResult.DIRECTORY;
      for (RemoteDirEntry child : children) {
        String childRemote = RemotePaths.join(remoteDir, child.name());
        String childZip = zipPath + ZIP_SEPARATOR + child.name();
        result = result.plus(child.attributes().directory()
                                 ? addDirectory(childRemote, childZip, child.attributes())
                                 : addFile(childRemote, childZip, child.attributes()));
      }
      return result;
    }

    private EntryResult addFile(String remotePath, String zipPath, RemoteAttributes attributes)
        throws SinkWriteException {
      InputStream source;
      try {
        source = connection.openRead(remotePath);
      } catch (IOException e) {
        return skip(remotePath, "cannot open: " + e.getMessage());
      }

      try {
        if (!putEntry(zipPath, attributes, remotePath)) {
          return EntryResult.SKIPPED;
        }
        try {
          copy(source);
        } catch (RemoteReadException e) {
          closeEntry();
          return skip(remotePath, "read failed, entry truncated: " + e.getCause().getMessage());
        }
        closeEntry();
        return EntryResult.FILE;
      } finally {
        closeSource(source, remotePath);
      }
    }

    /**
     * @return false if the entry was rejected (for example a duplicate name) and has been skipped
     */
    private boolean putEntry(String name, RemoteAttributes attributes, String remotePath) throws SinkWriteException {
      ZipEntry entry = new ZipEntry(name);
      entry.setLastModifiedTime(FileTime.from(attributes.modifiedAt()));
      try {
        zip.putNextEntry(entry);
        return true;
      } catch (SinkWriteException e) {
        throw e;
      } catch (IOException e) {
        skip(remotePath, "cannot add entry " + name + ": " + e.getMessage());
        return false;
      }
    }

    private void copy(InputStream source) throws SinkWriteException, RemoteReadException {
      while (true) {
        int read;
        try {
          read = source.read(buffer);
        } catch (IOException e) {
          throw new RemoteReadException(e);
        }
        if (read < 0) {
          return;
        }
        try {
          zip.write(buffer, 0, read);
        } catch (SinkWriteException e) {
          throw e;
        } catch (IOException e) {
          throw new SinkWriteException("Failed to write archive entry", e);
        }
      }
    }

    private void closeEntry() throws SinkWriteException {
      try {
        zip.closeEntry();
      } catch (SinkWriteException e) {
        throw e;
      } catch (IOException e) {
        throw new SinkWriteException("Failed to close archive entry", e);
      }
    }

    private void closeSource(InputStream source, String remotePath) {
      try {
        source.close();
      } catch (IOException e) {
        log.warn("Error closing remote stream for {}", remotePath, e);
      }
    }

    EntryResult skip(String path, String reason) {
      log.warn("Archive skipped {}: {}", path, reason);
      skipped.add(new SkippedEntry(path, reason));
      return EntryResult.SKIPPED;
    }
  }

  private static final class RemoteReadException extends Exception {
    RemoteReadException(IOException cause) {
      super(cause);
    }
  }
}
