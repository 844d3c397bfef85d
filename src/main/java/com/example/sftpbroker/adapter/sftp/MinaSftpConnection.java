package com.example.sftpbroker.adapter.sftp;

import lombok.RequiredArgsConstructor;
import org.apache.sshd.client.session.ClientSession;
import org.apache.sshd.sftp.client.SftpClient;
import org.apache.sshd.sftp.common.SftpConstants;
import org.apache.sshd.sftp.common.SftpException;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.NoSuchFileException;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link RemoteConnection} over a MINA SSHD SFTP channel.
 */
@RequiredArgsConstructor
class MinaSftpConnection implements RemoteConnection {

  private static final String CURRENT_DIR = ".";
  private static final String PARENT_DIR = "..";

  private final ClientSession session;
  private final SftpClient sftpClient;

  @Override
  public RemoteAttributes stat(String path) throws IOException {
    try {
      return toAttributes(sftpClient.stat(path));
    } catch (SftpException e) {
      throw translate(path, e);
    }
  }

  @Override
  public List<RemoteDirEntry> list(String path) throws IOException {
    List<RemoteDirEntry> entries = new ArrayList<>();
    try {
      for (SftpClient.DirEntry entry : sftpClient.readDir(path)) {
        String name = entry.getFilename();
        if (CURRENT_DIR.equals(name) || PARENT_DIR.equals(name)) {
          continue;
        }
        entries.add(new RemoteDirEntry(name, toAttributes(entry.getAttributes())));
      }
    } catch (SftpException e) {
      throw translate(path, e);
    }
    return entries;
  }

  @Override
  public InputStream openRead(String path) throws IOException {
    try {
      return sftpClient.read(path);
    } catch (SftpException e) {
      throw translate(path, e);
    }
  }

  @Override
  public OutputStream createWrite(String path) throws IOException {
    try {
      return sftpClient.write(path);
    } catch (SftpException e) {
      throw translate(path, e);
    }
  }

  @Override
  public void removeFile(String path) throws IOException {
    try {
      sftpClient.remove(path);
    } catch (SftpException e) {
      throw translate(path, e);
    }
  }

  @Override
  public void removeDirectory(String path) throws IOException {
    try {
      sftpClient.rmdir(path);
    } catch (SftpException e) {
      throw translate(path, e);
    }
  }

  @Override
  public void makeDirectory(String path) throws IOException {
    try {
      sftpClient.mkdir(path);
    } catch (SftpException e) {
      throw translate(path, e);
    }
  }

  @Override
  public String workingDirectory() throws IOException {
    return sftpClient.canonicalPath(CURRENT_DIR);
  }

  /**
   * Closes the SFTP channel, then the SSH session. The first failure is rethrown.
   */
  @Override
  public void close() throws IOException {
    IOException failure = null;
    try {
      sftpClient.close();
    } catch (IOException e) {
      failure = e;
    }
    try {
      session.close();
    } catch (IOException e) {
      if (failure == null) {
        failure = e;
      } else {
        failure.addSuppressed(e);
      }
    }
    if (failure != null) {
      throw failure;
    }
  }

  private static IOException translate(String path, SftpException e) {
    if (e.getStatus() == SftpConstants.SSH_FX_NO_SUCH_FILE) {
      NoSuchFileException missing = new NoSuchFileException(path);
      missing.initCause(e);
      return missing;
    }
    return e;
  }

  private static RemoteAttributes toAttributes(SftpClient.Attributes attributes) {
    FileTime modifyTime = attributes.getModifyTime();
    return new RemoteAttributes(
        attributes.getSize(),
        attributes.getPermissions(),
        modifyTime != null ? modifyTime.toInstant() : Instant.EPOCH,
        attributes.isDirectory());
  }
}
