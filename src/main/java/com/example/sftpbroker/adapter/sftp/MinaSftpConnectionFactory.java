package com.example.sftpbroker.adapter.sftp;

import com.example.sftpbroker.exception.ConnectionException;
import com.example.sftpbroker.properties.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.sshd.client.SshClient;
import org.apache.sshd.client.session.ClientSession;
import org.apache.sshd.sftp.client.SftpClient;
import org.apache.sshd.sftp.client.SftpClientFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;

/**
 * SFTP connection factory backed by Apache MINA SSHD.
 * One SSH session and one SFTP channel per connection; password authentication only.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MinaSftpConnectionFactory implements ConnectionFactory {

  private final SshClient sshClient;
  private final ApplicationProperties properties;

  @Override
  public RemoteConnection connect(String host, int port, String username, String credential, Duration timeout) {
    ClientSession session = null;
    try {
      session = sshClient.connect(username, host, port)
          .verify(timeout.toMillis())
          .getSession();
      session.addPasswordIdentity(credential);
      session.auth().verify(properties.sftp().authTimeout().toMillis());

      SftpClient sftpClient = SftpClientFactory.instance().createSftpClient(session);
      log.debug("Opened SFTP channel to {}@{}:{}", username, host, port);
      return new MinaSftpConnection(session, sftpClient);
    } catch (IOException | RuntimeException e) {
      closeQuietly(session, host);
      throw new ConnectionException(
          "Failed to connect to %s@%s:%d: %s".formatted(username, host, port, e.getMessage()), e);
    }
  }

  private void closeQuietly(ClientSession session, String host) {
    if (session == null) {
      return;
    }
    try {
      session.close();
    } catch (IOException e) {
      log.warn("Could not close half-open SSH session to {}", host, e);
    }
  }
}
