package com.example.sftpbroker.adapter.sftp;

import java.time.Duration;

/**
 * Opens authenticated remote connections.
 */
public interface ConnectionFactory {

  /**
   * @return a ready-to-use connection owned by the caller
   * @throws com.example.sftpbroker.exception.ConnectionException on network or authentication failure
   */
  RemoteConnection connect(String host, int port, String username, String credential, Duration timeout);
}
