package com.example.sftpbroker.adapter.sftp;

import java.io.IOException;

/**
 * Work performed against a session's connection while holding that session's connection guard.
 */
@FunctionalInterface
public interface ConnectionCallback<T> {

  T doWithConnection(RemoteConnection connection) throws IOException;
}
