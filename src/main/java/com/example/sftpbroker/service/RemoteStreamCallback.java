package com.example.sftpbroker.service;

import java.io.IOException;
import java.io.InputStream;

/**
 * Consumes a remote file's content. The stream is closed once the callback returns.
 */
@FunctionalInterface
public interface RemoteStreamCallback<T> {

  T doWithStream(InputStream in) throws IOException;
}
