package com.example.sftpbroker.adapter.sftp;

import java.time.Instant;

/**
 * Metadata returned by a remote stat or listing call.
 *
 * @param permissions POSIX permission bits, including file type bits when the server sends them
 */
public record RemoteAttributes(
    long size,
    int permissions,
    Instant modifiedAt,
    boolean directory
) {}
