package com.example.sftpbroker.domain.entity;

import java.time.Instant;

/**
 * Immutable snapshot of one remote filesystem entry, taken from a single stat or listing call.
 *
 * @param mode     permissions in {@code ls -l} form, e.g. {@code drwxr-xr-x}
 * @param fullPath absolute remote path
 */
public record FileEntry(
    String name,
    long size,
    String mode,
    Instant modifiedAt,
    boolean directory,
    String fullPath
) {}
