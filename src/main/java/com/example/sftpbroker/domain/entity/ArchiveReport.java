package com.example.sftpbroker.domain.entity;

import java.util.List;

/**
 * What a streamed archive ended up containing.
 *
 * @param skipped requested paths or walked entries left out of the archive, with the reason
 * @param aborted true when the output sink failed and the walk was stopped early
 */
public record ArchiveReport(
    int filesAdded,
    int directoriesAdded,
    List<SkippedEntry> skipped,
    boolean aborted
) {

  public record SkippedEntry(String path, String reason) {}
}
