package com.example.sftpbroker.service;

import com.example.sftpbroker.domain.entity.ArchiveReport;
import com.example.sftpbroker.domain.entity.ArchiveReport.SkippedEntry;
import com.example.sftpbroker.domain.entity.ConnectionTarget;
import com.example.sftpbroker.domain.entity.SftpSession;
import com.example.sftpbroker.support.InMemoryRemoteConnection;
import com.example.sftpbroker.support.InMemoryRemoteConnection.Operation;
import com.example.sftpbroker.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.util.unit.DataSize;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import static org.assertj.core.api.Assertions.assertThat;

class ArchiveServiceTest {

  private InMemoryRemoteConnection remote;
  private SftpSession session;
  private ArchiveService archiveService;
  private ByteArrayOutputStream sink;

  @BeforeEach
  void setUp() {
    remote = new InMemoryRemoteConnection()
        .addFile("/data/fileA.txt", "alpha")
        .addDirectory("/data/dirB")
        .addFile("/data/dirB/c.txt", "charlie")
        .addFile("/data/dirB/d.txt", "delta");
    session = new SftpSession("0123456789abcdef0123456789abcdef",
                              new ConnectionTarget("sftp.example.com", 22, "alice"),
                              remote, "/data", Instant.now());
    archiveService = new ArchiveService(TestProperties.builder().bufferSize(DataSize.ofKilobytes(1)).build());
    sink = new ByteArrayOutputStream();
  }

  @Test
  void archivesFilesAndDirectoriesSkippingUnreadableEntries() throws IOException {
    remote.failOn("/data/dirB/d.txt", Operation.OPEN);

    ArchiveReport report = archiveService.streamArchive(session, List.of("/data/fileA.txt", "/data/dirB/"), sink);

    Map<String, String> entries = readZip(sink.toByteArray());
    assertThat(entries.keySet()).containsExactly("fileA.txt", "dirB/", "dirB/c.txt");
    assertThat(entries).containsEntry("fileA.txt", "alpha").containsEntry("dirB/c.txt", "charlie");
    assertThat(report.filesAdded()).isEqualTo(2);
    assertThat(report.directoriesAdded()).isEqualTo(1);
    assertThat(report.skipped()).extracting(SkippedEntry::path).containsExactly("/data/dirB/d.txt");
    assertThat(report.aborted()).isFalse();
  }

  @Test
  void entryNamesAreRelativeToTheRequestedPath() throws IOException {
    remote.addFile("/data/dirB/nested/deep.txt", "deep");

    archiveService.streamArchive(session, List.of("/data/dirB"), sink);

    assertThat(readZip(sink.toByteArray()).keySet())
        .containsExactlyInAnyOrder("dirB/", "dirB/c.txt", "dirB/d.txt", "dirB/nested/", "dirB/nested/deep.txt");
  }

  @Test
  void emptyRequestProducesValidEmptyArchive() throws IOException {
    ArchiveReport report = archiveService.streamArchive(session, List.of(), sink);

    assertThat(sink.size()).isPositive();
    assertThat(readZip(sink.toByteArray())).isEmpty();
    assertThat(report).isEqualTo(new ArchiveReport(0, 0, List.of(), false));
  }

  @Test
  void missingAndUnlistablePathsAreSkipped() throws IOException {
    remote.failOn("/data/dirB", Operation.LIST);

    ArchiveReport report = archiveService.streamArchive(
        session, List.of("/data/nope.txt", "/data/dirB", "/data/fileA.txt"), sink);

    assertThat(readZip(sink.toByteArray()).keySet()).containsExactly("fileA.txt");
    assertThat(report.skipped()).extracting(SkippedEntry::path).containsExactly("/data/nope.txt", "/data/dirB");
  }

  @Test
  void readFailureMidFileKeepsArchiveValid() throws IOException {
    remote.failOn("/data/dirB/c.txt", Operation.READ);

    ArchiveReport report = archiveService.streamArchive(session, List.of("/data/dirB"), sink);

    Map<String, String> entries = readZip(sink.toByteArray());
    assertThat(entries).containsEntry("dirB/d.txt", "delta");
    assertThat(entries.get("dirB/c.txt")).isEqualTo("cha");
    assertThat(report.skipped()).singleElement()
        .satisfies(skipped -> assertThat(skipped.reason()).contains("truncated"));
  }

  @Test
  void duplicateNamesKeepFirstEntry() throws IOException {
    remote.addFile("/other/fileA.txt", "second");

    ArchiveReport report = archiveService.streamArchive(
        session, List.of("/data/fileA.txt", "/other/fileA.txt"), sink);

    assertThat(readZip(sink.toByteArray())).containsExactly(Map.entry("fileA.txt", "alpha"));
    assertThat(report.filesAdded()).isEqualTo(1);
    assertThat(report.skipped()).extracting(SkippedEntry::path).containsExactly("/other/fileA.txt");
  }

  @Test
  void sinkFailureStopsTheWalk() {
    OutputStream failingSink = new OutputStream() {
      @Override
      public void write(int b) throws IOException {
        throw new IOException("Broken pipe");
      }
    };

    ArchiveReport report = archiveService.streamArchive(
        session, List.of("/data/fileA.txt", "/data/dirB"), failingSink);

    assertThat(report.aborted()).isTrue();
    assertThat(report.filesAdded()).isZero();
    assertThat(remote.openedPaths()).containsExactly("/data/fileA.txt");
  }

  @Test
  void closedSessionYieldsEmptyArchiveWithEverythingSkipped() throws IOException {
    session.close();

    ArchiveReport report = archiveService.streamArchive(session, List.of("/data/fileA.txt"), sink);

    assertThat(readZip(sink.toByteArray())).isEmpty();
    assertThat(report.skipped()).containsExactly(new SkippedEntry("/data/fileA.txt", "session closed"));
    assertThat(remote.usedAfterClose()).isEmpty();
  }

  @Test
  void rootIsArchivedUnderRootName() throws IOException {
    InMemoryRemoteConnection small = new InMemoryRemoteConnection().addFile("/only.txt", "x");
    SftpSession rootSession = new SftpSession("fedcba9876543210fedcba9876543210",
                                              new ConnectionTarget("h", 22, "root"), small, "/", Instant.now());

    archiveService.streamArchive(rootSession, List.of("/"), sink);

    assertThat(readZip(sink.toByteArray()).keySet()).containsExactly("root/", "root/only.txt");
  }

  private static Map<String, String> readZip(byte[] archive) throws IOException {
    Map<String, String> entries = new LinkedHashMap<>();
    try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(archive))) {
      ZipEntry entry;
      while ((entry = zip.getNextEntry()) != null) {
        entries.put(entry.getName(), new String(zip.readAllBytes(), StandardCharsets.UTF_8));
      }
    }
    return entries;
  }
}
