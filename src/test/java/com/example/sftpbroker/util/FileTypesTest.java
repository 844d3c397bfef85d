package com.example.sftpbroker.util;

import com.example.sftpbroker.domain.entity.FileEntry;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;

import java.time.Instant;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;

class FileTypesTest {

  @Test
  void languageFromExtension() {
    assertThat(FileTypes.languageOf("main.py")).isEqualTo("python");
    assertThat(FileTypes.languageOf("App.JAVA")).isEqualTo("java");
    assertThat(FileTypes.languageOf("config.yml")).isEqualTo("yaml");
    assertThat(FileTypes.languageOf("README")).isEqualTo("text");
    assertThat(FileTypes.languageOf("data.unknown")).isEqualTo("text");
  }

  @Test
  void categoryFilters() {
    Predicate<FileEntry> images = FileTypes.filterFor("images");
    Predicate<FileEntry> archives = FileTypes.filterFor("Archives");

    assertThat(images.test(entry("photo.JPG"))).isTrue();
    assertThat(images.test(entry("notes.txt"))).isFalse();
    assertThat(archives.test(entry("backup.tar.gz"))).isTrue();
    assertThat(FileTypes.filterFor("documents").test(entry("report.pdf"))).isTrue();
  }

  @Test
  void otherKeywordsMatchNameSubstring() {
    Predicate<FileEntry> filter = FileTypes.filterFor("Report");

    assertThat(filter.test(entry("q3-report.pdf"))).isTrue();
    assertThat(filter.test(entry("summary.pdf"))).isFalse();
    assertThat(FileTypes.filterFor("").test(entry("anything"))).isTrue();
    assertThat(FileTypes.filterFor(null).test(entry("anything"))).isTrue();
  }

  @Test
  void contentTypeDefaultsToOctetStream() {
    assertThat(FileTypes.contentTypeOf("index.html")).isEqualTo(MediaType.TEXT_HTML);
    assertThat(FileTypes.contentTypeOf("blob.nothing")).isEqualTo(MediaType.APPLICATION_OCTET_STREAM);
  }

  private static FileEntry entry(String name) {
    return new FileEntry(name, 1, "-rw-r--r--", Instant.EPOCH, false, "/" + name);
  }
}
