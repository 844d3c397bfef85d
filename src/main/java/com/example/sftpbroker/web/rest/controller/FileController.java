package com.example.sftpbroker.web.rest.controller;

import com.example.sftpbroker.domain.entity.BatchDeleteResult;
import com.example.sftpbroker.domain.entity.FileEntry;
import com.example.sftpbroker.domain.entity.PreviewResult;
import com.example.sftpbroker.domain.entity.SftpSession;
import com.example.sftpbroker.exception.FileTooLargeException;
import com.example.sftpbroker.exception.NotAFileException;
import com.example.sftpbroker.exception.RemoteIOException;
import com.example.sftpbroker.properties.ApplicationProperties;
import com.example.sftpbroker.service.ArchiveService;
import com.example.sftpbroker.service.TransferService;
import com.example.sftpbroker.util.FileTypes;
import com.example.sftpbroker.util.RemotePaths;
import com.example.sftpbroker.web.rest.dto.DirectoryListing;
import com.example.sftpbroker.web.rest.dto.PathRequest;
import com.example.sftpbroker.web.rest.dto.PathsRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * File browsing and transfer endpoints. Every call runs on the connection of the session
 * resolved from the cookie.
 */
@RestController
@Slf4j
@RequiredArgsConstructor
public class FileController implements FileAPI {

  private static final MediaType APPLICATION_ZIP = MediaType.parseMediaType("application/zip");

  private final TransferService transferService;
  private final ArchiveService archiveService;
  private final ApplicationProperties properties;

  @Override
  public ResponseEntity<DirectoryListing> listDirectory(SftpSession session, String path,
                                                        boolean showHidden, String filter) {
    String directory = RemotePaths.normalize(path, session.getHomeDirectory());
    List<FileEntry> entries =
        transferService.listDirectory(session, directory, showHidden, FileTypes.filterFor(filter));
    return ResponseEntity.ok(new DirectoryListing(directory, RemotePaths.breadcrumbs(directory), entries));
  }

  @Override
  public ResponseEntity<FileEntry> stat(SftpSession session, String path) {
    return ResponseEntity.ok(transferService.stat(session, path));
  }

  @Override
  public ResponseEntity<StreamingResponseBody> download(SftpSession session, String path) {
    FileEntry entry = transferService.stat(session, path);
    if (entry.directory()) {
      throw new NotAFileException(entry.fullPath(), "Cannot download a directory");
    }
    log.debug("Session {} downloading {} ({} bytes)", session.maskedId(), entry.fullPath(), entry.size());

    // no Content-Length: the file may change size before the body is streamed
    StreamingResponseBody body = out -> transferService.download(session, entry.fullPath(), out);
    return ResponseEntity.ok()
        .contentType(FileTypes.contentTypeOf(entry.name()))
        .header(HttpHeaders.CONTENT_DISPOSITION, attachment(entry.name()))
        .body(body);
  }

  @Override
  public ResponseEntity<Map<String, Object>> upload(SftpSession session, MultipartFile file,
                                                    String path, boolean overwrite) {
    String fileName = StringUtils.getFilename(StringUtils.cleanPath(
        file.getOriginalFilename() == null ? "" : file.getOriginalFilename()));
    if (!StringUtils.hasText(fileName) || "..".equals(fileName)) {
      throw new IllegalArgumentException("File name is required");
    }
    String directory = RemotePaths.normalize(path, session.getHomeDirectory());
    String destination = RemotePaths.join(directory, fileName);

    long maxUpload = properties.transfer().maxUploadSize().toBytes();
    if (file.getSize() > maxUpload) {
      throw new FileTooLargeException(destination,
          "File too large for upload (%d > %d bytes)".formatted(file.getSize(), maxUpload));
    }

    try (InputStream in = file.getInputStream()) {
      transferService.uploadFile(session, destination, in, overwrite);
    } catch (IOException e) {
      throw new RemoteIOException(destination, "Failed to read uploaded file", e);
    }
    log.info("Session {} uploaded {} ({} bytes)", session.maskedId(), destination, file.getSize());

    return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
        "path", destination,
        "size", file.getSize()
                                                               ));
  }

  @Override
  public ResponseEntity<Void> delete(SftpSession session, String path) {
    transferService.deleteEntry(session, path);
    log.info("Session {} deleted {}", session.maskedId(), path);
    return ResponseEntity.noContent().build();
  }

  @Override
  public ResponseEntity<BatchDeleteResult> deleteBatch(SftpSession session, PathsRequest request) {
    BatchDeleteResult result = transferService.deleteEntries(session, request.paths());
    log.info("Session {} batch delete: {} deleted, {} failed",
             session.maskedId(), result.deleted().size(), result.failed().size());
    return ResponseEntity.ok(result);
  }

  @Override
  public ResponseEntity<PreviewResult> preview(SftpSession session, String path) {
    long maxPreview = properties.transfer().maxPreviewSize().toBytes();
    return ResponseEntity.ok(transferService.previewFile(session, path, maxPreview));
  }

  @Override
  public ResponseEntity<Map<String, Object>> createDirectory(SftpSession session, PathRequest request) {
    transferService.createDirectory(session, request.path());
    String created = RemotePaths.normalize(request.path());
    log.info("Session {} created directory {}", session.maskedId(), created);
    return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("path", created));
  }

  @Override
  public ResponseEntity<StreamingResponseBody> downloadArchive(SftpSession session, PathsRequest request) {
    List<String> paths = List.copyOf(request.paths());
    StreamingResponseBody body = out -> archiveService.streamArchive(session, paths, out);
    return ResponseEntity.ok()
        .contentType(APPLICATION_ZIP)
        .header(HttpHeaders.CONTENT_DISPOSITION, attachment(properties.transfer().archiveFileName()))
        .body(body);
  }

  private static String attachment(String fileName) {
    return ContentDisposition.attachment()
        .filename(fileName, StandardCharsets.UTF_8)
        .build()
        .toString();
  }
}
