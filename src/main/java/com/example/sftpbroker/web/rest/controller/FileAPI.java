package com.example.sftpbroker.web.rest.controller;

import static com.example.sftpbroker.web.rest.ApiConstants.ApiPath.*;

import com.example.sftpbroker.domain.entity.BatchDeleteResult;
import com.example.sftpbroker.domain.entity.FileEntry;
import com.example.sftpbroker.domain.entity.PreviewResult;
import com.example.sftpbroker.domain.entity.SftpSession;
import com.example.sftpbroker.web.rest.dto.DirectoryListing;
import com.example.sftpbroker.web.rest.dto.PathRequest;
import com.example.sftpbroker.web.rest.dto.PathsRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.util.Map;

@Tag(
    name = "Files",
    description = "Browse, transfer and manage files on the session's SFTP server"
)
@RequestMapping(value = API_BASE + FILES)
public interface FileAPI {

  @Operation(
      summary = "List a directory",
      description = "Directories first, then files by name. A blank path lists the home directory."
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Listing returned"),
      @ApiResponse(responseCode = "401", description = "Session invalid or expired"),
      @ApiResponse(responseCode = "500", description = "Directory could not be read")
  })
  @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<DirectoryListing> listDirectory(
      @Parameter(hidden = true) @AuthenticationPrincipal SftpSession session,
      @Parameter(description = "Remote directory", example = "/home/alice")
      @RequestParam(required = false) String path,
      @Parameter(description = "Include dot files")
      @RequestParam(defaultValue = "false") boolean showHidden,
      @Parameter(description = "images, documents, archives, code, or a name substring")
      @RequestParam(required = false) String filter
                                                );

  @Operation(summary = "Stat a file or directory")
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Entry returned"),
      @ApiResponse(responseCode = "500", description = "Path could not be stat'ed")
  })
  @GetMapping(value = STAT, produces = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<FileEntry> stat(
      @Parameter(hidden = true) @AuthenticationPrincipal SftpSession session,
      @RequestParam String path
                                );

  @Operation(
      summary = "Download a file",
      description = "Streams the file content as an attachment"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "File content"),
      @ApiResponse(responseCode = "400", description = "Path is a directory"),
      @ApiResponse(responseCode = "500", description = "File could not be read")
  })
  @GetMapping(value = DOWNLOAD)
  ResponseEntity<StreamingResponseBody> download(
      @Parameter(hidden = true) @AuthenticationPrincipal SftpSession session,
      @RequestParam String path
                                                );

  @Operation(
      summary = "Upload a file",
      description = "Writes the uploaded file into the target directory, keeping its original name"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "201", description = "File written"),
      @ApiResponse(responseCode = "409", description = "File exists and overwrite is false"),
      @ApiResponse(responseCode = "413", description = "File larger than the upload limit")
  })
  @PostMapping(value = UPLOAD,
               consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
               produces = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<Map<String, Object>> upload(
      @Parameter(hidden = true) @AuthenticationPrincipal SftpSession session,
      @RequestParam("file") MultipartFile file,
      @Parameter(description = "Target directory; blank means the home directory")
      @RequestParam(required = false) String path,
      @RequestParam(defaultValue = "false") boolean overwrite
                                            );

  @Operation(
      summary = "Delete a file or empty directory",
      description = "Non-empty directories are not deleted"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "204", description = "Deleted"),
      @ApiResponse(responseCode = "500", description = "Delete failed")
  })
  @DeleteMapping
  ResponseEntity<Void> delete(
      @Parameter(hidden = true) @AuthenticationPrincipal SftpSession session,
      @RequestParam String path
                             );

  @Operation(
      summary = "Delete several entries",
      description = "Each path is deleted independently; failures are reported, not raised"
  )
  @PostMapping(value = DELETE,
               consumes = MediaType.APPLICATION_JSON_VALUE,
               produces = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<BatchDeleteResult> deleteBatch(
      @Parameter(hidden = true) @AuthenticationPrincipal SftpSession session,
      @Valid @RequestBody PathsRequest request
                                               );

  @Operation(
      summary = "Preview a text file",
      description = "Returns the content of a small file with a syntax-highlighting language"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Preview returned"),
      @ApiResponse(responseCode = "400", description = "Path is a directory"),
      @ApiResponse(responseCode = "413", description = "File larger than the preview limit")
  })
  @GetMapping(value = PREVIEW, produces = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<PreviewResult> preview(
      @Parameter(hidden = true) @AuthenticationPrincipal SftpSession session,
      @RequestParam String path
                                       );

  @Operation(summary = "Create a directory")
  @ApiResponses(value = {
      @ApiResponse(responseCode = "201", description = "Directory created"),
      @ApiResponse(responseCode = "500", description = "Directory could not be created")
  })
  @PostMapping(value = MKDIR,
               consumes = MediaType.APPLICATION_JSON_VALUE,
               produces = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<Map<String, Object>> createDirectory(
      @Parameter(hidden = true) @AuthenticationPrincipal SftpSession session,
      @Valid @RequestBody PathRequest request
                                                     );

  @Operation(
      summary = "Download several entries as a ZIP archive",
      description = "Directories are added recursively. Unreadable entries are skipped."
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "ZIP stream")
  })
  @PostMapping(value = ARCHIVE, consumes = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<StreamingResponseBody> downloadArchive(
      @Parameter(hidden = true) @AuthenticationPrincipal SftpSession session,
      @Valid @RequestBody PathsRequest request
                                                       );
}
