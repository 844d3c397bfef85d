package com.example.sftpbroker.domain.entity;

/**
 * Text content of a small remote file and the syntax-highlighting language for it.
 */
public record PreviewResult(String path, String content, String language) {}
