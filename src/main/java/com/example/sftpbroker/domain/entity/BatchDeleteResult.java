package com.example.sftpbroker.domain.entity;

import java.util.List;

/**
 * Outcome of a multi-path delete. Every requested path appears in exactly one list.
 */
public record BatchDeleteResult(List<String> deleted, List<String> failed) {}
