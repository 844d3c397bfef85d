package com.example.sftpbroker.web.rest.dto;

import com.example.sftpbroker.domain.entity.Breadcrumb;
import com.example.sftpbroker.domain.entity.FileEntry;

import java.util.List;

public record DirectoryListing(String path, List<Breadcrumb> breadcrumbs, List<FileEntry> entries) {}
