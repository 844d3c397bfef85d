package com.example.sftpbroker.web.rest.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Several remote paths in one request, for batch delete and archive download.
 */
public record PathsRequest(
    @NotNull(message = "Paths are required") List<@NotBlank(message = "Paths must not be blank") String> paths
) {}
