package com.example.sftpbroker.web.rest.dto;

import jakarta.validation.constraints.NotBlank;

public record PathRequest(@NotBlank(message = "Path is required") String path) {}
