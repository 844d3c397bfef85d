package com.example.sftpbroker.domain.entity;

/**
 * One step of the navigation trail for a remote directory.
 */
public record Breadcrumb(String name, String path) {}
