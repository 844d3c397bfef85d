package com.example.sftpbroker.web.rest;

public final class ApiConstants {

  public static final class ApiPath {
    // Base paths
    public static final String AUTH_BASE = "/auth";
    public static final String API_BASE = "/api";
    public static final String HEALTH_BASE = "/health";

    // Auth paths
    public static final String LOGIN = "/login";
    public static final String LOGOUT = "/logout";

    // Session paths
    public static final String SESSION = "/session";
    public static final String INFO = "/info";
    public static final String LIST = "/list";

    // File paths
    public static final String FILES = "/files";
    public static final String STAT = "/stat";
    public static final String DOWNLOAD = "/download";
    public static final String UPLOAD = "/upload";
    public static final String DELETE = "/delete";
    public static final String PREVIEW = "/preview";
    public static final String MKDIR = "/mkdir";
    public static final String ARCHIVE = "/archive";

    // Health paths
    public static final String LIVE = "/live";
    public static final String READY = "/ready";

    private ApiPath() {}
  }

  private ApiConstants() {}
}
