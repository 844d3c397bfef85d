package com.example.sftpbroker.util;

import com.example.sftpbroker.domain.entity.Breadcrumb;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * POSIX path helpers for remote paths. Remote paths always use {@code /}, whatever the local OS.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class RemotePaths {

  public static final String ROOT = "/";
  private static final String SEPARATOR = "/";
  private static final String HOME_CRUMB = "Home";

  /**
   * Cleans a remote path: collapses {@code .}, {@code ..} and duplicate separators.
   * A blank path resolves to {@code fallback}; {@code ..} never climbs above the root.
   */
  public static String normalize(String path, String fallback) {
    if (!StringUtils.hasText(path)) {
      return fallback;
    }
    boolean absolute = path.startsWith(SEPARATOR);
    List<String> segments = new ArrayList<>();
    for (String segment : path.split(SEPARATOR)) {
      if (segment.isEmpty() || ".".equals(segment)) {
        continue;
      }
      if ("..".equals(segment)) {
        if (!segments.isEmpty() && !"..".equals(segments.get(segments.size() - 1))) {
          segments.remove(segments.size() - 1);
        } else if (!absolute) {
          segments.add(segment);
        }
        continue;
      }
      segments.add(segment);
    }
    String joined = String.join(SEPARATOR, segments);
    if (absolute) {
      return SEPARATOR + joined;
    }
    return joined.isEmpty() ? "." : joined;
  }

  public static String normalize(String path) {
    return normalize(path, ROOT);
  }

  public static String join(String directory, String name) {
    if (directory.endsWith(SEPARATOR)) {
      return directory + name;
    }
    return directory + SEPARATOR + name;
  }

  /**
   * Last path segment; the root's base name is {@code /}.
   */
  public static String baseName(String path) {
    String cleaned = normalize(path);
    if (ROOT.equals(cleaned)) {
      return ROOT;
    }
    return cleaned.substring(cleaned.lastIndexOf(SEPARATOR) + 1);
  }

  public static List<Breadcrumb> breadcrumbs(String currentPath) {
    List<Breadcrumb> crumbs = new ArrayList<>();
    crumbs.add(new Breadcrumb(HOME_CRUMB, ROOT));

    StringBuilder current = new StringBuilder();
    for (String part : normalize(currentPath).split(SEPARATOR)) {
      if (part.isEmpty()) {
        continue;
      }
      current.append(SEPARATOR).append(part);
      crumbs.add(new Breadcrumb(part, current.toString()));
    }
    return crumbs;
  }
}
