package com.example.sftpbroker.util;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Renders POSIX permission bits the way {@code ls -l} does.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class FileModes {

  private static final int TYPE_MASK = 0170000;
  private static final int TYPE_SYMLINK = 0120000;
  private static final char[] RWX = {'r', 'w', 'x'};

  public static String format(int permissions, boolean directory) {
    StringBuilder mode = new StringBuilder(10);
    if (directory) {
      mode.append('d');
    } else if ((permissions & TYPE_MASK) == TYPE_SYMLINK) {
      mode.append('l');
    } else {
      mode.append('-');
    }
    for (int bit = 8; bit >= 0; bit--) {
      boolean set = (permissions & (1 << bit)) != 0;
      mode.append(set ? RWX[(8 - bit) % 3] : '-');
    }
    return mode.toString();
  }
}
