/*
 * ao-ant-repack - Ant task for idempotent repackaging of ZIP build artifacts.
 * Copyright (C) 2026  AO Industries, Inc.
 *     support@aoindustries.com
 *     7262 Bull Pen Cir
 *     Mobile, AL 36695
 *
 * This file is part of ao-ant-repack.
 *
 * ao-ant-repack is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * ao-ant-repack is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with ao-ant-repack.  If not, see <https://www.gnu.org/licenses/>.
 */

package com.aoapps.ant.repack;

import java.nio.charset.StandardCharsets;
import java.nio.file.attribute.PosixFilePermission;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.TimeZone;
import java.util.zip.ZipEntry;

/**
 * ZIP file utilities.
 */
final class ZipUtils {

  /** Make no instances. */
  private ZipUtils() {
    throw new AssertionError();
  }

  /**
   * The permission bits kept from Unix modes.  File type, setuid, setgid and sticky bits are discarded.
   */
  static final int PERMISSION_MASK = 0777;

  /**
   * The mode given to extracted files when their entry carries no Unix mode.
   */
  static final int DEFAULT_FILE_MODE = 0644;

  /**
   * The owner read permission bit.
   */
  static final int OWNER_READ = 0400;

  /**
   * The file type bits of a regular file, combined with permissions when storing a Unix mode.
   */
  static final int REGULAR_FILE_TYPE = 0100000;

  /**
   * The file type bits of a directory, combined with permissions when storing a Unix mode.
   */
  static final int DIRECTORY_TYPE = 040000;

  /**
   * Gets the time for a ZipEntry, converting from UTC as stored in the ZIP
   * entry to make times correct between time zones.
   *
   * @return  the time assuming UTC zone or {@link Optional#empty()} if not specified.
   *
   * @see #setTimeUtc(java.util.zip.ZipEntry, long)
   */
  // Copied from ao-lang:ZipUtils.java
  static Optional<Long> getTimeUtc(ZipEntry entry) {
    long time = entry.getTime();
    return time == -1 ? Optional.empty() : Optional.of(time + TimeZone.getDefault().getOffset(time));
  }

  /**
   * Sets the time for a ZipEntry, converting to UTC while storing to the ZIP
   * entry to make times correct between time zones.  The actual time stored
   * may be rounded to the nearest two-second interval.
   *
   * @see #getTimeUtc(java.util.zip.ZipEntry)
   */
  // Copied from ao-lang:ZipUtils.java
  static void setTimeUtc(ZipEntry entry, long time) {
    entry.setTime(time - TimeZone.getDefault().getOffset(time));
  }

  /**
   * Round to 2-second interval for ZIP time compatibility.
   */
  static long roundDownDosTime(long millis) {
    return Math.floorDiv(millis, 2000) * 2000;
  }

  /**
   * Orders entry names by the unsigned bytes of their UTF-8 encoding.  Unlike {@link String#compareTo(java.lang.String)},
   * which compares UTF-16 code units, this matches the order of the names as stored in the archive.
   */
  static final Comparator<String> NAME_ORDER = (name1, name2) -> Arrays.compareUnsigned(
      name1.getBytes(StandardCharsets.UTF_8),
      name2.getBytes(StandardCharsets.UTF_8)
  );

  private static final PosixFilePermission[] PERMISSION_BITS = {
      // Ordered from bit 8 down to bit 0
      PosixFilePermission.OWNER_READ,
      PosixFilePermission.OWNER_WRITE,
      PosixFilePermission.OWNER_EXECUTE,
      PosixFilePermission.GROUP_READ,
      PosixFilePermission.GROUP_WRITE,
      PosixFilePermission.GROUP_EXECUTE,
      PosixFilePermission.OTHERS_READ,
      PosixFilePermission.OTHERS_WRITE,
      PosixFilePermission.OTHERS_EXECUTE
  };

  /**
   * Converts the permission bits of a Unix mode to POSIX file permissions.
   */
  static Set<PosixFilePermission> toPosixPermissions(int mode) {
    Set<PosixFilePermission> permissions = EnumSet.noneOf(PosixFilePermission.class);
    for (int i = 0; i < PERMISSION_BITS.length; i++) {
      if ((mode & (1 << (PERMISSION_BITS.length - 1 - i))) != 0) {
        permissions.add(PERMISSION_BITS[i]);
      }
    }
    return permissions;
  }

  /**
   * Converts POSIX file permissions to the permission bits of a Unix mode.
   */
  static int toPermissionBits(Set<PosixFilePermission> permissions) {
    int mode = 0;
    for (int i = 0; i < PERMISSION_BITS.length; i++) {
      if (permissions.contains(PERMISSION_BITS[i])) {
        mode |= 1 << (PERMISSION_BITS.length - 1 - i);
      }
    }
    return mode;
  }
}
