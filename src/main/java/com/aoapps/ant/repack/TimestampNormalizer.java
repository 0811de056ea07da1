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

import java.io.File;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributeView;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Sets the last-accessed and last-modified times of every file in a directory tree to the same fixed time.
 * <p>
 * File times are the dominant source of differences between otherwise identical archives.  Once normalized, only
 * the path, content and permissions of each file remain.
 * </p>
 *
 * @author  AO Industries, Inc.
 */
public final class TimestampNormalizer {

  /** Make no instances. */
  private TimestampNormalizer() {
    throw new AssertionError();
  }

  private static final Logger logger = Logger.getLogger(TimestampNormalizer.class.getName());

  /**
   * Implementation of {@link #normalize(java.io.File, java.time.Instant)} with provided logging.
   */
  static int normalize(File directory, Instant timestamp, Consumer<Supplier<String>> debug) throws FilesystemException {
    Objects.requireNonNull(directory, "directory required");
    Objects.requireNonNull(timestamp, "timestamp required");
    if (!directory.isDirectory()) {
      throw new FilesystemException("Not a directory: " + directory);
    }
    FileTime time = FileTime.from(timestamp);
    int[] count = {0};
    try {
      Files.walkFileTree(directory.toPath(), new SimpleFileVisitor<Path>() {
        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
          if (attrs.isRegularFile()) {
            try {
              Files.getFileAttributeView(file, BasicFileAttributeView.class).setTimes(time, time, null);
            } catch (IOException e) {
              throw new FilesystemException("Unable to set timestamps of " + file + " to " + timestamp, e);
            }
            count[0]++;
          }
          return FileVisitResult.CONTINUE;
        }
      });
    } catch (FilesystemException e) {
      throw e;
    } catch (IOException e) {
      throw new FilesystemException("Unable to normalize timestamps in " + directory, e);
    }
    debug.accept(() -> "Normalized timestamps of " + count[0] + (count[0] == 1 ? " file" : " files") + " in "
        + directory + " to " + timestamp);
    return count[0];
  }

  /**
   * Sets both the last-accessed and last-modified times of every regular file below {@code directory} to
   * {@code timestamp}.  Directories are not changed.
   *
   * @return  the number of files normalized
   *
   * @throws FilesystemException when any file time cannot be set, since that file would otherwise keep its
   *                             original time
   */
  public static int normalize(File directory, Instant timestamp) throws FilesystemException {
    return normalize(directory, timestamp, logger::fine);
  }
}
