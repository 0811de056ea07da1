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
import java.io.UncheckedIOException;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitOption;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Resolves the archives to repackage.
 * <p>
 * Some archives are known ahead of time, while others are only produced by later or auxiliary build steps.
 * Both are merged into one list in which each archive appears once.
 * </p>
 *
 * @author  AO Industries, Inc.
 */
public final class ArchiveLocator {

  /** Make no instances. */
  private ArchiveLocator() {
    throw new AssertionError();
  }

  private static final Logger logger = Logger.getLogger(ArchiveLocator.class.getName());

  /**
   * The pattern used to discover archives when none is specified.
   */
  public static final String DEFAULT_PATTERN = "**/*.zip";

  private static final String ANY_DIRECTORIES = "**/";

  /**
   * Gets a matcher for a glob pattern, applied to paths relative to the search directory.
   * A leading <code>**&#47;</code> also matches zero directories, so {@link #DEFAULT_PATTERN} finds archives
   * directly in the search directory.
   */
  static PathMatcher getMatcher(String pattern) {
    Objects.requireNonNull(pattern, "pattern required");
    FileSystem fileSystem = FileSystems.getDefault();
    PathMatcher matcher = fileSystem.getPathMatcher("glob:" + pattern);
    if (pattern.startsWith(ANY_DIRECTORIES)) {
      PathMatcher tailMatcher = fileSystem.getPathMatcher("glob:" + pattern.substring(ANY_DIRECTORIES.length()));
      return path -> matcher.matches(path) || tailMatcher.matches(path);
    }
    return matcher;
  }

  /**
   * Two archives are the same when their absolute, normalized paths are equal.
   */
  private static Path toKey(File archive) {
    return archive.getAbsoluteFile().toPath().normalize();
  }

  /**
   * Implementation of {@link #locate(java.util.List, java.io.File, java.lang.String)}
   * with provided logging.
   */
  static List<File> locate(
      List<File> explicitArchives,
      File searchDirectory,
      String pattern,
      Consumer<Supplier<String>> debug
  ) throws IOException {
    Objects.requireNonNull(explicitArchives, "explicitArchives required");
    Map<Path, File> archives = new LinkedHashMap<>();
    for (File archive : explicitArchives) {
      Objects.requireNonNull(archive, "explicitArchives may not contain null");
      if (archives.putIfAbsent(toKey(archive), archive.getAbsoluteFile()) != null) {
        debug.accept(() -> "Duplicate archive listed more than once: " + archive);
      }
    }
    if (searchDirectory != null) {
      PathMatcher matcher = getMatcher(pattern);
      if (!searchDirectory.exists()) {
        debug.accept(() -> "searchDirectory does not exist, nothing to discover: " + searchDirectory);
      } else if (!searchDirectory.isDirectory()) {
        throw new IOException("searchDirectory is not a directory: " + searchDirectory);
      } else {
        Path searchPath = searchDirectory.toPath();
        try (Stream<Path> walk = Files.walk(searchPath, FileVisitOption.FOLLOW_LINKS)) {
          Iterator<Path> iter = walk.iterator();
          while (iter.hasNext()) {
            Path path = iter.next();
            if (Files.isRegularFile(path) && matcher.matches(searchPath.relativize(path))) {
              File archive = path.toFile();
              if (archives.putIfAbsent(toKey(archive), archive.getAbsoluteFile()) == null) {
                debug.accept(() -> "Discovered archive: " + archive);
              } else {
                debug.accept(() -> "Discovered archive already listed: " + archive);
              }
            }
          }
        } catch (UncheckedIOException e) {
          throw e.getCause();
        }
      }
    }
    return new ArrayList<>(archives.values());
  }

  /**
   * Gets all of {@code explicitArchives}, in order, followed by every regular file below {@code searchDirectory}
   * matching {@code pattern} that is not already listed, in the order found.
   * <p>
   * Symbolic links are followed and hidden files are included.
   * </p>
   *
   * @param explicitArchives  The archives expected from known build targets.  These need not exist yet.
   * @param searchDirectory   The directory to scan, or {@code null} to not scan.  A directory that does not exist
   *                          contributes nothing.
   * @param pattern           The glob, relative to {@code searchDirectory}, such as {@link #DEFAULT_PATTERN}
   *
   * @return  the absolute paths of the archives, each listed only once
   */
  public static List<File> locate(List<File> explicitArchives, File searchDirectory, String pattern) throws IOException {
    return locate(explicitArchives, searchDirectory, pattern, logger::fine);
  }
}
