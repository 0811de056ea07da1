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

import java.io.Closeable;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.logging.Logger;
import org.apache.commons.io.FileUtils;

/**
 * The working directory owned by one repackaging run.
 * <p>
 * Any directory left at the same location by an interrupted run is removed before a fresh, empty directory is
 * created.  {@link #close()} removes the directory again, whether the run succeeded or not.
 * </p>
 * <p>
 * Each archive is given its own extraction directory and staging file, named after the archive, so jobs never
 * share paths.  Two archives mapping to the same names is a naming collision and fails the second job.
 * </p>
 *
 * @author  AO Industries, Inc.
 */
public final class ScratchSpace implements Closeable {

  private static final Logger logger = Logger.getLogger(ScratchSpace.class.getName());

  /**
   * The archive extension removed from archive names to get the job directory name.
   */
  private static final String ARCHIVE_EXTENSION = ".zip";

  /**
   * Appended to the job directory name to get the staging file name.
   */
  static final String STAGING_SUFFIX = ARCHIVE_EXTENSION + ".new";

  /**
   * Gets the name of the directory an archive is extracted into: its file name without any {@code .zip} extension.
   */
  static String getBaseName(File archive) {
    String name = archive.getName();
    if (name.toLowerCase(Locale.ROOT).endsWith(ARCHIVE_EXTENSION) && name.length() > ARCHIVE_EXTENSION.length()) {
      return name.substring(0, name.length() - ARCHIVE_EXTENSION.length());
    }
    return name;
  }

  /**
   * Implementation of {@link #create(java.io.File)} with provided logging.
   */
  static ScratchSpace create(
      File root,
      Consumer<Supplier<String>> debug,
      Consumer<Supplier<String>> info,
      Consumer<Supplier<String>> warn
  ) throws FilesystemException {
    Objects.requireNonNull(root, "root required");
    if (root.exists() || Files.isSymbolicLink(root.toPath())) {
      info.accept(() -> "Removing scratch directory left by a previous run: " + root);
      try {
        FileUtils.forceDelete(root);
      } catch (FileNotFoundException | NoSuchFileException e) {
        debug.accept(() -> "Scratch directory already removed: " + root);
      } catch (IOException e) {
        throw new FilesystemException("Unable to remove stale scratch directory: " + root, e);
      }
    }
    try {
      FileUtils.forceMkdir(root);
    } catch (IOException e) {
      throw new FilesystemException("Unable to create scratch directory: " + root, e);
    }
    debug.accept(() -> "Created scratch directory: " + root);
    return new ScratchSpace(root, debug, warn);
  }

  /**
   * Removes anything at {@code root} and creates it as a new, empty directory.
   *
   * @throws FilesystemException when the directory cannot be removed or created.  No archive can be processed.
   */
  public static ScratchSpace create(File root) throws FilesystemException {
    return create(root, logger::fine, logger::info, logger::warning);
  }

  private final File root;
  private final Consumer<Supplier<String>> debug;
  private final Consumer<Supplier<String>> warn;
  private final Set<String> reservedNames = ConcurrentHashMap.newKeySet();
  private final AtomicBoolean closed = new AtomicBoolean();

  private ScratchSpace(File root, Consumer<Supplier<String>> debug, Consumer<Supplier<String>> warn) {
    this.root = root;
    this.debug = debug;
    this.warn = warn;
  }

  /**
   * The directory owned by this run.
   */
  public File getRoot() {
    return root;
  }

  /**
   * Reserves the scratch paths for one archive.  The extraction directory and staging file do not exist yet.
   *
   * @throws FilesystemException when another job already holds the same names, or the paths already exist
   */
  public RepackJob newJob(File archive) throws FilesystemException {
    Objects.requireNonNull(archive, "archive required");
    if (closed.get()) {
      throw new IllegalStateException("Scratch directory already closed: " + root);
    }
    String baseName = getBaseName(archive);
    String stagingName = baseName + STAGING_SUFFIX;
    if (!reservedNames.add(baseName)) {
      throw new FilesystemException("Scratch directory name collision for " + archive + ": " + baseName);
    }
    if (!reservedNames.add(stagingName)) {
      reservedNames.remove(baseName);
      throw new FilesystemException("Scratch staging name collision for " + archive + ": " + stagingName);
    }
    File extractDirectory = new File(root, baseName);
    File stagingFile = new File(root, stagingName);
    if (extractDirectory.exists() || stagingFile.exists()) {
      reservedNames.remove(baseName);
      reservedNames.remove(stagingName);
      throw new FilesystemException("Scratch paths already exist for " + archive + ": " + extractDirectory
          + ", " + stagingFile);
    }
    debug.accept(() -> "Reserved " + extractDirectory + " and " + stagingFile + " for " + archive);
    return new RepackJob(this, archive, extractDirectory, stagingFile);
  }

  /**
   * Removes the scratch paths of a finished job, best-effort, and makes its names available again.
   */
  void release(RepackJob job) {
    deleteQuietly(job.getStagingFile());
    deleteQuietly(job.getExtractDirectory());
    reservedNames.remove(job.getStagingFile().getName());
    reservedNames.remove(job.getExtractDirectory().getName());
  }

  private void deleteQuietly(File file) {
    if (file.exists()) {
      try {
        FileUtils.forceDelete(file);
      } catch (IOException e) {
        warn.accept(() -> "Unable to remove scratch path, will retry with scratch directory: " + file + ": " + e);
      }
    }
  }

  /**
   * Removes the scratch directory and everything in it.  Failure is only logged, the next run removes it anyway.
   */
  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      try {
        FileUtils.deleteDirectory(root);
        debug.accept(() -> "Removed scratch directory: " + root);
      } catch (IOException | RuntimeException e) {
        warn.accept(() -> "Unable to remove scratch directory: " + root + ": " + e);
      }
    }
  }
}
