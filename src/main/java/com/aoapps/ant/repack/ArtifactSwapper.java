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
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Replaces an archive with its rebuilt version such that readers only ever see the complete old file or the
 * complete new file.
 *
 * @author  AO Industries, Inc.
 */
public final class ArtifactSwapper {

  /** Make no instances. */
  private ArtifactSwapper() {
    throw new AssertionError();
  }

  private static final Logger logger = Logger.getLogger(ArtifactSwapper.class.getName());

  /**
   * Gives {@code to} the same POSIX permissions as {@code from}, when both exist on filesystems supporting them.
   * This keeps the permissions of the archive being replaced.
   */
  private static void copyPermissions(Path from, Path to) throws IOException {
    if (
        Files.exists(from)
        && Files.getFileStore(from).supportsFileAttributeView(PosixFileAttributeView.class)
        && Files.getFileStore(to).supportsFileAttributeView(PosixFileAttributeView.class)
    ) {
      Files.setPosixFilePermissions(to, Files.getPosixFilePermissions(from));
    }
  }

  /**
   * Copies a file and forces its content to storage before returning.
   */
  private static void copyAndForce(Path from, Path to) throws IOException {
    try (
        FileChannel in = FileChannel.open(from, StandardOpenOption.READ);
        FileChannel out = FileChannel.open(to, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)
        ) {
      long size = in.size();
      long position = 0;
      while (position < size) {
        position += in.transferTo(position, size - position, out);
      }
      out.force(true);
    }
  }

  /**
   * Copies {@code staging} into a new file beside {@code target}, then renames that file over {@code target}.
   * Used when {@code staging} is on a different filesystem and cannot simply be renamed.
   * The original is not touched until the copy is complete and on storage.
   */
  // Note: Based on ao-lang:FileUtils.renameAllowNonAtomic, but never writes over the target in-place
  static void replaceByCopy(File staging, File target, Consumer<Supplier<String>> debug) throws SwapException {
    Path targetPath = target.toPath().toAbsolutePath();
    Path temp = null;
    try {
      temp = Files.createTempFile(targetPath.getParent(), "." + target.getName() + '.', ".tmp");
      Path copy = temp;
      debug.accept(() -> "Copying " + staging + " to " + copy);
      copyAndForce(staging.toPath(), temp);
      copyPermissions(targetPath, temp);
      try {
        Files.move(temp, targetPath, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        debug.accept(() -> "Atomic rename within directory not supported, replacing: " + target);
        Files.move(temp, targetPath, StandardCopyOption.REPLACE_EXISTING);
      }
      temp = null;
    } catch (IOException e) {
      throw new SwapException("Unable to copy \"" + staging + "\" over \"" + target + '"', e);
    } finally {
      if (temp != null) {
        try {
          Files.deleteIfExists(temp);
        } catch (IOException e) {
          Path leftover = temp;
          debug.accept(() -> "Unable to remove temporary copy: " + leftover + ": " + e);
        }
      }
    }
    try {
      Files.delete(staging.toPath());
    } catch (IOException e) {
      // The target is already replaced, the staging file is removed with the scratch directory
      debug.accept(() -> "Unable to remove staging file: " + staging + ": " + e);
    }
  }

  /**
   * Implementation of {@link #swap(java.io.File, java.io.File)} with provided logging.
   */
  static void swap(File staging, File target, Consumer<Supplier<String>> debug) throws SwapException {
    Objects.requireNonNull(staging, "staging required");
    Objects.requireNonNull(target, "target required");
    Path stagingPath = staging.toPath();
    Path targetPath = target.toPath();
    try {
      copyPermissions(targetPath, stagingPath);
      Files.move(stagingPath, targetPath, StandardCopyOption.ATOMIC_MOVE);
      debug.accept(() -> "Renamed " + staging + " to " + target);
      return;
    } catch (AtomicMoveNotSupportedException e) {
      debug.accept(() -> "Atomic rename not supported, copying instead: " + staging + " to " + target);
    } catch (IOException e) {
      throw new SwapException("Unable to rename \"" + staging + "\" to \"" + target + '"', e);
    }
    replaceByCopy(staging, target, debug);
  }

  /**
   * Replaces {@code target} with {@code staging}, keeping the permissions of {@code target}.
   * <p>
   * A rename is attempted first, which is a single atomic step on the same filesystem.  Across filesystems,
   * {@code staging} is copied beside {@code target} and renamed over it from there.
   * </p>
   *
   * @throws SwapException when the replacement fails, in which case {@code target} is unchanged
   */
  public static void swap(File staging, File target) throws SwapException {
    swap(staging, target, logger::fine);
  }
}
