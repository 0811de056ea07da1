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
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.util.Enumeration;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.logging.Logger;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.commons.io.IOUtils;

/**
 * Unpacks one ZIP file into a new directory, keeping the relative path, bytes and permissions of every entry.
 * Timestamps are not kept since they are normalized afterwards.
 * <p>
 * Entry names must be representable as file names by the JVM, which depends on its file name encoding
 * ({@code sun.jnu.encoding}, from the locale).  Run with a UTF-8 locale, such as {@code LANG=C.UTF-8}, since
 * under the {@code C} or {@code POSIX} locale any archive with non-ASCII entry names fails to extract.
 * </p>
 *
 * @author  AO Industries, Inc.
 */
public final class ArchiveExtractor {

  /** Make no instances. */
  private ArchiveExtractor() {
    throw new AssertionError();
  }

  private static final Logger logger = Logger.getLogger(ArchiveExtractor.class.getName());

  private static final String AT = " @ ";

  /**
   * Gets the permission bits to give an extracted file.  Entries without Unix permissions get
   * {@link ZipUtils#DEFAULT_FILE_MODE} so the result never depends on the umask of the process.
   * The owner may always read, since the file must be read again to rebuild the archive.
   */
  static int getFileMode(ZipArchiveEntry entry) {
    int mode = ZipUtils.DEFAULT_FILE_MODE;
    if (entry.getPlatform() == ZipArchiveEntry.PLATFORM_UNIX) {
      int permissions = entry.getUnixMode() & ZipUtils.PERMISSION_MASK;
      if (permissions != 0) {
        mode = permissions;
      }
    }
    return mode | ZipUtils.OWNER_READ;
  }

  /**
   * Resolves an entry name within the destination, rejecting names that would escape it.
   *
   * @return  the path of the entry or {@code null} when the entry is the destination itself
   */
  private static Path resolve(File archive, Path destination, ZipArchiveEntry entry) throws ExtractionException {
    String name = entry.getName();
    Path target;
    try {
      target = destination.resolve(name).normalize();
    } catch (InvalidPathException e) {
      throw new ExtractionException("Invalid entry name for file name encoding "
          + System.getProperty("sun.jnu.encoding") + ": " + archive + AT + name, e);
    }
    if (!target.startsWith(destination)) {
      throw new ExtractionException("Entry outside of extraction directory: " + archive + AT + name);
    }
    if (target.equals(destination)) {
      if (!entry.isDirectory()) {
        throw new ExtractionException("File entry without a name: " + archive + AT + name);
      }
      return null;
    }
    return target;
  }

  /**
   * Implementation of {@link #extract(java.io.File, java.io.File)} with provided logging.
   */
  static int extract(File archive, File destination, Consumer<Supplier<String>> debug) throws ExtractionException {
    Objects.requireNonNull(archive, "archive required");
    Objects.requireNonNull(destination, "destination required");
    if (!archive.isFile()) {
      throw new ExtractionException("Archive does not exist or is not a regular file: " + archive);
    }
    Path destinationPath = destination.toPath().toAbsolutePath().normalize();
    boolean posix;
    try {
      Files.createDirectory(destinationPath);
      posix = Files.getFileStore(destinationPath).supportsFileAttributeView(PosixFileAttributeView.class);
    } catch (IOException e) {
      throw new ExtractionException("Unable to create extraction directory: " + destination, e);
    }
    debug.accept(() -> "Extracting " + archive + " into " + destination);
    int fileCount = 0;
    try (ZipFile zipFile = new ZipFile(archive)) {
      Enumeration<ZipArchiveEntry> entries = zipFile.getEntriesInPhysicalOrder();
      while (entries.hasMoreElements()) {
        ZipArchiveEntry entry = entries.nextElement();
        Path target = resolve(archive, destinationPath, entry);
        if (entry.isUnixSymlink()) {
          throw new ExtractionException("Symbolic link entries are not supported: " + archive + AT + entry.getName());
        }
        if (entry.isDirectory()) {
          if (target != null) {
            Files.createDirectories(target);
          }
        } else {
          if (!zipFile.canReadEntryData(entry)) {
            throw new ExtractionException("Unsupported compression method or encryption: " + archive + AT
                + entry.getName());
          }
          Files.createDirectories(target.getParent());
          try (
              InputStream in = zipFile.getInputStream(entry);
              OutputStream out = Files.newOutputStream(target, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)
              ) {
            IOUtils.copy(in, out);
          } catch (FileAlreadyExistsException e) {
            throw new ExtractionException("Duplicate entry: " + archive + AT + entry.getName(), e);
          }
          if (posix) {
            Files.setPosixFilePermissions(target, ZipUtils.toPosixPermissions(getFileMode(entry)));
          }
          fileCount++;
        }
      }
    } catch (ExtractionException e) {
      throw e;
    } catch (IOException e) {
      throw new ExtractionException("Unable to extract " + archive + ": " + e.getMessage(), e);
    }
    int extracted = fileCount;
    debug.accept(() -> "Extracted " + extracted + (extracted == 1 ? " file" : " files") + " from " + archive);
    return fileCount;
  }

  /**
   * Extracts every entry of {@code archive} below {@code destination}.
   *
   * @param archive      The ZIP file to read
   * @param destination  The directory to create.  Must not exist yet.
   *
   * @return  the number of files extracted, not counting directories
   *
   * @throws ExtractionException when the archive is missing, unreadable or corrupt, contains entries that would
   *                             escape {@code destination}, duplicate entries or symbolic links, or when
   *                             {@code destination} cannot be created
   */
  public static int extract(File archive, File destination) throws ExtractionException {
    return extract(archive, destination, logger::fine);
  }
}
