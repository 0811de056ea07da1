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
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.PosixFileAttributeView;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.logging.Logger;
import org.apache.commons.compress.archivers.zip.Zip64Mode;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.apache.commons.io.IOUtils;

/**
 * Writes archives whose bytes depend only on the paths, content, times and permissions of the files archived.
 * <ol>
 * <li>Entries are written in {@linkplain ZipUtils#NAME_ORDER byte-wise order of their names}, never in the order the
 *     filesystem happens to list them.</li>
 * <li>Every entry uses the same method and {@linkplain RepackOptions#getCompressionLevel() level}.</li>
 * <li>Times are stored as UTC, so the result does not depend on the time zone of the JVM.</li>
 * <li>Directory entries are omitted when {@linkplain RepackOptions#isOmitDirectoryEntries() configured}.</li>
 * </ol>
 *
 * @author  AO Industries, Inc.
 */
public final class DeterministicCompressor implements Compressor {

  private static final Logger logger = Logger.getLogger(DeterministicCompressor.class.getName());

  /**
   * Gets the entry name of a path: relative to the tree, separated by {@code '/'}.
   */
  static String toEntryName(Path tree, Path path) {
    StringBuilder name = new StringBuilder();
    for (Path part : tree.relativize(path)) {
      if (name.length() > 0) {
        name.append('/');
      }
      name.append(part);
    }
    return name.toString();
  }

  /**
   * Lists the files below a tree, and optionally its directories, in canonical order.
   * Directory names end in {@code '/'}.  The tree itself is never listed.
   */
  static SortedMap<String, Path> listEntries(Path tree, boolean includeDirectories) throws IOException {
    SortedMap<String, Path> entries = new TreeMap<>(ZipUtils.NAME_ORDER);
    Files.walkFileTree(tree, new SimpleFileVisitor<Path>() {
      @Override
      public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
        if (includeDirectories && !dir.equals(tree)) {
          entries.put(toEntryName(tree, dir) + '/', dir);
        }
        return FileVisitResult.CONTINUE;
      }

      @Override
      public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
        if (!attrs.isRegularFile()) {
          throw new IOException("Not a regular file: " + file);
        }
        entries.put(toEntryName(tree, file), file);
        return FileVisitResult.CONTINUE;
      }
    });
    return entries;
  }

  private final RepackOptions options;
  private final Consumer<Supplier<String>> debug;

  DeterministicCompressor(RepackOptions options, Consumer<Supplier<String>> debug) {
    this.options = Objects.requireNonNull(options, "options required");
    this.debug = debug;
  }

  public DeterministicCompressor(RepackOptions options) {
    this(options, logger::fine);
  }

  private void writeEntry(ZipArchiveOutputStream zipOut, boolean posix, String name, Path path) throws IOException {
    boolean directory = name.endsWith("/");
    BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
    ZipArchiveEntry entry = new ZipArchiveEntry(name);
    ZipUtils.setTimeUtc(entry, ZipUtils.roundDownDosTime(attrs.lastModifiedTime().toMillis()));
    if (posix) {
      entry.setUnixMode((directory ? ZipUtils.DIRECTORY_TYPE : ZipUtils.REGULAR_FILE_TYPE)
          | ZipUtils.toPermissionBits(Files.getPosixFilePermissions(path)));
    }
    if (!directory) {
      entry.setSize(attrs.size());
    }
    zipOut.putArchiveEntry(entry);
    if (!directory) {
      try (InputStream in = Files.newInputStream(path)) {
        IOUtils.copy(in, zipOut);
      }
    }
    zipOut.closeArchiveEntry();
  }

  @Override
  public void compress(File tree, File stagingFile) throws FilesystemException, CompressionException {
    Objects.requireNonNull(tree, "tree required");
    Objects.requireNonNull(stagingFile, "stagingFile required");
    Path treePath = tree.toPath();
    SortedMap<String, Path> entries;
    boolean posix;
    try {
      entries = listEntries(treePath, !options.isOmitDirectoryEntries());
      posix = Files.getFileStore(treePath).supportsFileAttributeView(PosixFileAttributeView.class);
    } catch (IOException e) {
      throw new CompressionException("Unable to list files in " + tree, e);
    }
    SeekableByteChannel channel;
    try {
      channel = Files.newByteChannel(stagingFile.toPath(), StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
    } catch (IOException e) {
      throw new FilesystemException("Unable to create staging file: " + stagingFile, e);
    }
    debug.accept(() -> "Writing " + entries.size() + (entries.size() == 1 ? " entry" : " entries") + " to "
        + stagingFile);
    boolean written = false;
    try (
        SeekableByteChannel out = channel;
        ZipArchiveOutputStream zipOut = new ZipArchiveOutputStream(out)
        ) {
      zipOut.setEncoding(StandardCharsets.UTF_8.name());
      zipOut.setUseLanguageEncodingFlag(true);
      zipOut.setCreateUnicodeExtraFields(ZipArchiveOutputStream.UnicodeExtraFieldPolicy.NEVER);
      zipOut.setUseZip64(Zip64Mode.AsNeeded);
      zipOut.setMethod(ZipArchiveOutputStream.DEFLATED);
      zipOut.setLevel(options.getCompressionLevel());
      for (Map.Entry<String, Path> entry : entries.entrySet()) {
        writeEntry(zipOut, posix, entry.getKey(), entry.getValue());
      }
      zipOut.finish();
      written = true;
    } catch (IOException e) {
      throw new CompressionException("Unable to write " + stagingFile + " from " + tree, e);
    } finally {
      if (!written) {
        try {
          Files.deleteIfExists(stagingFile.toPath());
        } catch (IOException e) {
          debug.accept(() -> "Unable to remove partial staging file, left for scratch cleanup: " + stagingFile
              + ": " + e);
        }
      }
    }
  }
}
