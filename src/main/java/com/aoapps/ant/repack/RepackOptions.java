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

import java.time.Instant;
import java.util.zip.Deflater;

/**
 * Settings for one repackaging run.  Instances are immutable and passed explicitly to every stage that needs them.
 *
 * @author  AO Industries, Inc.
 */
public final class RepackOptions {

  /**
   * The fixed time given to every extracted file and therefore to every rebuilt entry.
   * This is a build-time constant and must never change, or every previously rebuilt archive would differ.
   */
  public static final Instant NORMALIZED_TIMESTAMP = Instant.parse("1990-02-01T00:00:00Z");

  /**
   * The compression level used when none is specified.
   */
  public static final int DEFAULT_COMPRESSION_LEVEL = Deflater.BEST_COMPRESSION;

  /**
   * Omits directory entries, uses {@link #DEFAULT_COMPRESSION_LEVEL}, and processes one archive at a time.
   */
  public static final RepackOptions DEFAULT = new RepackOptions(true, DEFAULT_COMPRESSION_LEVEL, 1);

  private final boolean omitDirectoryEntries;
  private final int compressionLevel;
  private final int threads;

  /**
   * @param omitDirectoryEntries  See {@link #isOmitDirectoryEntries()}
   * @param compressionLevel      See {@link #getCompressionLevel()}
   * @param threads               See {@link #getThreads()}
   */
  public RepackOptions(boolean omitDirectoryEntries, int compressionLevel, int threads) {
    if (compressionLevel < Deflater.NO_COMPRESSION || compressionLevel > Deflater.BEST_COMPRESSION) {
      throw new IllegalArgumentException("compressionLevel must be between " + Deflater.NO_COMPRESSION + " and "
          + Deflater.BEST_COMPRESSION + ": " + compressionLevel);
    }
    if (threads < 1) {
      throw new IllegalArgumentException("threads must be at least one: " + threads);
    }
    this.omitDirectoryEntries = omitDirectoryEntries;
    this.compressionLevel = compressionLevel;
    this.threads = threads;
  }

  /**
   * When {@code true} (the default), rebuilt archives contain only file entries.
   */
  public boolean isOmitDirectoryEntries() {
    return omitDirectoryEntries;
  }

  /**
   * The DEFLATE level used for every entry of every rebuilt archive.
   */
  public int getCompressionLevel() {
    return compressionLevel;
  }

  /**
   * The number of archives processed concurrently.  One (the default) processes archives in order in the
   * calling thread.
   */
  public int getThreads() {
    return threads;
  }

  /**
   * Gets a copy with a different compression level.
   */
  public RepackOptions withCompressionLevel(int compressionLevel) {
    return new RepackOptions(omitDirectoryEntries, compressionLevel, threads);
  }

  /**
   * Gets a copy with a different number of threads.
   */
  public RepackOptions withThreads(int threads) {
    return new RepackOptions(omitDirectoryEntries, compressionLevel, threads);
  }

  @Override
  public String toString() {
    return "RepackOptions(omitDirectoryEntries=" + omitDirectoryEntries + ", compressionLevel=" + compressionLevel
        + ", threads=" + threads + ')';
  }
}
