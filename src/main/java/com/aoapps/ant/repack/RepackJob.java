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

/**
 * The scratch paths of one archive while it is being repackaged.  Closing releases the paths.
 *
 * @author  AO Industries, Inc.
 */
public final class RepackJob implements Closeable {

  private final ScratchSpace scratchSpace;
  private final File sourceArchive;
  private final File extractDirectory;
  private final File stagingFile;

  RepackJob(ScratchSpace scratchSpace, File sourceArchive, File extractDirectory, File stagingFile) {
    this.scratchSpace = scratchSpace;
    this.sourceArchive = sourceArchive;
    this.extractDirectory = extractDirectory;
    this.stagingFile = stagingFile;
  }

  /**
   * The archive being repackaged, which is replaced once rebuilt.
   */
  public File getSourceArchive() {
    return sourceArchive;
  }

  /**
   * Where the archive is extracted.  Does not exist until extraction.
   */
  public File getExtractDirectory() {
    return extractDirectory;
  }

  /**
   * Where the rebuilt archive is written before replacing {@link #getSourceArchive()}.
   */
  public File getStagingFile() {
    return stagingFile;
  }

  @Override
  public void close() {
    scratchSpace.release(this);
  }

  @Override
  public String toString() {
    return "RepackJob(" + sourceArchive + ')';
  }
}
