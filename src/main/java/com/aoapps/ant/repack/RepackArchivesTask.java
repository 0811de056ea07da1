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
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.apache.commons.lang3.StringUtils;
import org.apache.tools.ant.BuildException;
import org.apache.tools.ant.Task;
import org.apache.tools.ant.types.LogLevel;

/**
 * Ant task that invokes {@link RepackArchives#repack(java.io.File, java.util.List, com.aoapps.ant.repack.RepackOptions)}
 * on the archives found by {@link ArchiveLocator#locate(java.util.List, java.io.File, java.lang.String)}.
 *
 * <p>Bind this task after the packaging step that creates the archives.  When some archives are only created by a
 * later step, bind it again after that step with the same {@link #setSearchDirectory(java.lang.String) searchDirectory};
 * archives already normalized are left untouched.</p>
 *
 * @author  AO Industries, Inc.
 */
@SuppressWarnings("CloneableImplementsClone")
public class RepackArchivesTask extends Task {

  /**
   * The characters separating archives in {@link #setArchives(java.lang.String)}.
   */
  private static final String ARCHIVE_SEPARATORS = ", \t\r\n";

  private File scratchDirectory;
  private final List<File> archives = new ArrayList<>();
  private File searchDirectory;
  private String pattern = ArchiveLocator.DEFAULT_PATTERN;
  private int compressionLevel = RepackOptions.DEFAULT_COMPRESSION_LEVEL;
  private int threads = 1;
  private boolean failOnError = true;

  /**
   * The working directory for the run.  Anything there is removed first, and it is removed again when done.
   * Required.
   */
  public void setScratchDirectory(String scratchDirectory) {
    this.scratchDirectory = new File(scratchDirectory);
  }

  /**
   * The archives expected from known build targets, separated by commas or whitespace.  These are processed first,
   * in the order given.
   */
  public void setArchives(String archives) {
    this.archives.clear();
    for (String archive : StringUtils.split(archives, ARCHIVE_SEPARATORS)) {
      this.archives.add(new File(archive));
    }
  }

  /**
   * A directory scanned for more archives matching {@link #setPattern(java.lang.String) pattern}.
   * Optional.  Does not need to exist.
   */
  public void setSearchDirectory(String searchDirectory) {
    this.searchDirectory = new File(searchDirectory);
  }

  /**
   * The glob, relative to {@link #setSearchDirectory(java.lang.String) searchDirectory}, of archives to discover.
   * Defaults to {@link ArchiveLocator#DEFAULT_PATTERN}.
   */
  public void setPattern(String pattern) {
    if (StringUtils.isBlank(pattern)) {
      throw new IllegalArgumentException("pattern may not be blank");
    }
    this.pattern = pattern;
  }

  /**
   * See {@link RepackOptions#getCompressionLevel()}.  Defaults to {@link RepackOptions#DEFAULT_COMPRESSION_LEVEL}.
   * Changing it changes the bytes of every rebuilt archive.
   */
  public void setCompressionLevel(int compressionLevel) {
    this.compressionLevel = compressionLevel;
  }

  /**
   * See {@link RepackOptions#getThreads()}.  Defaults to one.
   */
  public void setThreads(int threads) {
    this.threads = threads;
  }

  /**
   * When {@code true} (the default), the build fails when any archive could not be normalized.
   * Otherwise the failures are only logged.
   */
  public void setFailOnError(boolean failOnError) {
    this.failOnError = failOnError;
  }

  /**
   * Locates and repacks the archives while logging to {@link #log(java.lang.String, int)}.
   */
  @Override
  public void execute() throws BuildException {
    if (scratchDirectory == null) {
      throw new BuildException("scratchDirectory required");
    }
    RepackOptions options;
    try {
      options = new RepackOptions(true, compressionLevel, threads);
    } catch (IllegalArgumentException e) {
      throw new BuildException(e.getMessage(), e);
    }
    Consumer<Supplier<String>> debug = msg -> log(msg.get(), LogLevel.DEBUG.getLevel());
    Consumer<Supplier<String>> info = msg -> log(msg.get(), LogLevel.INFO.getLevel());
    Consumer<Supplier<String>> warn = msg -> log(msg.get(), LogLevel.WARN.getLevel());
    List<File> located;
    try {
      located = ArchiveLocator.locate(archives, searchDirectory, pattern, debug);
    } catch (IOException e) {
      throw new BuildException(e);
    }
    if (located.isEmpty()) {
      log("Repack found no archives", LogLevel.INFO.getLevel());
      return;
    }
    RepackResult result = RepackArchives.repack(
        scratchDirectory,
        located,
        options,
        new DeterministicCompressor(options, debug),
        debug,
        info,
        warn
    );
    if (!result.isSuccess()) {
      StringBuilder message = new StringBuilder("Repack ")
          .append(result.getStatus().name().toLowerCase(Locale.ROOT))
          .append(", archives not normalized:");
      for (ArchiveOutcome failure : result.getFailures()) {
        message.append(System.lineSeparator()).append("  ").append(failure);
      }
      if (failOnError) {
        throw new BuildException(message.toString(), result.getAbortCause().orElse(null));
      }
      log(message.toString(), LogLevel.WARN.getLevel());
    }
  }
}
