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
import java.util.Objects;
import java.util.Optional;

/**
 * What happened to one archive during a run.
 *
 * @author  AO Industries, Inc.
 */
public final class ArchiveOutcome {

  /**
   * The possible outcomes for one archive.
   */
  public enum Outcome {
    /**
     * Rebuilt and replaced.
     */
    OK(true),

    /**
     * Rebuilt, but the result was byte-for-byte the same as the archive, which was left untouched.
     */
    UNCHANGED(true),

    /**
     * Could not be extracted.  Left untouched.
     */
    EXTRACTION_FAILED(false),

    /**
     * Scratch paths, timestamps or the staging file could not be managed.  Left untouched.
     */
    FILESYSTEM_FAILED(false),

    /**
     * Could not be rebuilt, which aborted the run.  Left untouched.
     */
    COMPRESSION_FAILED(false),

    /**
     * Rebuilt, but could not be replaced.  Left untouched.
     */
    SWAP_FAILED(false),

    /**
     * Not started because the run was aborted first.  Left untouched.
     */
    NOT_ATTEMPTED(false);

    private final boolean success;

    private Outcome(boolean success) {
      this.success = success;
    }

    /**
     * Is this archive now in its normalized form?
     */
    public boolean isSuccess() {
      return success;
    }
  }

  private final File archive;
  private final Outcome outcome;
  private final RepackException cause;

  ArchiveOutcome(File archive, Outcome outcome, RepackException cause) {
    this.archive = Objects.requireNonNull(archive);
    this.outcome = Objects.requireNonNull(outcome);
    if (outcome.isSuccess() && cause != null) {
      throw new IllegalArgumentException("Successful outcome may not have a cause: " + outcome);
    }
    this.cause = cause;
  }

  public File getArchive() {
    return archive;
  }

  public Outcome getOutcome() {
    return outcome;
  }

  /**
   * The failure that caused this outcome, if any.  Empty for successful and not-attempted archives.
   */
  public Optional<RepackException> getCause() {
    return Optional.ofNullable(cause);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder().append(archive).append(": ").append(outcome);
    if (cause != null) {
      sb.append(": ").append(cause.getMessage());
    }
    return sb.toString();
  }
}
