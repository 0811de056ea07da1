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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The outcome of every archive in a run, in the order the archives were given, plus the status of the run as a whole.
 *
 * @author  AO Industries, Inc.
 */
public final class RepackResult {

  /**
   * The status of a run as a whole.
   */
  public enum RunStatus {
    /**
     * Every archive was attempted.  Individual archives may still have failed.
     */
    COMPLETED,

    /**
     * The run stopped early, either because the scratch directory could not be prepared or because an archive could
     * not be rebuilt.
     */
    ABORTED
  }

  private final RunStatus status;
  private final List<ArchiveOutcome> outcomes;
  private final RepackException abortCause;

  RepackResult(RunStatus status, List<ArchiveOutcome> outcomes, RepackException abortCause) {
    this.status = Objects.requireNonNull(status);
    this.outcomes = Collections.unmodifiableList(new ArrayList<>(outcomes));
    if ((status == RunStatus.ABORTED) != (abortCause != null)) {
      throw new IllegalArgumentException("Aborted runs, and only aborted runs, have a cause: " + status);
    }
    this.abortCause = abortCause;
  }

  public RunStatus getStatus() {
    return status;
  }

  public List<ArchiveOutcome> getOutcomes() {
    return outcomes;
  }

  /**
   * The failure that aborted the run, if aborted.
   */
  public Optional<RepackException> getAbortCause() {
    return Optional.ofNullable(abortCause);
  }

  /**
   * Gets the outcomes of the archives that are not in their normalized form, in order.
   */
  public List<ArchiveOutcome> getFailures() {
    List<ArchiveOutcome> failures = new ArrayList<>();
    for (ArchiveOutcome outcome : outcomes) {
      if (!outcome.getOutcome().isSuccess()) {
        failures.add(outcome);
      }
    }
    return failures;
  }

  /**
   * Did the run complete with every archive normalized?  When not, the caller should fail the build.
   */
  public boolean isSuccess() {
    return status == RunStatus.COMPLETED && getFailures().isEmpty();
  }

  @Override
  public String toString() {
    return "RepackResult(" + status + ", " + outcomes.size() + (outcomes.size() == 1 ? " archive" : " archives")
        + ", " + getFailures().size() + (getFailures().size() == 1 ? " failure)" : " failures)");
  }
}
