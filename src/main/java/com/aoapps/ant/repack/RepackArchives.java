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
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.logging.Logger;
import org.apache.commons.io.FileUtils;

/**
 * Standalone implementation of idempotent archive repackaging.
 * <p>
 * Each archive is extracted, has the times of all its files set to {@link RepackOptions#NORMALIZED_TIMESTAMP},
 * and is rebuilt by a {@link DeterministicCompressor} before replacing the original.  Given the same files, the
 * rebuilt archive is byte-for-byte identical no matter when, where, or from which packaging of those files it was
 * built.  This allows deployment tools comparing artifact hashes to skip unchanged artifacts.
 * </p>
 * <p>
 * Unix permissions are part of the files, so they are carried into the rebuilt archive.  Archives that differ only
 * in the mode of their files, such as when packaged under a different umask, are rebuilt differently.
 * </p>
 * <p>
 * Failure handling depends on the stage:
 * </p>
 * <ul>
 * <li>An archive that cannot be extracted, normalized or replaced is left untouched and reported, while the
 *     remaining archives are still processed.</li>
 * <li>An archive that cannot be rebuilt aborts the run: no further archive is started, since a rebuild that
 *     failed once cannot be trusted for the others.</li>
 * </ul>
 * <p>
 * This does not have any direct Ant dependencies.
 * If only using this class, it is permissible to exclude the ant dependencies.
 * </p>
 *
 * @author  AO Industries, Inc.
 */
public final class RepackArchives {

  /** Make no instances. */
  private RepackArchives() {
    throw new AssertionError();
  }

  private static final Logger logger = Logger.getLogger(RepackArchives.class.getName());

  /**
   * Repackages one archive, never throwing for failures of the archive itself.
   */
  private static ArchiveOutcome repackArchive(
      ScratchSpace scratchSpace,
      File archive,
      Compressor compressor,
      AtomicReference<CompressionException> abortCause,
      Consumer<Supplier<String>> debug,
      Consumer<Supplier<String>> info,
      Consumer<Supplier<String>> warn
  ) {
    if (abortCause.get() != null) {
      info.accept(() -> "Run aborted, not repacking " + archive);
      return new ArchiveOutcome(archive, ArchiveOutcome.Outcome.NOT_ATTEMPTED, null);
    }
    info.accept(() -> "Repacking " + archive);
    try (RepackJob job = scratchSpace.newJob(archive)) {
      File extractDirectory = job.getExtractDirectory();
      File stagingFile = job.getStagingFile();
      ArchiveExtractor.extract(archive, extractDirectory, debug);
      TimestampNormalizer.normalize(extractDirectory, RepackOptions.NORMALIZED_TIMESTAMP, debug);
      try {
        compressor.compress(extractDirectory, stagingFile);
      } catch (CompressionException e) {
        abortCause.compareAndSet(null, e);
        warn.accept(() -> "Unable to rebuild, aborting run: " + archive + ": " + e.getMessage());
        return new ArchiveOutcome(archive, ArchiveOutcome.Outcome.COMPRESSION_FAILED, e);
      }
      boolean unchanged;
      try {
        unchanged = FileUtils.contentEquals(stagingFile, archive);
      } catch (IOException e) {
        debug.accept(() -> "Unable to compare with original, replacing anyway: " + archive + ": " + e);
        unchanged = false;
      }
      if (unchanged) {
        info.accept(() -> "Already in normalized form, leaving untouched: " + archive);
        return new ArchiveOutcome(archive, ArchiveOutcome.Outcome.UNCHANGED, null);
      }
      ArtifactSwapper.swap(stagingFile, archive, debug);
      debug.accept(() -> "Replaced " + archive);
      return new ArchiveOutcome(archive, ArchiveOutcome.Outcome.OK, null);
    } catch (ExtractionException e) {
      warn.accept(() -> "Unable to extract, skipping: " + archive + ": " + e.getMessage());
      return new ArchiveOutcome(archive, ArchiveOutcome.Outcome.EXTRACTION_FAILED, e);
    } catch (FilesystemException e) {
      warn.accept(() -> "Filesystem failure, skipping: " + archive + ": " + e.getMessage());
      return new ArchiveOutcome(archive, ArchiveOutcome.Outcome.FILESYSTEM_FAILED, e);
    } catch (SwapException e) {
      warn.accept(() -> "Unable to replace, original kept: " + archive + ": " + e.getMessage());
      return new ArchiveOutcome(archive, ArchiveOutcome.Outcome.SWAP_FAILED, e);
    }
  }

  /**
   * Waits for a job to finish.  Jobs are never cancelled, so an interrupt is deferred until the job is done.
   */
  private static ArchiveOutcome await(Future<ArchiveOutcome> future) {
    boolean interrupted = false;
    try {
      while (true) {
        try {
          return future.get();
        } catch (InterruptedException e) {
          interrupted = true;
        } catch (ExecutionException e) {
          Throwable cause = e.getCause();
          if (cause instanceof RuntimeException) {
            throw (RuntimeException) cause;
          }
          if (cause instanceof Error) {
            throw (Error) cause;
          }
          throw new AssertionError("Unexpected checked exception", cause);
        }
      }
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /**
   * Waits for every submitted job to finish.  As in {@link #await(java.util.concurrent.Future)}, an interrupt is
   * deferred until then.
   */
  private static void awaitTermination(ExecutorService executor) {
    boolean interrupted = false;
    try {
      while (true) {
        try {
          if (executor.awaitTermination(1, TimeUnit.MINUTES)) {
            return;
          }
        } catch (InterruptedException e) {
          interrupted = true;
        }
      }
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /**
   * Implementation of {@link #repack(java.io.File, java.util.List, com.aoapps.ant.repack.RepackOptions)}
   * with provided compressor and logging.
   */
  static RepackResult repack(
      File scratchDirectory,
      List<File> archives,
      RepackOptions options,
      Compressor compressor,
      Consumer<Supplier<String>> debug,
      Consumer<Supplier<String>> info,
      Consumer<Supplier<String>> warn
  ) {
    Objects.requireNonNull(scratchDirectory, "scratchDirectory required");
    Objects.requireNonNull(archives, "archives required");
    Objects.requireNonNull(options, "options required");
    Objects.requireNonNull(compressor, "compressor required");
    List<File> jobs = new ArrayList<>(archives.size());
    for (File archive : archives) {
      jobs.add(Objects.requireNonNull(archive, "archives may not contain null"));
    }
    info.accept(() -> "Repacking " + jobs.size() + (jobs.size() == 1 ? " archive" : " archives")
        + " for idempotent deployment");
    debug.accept(() -> "options = " + options);
    ScratchSpace scratchSpace;
    try {
      scratchSpace = ScratchSpace.create(scratchDirectory, debug, info, warn);
    } catch (FilesystemException e) {
      warn.accept(() -> "Unable to prepare scratch directory, no archive repacked: " + e.getMessage());
      List<ArchiveOutcome> outcomes = new ArrayList<>(jobs.size());
      for (File archive : jobs) {
        outcomes.add(new ArchiveOutcome(archive, ArchiveOutcome.Outcome.NOT_ATTEMPTED, null));
      }
      return new RepackResult(RepackResult.RunStatus.ABORTED, outcomes, e);
    }
    AtomicReference<CompressionException> abortCause = new AtomicReference<>();
    List<ArchiveOutcome> outcomes = new ArrayList<>(jobs.size());
    try (ScratchSpace scratch = scratchSpace) {
      int threads = Math.min(options.getThreads(), jobs.size());
      if (threads <= 1) {
        for (File archive : jobs) {
          outcomes.add(repackArchive(scratch, archive, compressor, abortCause, debug, info, warn));
        }
      } else {
        debug.accept(() -> "Repacking with " + threads + " threads");
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
          List<Future<ArchiveOutcome>> futures = new ArrayList<>(jobs.size());
          for (File archive : jobs) {
            futures.add(executor.submit(() -> repackArchive(scratch, archive, compressor, abortCause, debug, info,
                warn)));
          }
          for (Future<ArchiveOutcome> future : futures) {
            outcomes.add(await(future));
          }
        } finally {
          // Scratch space is closed only after every job is done, even when a job failed unexpectedly
          executor.shutdown();
          awaitTermination(executor);
        }
      }
    }
    RepackResult result = new RepackResult(
        abortCause.get() == null ? RepackResult.RunStatus.COMPLETED : RepackResult.RunStatus.ABORTED,
        outcomes,
        abortCause.get()
    );
    List<ArchiveOutcome> failures = result.getFailures();
    if (failures.isEmpty()) {
      info.accept(() -> "Repacked " + jobs.size() + (jobs.size() == 1 ? " archive" : " archives"));
    } else {
      warn.accept(() -> {
        StringBuilder message = new StringBuilder("Run ").append(result.getStatus()).append(" with ")
            .append(failures.size()).append(failures.size() == 1 ? " archive" : " archives")
            .append(" not normalized:");
        for (ArchiveOutcome failure : failures) {
          message.append(System.lineSeparator()).append("  ").append(failure);
        }
        return message.toString();
      });
    }
    return result;
  }

  /**
   * Rebuilds each archive in place so that its bytes depend only on the paths, content and permissions of its files.
   * <p>
   * The result reports every archive, in the order given.  Archives that are not reported as
   * {@linkplain ArchiveOutcome.Outcome#isSuccess() successful} are byte-for-byte as they were before the run.
   * </p>
   *
   * @param scratchDirectory  The working directory for the run.  Anything there is removed first, and it is removed
   *                          again when done.
   * @param archives          The ZIP files to rebuild, such as found by
   *                          {@link ArchiveLocator#locate(java.util.List, java.io.File, java.lang.String)}
   * @param options           The settings for the run
   */
  public static RepackResult repack(File scratchDirectory, List<File> archives, RepackOptions options) {
    return repack(
        scratchDirectory,
        archives,
        options,
        new DeterministicCompressor(options),
        logger::fine,
        logger::info,
        logger::warning
    );
  }

  /**
   * Rebuilds each archive in place using {@link RepackOptions#DEFAULT}.
   *
   * @see #repack(java.io.File, java.util.List, com.aoapps.ant.repack.RepackOptions)
   */
  public static RepackResult repack(File scratchDirectory, List<File> archives) {
    return repack(scratchDirectory, archives, RepackOptions.DEFAULT);
  }
}
