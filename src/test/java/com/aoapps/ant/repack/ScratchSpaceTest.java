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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 * Tests {@link ScratchSpace} and {@link RepackJob}.
 */
public class ScratchSpaceTest {

  @Rule
  public final TemporaryFolder temporaryFolder = TemporaryFolder.builder().assureDeletion().build();

  private File getRoot() {
    return new File(temporaryFolder.getRoot(), ".repack");
  }

  /**
   * Tests {@link ScratchSpace#getBaseName(java.io.File)}.
   */
  @Test
  public void testGetBaseName() {
    assertEquals("service", ScratchSpace.getBaseName(new File("/build/.serverless/service.zip")));
    assertEquals("upper case extension", "SERVICE", ScratchSpace.getBaseName(new File("SERVICE.ZIP")));
    assertEquals("other extension kept", "service.jar", ScratchSpace.getBaseName(new File("service.jar")));
    assertEquals("only extension", ".zip", ScratchSpace.getBaseName(new File(".zip")));
  }

  @Test
  public void testCreate() throws IOException {
    File root = getRoot();
    try (ScratchSpace scratchSpace = ScratchSpace.create(root)) {
      assertEquals(root, scratchSpace.getRoot());
      assertTrue(root.isDirectory());
      assertEquals(0, root.list().length);
    }
    assertFalse("removed on close", root.exists());
  }

  /**
   * A scratch directory left by an interrupted run is replaced.
   */
  @Test
  public void testCreateStale() throws IOException {
    File root = getRoot();
    File stale = new File(root, "service/nested/leftover.txt");
    assertTrue(stale.getParentFile().mkdirs());
    Files.writeString(stale.toPath(), "leftover");
    Files.writeString(new File(root, "service.zip.new").toPath(), "partial");
    try (ScratchSpace scratchSpace = ScratchSpace.create(root)) {
      assertTrue(root.isDirectory());
      assertEquals("stale content removed", 0, root.list().length);
    }
  }

  @Test
  public void testCreateOverFile() throws IOException {
    File root = getRoot();
    Files.writeString(root.toPath(), "not a directory");
    try (ScratchSpace scratchSpace = ScratchSpace.create(root)) {
      assertTrue(root.isDirectory());
    }
  }

  @Test
  @SuppressWarnings("ThrowableResultIgnored")
  public void testCreateFails() throws IOException {
    File file = temporaryFolder.newFile("file");
    assertThrows(FilesystemException.class, () -> ScratchSpace.create(new File(file, ".repack")));
  }

  @Test
  public void testNewJob() throws IOException {
    File root = getRoot();
    try (ScratchSpace scratchSpace = ScratchSpace.create(root)) {
      File archive = new File(temporaryFolder.getRoot(), "service.zip");
      try (RepackJob job = scratchSpace.newJob(archive)) {
        assertEquals(archive, job.getSourceArchive());
        assertEquals(new File(root, "service"), job.getExtractDirectory());
        assertEquals(new File(root, "service.zip.new"), job.getStagingFile());
        assertFalse("extract directory not created", job.getExtractDirectory().exists());
        assertFalse("staging file not created", job.getStagingFile().exists());
        assertTrue(job.getExtractDirectory().mkdir());
        Files.writeString(job.getStagingFile().toPath(), "staged");
      }
      assertEquals("job paths removed on close", 0, root.list().length);
      try (RepackJob job = scratchSpace.newJob(archive)) {
        assertEquals("names released for reuse", new File(root, "service"), job.getExtractDirectory());
      }
    }
  }

  /**
   * Two archives with the same base name cannot be processed at the same time.
   */
  @Test
  @SuppressWarnings("ThrowableResultIgnored")
  public void testNewJobCollision() throws IOException {
    try (ScratchSpace scratchSpace = ScratchSpace.create(getRoot())) {
      File archive1 = new File(temporaryFolder.getRoot(), "a/service.zip");
      File archive2 = new File(temporaryFolder.getRoot(), "b/service.zip");
      try (RepackJob job = scratchSpace.newJob(archive1)) {
        assertThrows(FilesystemException.class, () -> scratchSpace.newJob(archive2));
      }
      try (RepackJob job = scratchSpace.newJob(archive2)) {
        assertEquals(archive2, job.getSourceArchive());
      }
    }
  }

  @Test
  @SuppressWarnings("ThrowableResultIgnored")
  public void testNewJobStagingCollision() throws IOException {
    try (ScratchSpace scratchSpace = ScratchSpace.create(getRoot())) {
      try (RepackJob job = scratchSpace.newJob(new File("service.zip"))) {
        assertNotEquals(job.getExtractDirectory(), job.getStagingFile());
        assertThrows(FilesystemException.class, () -> scratchSpace.newJob(new File("service.zip.new")));
      }
    }
  }

  @Test
  @SuppressWarnings("ThrowableResultIgnored")
  public void testNewJobAfterClose() throws IOException {
    ScratchSpace scratchSpace = ScratchSpace.create(getRoot());
    scratchSpace.close();
    scratchSpace.close();
    assertThrows(IllegalStateException.class, () -> scratchSpace.newJob(new File("service.zip")));
  }
}
