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
import static org.junit.Assert.assertThrows;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 * Tests {@link TimestampNormalizer}.
 */
public class TimestampNormalizerTest {

  @Rule
  public final TemporaryFolder temporaryFolder = TemporaryFolder.builder().assureDeletion().build();

  @Test
  public void testNormalize() throws IOException {
    File tree = temporaryFolder.newFolder("tree");
    Path top = Files.writeString(tree.toPath().resolve("a.txt"), "top");
    Path nestedDirectory = Files.createDirectories(tree.toPath().resolve("b/c"));
    Path nested = Files.writeString(nestedDirectory.resolve("file.txt"), "nested");
    FileTime directoryTime = FileTime.from(Instant.parse("2023-09-07T01:38:34Z"));
    Files.setLastModifiedTime(nestedDirectory, directoryTime);

    assertEquals(2, TimestampNormalizer.normalize(tree, RepackOptions.NORMALIZED_TIMESTAMP));

    FileTime expected = FileTime.from(RepackOptions.NORMALIZED_TIMESTAMP);
    for (Path file : new Path[] {top, nested}) {
      BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
      assertEquals("lastModifiedTime: " + file, expected.toMillis(), attrs.lastModifiedTime().toMillis());
      assertEquals("lastAccessTime: " + file, expected.toMillis(), attrs.lastAccessTime().toMillis());
    }
    assertEquals("directories untouched", directoryTime, Files.getLastModifiedTime(nestedDirectory));
  }

  @Test
  public void testNormalizeEmpty() throws IOException {
    assertEquals(0, TimestampNormalizer.normalize(temporaryFolder.newFolder("empty"),
        RepackOptions.NORMALIZED_TIMESTAMP));
  }

  @Test
  @SuppressWarnings("ThrowableResultIgnored")
  public void testNotDirectory() throws IOException {
    File file = temporaryFolder.newFile("file.txt");
    assertThrows(FilesystemException.class, () -> TimestampNormalizer.normalize(file,
        RepackOptions.NORMALIZED_TIMESTAMP));
    assertThrows(FilesystemException.class, () -> TimestampNormalizer.normalize(
        new File(temporaryFolder.getRoot(), "missing"), RepackOptions.NORMALIZED_TIMESTAMP));
  }
}
