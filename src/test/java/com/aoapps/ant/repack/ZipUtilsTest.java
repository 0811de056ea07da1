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
import static org.junit.Assert.assertTrue;

import java.lang.reflect.InvocationTargetException;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.zip.ZipEntry;
import org.junit.Test;

/**
 * Tests {@link ZipUtils}.
 */
public class ZipUtilsTest {

  /**
   * Tests {@link ZipUtils} cannot be constructed.
   */
  @Test
  @SuppressWarnings("ThrowableResultIgnored")
  public void testNoConstructor() throws ReflectiveOperationException {
    var constructor = ZipUtils.class.getDeclaredConstructor();
    constructor.setAccessible(true);
    assertThrows("Make no instances.", AssertionError.class, () -> {
      try {
        constructor.newInstance();
      } catch (InvocationTargetException e) {
        throw e.getCause();
      }
    });
  }

  /**
   * Tests {@link ZipUtils#NAME_ORDER}.
   */
  @Test
  public void testNameOrder() {
    List<String> names = new ArrayList<>(Arrays.asList("b/file.txt", "a.txt", "a/b", "a.b", "B", "Ａ", "😀"));
    names.sort(ZipUtils.NAME_ORDER);
    assertEquals(
        "byte-wise UTF-8, supplementary characters after all BMP characters",
        Arrays.asList("B", "a.b", "a.txt", "a/b", "b/file.txt", "Ａ", "😀"),
        names
    );
    assertTrue("UTF-16 order differs", "😀".compareTo("Ａ") < 0);
  }

  /**
   * Tests {@link ZipUtils#setTimeUtc(java.util.zip.ZipEntry, long)} and {@link ZipUtils#getTimeUtc(java.util.zip.ZipEntry)}.
   */
  @Test
  public void testTimeUtc() {
    long time = RepackOptions.NORMALIZED_TIMESTAMP.toEpochMilli();
    ZipEntry entry = new ZipEntry("a.txt");
    assertTrue("no time by default", ZipUtils.getTimeUtc(entry).isEmpty());
    ZipUtils.setTimeUtc(entry, time);
    assertEquals(Long.valueOf(time), ZipUtils.getTimeUtc(entry).get());
  }

  /**
   * Tests {@link ZipUtils#roundDownDosTime(long)}.
   */
  @Test
  public void testRoundDownDosTime() {
    long even = Instant.parse("2023-09-07T01:38:34Z").toEpochMilli();
    assertEquals(even, ZipUtils.roundDownDosTime(even));
    assertEquals(even, ZipUtils.roundDownDosTime(even + 1999));
    assertEquals(even + 2000, ZipUtils.roundDownDosTime(even + 2000));
  }

  /**
   * Tests {@link ZipUtils#toPosixPermissions(int)} and {@link ZipUtils#toPermissionBits(java.util.Set)}.
   */
  @Test
  public void testPermissions() {
    assertEquals(PosixFilePermissions.fromString("rwxr-xr-x"), ZipUtils.toPosixPermissions(0755));
    assertEquals(PosixFilePermissions.fromString("rw-r-----"), ZipUtils.toPosixPermissions(0100640));
    assertEquals(0644, ZipUtils.toPermissionBits(PosixFilePermissions.fromString("rw-r--r--")));
    assertEquals(0, ZipUtils.toPermissionBits(PosixFilePermissions.fromString("---------")));
    for (int mode = 0; mode <= ZipUtils.PERMISSION_MASK; mode++) {
      assertEquals(mode, ZipUtils.toPermissionBits(ZipUtils.toPosixPermissions(mode)));
    }
    assertTrue(ZipUtils.toPosixPermissions(0400).contains(PosixFilePermission.OWNER_READ));
  }
}
