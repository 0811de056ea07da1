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

import java.time.Instant;
import org.junit.Test;

/**
 * Tests {@link RepackOptions}.
 */
public class RepackOptionsTest {

  /**
   * The normalized time must never change, or previously rebuilt archives would all differ.
   */
  @Test
  public void testNormalizedTimestamp() {
    assertEquals(Instant.parse("1990-02-01T00:00:00Z"), RepackOptions.NORMALIZED_TIMESTAMP);
    assertEquals("even seconds for DOS time", 0, RepackOptions.NORMALIZED_TIMESTAMP.toEpochMilli() % 2000);
  }

  @Test
  public void testDefault() {
    assertTrue(RepackOptions.DEFAULT.isOmitDirectoryEntries());
    assertEquals(9, RepackOptions.DEFAULT.getCompressionLevel());
    assertEquals(1, RepackOptions.DEFAULT.getThreads());
  }

  @Test
  public void testWith() {
    RepackOptions options = RepackOptions.DEFAULT.withCompressionLevel(1).withThreads(4);
    assertTrue(options.isOmitDirectoryEntries());
    assertEquals(1, options.getCompressionLevel());
    assertEquals(4, options.getThreads());
    assertEquals("DEFAULT unchanged", 9, RepackOptions.DEFAULT.getCompressionLevel());
  }

  @Test
  @SuppressWarnings("ThrowableResultIgnored")
  public void testInvalid() {
    assertThrows("level too low", IllegalArgumentException.class, () -> new RepackOptions(true, -1, 1));
    assertThrows("level too high", IllegalArgumentException.class, () -> new RepackOptions(true, 10, 1));
    assertThrows("no threads", IllegalArgumentException.class, () -> new RepackOptions(true, 9, 0));
  }
}
