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

/**
 * Rebuilding an archive failed.  Fatal to the whole run: once the rebuild step is broken, no further
 * archive is started.
 *
 * @author  AO Industries, Inc.
 */
public class CompressionException extends RepackException {

  private static final long serialVersionUID = 1L;

  public CompressionException(String message) {
    super(message);
  }

  public CompressionException(String message, Throwable cause) {
    super(message, cause);
  }
}
