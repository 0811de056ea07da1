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
 * Scratch directories could not be created or removed, timestamps could not be set, or a staging file could
 * not be created.  Fatal to the job, or to the whole run when raised while preparing the scratch root.
 *
 * @author  AO Industries, Inc.
 */
public class FilesystemException extends RepackException {

  private static final long serialVersionUID = 1L;

  public FilesystemException(String message) {
    super(message);
  }

  public FilesystemException(String message, Throwable cause) {
    super(message, cause);
  }
}
