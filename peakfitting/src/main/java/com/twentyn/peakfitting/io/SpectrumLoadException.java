/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.twentyn.peakfitting.io;

import java.io.IOException;

/**
 * Thrown when a spectrum file cannot be turned into a usable trace: unreadable, too few columns, non-numeric
 * values or not enough rows.
 */
public class SpectrumLoadException extends IOException {
  private static final long serialVersionUID = -2180773160512496416L;

  private final String fileName;
  private final Integer lineNumber;

  public SpectrumLoadException(String fileName, Integer lineNumber, String message) {
    super(lineNumber == null ?
        String.format("%s: %s", fileName, message) :
        String.format("%s, line %d: %s", fileName, lineNumber, message));
    this.fileName = fileName;
    this.lineNumber = lineNumber;
  }

  public SpectrumLoadException(String fileName, String message, Throwable cause) {
    super(String.format("%s: %s", fileName, message), cause);
    this.fileName = fileName;
    this.lineNumber = null;
  }

  public String getFileName() {
    return fileName;
  }

  public Integer getLineNumber() {
    return lineNumber;
  }
}
