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

package com.twentyn.peakfitting.fitting;

/**
 * A peak or group of peaks could not be fitted.  Carries the position of the (first) peak involved so that callers
 * can log and report the failure without further context.
 */
public class PeakFitException extends Exception {
  private static final long serialVersionUID = 5279086115240918133L;

  private final double position;

  public PeakFitException(double position, String message) {
    super(message);
    this.position = position;
  }

  public PeakFitException(double position, String message, Throwable cause) {
    super(message, cause);
    this.position = position;
  }

  public double getPosition() {
    return position;
  }
}
