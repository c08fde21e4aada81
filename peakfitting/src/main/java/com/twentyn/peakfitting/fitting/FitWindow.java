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

import com.twentyn.peakfitting.background.LocalBackground;

import java.util.Arrays;

/**
 * A contiguous slice [start, end] (inclusive) of a trace with its edge background removed.
 */
public class FitWindow {
  private final int start;
  private final int end;
  private final double[] x;
  private final double[] y;
  private final LocalBackground background;

  private FitWindow(int start, int end, double[] x, double[] rawY, LocalBackground background) {
    this.start = start;
    this.end = end;
    this.x = x;
    this.background = background;
    this.y = background.subtract(x, rawY);
  }

  /**
   * Cuts [from, to] out of the trace, clipped to its bounds, and removes a straight edge background.
   */
  public static FitWindow slice(double[] x, double[] y, int from, int to) {
    int start = Math.max(0, from);
    int end = Math.min(x.length - 1, to);
    double[] wx = end >= start ? Arrays.copyOfRange(x, start, end + 1) : new double[0];
    double[] wy = end >= start ? Arrays.copyOfRange(y, start, end + 1) : new double[0];
    return new FitWindow(start, end, wx, wy, LocalBackground.estimate(wx, wy));
  }

  public static FitWindow around(double[] x, double[] y, int center, int halfWidth) {
    return slice(x, y, center - halfWidth, center + halfWidth);
  }

  public int getStart() {
    return start;
  }

  public int getEnd() {
    return end;
  }

  public int size() {
    return x.length;
  }

  public boolean contains(int index) {
    return index >= start && index <= end;
  }

  public double[] getX() {
    return x;
  }

  /**
   * @return The intensities with the edge background removed.
   */
  public double[] getY() {
    return y;
  }

  public LocalBackground getBackground() {
    return background;
  }

  public double maxY() {
    return Arrays.stream(y).max().orElse(0.0);
  }

  public double range() {
    if (y.length == 0) {
      return 0.0;
    }
    return maxY() - Arrays.stream(y).min().getAsDouble();
  }
}
