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

package com.twentyn.peakfitting.background;

import java.util.Arrays;

/**
 * A straight line background for one fitting window, estimated from its edges.
 *
 * Each edge margin is 5% of the window (at least one sample).  Within a margin the lowest 10% of intensities (again at
 * least one sample) are averaged together with their positions, giving one anchor per side.  The line joins the two
 * anchors.
 */
public class LocalBackground {
  public static final double EDGE_MARGIN_FRACTION = 0.05;
  public static final double LOWEST_FRACTION = 0.1;

  private final double slope;
  private final double intercept;

  public LocalBackground(double slope, double intercept) {
    this.slope = slope;
    this.intercept = intercept;
  }

  public static LocalBackground estimate(double[] x, double[] y) {
    if (x.length == 0) {
      return new LocalBackground(0.0, 0.0);
    }
    int margin = Math.max(1, (int) (x.length * EDGE_MARGIN_FRACTION));
    double[] left = lowAnchor(x, y, 0, margin);
    double[] right = lowAnchor(x, y, x.length - margin, x.length);

    double slope = (right[1] - left[1]) / (right[0] - left[0] + 1e-10);
    double intercept = left[1] - slope * left[0];
    return new LocalBackground(slope, intercept);
  }

  /* Mean (x, y) of the lowest samples in [from, to). */
  private static double[] lowAnchor(double[] x, double[] y, int from, int to) {
    Integer[] order = new Integer[to - from];
    for (int i = 0; i < order.length; i++) {
      order[i] = from + i;
    }
    Arrays.sort(order, (a, b) -> Double.compare(y[a], y[b]));
    int count = Math.max(1, (int) (order.length * LOWEST_FRACTION));
    double sx = 0.0;
    double sy = 0.0;
    for (int i = 0; i < count; i++) {
      sx += x[order[i]];
      sy += y[order[i]];
    }
    return new double[]{sx / count, sy / count};
  }

  public double valueAt(double x) {
    return slope * x + intercept;
  }

  public double[] values(double[] x) {
    double[] out = new double[x.length];
    for (int i = 0; i < x.length; i++) {
      out[i] = valueAt(x[i]);
    }
    return out;
  }

  /**
   * @return y with this line removed, as a new array.
   */
  public double[] subtract(double[] x, double[] y) {
    double[] out = new double[y.length];
    for (int i = 0; i < y.length; i++) {
      out[i] = y[i] - valueAt(x[i]);
    }
    return out;
  }

  public double getSlope() {
    return slope;
  }

  public double getIntercept() {
    return intercept;
  }
}
