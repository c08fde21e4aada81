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

import com.twentyn.peakfitting.spectrum.XY;

import java.util.ArrayList;
import java.util.List;

/**
 * Piecewise linear interpolation through control points, held flat beyond the first and last point.
 */
public final class LinearInterpolator {

  private LinearInterpolator() {
  }

  /**
   * @param points Control points; sorted copies are used so callers may pass them in any order.
   */
  public static double[] interpolate(double[] x, List<XY> points) {
    if (points.isEmpty()) {
      throw new IllegalArgumentException("Need at least one control point to interpolate");
    }
    List<XY> sorted = new ArrayList<>(points);
    sorted.sort((a, b) -> Double.compare(a.getX(), b.getX()));
    double[] xp = new double[sorted.size()];
    double[] fp = new double[sorted.size()];
    for (int i = 0; i < sorted.size(); i++) {
      xp[i] = sorted.get(i).getX();
      fp[i] = sorted.get(i).getY();
    }
    return interpolate(x, xp, fp);
  }

  /**
   * @param xp Increasing control positions.
   * @param fp Values at the control positions.
   */
  public static double[] interpolate(double[] x, double[] xp, double[] fp) {
    double[] out = new double[x.length];
    for (int i = 0; i < x.length; i++) {
      out[i] = valueAt(x[i], xp, fp);
    }
    return out;
  }

  public static double valueAt(double v, double[] xp, double[] fp) {
    int last = xp.length - 1;
    if (v <= xp[0]) {
      return fp[0];
    }
    if (v >= xp[last]) {
      return fp[last];
    }
    int lo = 0;
    int hi = last;
    while (hi - lo > 1) {
      int mid = (lo + hi) >>> 1;
      if (xp[mid] <= v) {
        lo = mid;
      } else {
        hi = mid;
      }
    }
    double span = xp[hi] - xp[lo];
    if (span == 0.0) {
      return fp[hi];
    }
    return fp[lo] + (fp[hi] - fp[lo]) * (v - xp[lo]) / span;
  }
}
