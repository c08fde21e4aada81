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

import org.apache.commons.math3.analysis.interpolation.SplineInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Penalized cubic smoothing spline (Reinsch / Green and Silverman formulation).
 *
 * The fitted knot values g minimize sum (y_i - g_i)^2 + lambda * integral g''(x)^2 dx, which reduces to the linear
 * system (I + lambda Q R^-1 Q^T) g = y.  The spline through the smoothed values is then a natural cubic interpolant,
 * built with commons-math's {@link SplineInterpolator}.  Beyond the outer knots the curve is held flat.
 */
public class SmoothingSpline {
  private final double[] knots;
  private final PolynomialSplineFunction function;

  private SmoothingSpline(double[] knots, PolynomialSplineFunction function) {
    this.knots = knots;
    this.function = function;
  }

  /**
   * @param x Strictly increasing knot positions, at least three of them.
   * @param y Observed values at the knots.
   * @param smoothing Dimensionless smoothing strength; scaled by the cube of the mean knot spacing.
   */
  public static SmoothingSpline fit(double[] x, double[] y, double smoothing) {
    int n = x.length;
    if (n < 3) {
      throw new IllegalArgumentException(String.format("Smoothing spline needs at least 3 knots, got %d", n));
    }
    double[] h = new double[n - 1];
    for (int i = 0; i < n - 1; i++) {
      h[i] = x[i + 1] - x[i];
      if (h[i] <= 0.0) {
        throw new IllegalArgumentException("Smoothing spline knots must be strictly increasing");
      }
    }
    double meanSpacing = (x[n - 1] - x[0]) / (n - 1);
    double lambda = smoothing * meanSpacing * meanSpacing * meanSpacing;

    RealMatrix q = new Array2DRowRealMatrix(n, n - 2);
    RealMatrix r = new Array2DRowRealMatrix(n - 2, n - 2);
    for (int j = 1; j < n - 1; j++) {
      int col = j - 1;
      q.setEntry(j - 1, col, 1.0 / h[j - 1]);
      q.setEntry(j, col, -1.0 / h[j - 1] - 1.0 / h[j]);
      q.setEntry(j + 1, col, 1.0 / h[j]);

      r.setEntry(col, col, (h[j - 1] + h[j]) / 3.0);
      if (col + 1 < n - 2) {
        r.setEntry(col, col + 1, h[j] / 6.0);
        r.setEntry(col + 1, col, h[j] / 6.0);
      }
    }

    RealMatrix rInverse = new LUDecomposition(r).getSolver().getInverse();
    RealMatrix penalty = q.multiply(rInverse).multiply(q.transpose());
    RealMatrix system = MatrixUtils.createRealIdentityMatrix(n).add(penalty.scalarMultiply(lambda));
    double[] smoothed = new LUDecomposition(system).getSolver().solve(new ArrayRealVector(y)).toArray();

    PolynomialSplineFunction function = new SplineInterpolator().interpolate(x, smoothed);
    return new SmoothingSpline(x.clone(), function);
  }

  public double value(double v) {
    double clamped = Math.max(knots[0], Math.min(knots[knots.length - 1], v));
    return function.value(clamped);
  }
}
