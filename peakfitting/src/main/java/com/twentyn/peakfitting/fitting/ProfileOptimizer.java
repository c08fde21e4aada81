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

import com.twentyn.peakfitting.profile.ProfileType;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Bounded Levenberg-Marquardt least squares for sums of profiles.  Bounds are enforced by projecting every trial
 * point into the box through the problem's parameter validator.
 */
public class ProfileOptimizer {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ProfileOptimizer.class);

  /**
   * @param position Position used to label failures.
   * @return The optimal concatenated parameters, always inside the bounds.
   * @throws FitConvergenceException if the optimizer gives up or returns non-finite values.
   */
  public double[] optimize(ProfileType profile, double[] x, double[] y, int peakCount, double[] start,
                           ParameterBounds bounds, double tolerance, int maxIterations, double position)
      throws FitConvergenceException {
    ProfileSumFunction model = new ProfileSumFunction(profile, x, peakCount);
    LeastSquaresProblem problem = new LeastSquaresBuilder()
        .parameterValidator(bounds)
        .maxEvaluations(maxIterations)
        .maxIterations(maxIterations)
        .lazyEvaluation(false)
        .start(bounds.clamp(start))
        .target(y)
        .model(model)
        .build();

    LevenbergMarquardtOptimizer optimizer = new LevenbergMarquardtOptimizer()
        .withCostRelativeTolerance(tolerance)
        .withParameterRelativeTolerance(tolerance);

    LeastSquaresOptimizer.Optimum optimum;
    try {
      optimum = optimizer.optimize(problem);
    } catch (MathIllegalStateException | MathIllegalArgumentException e) {
      throw new FitConvergenceException(position,
          String.format("Optimizer failed for %d peak(s) near %.4f: %s", peakCount, position, e.getMessage()), e);
    }

    double[] solution = bounds.clamp(optimum.getPoint().toArray());
    for (double v : solution) {
      if (Double.isNaN(v) || Double.isInfinite(v)) {
        throw new FitConvergenceException(position,
            String.format("Optimizer returned non-finite parameters near %.4f", position));
      }
    }
    LOGGER.debug("Converged for %d peak(s) near %.4f after %d iterations, %d evaluations, rms %.4g", peakCount,
        position, optimum.getIterations(), optimum.getEvaluations(), optimum.getRMS());
    return solution;
  }

  /**
   * Coefficient of determination of model against data, floored at zero.  A flat data window yields zero.
   */
  public static double rSquared(double[] y, double[] model) {
    double mean = 0.0;
    for (double v : y) {
      mean += v;
    }
    mean /= y.length;
    double ssRes = 0.0;
    double ssTot = 0.0;
    for (int i = 0; i < y.length; i++) {
      double r = y[i] - model[i];
      ssRes += r * r;
      double d = y[i] - mean;
      ssTot += d * d;
    }
    if (ssTot <= 0.0) {
      return 0.0;
    }
    return Math.max(0.0, 1.0 - ssRes / ssTot);
  }
}
