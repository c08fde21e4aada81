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

import com.twentyn.peakfitting.profile.PeakProfile;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;

/**
 * The sum of N profiles of one type, evaluated at fixed positions, for use as a least squares model.  Parameters are
 * the concatenation of the per-peak parameter blocks.  The Jacobian is computed by central differences.
 */
public class ProfileSumFunction implements MultivariateJacobianFunction {
  private static final double RELATIVE_STEP = 1e-6;
  private static final double MIN_STEP = 1e-8;

  private final PeakProfile profile;
  private final double[] x;
  private final int peakCount;

  public ProfileSumFunction(PeakProfile profile, double[] x, int peakCount) {
    this.profile = profile;
    this.x = x;
    this.peakCount = peakCount;
  }

  public int getParameterCount() {
    return profile.getParameterCount() * peakCount;
  }

  public double[] evaluate(double[] params) {
    int width = profile.getParameterCount();
    double[] out = new double[x.length];
    double[] block = new double[width];
    for (int p = 0; p < peakCount; p++) {
      System.arraycopy(params, p * width, block, 0, width);
      for (int i = 0; i < x.length; i++) {
        out[i] += profile.value(x[i], block);
      }
    }
    return out;
  }

  @Override
  public Pair<RealVector, RealMatrix> value(RealVector point) {
    double[] params = point.toArray();
    double[] values = evaluate(params);

    RealMatrix jacobian = new Array2DRowRealMatrix(x.length, params.length);
    int width = profile.getParameterCount();
    double[] block = new double[width];
    for (int j = 0; j < params.length; j++) {
      int peak = j / width;
      int slot = j % width;
      System.arraycopy(params, peak * width, block, 0, width);
      double original = block[slot];
      double step = Math.max(MIN_STEP, RELATIVE_STEP * Math.abs(original));
      // Only peak `peak` depends on parameter j, so the other profiles cancel out of the difference.
      for (int i = 0; i < x.length; i++) {
        block[slot] = original + step;
        double up = profile.value(x[i], block);
        block[slot] = original - step;
        double down = profile.value(x[i], block);
        jacobian.setEntry(i, j, (up - down) / (2.0 * step));
      }
    }
    return new Pair<>(new ArrayRealVector(values, false), jacobian);
  }
}
