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
import com.twentyn.peakfitting.profile.ProfileType;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealVector;

import java.util.Arrays;

/**
 * Box constraints on a concatenation of per-peak parameter blocks.  Also serves as the optimizer's parameter
 * validator, projecting every trial point back into the box.
 */
public class ParameterBounds implements ParameterValidator {
  private final double[] lower;
  private final double[] upper;

  public ParameterBounds(double[] lower, double[] upper) {
    if (lower.length != upper.length) {
      throw new IllegalArgumentException("Lower and upper bounds differ in length");
    }
    this.lower = lower.clone();
    this.upper = upper.clone();
  }

  /**
   * Bounds for one peak: centre within tolerance x FWHM of the candidate position, amplitude between zero and ten
   * times the window range scaled to an area, widths between half a sample and three FWHMs, eta in [0, 1].
   *
   * @param windowRange Intensity range of the background-subtracted window.
   * @throws BoundsInfeasibleException if any interval is empty.
   */
  public static ParameterBounds forPeak(ProfileType profile, double position, double fwhm, double dx,
                                        double windowRange, double centerTolerance)
      throws BoundsInfeasibleException {
    int width = profile.getParameterCount();
    double[] lower = new double[width];
    double[] upper = new double[width];
    double sigma0 = fwhm / ProfileType.GAUSSIAN_FWHM_FACTOR;

    lower[PeakProfile.AMPLITUDE] = 0.0;
    upper[PeakProfile.AMPLITUDE] = FitSettings.AMPLITUDE_CEILING * windowRange * sigma0 * ProfileType.SQRT_2PI;
    lower[PeakProfile.CENTER] = position - fwhm * centerTolerance;
    upper[PeakProfile.CENTER] = position + fwhm * centerTolerance;
    lower[PeakProfile.SIGMA] = dx * FitSettings.MIN_WIDTH_SAMPLES;
    upper[PeakProfile.SIGMA] = fwhm * FitSettings.MAX_WIDTH_FWHMS;
    lower[PeakProfile.GAMMA] = dx * FitSettings.MIN_WIDTH_SAMPLES;
    upper[PeakProfile.GAMMA] = fwhm * FitSettings.MAX_WIDTH_FWHMS;
    if (profile.hasEta()) {
      lower[PeakProfile.ETA] = 0.0;
      upper[PeakProfile.ETA] = 1.0;
    }

    ParameterBounds bounds = new ParameterBounds(lower, upper);
    bounds.checkFeasible(position, profile);
    return bounds;
  }

  /**
   * Concatenates per-peak bounds in order.
   */
  public static ParameterBounds concat(ParameterBounds... blocks) {
    int total = 0;
    for (ParameterBounds b : blocks) {
      total += b.size();
    }
    double[] lower = new double[total];
    double[] upper = new double[total];
    int offset = 0;
    for (ParameterBounds b : blocks) {
      System.arraycopy(b.lower, 0, lower, offset, b.size());
      System.arraycopy(b.upper, 0, upper, offset, b.size());
      offset += b.size();
    }
    return new ParameterBounds(lower, upper);
  }

  private void checkFeasible(double position, PeakProfile profile) throws BoundsInfeasibleException {
    for (int i = 0; i < lower.length; i++) {
      if (!(lower[i] < upper[i])) {
        throw new BoundsInfeasibleException(position, String.format(
            "Empty bounds for %s: [%g, %g]", profile.getParameterNames().get(i % profile.getParameterCount()),
            lower[i], upper[i]));
      }
    }
  }

  public int size() {
    return lower.length;
  }

  public double[] clamp(double[] params) {
    double[] out = new double[params.length];
    for (int i = 0; i < params.length; i++) {
      out[i] = Math.max(lower[i], Math.min(upper[i], params[i]));
    }
    return out;
  }

  @Override
  public RealVector validate(RealVector params) {
    return new ArrayRealVector(clamp(params.toArray()), false);
  }

  @Override
  public String toString() {
    return String.format("ParameterBounds[lower=%s, upper=%s]", Arrays.toString(lower), Arrays.toString(upper));
  }
}
