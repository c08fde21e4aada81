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

import java.util.Arrays;

/**
 * Parameter block of a single fitted profile.
 */
public class ProfileParameters {
  private final ProfileType profile;
  private final double[] values;

  public ProfileParameters(ProfileType profile, double[] values) {
    if (values.length != profile.getParameterCount()) {
      throw new IllegalArgumentException(String.format("%s takes %d parameters, got %d",
          profile, profile.getParameterCount(), values.length));
    }
    this.profile = profile;
    this.values = values.clone();
  }

  /**
   * Splits a concatenated parameter vector into per-peak blocks.
   */
  public static ProfileParameters[] split(ProfileType profile, double[] concatenated) {
    int width = profile.getParameterCount();
    ProfileParameters[] out = new ProfileParameters[concatenated.length / width];
    for (int p = 0; p < out.length; p++) {
      out[p] = new ProfileParameters(profile, Arrays.copyOfRange(concatenated, p * width, (p + 1) * width));
    }
    return out;
  }

  public static double[] join(ProfileParameters... blocks) {
    if (blocks.length == 0) {
      return new double[0];
    }
    int width = blocks[0].values.length;
    double[] out = new double[width * blocks.length];
    for (int p = 0; p < blocks.length; p++) {
      System.arraycopy(blocks[p].values, 0, out, p * width, width);
    }
    return out;
  }

  public ProfileType getProfile() {
    return profile;
  }

  public double[] toArray() {
    return values.clone();
  }

  public double getAmplitude() {
    return values[PeakProfile.AMPLITUDE];
  }

  public double getCenter() {
    return values[PeakProfile.CENTER];
  }

  public double getSigma() {
    return values[PeakProfile.SIGMA];
  }

  public double getGamma() {
    return values[PeakProfile.GAMMA];
  }

  /**
   * @return The Lorentzian fraction, or NaN for profiles without one.
   */
  public double getEta() {
    return profile.hasEta() ? values[PeakProfile.ETA] : Double.NaN;
  }

  public double fwhm() {
    return profile.fwhm(values);
  }

  public double area() {
    return profile.area(values);
  }

  public double[] curve(double[] x) {
    return profile.values(x, values);
  }

  @Override
  public String toString() {
    return String.format("%s%s", profile, Arrays.toString(values));
  }
}
