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

import com.twentyn.peakfitting.spectrum.Spectrum;
import com.twentyn.peakfitting.spectrum.XY;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A background curve evaluated at every sample of one spectrum, together with the control points and method that
 * produced it.
 */
public class BackgroundModel {
  private final BackgroundMethod method;
  private final List<XY> controlPoints;
  private final double[] curve;

  public BackgroundModel(BackgroundMethod method, List<XY> controlPoints, double[] curve, int spectrumSize) {
    if (curve.length != spectrumSize) {
      throw new IllegalArgumentException(String.format(
          "Background curve has %d samples but the spectrum has %d", curve.length, spectrumSize));
    }
    this.method = method;
    this.controlPoints = Collections.unmodifiableList(new ArrayList<>(controlPoints));
    this.curve = Arrays.copyOf(curve, curve.length);
  }

  public BackgroundMethod getMethod() {
    return method;
  }

  public List<XY> getControlPoints() {
    return controlPoints;
  }

  public double[] getCurve() {
    return Arrays.copyOf(curve, curve.length);
  }

  public double valueAt(int index) {
    return curve[index];
  }

  public int size() {
    return curve.length;
  }

  /**
   * Sets the spectrum's working intensities to its original intensities minus this background.  Subtraction always
   * starts from the original data, so applying it twice does not subtract twice.
   */
  public void subtractFrom(Spectrum spectrum) {
    if (spectrum.size() != curve.length) {
      throw new IllegalArgumentException(String.format(
          "Background for %d samples cannot be applied to %s with %d samples",
          curve.length, spectrum.getName(), spectrum.size()));
    }
    double[] original = spectrum.getOriginalIntensities();
    double[] corrected = new double[original.length];
    for (int i = 0; i < original.length; i++) {
      corrected[i] = original[i] - curve[i];
    }
    spectrum.setIntensities(corrected);
  }
}
