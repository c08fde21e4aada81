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

package com.twentyn.peakfitting.profile;

import java.util.List;

/**
 * An analytic line shape.  Parameters are passed as a flat array in the order given by {@link #getParameterNames()};
 * the first four slots are shared by every profile (amplitude, center, sigma, gamma).  Amplitude is the integrated
 * area of the peak.
 */
public interface PeakProfile {
  int AMPLITUDE = 0;
  int CENTER = 1;
  int SIGMA = 2;
  int GAMMA = 3;
  int ETA = 4;

  double value(double x, double[] params);

  double fwhm(double[] params);

  double area(double[] params);

  int getParameterCount();

  List<String> getParameterNames();

  /**
   * Evaluates the profile at every position.
   */
  default double[] values(double[] x, double[] params) {
    double[] out = new double[x.length];
    for (int i = 0; i < x.length; i++) {
      out[i] = value(x[i], params);
    }
    return out;
  }
}
