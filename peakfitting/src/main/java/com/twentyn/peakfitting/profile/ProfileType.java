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

import org.apache.commons.math3.complex.Complex;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The line shapes available for fitting.  Both are unit-area shapes scaled by the amplitude.
 */
public enum ProfileType implements PeakProfile {
  /**
   * eta * Lorentzian(gamma) + (1 - eta) * Gaussian(sigma).
   */
  PSEUDO_VOIGT(Arrays.asList("amplitude", "center", "sigma", "gamma", "eta")) {
    @Override
    public double value(double x, double[] p) {
      double amplitude = p[AMPLITUDE];
      double dx = x - p[CENTER];
      double sigma = p[SIGMA];
      double gamma = p[GAMMA];
      double eta = p[ETA];
      double gaussian = Math.exp(-dx * dx / (2.0 * sigma * sigma)) / (sigma * SQRT_2PI);
      double lorentzian = gamma / (Math.PI * (dx * dx + gamma * gamma));
      return amplitude * (eta * lorentzian + (1.0 - eta) * gaussian);
    }

    @Override
    public double fwhm(double[] p) {
      return p[ETA] * 2.0 * p[GAMMA] + (1.0 - p[ETA]) * GAUSSIAN_FWHM_FACTOR * p[SIGMA];
    }
  },

  /**
   * Gaussian(sigma) convolved with Lorentzian(gamma), evaluated through the Faddeeva function.
   */
  VOIGT(Arrays.asList("amplitude", "center", "sigma", "gamma")) {
    @Override
    public double value(double x, double[] p) {
      double sigma = p[SIGMA];
      double scale = sigma * Math.sqrt(2.0);
      Complex z = new Complex((x - p[CENTER]) / scale, p[GAMMA] / scale);
      return p[AMPLITUDE] * Faddeeva.w(z).getReal() / (sigma * SQRT_2PI);
    }

    @Override
    public double fwhm(double[] p) {
      // Olivero & Longbothum, accurate to 0.02%.
      double fL = 2.0 * p[GAMMA];
      double fG = GAUSSIAN_FWHM_FACTOR * p[SIGMA];
      return 0.5346 * fL + Math.sqrt(0.2166 * fL * fL + fG * fG);
    }
  },
  ;

  public static final double SQRT_2PI = Math.sqrt(2.0 * Math.PI);
  public static final double GAUSSIAN_FWHM_FACTOR = 2.355;

  private final List<String> parameterNames;

  ProfileType(List<String> parameterNames) {
    this.parameterNames = Collections.unmodifiableList(parameterNames);
  }

  @Override
  public double area(double[] params) {
    return params[AMPLITUDE];
  }

  @Override
  public int getParameterCount() {
    return parameterNames.size();
  }

  @Override
  public List<String> getParameterNames() {
    return parameterNames;
  }

  public boolean hasEta() {
    return getParameterCount() > ETA;
  }
}
