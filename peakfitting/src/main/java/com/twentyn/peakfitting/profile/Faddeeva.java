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

/**
 * The Faddeeva function w(z) = exp(-z^2) erfc(-iz) for Im(z) >= 0, using Humlicek's four region rational
 * approximation (J. Quant. Spectrosc. Radiat. Transfer 27, 437, 1982).  Relative accuracy is about 1e-4, which is
 * well below the noise of any measured line shape.
 */
public final class Faddeeva {

  private static final double INV_SQRT_PI = 0.5641896;

  private Faddeeva() {
  }

  public static Complex w(Complex z) {
    double x = z.getReal();
    double y = z.getImaginary();
    if (y < 0.0) {
      throw new IllegalArgumentException(String.format("Faddeeva approximation needs Im(z) >= 0, got %f", y));
    }

    Complex t = new Complex(y, -x);
    double s = Math.abs(x) + y;

    if (s >= 15.0) {
      // Region I: asymptotic one-pole form.
      return t.multiply(INV_SQRT_PI).divide(t.multiply(t).add(0.5));
    }

    if (s >= 5.5) {
      Complex u = t.multiply(t);
      Complex numerator = t.multiply(u.multiply(INV_SQRT_PI).add(1.410474));
      Complex denominator = u.multiply(u.add(3.0)).add(0.75);
      return numerator.divide(denominator);
    }

    if (y >= 0.195 * Math.abs(x) - 0.176) {
      Complex numerator = horner(t, 16.4955, 20.20933, 11.96482, 3.778987, 0.5642236);
      Complex denominator = horner(t, 16.4955, 38.82363, 39.27121, 21.69274, 6.699398, 1.0);
      return numerator.divide(denominator);
    }

    Complex u = t.multiply(t);
    Complex numerator = horner(u.negate(), 36183.31, 3321.9905, 1540.787, 219.0313, 35.76683, 1.320522, 0.56419);
    Complex denominator = horner(u.negate(), 32066.6, 24322.84, 9022.228, 2186.181, 364.2191, 61.57037, 1.841439,
        1.0);
    return u.exp().subtract(t.multiply(numerator).divide(denominator));
  }

  /* Evaluates c0 + c1*v + c2*v^2 + ...  The region IV polynomials alternate in sign, which is folded into -u. */
  private static Complex horner(Complex v, double... coefficients) {
    Complex acc = Complex.ZERO;
    for (int k = coefficients.length - 1; k >= 0; k--) {
      acc = acc.multiply(v).add(coefficients[k]);
    }
    return acc;
  }
}
