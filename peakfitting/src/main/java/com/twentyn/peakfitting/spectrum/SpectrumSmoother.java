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

package com.twentyn.peakfitting.spectrum;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Length-preserving smoothing filters for intensity traces.
 *
 * Savitzky-Golay and the moving average work on sample indices, not on positions, so they assume roughly uniform
 * spacing, which holds for integrated powder patterns.
 */
public class SpectrumSmoother {

  public enum Method {
    GAUSSIAN,
    SAVITZKY_GOLAY,
    MOVING_AVERAGE,
  }

  public static final double DEFAULT_GAUSSIAN_SIGMA = 2.0;
  public static final int DEFAULT_SAVGOL_WINDOW = 11;
  public static final int DEFAULT_SAVGOL_ORDER = 3;
  public static final int DEFAULT_MOVING_AVERAGE_WINDOW = 5;

  private SpectrumSmoother() {
  }

  /**
   * Applies the chosen filter.  The parameter is sigma for the Gaussian filter and the window length for the other
   * two.
   */
  public static double[] smooth(double[] y, Method method, double parameter) {
    switch (method) {
      case GAUSSIAN:
        return gaussian(y, parameter);
      case SAVITZKY_GOLAY:
        return savitzkyGolay(y, (int) Math.round(parameter), DEFAULT_SAVGOL_ORDER);
      case MOVING_AVERAGE:
        return movingAverage(y, (int) Math.round(parameter));
      default:
        throw new IllegalArgumentException(String.format("Unknown smoothing method %s", method));
    }
  }

  /**
   * Convolves with a normalized Gaussian kernel truncated at 4 sigma.  Borders are handled by mirroring about the
   * outer edge of the first/last sample (d c b a | a b c d | d c b a).
   */
  public static double[] gaussian(double[] y, double sigma) {
    if (sigma <= 0.0 || y.length == 0) {
      return y.clone();
    }
    int radius = (int) (4.0 * sigma + 0.5);
    double[] kernel = new double[2 * radius + 1];
    double sum = 0.0;
    for (int k = -radius; k <= radius; k++) {
      double v = Math.exp(-0.5 * k * k / (sigma * sigma));
      kernel[k + radius] = v;
      sum += v;
    }
    for (int k = 0; k < kernel.length; k++) {
      kernel[k] /= sum;
    }

    double[] out = new double[y.length];
    for (int i = 0; i < y.length; i++) {
      double acc = 0.0;
      for (int k = -radius; k <= radius; k++) {
        acc += kernel[k + radius] * y[reflect(i + k, y.length)];
      }
      out[i] = acc;
    }
    return out;
  }

  private static int reflect(int index, int n) {
    if (n == 1) {
      return 0;
    }
    int period = 2 * n;
    int i = index % period;
    if (i < 0) {
      i += period;
    }
    return i < n ? i : period - 1 - i;
  }

  /**
   * Savitzky-Golay filter.  The window is shrunk to the data length and forced odd, and grown to at least
   * order + 2 samples.  Samples within half a window of either end take the value of a polynomial fitted to the
   * first/last full window.
   */
  public static double[] savitzkyGolay(double[] y, int window, int order) {
    int n = y.length;
    int w = Math.min(window, n);
    if (w % 2 == 0) {
      w -= 1;
    }
    if (w < order + 2) {
      w = order + 2;
      if (w % 2 == 0) {
        w += 1;
      }
    }
    if (w > n || order >= w) {
      // Not enough data to fit anything meaningful.
      return y.clone();
    }

    int half = w / 2;
    RealMatrix pseudoInverse = vandermondePseudoInverse(w, order, half);

    double[] out = new double[n];
    double[] center = pseudoInverse.getRow(0);
    for (int i = half; i < n - half; i++) {
      double acc = 0.0;
      for (int j = 0; j < w; j++) {
        acc += center[j] * y[i - half + j];
      }
      out[i] = acc;
    }

    double[] leftCoefficients = pseudoInverse.operate(slice(y, 0, w));
    double[] rightCoefficients = pseudoInverse.operate(slice(y, n - w, w));
    for (int i = 0; i < half; i++) {
      out[i] = evaluatePolynomial(leftCoefficients, i - half);
      int r = n - half + i;
      out[r] = evaluatePolynomial(rightCoefficients, i + 1);
    }
    return out;
  }

  /* Polynomial basis over offsets -half..half: row j of the returned (order+1) x w matrix maps a window of samples to
   * the coefficient of offset^j. */
  private static RealMatrix vandermondePseudoInverse(int w, int order, int half) {
    double[][] a = new double[w][order + 1];
    for (int row = 0; row < w; row++) {
      double offset = row - half;
      double p = 1.0;
      for (int col = 0; col <= order; col++) {
        a[row][col] = p;
        p *= offset;
      }
    }
    return new QRDecomposition(new Array2DRowRealMatrix(a, false)).getSolver().getInverse();
  }

  private static double evaluatePolynomial(double[] coefficients, double offset) {
    double acc = 0.0;
    for (int k = coefficients.length - 1; k >= 0; k--) {
      acc = acc * offset + coefficients[k];
    }
    return acc;
  }

  private static double[] slice(double[] y, int from, int length) {
    double[] out = new double[length];
    System.arraycopy(y, from, out, 0, length);
    return out;
  }

  /**
   * Centered moving average.  The window shrinks symmetrically near the ends so the output keeps the input length.
   */
  public static double[] movingAverage(double[] y, int window) {
    int w = Math.min(window, y.length);
    if (w <= 1) {
      return y.clone();
    }
    int half = w / 2;
    double[] prefix = new double[y.length + 1];
    for (int i = 0; i < y.length; i++) {
      prefix[i + 1] = prefix[i] + y[i];
    }
    double[] out = new double[y.length];
    for (int i = 0; i < y.length; i++) {
      int reach = Math.min(half, Math.min(i, y.length - 1 - i));
      int lo = i - reach;
      int hi = i + reach;
      out[i] = (prefix[hi + 1] - prefix[lo]) / (hi - lo + 1);
    }
    return out;
  }
}
