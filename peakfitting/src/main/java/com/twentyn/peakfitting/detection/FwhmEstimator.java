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

package com.twentyn.peakfitting.detection;

import com.twentyn.peakfitting.spectrum.SpectrumSmoother;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Estimates the full width at half maximum of a peak directly from the data, by walking outwards from the apex until
 * the (smoothed) trace drops below halfway between the apex and an edge baseline, and interpolating the crossing.
 */
public class FwhmEstimator {
  private static final Logger LOGGER = LogManager.getFormatterLogger(FwhmEstimator.class);

  public static final int DEFAULT_HALF_WINDOW = 50;
  public static final double DEFAULT_FALLBACK_FWHM = 0.5;

  private static final int SMOOTHING_WINDOW = 11;
  private static final int SMOOTHING_ORDER = 3;
  // Widths narrower than this many samples are not trusted.
  private static final double MIN_WIDTH_SAMPLES = 2.0;
  private static final double REPLACEMENT_WIDTH_SAMPLES = 8.0;

  private final int halfWindow;
  private final double fallbackFwhm;

  public FwhmEstimator() {
    this(DEFAULT_HALF_WINDOW, DEFAULT_FALLBACK_FWHM);
  }

  public FwhmEstimator(int halfWindow, double fallbackFwhm) {
    this.halfWindow = halfWindow;
    this.fallbackFwhm = fallbackFwhm;
  }

  public double getFallbackFwhm() {
    return fallbackFwhm;
  }

  /**
   * Estimates the FWHM of the peak at peakIndex using a neighbourhood of +/- halfWindow samples.
   * @return The width in position units, or the fallback width if no sensible estimate can be made.
   */
  public double estimate(double[] x, double[] y, int peakIndex) {
    if (peakIndex < 0 || peakIndex >= x.length) {
      throw new IllegalArgumentException(String.format("Peak index %d outside of [0, %d)", peakIndex, x.length));
    }
    int left = Math.max(0, peakIndex - halfWindow);
    int right = Math.min(x.length, peakIndex + halfWindow);
    if (right - left < 3) {
      LOGGER.debug("Neighbourhood of peak at index %d too small, using fallback width %.4f", peakIndex, fallbackFwhm);
      return fallbackFwhm;
    }

    double[] xLocal = new double[right - left];
    double[] yLocal = new double[right - left];
    System.arraycopy(x, left, xLocal, 0, xLocal.length);
    System.arraycopy(y, left, yLocal, 0, yLocal.length);

    double fwhm = estimateLocal(xLocal, yLocal, peakIndex - left);
    if (Double.isNaN(fwhm) || Double.isInfinite(fwhm) || fwhm <= 0.0) {
      LOGGER.debug("FWHM estimate for peak at %.4f failed, using fallback width %.4f", x[peakIndex], fallbackFwhm);
      return fallbackFwhm;
    }
    return fwhm;
  }

  private double estimateLocal(double[] x, double[] y, int peak) {
    int n = y.length;
    double[] smooth = n > SMOOTHING_WINDOW ? SpectrumSmoother.savitzkyGolay(y, SMOOTHING_WINDOW, SMOOTHING_ORDER) : y;

    double peakHeight = smooth[peak];
    double baseline = edgeBaseline(smooth, Math.max(3, n / 10));
    double halfMax = (peakHeight + baseline) / 2.0;

    double leftX = x[0];
    for (int j = peak; j > 0; j--) {
      if (smooth[j] <= halfMax) {
        if (j + 1 < n && smooth[j + 1] != smooth[j]) {
          double frac = (halfMax - smooth[j]) / (smooth[j + 1] - smooth[j]);
          leftX = x[j] + frac * (x[j + 1] - x[j]);
        } else {
          leftX = x[j];
        }
        break;
      }
    }

    double rightX = x[n - 1];
    for (int j = peak; j < n - 1; j++) {
      if (smooth[j] <= halfMax) {
        if (j > 0 && smooth[j - 1] != smooth[j]) {
          double frac = (halfMax - smooth[j]) / (smooth[j - 1] - smooth[j]);
          rightX = x[j] - frac * (x[j] - x[j - 1]);
        } else {
          rightX = x[j];
        }
        break;
      }
    }

    double fwhm = Math.abs(rightX - leftX);
    double dx = (x[n - 1] - x[0]) / (n - 1);
    if (fwhm < dx * MIN_WIDTH_SAMPLES) {
      fwhm = dx * REPLACEMENT_WIDTH_SAMPLES;
    }
    return fwhm;
  }

  /**
   * Mean of the first and last edgeCount samples, averaged.
   */
  public static double edgeBaseline(double[] y, int edgeCount) {
    int count = Math.max(1, Math.min(edgeCount, y.length));
    double leftSum = 0.0;
    double rightSum = 0.0;
    for (int i = 0; i < count; i++) {
      leftSum += y[i];
      rightSum += y[y.length - 1 - i];
    }
    return (leftSum / count + rightSum / count) / 2.0;
  }
}
