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

import com.twentyn.peakfitting.spectrum.Spectrum;
import com.twentyn.peakfitting.spectrum.SpectrumSmoother;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Finds peak apexes in a diffraction trace.
 *
 * The trace is lightly smoothed, then every local maximum is tested against four adaptive criteria derived from the
 * intensity range: absolute height, topographic prominence, minimum separation from taller neighbours and minimum
 * width at half prominence.  If nothing passes, one retry is made with relaxed thresholds and no width criterion.
 * Survivors must finally stand at least 10% above a baseline estimated from the edges of their neighbourhood.
 */
public class PeakDetector {
  private static final Logger LOGGER = LogManager.getFormatterLogger(PeakDetector.class);

  private static final int SMOOTHING_WINDOW = 15;
  private static final int SMOOTHING_ORDER = 3;

  public static final double DEFAULT_HEIGHT_FRACTION = 0.05;
  public static final double DEFAULT_PROMINENCE_FRACTION = 0.02;
  public static final double RELAXED_HEIGHT_FRACTION = 0.02;
  public static final double RELAXED_PROMINENCE_FRACTION = 0.01;
  public static final int RELAXED_MIN_DISTANCE = 3;
  public static final int MIN_DISTANCE_SAMPLES = 5;
  // Minimum separation expressed in position units (degrees 2-theta).
  public static final double MIN_DISTANCE_POSITION = 0.1;
  public static final double MIN_WIDTH_SAMPLES = 2.0;
  public static final int LOCAL_BASELINE_HALF_WINDOW = 40;
  public static final double LOCAL_BASELINE_FACTOR = 1.1;

  private final double heightFraction;
  private final double prominenceFraction;
  private final FwhmEstimator fwhmEstimator;

  public PeakDetector() {
    this(DEFAULT_HEIGHT_FRACTION, DEFAULT_PROMINENCE_FRACTION, new FwhmEstimator());
  }

  public PeakDetector(double heightFraction, double prominenceFraction, FwhmEstimator fwhmEstimator) {
    this.heightFraction = heightFraction;
    this.prominenceFraction = prominenceFraction;
    this.fwhmEstimator = fwhmEstimator;
  }

  /**
   * Detects peaks on the working intensities of a spectrum.
   * @return Candidates sorted by index, each with an FWHM estimate.  Empty if nothing looks like a peak.
   */
  public List<PeakCandidate> detect(Spectrum spectrum) {
    double[] x = spectrum.getPositions();
    double[] y = spectrum.getIntensities();
    int[] indices = findPeakIndices(x, y);

    List<PeakCandidate> candidates = new ArrayList<>(indices.length);
    for (int index : indices) {
      candidates.add(PeakCandidate.at(spectrum, index, fwhmEstimator.estimate(x, y, index)));
    }
    if (candidates.isEmpty()) {
      LOGGER.warn("No peaks detected in %s", spectrum.getName());
    } else {
      LOGGER.info("Detected %d peaks in %s", candidates.size(), spectrum.getName());
    }
    return candidates;
  }

  /**
   * Runs the detection criteria on raw arrays.
   * @return Sorted sample indices of accepted peaks, possibly empty.
   */
  public int[] findPeakIndices(double[] x, double[] y) {
    if (y.length < 3) {
      return new int[0];
    }
    double[] smooth = y.length > SMOOTHING_WINDOW ?
        SpectrumSmoother.savitzkyGolay(y, SMOOTHING_WINDOW, SMOOTHING_ORDER) : y;

    double min = Arrays.stream(y).min().getAsDouble();
    double max = Arrays.stream(y).max().getAsDouble();
    double range = max - min;
    double dx = (x[x.length - 1] - x[0]) / (x.length - 1);
    int minDistance = dx > 0 ?
        Math.max(MIN_DISTANCE_SAMPLES, (int) (MIN_DISTANCE_POSITION / dx)) : MIN_DISTANCE_SAMPLES;

    List<Integer> peaks = findPeaks(smooth, min + range * heightFraction, range * prominenceFraction,
        minDistance, MIN_WIDTH_SAMPLES);
    if (peaks.isEmpty()) {
      LOGGER.debug("No peaks with strict thresholds, retrying with relaxed ones");
      peaks = findPeaks(smooth, min + range * RELAXED_HEIGHT_FRACTION, range * RELAXED_PROMINENCE_FRACTION,
          RELAXED_MIN_DISTANCE, 0.0);
    }

    List<Integer> accepted = new ArrayList<>();
    for (int idx : peaks) {
      int left = Math.max(0, idx - LOCAL_BASELINE_HALF_WINDOW);
      int right = Math.min(y.length, idx + LOCAL_BASELINE_HALF_WINDOW);
      int edgeCount = Math.max(3, (right - left) / 10);
      double localBaseline = (mean(y, left, Math.min(right, left + edgeCount)) +
          mean(y, Math.max(left, right - edgeCount), right)) / 2.0;
      if (y[idx] > localBaseline * LOCAL_BASELINE_FACTOR) {
        accepted.add(idx);
      }
    }

    return accepted.stream().mapToInt(Integer::intValue).toArray();
  }

  private static double mean(double[] y, int from, int to) {
    double sum = 0.0;
    for (int i = from; i < to; i++) {
      sum += y[i];
    }
    return sum / Math.max(1, to - from);
  }

  /* Local maxima, with flat tops reported at their (lower) middle sample. */
  static List<Integer> localMaxima(double[] y) {
    List<Integer> maxima = new ArrayList<>();
    int i = 1;
    int last = y.length - 1;
    while (i < last) {
      if (y[i - 1] < y[i]) {
        int ahead = i + 1;
        while (ahead <= last && y[ahead] == y[i]) {
          ahead++;
        }
        if (ahead <= last && y[ahead] < y[i]) {
          maxima.add((i + ahead - 1) / 2);
          i = ahead;
          continue;
        }
      }
      i++;
    }
    return maxima;
  }

  static List<Integer> findPeaks(double[] y, double minHeight, double minProminence, int minDistance,
                                 double minWidth) {
    List<Integer> peaks = new ArrayList<>();
    for (int p : localMaxima(y)) {
      if (y[p] >= minHeight) {
        peaks.add(p);
      }
    }

    peaks = enforceDistance(y, peaks, minDistance);

    List<Integer> result = new ArrayList<>();
    for (int p : peaks) {
      int[] bases = new int[2];
      double prominence = prominence(y, p, bases);
      if (prominence < minProminence) {
        continue;
      }
      if (minWidth > 0.0 && widthAtHalfProminence(y, p, prominence, bases[0], bases[1]) < minWidth) {
        continue;
      }
      result.add(p);
    }
    return result;
  }

  /* Taller peaks claim their neighbourhood first; any peak closer than minDistance to a kept one is dropped. */
  private static List<Integer> enforceDistance(double[] y, List<Integer> peaks, int minDistance) {
    if (minDistance <= 1 || peaks.size() < 2) {
      return peaks;
    }
    List<Integer> byHeight = new ArrayList<>(peaks);
    // Stable sort keeps lower index first among equal heights.
    byHeight.sort((a, b) -> Double.compare(y[b], y[a]));

    boolean[] removed = new boolean[y.length];
    List<Integer> kept = new ArrayList<>();
    for (int p : byHeight) {
      if (removed[p]) {
        continue;
      }
      kept.add(p);
      for (int q : peaks) {
        if (q != p && Math.abs(q - p) < minDistance) {
          removed[q] = true;
        }
      }
    }
    Collections.sort(kept);
    return kept;
  }

  /**
   * Topographic prominence: height above the higher of the two minima found by walking outwards from the peak until
   * a taller sample or the edge of the trace is reached.  The indices of those minima are written to bases.
   */
  static double prominence(double[] y, int peak, int[] bases) {
    int leftBase = peak;
    double leftMin = y[peak];
    for (int i = peak - 1; i >= 0 && y[i] <= y[peak]; i--) {
      if (y[i] < leftMin) {
        leftMin = y[i];
        leftBase = i;
      }
    }
    int rightBase = peak;
    double rightMin = y[peak];
    for (int i = peak + 1; i < y.length && y[i] <= y[peak]; i++) {
      if (y[i] < rightMin) {
        rightMin = y[i];
        rightBase = i;
      }
    }
    bases[0] = leftBase;
    bases[1] = rightBase;
    return y[peak] - Math.max(leftMin, rightMin);
  }

  static double widthAtHalfProminence(double[] y, int peak, double prominence, int leftBase, int rightBase) {
    double level = y[peak] - prominence * 0.5;

    int i = peak;
    while (i > leftBase && y[i] > level) {
      i--;
    }
    double leftIp = i;
    if (y[i] < level) {
      leftIp += (level - y[i]) / (y[i + 1] - y[i]);
    }

    i = peak;
    while (i < rightBase && y[i] > level) {
      i++;
    }
    double rightIp = i;
    if (y[i] < level) {
      rightIp -= (level - y[i]) / (y[i - 1] - y[i]);
    }
    return rightIp - leftIp;
  }
}
