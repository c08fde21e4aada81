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
import com.twentyn.peakfitting.spectrum.SpectrumSmoother;
import com.twentyn.peakfitting.spectrum.XY;
import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.fitting.PolynomialCurveFitter;
import org.apache.commons.math3.fitting.WeightedObservedPoints;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builds global background curves for a spectrum, either from user supplied control points or automatically from
 * the minima between peaks, and chooses control points automatically for batch runs.
 */
public class BackgroundEstimator {
  private static final Logger LOGGER = LogManager.getFormatterLogger(BackgroundEstimator.class);

  public static final int DEFAULT_SEGMENT_COUNT = 10;
  public static final double DEFAULT_SPLINE_SMOOTHING = 1.0;
  public static final int DEFAULT_POLYNOMIAL_ORDER = 3;

  // Samples kept clear of the outermost peaks when looking for edge minima.
  private static final int EDGE_CLEARANCE = 5;
  private static final int SEGMENT_SMOOTHING_WINDOW = 50;
  private static final int SEGMENT_SMOOTHING_ORDER = 2;
  private static final int MIN_SPLINE_POINTS = 4;

  private final double splineSmoothing;
  private final int polynomialOrder;

  public BackgroundEstimator() {
    this(DEFAULT_SPLINE_SMOOTHING, DEFAULT_POLYNOMIAL_ORDER);
  }

  public BackgroundEstimator(double splineSmoothing, int polynomialOrder) {
    this.splineSmoothing = splineSmoothing;
    this.polynomialOrder = polynomialOrder;
  }

  /**
   * Linear interpolation through manually chosen points, flat beyond the outermost ones.
   * @throws IllegalArgumentException if fewer than two points are given.
   */
  public BackgroundModel fromControlPoints(Spectrum spectrum, List<XY> points) {
    if (points.size() < 2) {
      throw new IllegalArgumentException(String.format(
          "At least 2 background points are needed, got %d", points.size()));
    }
    List<XY> sorted = sortedByX(points);
    double[] curve = LinearInterpolator.interpolate(spectrum.getPositions(), sorted);
    return new BackgroundModel(BackgroundMethod.MANUAL, sorted, curve, spectrum.size());
  }

  /**
   * Fits a background through the valleys around and between the given peaks.  Without peaks the background is a
   * flat line at the median intensity.
   */
  public BackgroundModel estimate(Spectrum spectrum, int[] peakIndices, BackgroundMethod method) {
    double[] x = spectrum.getPositions();
    double[] y = spectrum.getIntensities();

    if (peakIndices.length == 0) {
      double[] flat = new double[x.length];
      Arrays.fill(flat, median(y));
      return new BackgroundModel(method, new ArrayList<>(), flat, spectrum.size());
    }

    List<XY> points = findValleyPoints(x, y, peakIndices);
    if (points.size() < 2) {
      double[] flat = new double[x.length];
      Arrays.fill(flat, points.get(0).getY());
      return new BackgroundModel(method, points, flat, spectrum.size());
    }

    double yMax = Arrays.stream(y).max().getAsDouble();
    double[] curve;
    switch (method) {
      case SPLINE:
        curve = points.size() >= MIN_SPLINE_POINTS ? splineCurve(x, points, yMax) :
            LinearInterpolator.interpolate(x, points);
        break;
      case POLYNOMIAL:
        curve = polynomialCurve(x, points, yMax);
        break;
      case VALLEY:
      case MANUAL:
        curve = LinearInterpolator.interpolate(x, points);
        break;
      default:
        throw new IllegalArgumentException(String.format("Unknown background method %s", method));
    }
    LOGGER.debug("%s background for %s from %d anchor points", method, spectrum.getName(), points.size());
    return new BackgroundModel(method, points, curve, spectrum.size());
  }

  /**
   * Anchor points: the minimum left of the first peak, the minimum in every gap between neighbouring peaks, and the
   * minimum right of the last peak.  Returned sorted by position with duplicates removed.
   */
  public List<XY> findValleyPoints(double[] x, double[] y, int[] peakIndices) {
    int[] peaks = peakIndices.clone();
    Arrays.sort(peaks);
    int n = x.length;
    List<XY> points = new ArrayList<>();

    int leftEnd = Math.max(0, peaks[0] - EDGE_CLEARANCE);
    if (leftEnd > 0) {
      int idx = argMin(y, 0, leftEnd + 1);
      points.add(new XY(x[idx], y[idx]));
    } else {
      points.add(new XY(x[0], y[0]));
    }

    for (int i = 0; i < peaks.length - 1; i++) {
      int a = peaks[i];
      int b = peaks[i + 1];
      if (b > a + 1) {
        int idx = argMin(y, a, b + 1);
        points.add(new XY(x[idx], y[idx]));
      }
    }

    int rightStart = Math.min(n - 1, peaks[peaks.length - 1] + EDGE_CLEARANCE);
    if (rightStart < n - 1) {
      int idx = argMin(y, rightStart, n);
      points.add(new XY(x[idx], y[idx]));
    } else {
      points.add(new XY(x[n - 1], y[n - 1]));
    }

    List<XY> sorted = sortedByX(points);
    List<XY> unique = new ArrayList<>();
    for (XY p : sorted) {
      if (unique.isEmpty() || p.getX() > unique.get(unique.size() - 1).getX()) {
        unique.add(p);
      }
    }
    return unique;
  }

  /**
   * Splits the position range into equal segments and takes the lowest point of each (after light smoothing of the
   * segment).  Used to pick background points without any peak information.
   */
  public List<XY> selectSegmentMinima(Spectrum spectrum, int segmentCount) {
    double[] x = spectrum.getPositions();
    double[] y = spectrum.getIntensities();
    List<XY> points = new ArrayList<>();
    if (x.length < 2 || segmentCount < 1) {
      return points;
    }

    double xMin = Arrays.stream(x).min().getAsDouble();
    double xMax = Arrays.stream(x).max().getAsDouble();
    double step = (xMax - xMin) / segmentCount;

    for (int s = 0; s < segmentCount; s++) {
      double start = xMin + s * step;
      double end = s == segmentCount - 1 ? xMax : xMin + (s + 1) * step;
      List<Integer> indices = new ArrayList<>();
      for (int i = 0; i < x.length; i++) {
        if (x[i] >= start && x[i] <= end) {
          indices.add(i);
        }
      }
      if (indices.isEmpty()) {
        continue;
      }

      double[] segment = new double[indices.size()];
      for (int i = 0; i < segment.length; i++) {
        segment[i] = y[indices.get(i)];
      }
      int localWindow = Math.min(SEGMENT_SMOOTHING_WINDOW, segment.length / 2);
      double[] smooth = localWindow >= 3 ?
          SpectrumSmoother.savitzkyGolay(segment, Math.min(localWindow, segment.length / 2 * 2 + 1),
              SEGMENT_SMOOTHING_ORDER) :
          segment;

      int best = indices.get(argMin(smooth, 0, smooth.length));
      points.add(new XY(x[best], y[best]));
    }
    return points;
  }

  /**
   * Re-uses the positions of an earlier set of background points on a new spectrum: each template position is
   * mapped to the nearest sample and takes that sample's intensity.
   */
  public List<XY> applyTemplate(Spectrum spectrum, double[] templatePositions) {
    List<XY> points = new ArrayList<>(templatePositions.length);
    for (double position : templatePositions) {
      int idx = spectrum.nearestIndex(position);
      points.add(new XY(spectrum.getPosition(idx), spectrum.getIntensity(idx)));
    }
    return points;
  }

  private double[] splineCurve(double[] x, List<XY> points, double yMax) {
    double[] px = new double[points.size()];
    double[] py = new double[points.size()];
    for (int i = 0; i < px.length; i++) {
      px[i] = points.get(i).getX();
      py[i] = points.get(i).getY();
    }
    try {
      SmoothingSpline spline = SmoothingSpline.fit(px, py, splineSmoothing);
      double[] curve = new double[x.length];
      for (int i = 0; i < x.length; i++) {
        curve[i] = Math.min(spline.value(x[i]), yMax);
      }
      return curve;
    } catch (MathIllegalArgumentException | MathIllegalStateException e) {
      LOGGER.warn("Smoothing spline failed (%s), falling back to linear background", e.getMessage());
      return LinearInterpolator.interpolate(x, points);
    }
  }

  private double[] polynomialCurve(double[] x, List<XY> points, double yMax) {
    int order = Math.min(polynomialOrder, points.size() - 1);
    WeightedObservedPoints observations = new WeightedObservedPoints();
    for (XY p : points) {
      observations.add(p.getX(), p.getY());
    }
    try {
      PolynomialFunction polynomial =
          new PolynomialFunction(PolynomialCurveFitter.create(order).fit(observations.toList()));
      double[] curve = new double[x.length];
      for (int i = 0; i < x.length; i++) {
        curve[i] = Math.min(polynomial.value(x[i]), yMax);
      }
      return curve;
    } catch (MathIllegalArgumentException | MathIllegalStateException e) {
      LOGGER.warn("Polynomial background failed (%s), falling back to linear background", e.getMessage());
      return LinearInterpolator.interpolate(x, points);
    }
  }

  private static List<XY> sortedByX(List<XY> points) {
    List<XY> sorted = new ArrayList<>(points);
    sorted.sort((a, b) -> Double.compare(a.getX(), b.getX()));
    return sorted;
  }

  private static int argMin(double[] y, int from, int to) {
    int best = from;
    for (int i = from + 1; i < to; i++) {
      if (y[i] < y[best]) {
        best = i;
      }
    }
    return best;
  }

  private static double median(double[] y) {
    double[] sorted = y.clone();
    Arrays.sort(sorted);
    int mid = sorted.length / 2;
    return sorted.length % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
  }
}
