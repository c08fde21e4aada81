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

import com.twentyn.peakfitting.SyntheticSpectra;
import com.twentyn.peakfitting.spectrum.Spectrum;
import com.twentyn.peakfitting.spectrum.XY;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class BackgroundEstimatorTest {

  private Spectrum spectrum;
  private int[] peaks;

  @Before
  public void setUp() {
    // Three peaks on a sloped background: 50 + 10 * (x - 10).
    spectrum = new SyntheticSpectra(10.0, 20.0, 0.01)
        .peak(200.0, 12.0, 0.2)
        .peak(200.0, 15.0, 0.2)
        .peak(200.0, 18.0, 0.2)
        .background(50.0, 10.0)
        .build("sloped");
    peaks = new int[]{spectrum.nearestIndex(12.0), spectrum.nearestIndex(15.0), spectrum.nearestIndex(18.0)};
  }

  @Test
  public void testEveryMethodGivesOneValuePerSample() {
    BackgroundEstimator estimator = new BackgroundEstimator();
    for (BackgroundMethod method : BackgroundMethod.values()) {
      BackgroundModel model = estimator.estimate(spectrum, peaks, method);
      assertEquals(method.name(), spectrum.size(), model.size());
      assertEquals(method, model.getMethod());
    }
  }

  @Test
  public void testValleyPointsSitBetweenPeaks() {
    List<XY> points = new BackgroundEstimator().findValleyPoints(spectrum.getPositions(),
        spectrum.getIntensities(), peaks);
    assertEquals(4, points.size());
    assertEquals(10.0, points.get(0).getX(), 1e-9);
    assertTrue(points.get(1).getX() > 12.0 && points.get(1).getX() < 15.0);
    assertTrue(points.get(2).getX() > 15.0 && points.get(2).getX() < 18.0);
    for (int i = 1; i < points.size(); i++) {
      assertTrue(points.get(i).getX() > points.get(i - 1).getX());
    }
  }

  @Test
  public void testValleyBackgroundFollowsTheSlope() {
    BackgroundModel model = new BackgroundEstimator().estimate(spectrum, peaks, BackgroundMethod.VALLEY);
    // Between peaks the curve stays within the Lorentzian tails of the true line.
    int idx = spectrum.nearestIndex(13.5);
    assertEquals(50.0 + 10.0 * 3.5, model.valueAt(idx), 6.0);
  }

  @Test
  public void testNoPeaksGivesFlatMedian() {
    BackgroundModel model = new BackgroundEstimator().estimate(spectrum, new int[0], BackgroundMethod.SPLINE);
    double first = model.valueAt(0);
    for (double v : model.getCurve()) {
      assertEquals(first, v, 0.0);
    }
    assertTrue(model.getControlPoints().isEmpty());
  }

  @Test
  public void testManualPointsInterpolateAndHoldFlatOutside() {
    List<XY> points = new ArrayList<XY>() {{
      add(new XY(16.0, 20.0));
      add(new XY(12.0, 10.0));
    }};
    BackgroundModel model = new BackgroundEstimator().fromControlPoints(spectrum, points);
    assertEquals(BackgroundMethod.MANUAL, model.getMethod());
    assertEquals(12.0, model.getControlPoints().get(0).getX(), 0.0);
    assertEquals(10.0, model.valueAt(0), 1e-9);
    assertEquals(20.0, model.valueAt(spectrum.size() - 1), 1e-9);
    assertEquals(15.0, model.valueAt(spectrum.nearestIndex(14.0)), 1e-6);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testManualNeedsTwoPoints() {
    new BackgroundEstimator().fromControlPoints(spectrum, Collections.singletonList(new XY(12.0, 10.0)));
  }

  @Test
  public void testSubtractAlwaysStartsFromOriginalAndRestoreUndoesIt() {
    BackgroundModel model = new BackgroundEstimator().estimate(spectrum, peaks, BackgroundMethod.VALLEY);
    model.subtractFrom(spectrum);
    double[] once = spectrum.getIntensities();
    model.subtractFrom(spectrum);
    assertArrayEquals(once, spectrum.getIntensities(), 0.0);
    assertTrue(spectrum.isModified());

    spectrum.restoreOriginal();
    assertFalse(spectrum.isModified());
  }

  @Test
  public void testSegmentMinimaOnePerSegment() {
    List<XY> points = new BackgroundEstimator().selectSegmentMinima(spectrum, 10);
    assertEquals(10, points.size());
    for (int s = 0; s < points.size(); s++) {
      double x = points.get(s).getX();
      assertTrue(x >= 10.0 + s - 1e-9 && x <= 11.0 + s + 1e-9);
    }
  }

  @Test
  public void testTemplateSnapsToNearestSamples() {
    List<XY> points = new BackgroundEstimator().applyTemplate(spectrum, new double[]{10.004, 19.5});
    assertEquals(2, points.size());
    assertEquals(10.0, points.get(0).getX(), 1e-9);
    assertEquals(spectrum.getIntensity(0), points.get(0).getY(), 0.0);
    assertEquals(19.5, points.get(1).getX(), 1e-9);
  }

  @Test
  public void testSplineReproducesStraightLines() {
    double[] x = new double[]{0.0, 1.0, 2.5, 4.0, 5.0};
    double[] y = new double[x.length];
    for (int i = 0; i < x.length; i++) {
      y[i] = 3.0 - 2.0 * x[i];
    }
    SmoothingSpline spline = SmoothingSpline.fit(x, y, 10.0);
    for (double v : new double[]{0.5, 2.0, 3.3, 4.9}) {
      assertEquals(3.0 - 2.0 * v, spline.value(v), 1e-9);
    }
    assertEquals(3.0, spline.value(-1.0), 1e-9);
  }

  @Test
  public void testLinearInterpolation() {
    double[] xp = new double[]{0.0, 1.0, 3.0};
    double[] fp = new double[]{0.0, 10.0, 30.0};
    assertEquals(0.0, LinearInterpolator.valueAt(-2.0, xp, fp), 0.0);
    assertEquals(5.0, LinearInterpolator.valueAt(0.5, xp, fp), 1e-12);
    assertEquals(20.0, LinearInterpolator.valueAt(2.0, xp, fp), 1e-12);
    assertEquals(30.0, LinearInterpolator.valueAt(7.0, xp, fp), 0.0);
  }

  @Test
  public void testLocalBackgroundUsesLowEdges() {
    double[] x = new double[40];
    double[] y = new double[40];
    for (int i = 0; i < x.length; i++) {
      x[i] = i;
      y[i] = 2.0 * i + 1.0;
    }
    y[20] = 500.0;
    LocalBackground line = LocalBackground.estimate(x, y);
    assertEquals(2.0, line.getSlope(), 1e-6);
    assertEquals(1.0, line.getIntercept(), 1e-6);
    assertEquals(0.0, line.subtract(x, y)[5], 1e-6);
  }
}
