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

import com.twentyn.peakfitting.SyntheticSpectra;
import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class FwhmEstimatorTest {

  @Test
  public void testEstimatesWidthOfCleanPeak() {
    SyntheticSpectra synthetic = new SyntheticSpectra(0.0, 4.0, 0.01).peak(100.0, 2.0, 0.3);
    double[] x = synthetic.positions();
    double[] y = synthetic.intensities();
    // Sample 200 sits on the apex; the edges of +/- 50 samples still carry some Lorentzian tail.
    double fwhm = new FwhmEstimator().estimate(x, y, 200);
    assertEquals(0.3, fwhm, 0.05);
  }

  @Test
  public void testFallsBackForTooSmallNeighbourhood() {
    FwhmEstimator estimator = new FwhmEstimator(1, 0.7);
    assertEquals(0.7, estimator.estimate(new double[]{0.0, 1.0, 2.0}, new double[]{0.0, 1.0, 0.0}, 0), 0.0);
  }

  @Test
  public void testNarrowSpikeIsWidenedToMinimumWidth() {
    double[] x = new double[41];
    double[] y = new double[41];
    for (int i = 0; i < x.length; i++) {
      x[i] = i * 0.1;
    }
    y[20] = 10.0;
    // Ten samples are too few to smooth, so the spike measures under one sample wide and is replaced by eight.
    double fwhm = new FwhmEstimator(5, 0.5).estimate(x, y, 20);
    assertEquals(0.8, fwhm, 1e-9);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRejectsIndexOutsideTrace() {
    new FwhmEstimator().estimate(new double[]{0.0, 1.0}, new double[]{0.0, 1.0}, 2);
  }

  @Test
  public void testEdgeBaselineAveragesBothEnds() {
    double[] y = new double[]{1.0, 3.0, 100.0, 100.0, 5.0, 7.0};
    assertEquals(4.0, FwhmEstimator.edgeBaseline(y, 2), 1e-12);
  }
}
