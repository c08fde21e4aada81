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

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class SpectrumTest {

  private static final double[] X = new double[]{10.0, 10.1, 10.2, 10.3, 10.4};
  private static final double[] Y = new double[]{1.0, 4.0, 9.0, 4.0, 1.0};

  private Spectrum spectrum;

  @Before
  public void setUp() {
    spectrum = new Spectrum("test", X, Y);
  }

  @Test
  public void testWorkingCopyIsIndependentOfOriginal() {
    double[] working = spectrum.getIntensities();
    working[2] = 0.0;
    assertEquals(9.0, spectrum.getIntensity(2), 0.0);

    spectrum.setIntensities(new double[]{0.0, 0.0, 0.0, 0.0, 0.0});
    assertTrue(spectrum.isModified());
    assertArrayEquals(Y, spectrum.getOriginalIntensities(), 0.0);
  }

  @Test
  public void testRestoreIsBitIdentical() {
    double[] shifted = spectrum.getIntensities();
    for (int i = 0; i < shifted.length; i++) {
      shifted[i] -= 0.1 * i + 1.0 / 3.0;
    }
    spectrum.setIntensities(shifted);
    spectrum.restoreOriginal();
    assertFalse(spectrum.isModified());
    for (int i = 0; i < Y.length; i++) {
      assertEquals(Double.doubleToLongBits(Y[i]), Double.doubleToLongBits(spectrum.getIntensity(i)));
    }
  }

  @Test
  public void testCopiesPreserveState() {
    spectrum.setIntensities(new double[]{5.0, 5.0, 5.0, 5.0, 5.0});
    Spectrum copy = spectrum.copy();
    assertArrayEquals(spectrum.getIntensities(), copy.getIntensities(), 0.0);
    assertArrayEquals(Y, copy.getOriginalIntensities(), 0.0);
    assertArrayEquals(Y, spectrum.copyOfOriginal().getIntensities(), 0.0);
  }

  @Test
  public void testNearestIndexAndSpacing() {
    assertEquals(0, spectrum.nearestIndex(-5.0));
    assertEquals(2, spectrum.nearestIndex(10.21));
    assertEquals(4, spectrum.nearestIndex(99.0));
    assertEquals(0.1, spectrum.meanSpacing(), 1e-12);
    assertTrue(spectrum.isValidIndex(4));
    assertFalse(spectrum.isValidIndex(5));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testColumnsMustMatch() {
    new Spectrum("bad", new double[]{1.0, 2.0}, new double[]{1.0});
  }

  @Test(expected = IllegalArgumentException.class)
  public void testWorkingIntensitiesMustMatchLength() {
    spectrum.setIntensities(new double[]{1.0});
  }
}
