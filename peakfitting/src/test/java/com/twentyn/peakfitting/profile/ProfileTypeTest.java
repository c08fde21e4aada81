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
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class ProfileTypeTest {

  private static final double[] PV_PARAMS = new double[]{200.0, 10.0, 0.05, 0.04, 0.3};

  @Test
  public void testPseudoVoigtFwhmMixesComponentWidths() {
    double expected = 0.3 * 2.0 * 0.04 + 0.7 * 2.355 * 0.05;
    assertEquals(expected, ProfileType.PSEUDO_VOIGT.fwhm(PV_PARAMS), 1e-12);
  }

  @Test
  public void testPseudoVoigtIsSymmetricAboutCenter() {
    for (double d = 0.0; d < 0.5; d += 0.01) {
      assertEquals(ProfileType.PSEUDO_VOIGT.value(10.0 - d, PV_PARAMS),
          ProfileType.PSEUDO_VOIGT.value(10.0 + d, PV_PARAMS), 1e-9);
    }
  }

  @Test
  public void testPseudoVoigtPureLimits() {
    double[] gaussian = new double[]{1.0, 0.0, 0.5, 0.5, 0.0};
    assertEquals(1.0 / (0.5 * ProfileType.SQRT_2PI), ProfileType.PSEUDO_VOIGT.value(0.0, gaussian), 1e-12);

    double[] lorentzian = new double[]{1.0, 0.0, 0.5, 0.5, 1.0};
    assertEquals(1.0 / (Math.PI * 0.5), ProfileType.PSEUDO_VOIGT.value(0.0, lorentzian), 1e-12);
  }

  @Test
  public void testAmplitudeIsArea() {
    // Narrow Gaussian-dominated peak so the tails outside the integration range are negligible.
    double[] params = new double[]{123.0, 5.0, 0.02, 0.0001, 0.0};
    double step = 1e-4;
    double integral = 0.0;
    for (double x = 4.0; x < 6.0; x += step) {
      integral += ProfileType.PSEUDO_VOIGT.value(x, params) * step;
    }
    assertEquals(123.0, integral, 0.01);
    assertEquals(123.0, ProfileType.PSEUDO_VOIGT.area(params), 0.0);
  }

  @Test
  public void testVoigtTendsToLorentzianForTinySigma() {
    double amplitude = 50.0;
    double gamma = 1.0;
    double[] params = new double[]{amplitude, 0.0, 1e-3, gamma};
    double peakHeight = amplitude / (Math.PI * gamma);
    for (double x = -5.0; x <= 5.0; x += 0.25) {
      double lorentzian = amplitude * gamma / (Math.PI * (x * x + gamma * gamma));
      assertEquals(String.format("at x=%.2f", x), lorentzian, ProfileType.VOIGT.value(x, params), 1e-3 * peakHeight);
    }
  }

  @Test
  public void testVoigtTendsToGaussianForTinyGamma() {
    double amplitude = 50.0;
    double sigma = 0.5;
    double[] params = new double[]{amplitude, 2.0, sigma, 1e-8};
    double peakHeight = amplitude / (sigma * ProfileType.SQRT_2PI);
    for (double x = 0.0; x <= 4.0; x += 0.1) {
      double dx = x - 2.0;
      double gaussian = peakHeight * Math.exp(-dx * dx / (2.0 * sigma * sigma));
      assertEquals(String.format("at x=%.2f", x), gaussian, ProfileType.VOIGT.value(x, params), 1e-3 * peakHeight);
    }
  }

  @Test
  public void testVoigtFwhmLimits() {
    assertEquals(2.0, ProfileType.VOIGT.fwhm(new double[]{1.0, 0.0, 0.0, 1.0}), 2.0 * 1e-3);
    assertEquals(2.355, ProfileType.VOIGT.fwhm(new double[]{1.0, 0.0, 1.0, 0.0}), 2.355 * 1e-3);
  }

  @Test
  public void testParameterLayout() {
    assertEquals(5, ProfileType.PSEUDO_VOIGT.getParameterCount());
    assertEquals(4, ProfileType.VOIGT.getParameterCount());
    assertTrue(ProfileType.PSEUDO_VOIGT.hasEta());
    assertEquals("center", ProfileType.VOIGT.getParameterNames().get(PeakProfile.CENTER));
  }

  @Test
  public void testFaddeevaAtOrigin() {
    Complex w = Faddeeva.w(new Complex(0.0, 0.0));
    assertEquals(1.0, w.getReal(), 1e-4);
    assertEquals(0.0, w.getImaginary(), 1e-4);
  }

  @Test
  public void testFaddeevaOnImaginaryAxisMatchesScaledErfc() {
    // w(iy) = exp(y^2) erfc(y); at y = 1 this is 0.4275835762.
    Complex w = Faddeeva.w(new Complex(0.0, 1.0));
    assertEquals(0.4275835762, w.getReal(), 1e-4);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testFaddeevaRejectsLowerHalfPlane() {
    Faddeeva.w(new Complex(1.0, -0.5));
  }
}
