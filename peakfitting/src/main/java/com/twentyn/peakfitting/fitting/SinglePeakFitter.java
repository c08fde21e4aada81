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

package com.twentyn.peakfitting.fitting;

import com.twentyn.peakfitting.detection.PeakCandidate;
import com.twentyn.peakfitting.grouping.PeakGroup;
import com.twentyn.peakfitting.profile.PeakProfile;
import com.twentyn.peakfitting.profile.ProfileType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;

/**
 * Fits one isolated peak inside a window sized from its FWHM estimate, after removing a straight background
 * estimated from the window edges.
 */
public class SinglePeakFitter {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SinglePeakFitter.class);

  private final ProfileOptimizer optimizer;

  public SinglePeakFitter() {
    this(new ProfileOptimizer());
  }

  public SinglePeakFitter(ProfileOptimizer optimizer) {
    this.optimizer = optimizer;
  }

  /**
   * @param x Positions of the whole trace.
   * @param y Working intensities of the whole trace.
   * @param candidate The peak, with an FWHM estimate.
   * @throws BoundsInfeasibleException if the window is too small or the bounds are empty.
   * @throws FitConvergenceException if the optimizer fails.
   */
  public GroupFit fit(double[] x, double[] y, PeakCandidate candidate, FitSettings settings)
      throws PeakFitException {
    double dx = meanSpacing(x);
    double fwhm = candidate.getFwhm();
    int halfWidth = halfWindow(fwhm, dx, settings.effectiveWindowMultiplier());
    FitWindow window = FitWindow.around(x, y, candidate.getIndex(), halfWidth);
    if (window.size() < FitSettings.MIN_WINDOW_SAMPLES) {
      throw new BoundsInfeasibleException(candidate.getPosition(), String.format(
          "Fitting window around %.4f has only %d samples", candidate.getPosition(), window.size()));
    }

    ProfileType profile = settings.getProfile();
    ParameterBounds bounds = ParameterBounds.forPeak(profile, candidate.getPosition(), fwhm, dx, window.range(),
        settings.centerTolerance());
    double[] start = bounds.clamp(initialGuess(profile, candidate, window));

    double[] solution = optimizer.optimize(profile, window.getX(), window.getY(), 1, start, bounds,
        settings.tolerance(), settings.maxIterations(), candidate.getPosition());

    ProfileParameters parameters = new ProfileParameters(profile, solution);
    double rSquared = ProfileOptimizer.rSquared(window.getY(), parameters.curve(window.getX()));
    LOGGER.debug("Fitted peak at %.4f: center %.4f, fwhm %.4f, r2 %.4f", candidate.getPosition(),
        parameters.getCenter(), parameters.fwhm(), rSquared);

    PeakFitResult result = PeakFitResult.single(candidate, parameters, rSquared);
    FitCurves curves = FitCurves.of(window, new ProfileParameters[]{parameters}, null);
    return new GroupFit(new PeakGroup(Collections.singletonList(candidate)), Collections.singletonList(result),
        rSquared, curves, false);
  }

  /**
   * Half window in samples: FWHM in samples times the multiplier, clamped to [20, 200].
   */
  static int halfWindow(double fwhm, double dx, double multiplier) {
    long samples = Math.round(fwhm / dx * multiplier);
    return (int) Math.max(FitSettings.MIN_HALF_WINDOW, Math.min(FitSettings.MAX_HALF_WINDOW, samples));
  }

  /**
   * Seeds from the candidate alone: area from local height and Gaussian width, gamma half the FWHM, eta one half.
   */
  static double[] initialGuess(ProfileType profile, PeakCandidate candidate, FitWindow window) {
    double fwhm = candidate.getFwhm();
    double sigma0 = fwhm / ProfileType.GAUSSIAN_FWHM_FACTOR;
    double gamma0 = fwhm / 2.0;

    double height;
    if (window.contains(candidate.getIndex())) {
      height = window.getY()[candidate.getIndex() - window.getStart()];
    } else {
      height = window.maxY();
    }
    if (height <= 0.0) {
      height = window.maxY() * 0.5;
    }

    double[] guess = new double[profile.getParameterCount()];
    guess[PeakProfile.AMPLITUDE] = height * sigma0 * ProfileType.SQRT_2PI;
    guess[PeakProfile.CENTER] = candidate.getPosition();
    guess[PeakProfile.SIGMA] = sigma0;
    guess[PeakProfile.GAMMA] = gamma0;
    if (profile.hasEta()) {
      guess[PeakProfile.ETA] = 0.5;
    }
    return guess;
  }

  static double meanSpacing(double[] x) {
    return Math.abs((x[x.length - 1] - x[0]) / (x.length - 1));
  }
}
