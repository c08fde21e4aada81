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
import com.twentyn.peakfitting.profile.ProfileType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Fits a group of overlapping peaks in two stages.
 *
 * Stage A fits every member on its own in a narrow window; a member that fails keeps its heuristic seeds.  Stage B
 * then fits the sum of all member profiles in one window spanning the group, starting from the Stage-A values.  If
 * Stage B fails, the Stage-A results are returned flagged as degraded.  Singleton groups go straight to the
 * {@link SinglePeakFitter}.
 */
public class MultiPeakFitter {
  private static final Logger LOGGER = LogManager.getFormatterLogger(MultiPeakFitter.class);

  private final SinglePeakFitter singlePeakFitter;
  private final ProfileOptimizer optimizer;

  public MultiPeakFitter() {
    this(new SinglePeakFitter(), new ProfileOptimizer());
  }

  public MultiPeakFitter(SinglePeakFitter singlePeakFitter, ProfileOptimizer optimizer) {
    this.singlePeakFitter = singlePeakFitter;
    this.optimizer = optimizer;
  }

  /**
   * @throws PeakFitException only for singleton groups, or when the joint window itself is infeasible and not a
   * single member could be pre-fitted.
   */
  public GroupFit fit(double[] x, double[] y, PeakGroup group, FitSettings settings) throws PeakFitException {
    if (group.isSingleton()) {
      return singlePeakFitter.fit(x, y, group.first(), settings);
    }

    ProfileType profile = settings.getProfile();
    List<PeakCandidate> members = group.getMembers();
    int n = members.size();

    // Stage A
    FitSettings stageASettings = settings.forStageA();
    PeakFitResult[] stageAResults = new PeakFitResult[n];
    ProfileParameters[] stageAParams = new ProfileParameters[n];
    for (int i = 0; i < n; i++) {
      PeakCandidate member = members.get(i);
      try {
        PeakFitResult r = singlePeakFitter.fit(x, y, member, stageASettings).getResults().get(0);
        stageAResults[i] = r;
        stageAParams[i] = r.getParameters();
      } catch (PeakFitException e) {
        LOGGER.info("Stage A pre-fit of peak at %.4f failed, seeding from heuristics: %s",
            member.getPosition(), e.getMessage());
        stageAResults[i] = PeakFitResult.failed(member, n, e.getMessage());
      }
    }

    // Stage B
    double dx = SinglePeakFitter.meanSpacing(x);
    int halfWidth = jointHalfWindow(group.meanFwhm(), dx, settings.effectiveWindowMultiplier());
    FitWindow window = FitWindow.slice(x, y, group.minIndex() - halfWidth, group.maxIndex() + halfWidth);

    try {
      if (window.size() < FitSettings.MIN_WINDOW_SAMPLES) {
        throw new BoundsInfeasibleException(group.first().getPosition(), String.format(
            "Joint window for %d peaks has only %d samples", n, window.size()));
      }

      ParameterBounds[] memberBounds = new ParameterBounds[n];
      double[][] seeds = new double[n][];
      for (int i = 0; i < n; i++) {
        PeakCandidate member = members.get(i);
        memberBounds[i] = ParameterBounds.forPeak(profile, member.getPosition(), member.getFwhm(), dx,
            window.range(), settings.centerTolerance());
        double[] seed = stageAParams[i] != null ?
            stageAParams[i].toArray() : SinglePeakFitter.initialGuess(profile, member, window);
        seeds[i] = memberBounds[i].clamp(seed);
      }
      ParameterBounds bounds = ParameterBounds.concat(memberBounds);
      double[] start = new double[bounds.size()];
      int width = profile.getParameterCount();
      for (int i = 0; i < n; i++) {
        System.arraycopy(seeds[i], 0, start, i * width, width);
      }

      // A multi-member group always gets the tight optimizer settings.
      double[] solution = optimizer.optimize(profile, window.getX(), window.getY(), n, start, bounds,
          FitSettings.OVERLAP_TOLERANCE, FitSettings.OVERLAP_MAX_ITERATIONS, group.first().getPosition());

      ProfileParameters[] fitted = ProfileParameters.split(profile, solution);
      FitCurves curves = FitCurves.of(window, fitted, stageAParams);
      double rSquared = ProfileOptimizer.rSquared(window.getY(), curves.getTotal());

      List<PeakFitResult> results = new ArrayList<>(n);
      for (int i = 0; i < n; i++) {
        results.add(PeakFitResult.joint(members.get(i), fitted[i], stageAParams[i], rSquared, n));
      }
      LOGGER.debug("Joint fit of %d peaks between %.4f and %.4f: r2 %.4f", n, group.first().getPosition(),
          group.last().getPosition(), rSquared);
      return new GroupFit(group, results, rSquared, curves, false);
    } catch (PeakFitException e) {
      return degradedFallback(group, stageAResults, stageAParams, x, y, e);
    }
  }

  private GroupFit degradedFallback(PeakGroup group, PeakFitResult[] stageAResults, ProfileParameters[] stageAParams,
                                    double[] x, double[] y, PeakFitException cause) throws PeakFitException {
    int n = stageAResults.length;
    boolean anyValid = false;
    List<PeakFitResult> results = new ArrayList<>(n);
    for (PeakFitResult r : stageAResults) {
      anyValid |= r.isValid();
      results.add(r.isValid() ? PeakFitResult.degraded(r, n, cause.getMessage()) : r);
    }
    if (!anyValid) {
      throw cause;
    }
    LOGGER.warn("Joint fit of %d peaks near %.4f failed, keeping individual pre-fits: %s", n,
        group.first().getPosition(), cause.getMessage());

    List<ProfileParameters> valid = new ArrayList<>();
    for (ProfileParameters p : stageAParams) {
      if (p != null) {
        valid.add(p);
      }
    }
    double dx = SinglePeakFitter.meanSpacing(x);
    int halfWidth = jointHalfWindow(group.meanFwhm(), dx, FitSettings.STAGE_A_WINDOW_MULTIPLIER);
    FitWindow window = FitWindow.slice(x, y, group.minIndex() - halfWidth, group.maxIndex() + halfWidth);
    FitCurves curves = FitCurves.of(window, valid.toArray(new ProfileParameters[0]), null);
    double rSquared = ProfileOptimizer.rSquared(window.getY(), curves.getTotal());
    return new GroupFit(group, results, rSquared, curves, true);
  }

  /**
   * Half width (samples) added on both sides of the group: mean FWHM in samples times the multiplier times 0.8,
   * clamped to [40, 250].
   */
  static int jointHalfWindow(double meanFwhm, double dx, double multiplier) {
    long samples = Math.round(meanFwhm / dx * multiplier * FitSettings.JOINT_WINDOW_FACTOR);
    return (int) Math.max(FitSettings.MIN_JOINT_HALF_WINDOW, Math.min(FitSettings.MAX_JOINT_HALF_WINDOW, samples));
  }
}
