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

/**
 * Outcome of fitting one peak.  Invalid results keep the candidate for reporting but carry NaN for every fitted
 * quantity.
 */
public class PeakFitResult {
  private final PeakCandidate candidate;
  private final ProfileParameters parameters;
  private final ProfileParameters stageAParameters;
  private final double rSquared;
  private final boolean valid;
  private final boolean multiPeak;
  private final boolean degraded;
  private final int groupSize;
  private final String failureReason;

  private PeakFitResult(PeakCandidate candidate, ProfileParameters parameters, ProfileParameters stageAParameters,
                        double rSquared, boolean valid, boolean multiPeak, boolean degraded, int groupSize,
                        String failureReason) {
    this.candidate = candidate;
    this.parameters = parameters;
    this.stageAParameters = stageAParameters;
    this.rSquared = rSquared;
    this.valid = valid;
    this.multiPeak = multiPeak;
    this.degraded = degraded;
    this.groupSize = groupSize;
    this.failureReason = failureReason;
  }

  public static PeakFitResult single(PeakCandidate candidate, ProfileParameters parameters, double rSquared) {
    return new PeakFitResult(candidate, parameters, null, rSquared, true, false, false, 1, null);
  }

  public static PeakFitResult joint(PeakCandidate candidate, ProfileParameters parameters,
                                    ProfileParameters stageAParameters, double rSquared, int groupSize) {
    return new PeakFitResult(candidate, parameters, stageAParameters, rSquared, true, true, false, groupSize, null);
  }

  /**
   * A Stage-A result standing in for a failed joint fit.
   */
  public static PeakFitResult degraded(PeakFitResult stageA, int groupSize, String reason) {
    return new PeakFitResult(stageA.candidate, stageA.parameters, stageA.parameters, stageA.rSquared, stageA.valid,
        false, true, groupSize, reason);
  }

  public static PeakFitResult failed(PeakCandidate candidate, int groupSize, String reason) {
    return new PeakFitResult(candidate, null, null, Double.NaN, false, groupSize > 1, false, groupSize, reason);
  }

  public PeakCandidate getCandidate() {
    return candidate;
  }

  /**
   * @return The fitted parameters, or null for an invalid result.
   */
  public ProfileParameters getParameters() {
    return parameters;
  }

  public ProfileParameters getStageAParameters() {
    return stageAParameters;
  }

  public double getRSquared() {
    return rSquared;
  }

  public boolean isValid() {
    return valid;
  }

  public boolean isMultiPeak() {
    return multiPeak;
  }

  public boolean isDegraded() {
    return degraded;
  }

  public int getGroupSize() {
    return groupSize;
  }

  public String getFailureReason() {
    return failureReason;
  }

  public double getCenter() {
    return valid ? parameters.getCenter() : Double.NaN;
  }

  public double getFwhm() {
    return valid ? parameters.fwhm() : Double.NaN;
  }

  public double getArea() {
    return valid ? parameters.area() : Double.NaN;
  }

  public double getAmplitude() {
    return valid ? parameters.getAmplitude() : Double.NaN;
  }

  public double getSigma() {
    return valid ? parameters.getSigma() : Double.NaN;
  }

  public double getGamma() {
    return valid ? parameters.getGamma() : Double.NaN;
  }

  public double getEta() {
    return valid ? parameters.getEta() : Double.NaN;
  }

  @Override
  public String toString() {
    if (!valid) {
      return String.format("PeakFitResult[%.4f failed: %s]", candidate.getPosition(), failureReason);
    }
    return String.format("PeakFitResult[center=%.4f, fwhm=%.4f, area=%.2f, r2=%.4f%s]", getCenter(), getFwhm(),
        getArea(), rSquared, multiPeak ? ", joint" : (degraded ? ", degraded" : ""));
  }
}
