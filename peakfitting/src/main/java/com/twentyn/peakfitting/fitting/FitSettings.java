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

import com.twentyn.peakfitting.grouping.OverlapGrouper;
import com.twentyn.peakfitting.profile.ProfileType;

/**
 * Immutable knobs for one fitting run.  Overlap mode widens fitting windows and centre bounds and tightens the
 * optimizer, for patterns where peaks sit on each other's shoulders.
 */
public class FitSettings {
  public static final double DEFAULT_WINDOW_MULTIPLIER = 3.0;
  public static final double OVERLAP_WINDOW_BONUS = 1.0;
  public static final double STAGE_A_WINDOW_MULTIPLIER = 2.0;
  public static final double JOINT_WINDOW_FACTOR = 0.8;

  public static final int MIN_HALF_WINDOW = 20;
  public static final int MAX_HALF_WINDOW = 200;
  public static final int MIN_JOINT_HALF_WINDOW = 40;
  public static final int MAX_JOINT_HALF_WINDOW = 250;
  public static final int MIN_WINDOW_SAMPLES = 5;

  public static final double CENTER_TOLERANCE = 0.5;
  public static final double OVERLAP_CENTER_TOLERANCE = 0.8;
  public static final double AMPLITUDE_CEILING = 10.0;
  public static final double MIN_WIDTH_SAMPLES = 0.5;
  public static final double MAX_WIDTH_FWHMS = 3.0;

  public static final double TOLERANCE = 1e-8;
  public static final double OVERLAP_TOLERANCE = 1e-9;
  public static final int MAX_ITERATIONS = 10000;
  public static final int OVERLAP_MAX_ITERATIONS = 30000;

  private final ProfileType profile;
  private final boolean overlapMode;
  private final double windowMultiplier;
  private final double groupingThreshold;

  public FitSettings(ProfileType profile, boolean overlapMode, double windowMultiplier, double groupingThreshold) {
    this.profile = profile;
    this.overlapMode = overlapMode;
    this.windowMultiplier = windowMultiplier;
    this.groupingThreshold = groupingThreshold;
  }

  public static FitSettings defaults(ProfileType profile, boolean overlapMode) {
    return new FitSettings(profile, overlapMode, DEFAULT_WINDOW_MULTIPLIER,
        overlapMode ? OverlapGrouper.DEFAULT_OVERLAP_THRESHOLD : OverlapGrouper.DEFAULT_THRESHOLD);
  }

  public ProfileType getProfile() {
    return profile;
  }

  public boolean isOverlapMode() {
    return overlapMode;
  }

  public double getWindowMultiplier() {
    return windowMultiplier;
  }

  public double getGroupingThreshold() {
    return groupingThreshold;
  }

  public double effectiveWindowMultiplier() {
    return overlapMode ? windowMultiplier + OVERLAP_WINDOW_BONUS : windowMultiplier;
  }

  public double centerTolerance() {
    return overlapMode ? OVERLAP_CENTER_TOLERANCE : CENTER_TOLERANCE;
  }

  public double tolerance() {
    return overlapMode ? OVERLAP_TOLERANCE : TOLERANCE;
  }

  public int maxIterations() {
    return overlapMode ? OVERLAP_MAX_ITERATIONS : MAX_ITERATIONS;
  }

  /**
   * Settings for the per-member pre-fit of a group: narrower windows and the normal (non overlap) rules.
   */
  public FitSettings forStageA() {
    return new FitSettings(profile, false, STAGE_A_WINDOW_MULTIPLIER, groupingThreshold);
  }

  public FitSettings withOverlapMode(boolean newOverlapMode) {
    return new FitSettings(profile, newOverlapMode, windowMultiplier, groupingThreshold);
  }

  public FitSettings withGroupingThreshold(double newThreshold) {
    return new FitSettings(profile, overlapMode, windowMultiplier, newThreshold);
  }

  @Override
  public String toString() {
    return String.format("FitSettings[%s, overlap=%s, window x%.1f, grouping %.2f]",
        profile, overlapMode, windowMultiplier, groupingThreshold);
  }
}
