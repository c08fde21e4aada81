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

import com.twentyn.peakfitting.grouping.PeakGroup;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Fit of one peak group: per-peak results in member order, the shared goodness of fit and display curves.
 */
public class GroupFit {
  private final PeakGroup group;
  private final List<PeakFitResult> results;
  private final double rSquared;
  private final FitCurves curves;
  private final boolean degraded;

  public GroupFit(PeakGroup group, List<PeakFitResult> results, double rSquared, FitCurves curves,
                  boolean degraded) {
    this.group = group;
    this.results = Collections.unmodifiableList(new ArrayList<>(results));
    this.rSquared = rSquared;
    this.curves = curves;
    this.degraded = degraded;
  }

  public PeakGroup getGroup() {
    return group;
  }

  public List<PeakFitResult> getResults() {
    return results;
  }

  public double getRSquared() {
    return rSquared;
  }

  /**
   * @return Curves over the fitting window, or null when no curve could be produced.
   */
  public FitCurves getCurves() {
    return curves;
  }

  public boolean isDegraded() {
    return degraded;
  }
}
