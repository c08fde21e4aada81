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
import java.util.OptionalDouble;

/**
 * Everything produced by fitting one spectrum: per-peak results ordered by position, the groups that were fitted and
 * the groups that failed outright.
 */
public class FitReport {

  public static class GroupFailure {
    private final PeakGroup group;
    private final PeakFitException cause;

    public GroupFailure(PeakGroup group, PeakFitException cause) {
      this.group = group;
      this.cause = cause;
    }

    public PeakGroup getGroup() {
      return group;
    }

    public PeakFitException getCause() {
      return cause;
    }
  }

  private final String spectrumName;
  private final List<PeakFitResult> results;
  private final List<GroupFit> groupFits;
  private final List<GroupFailure> failures;

  public FitReport(String spectrumName, List<PeakFitResult> results, List<GroupFit> groupFits,
                   List<GroupFailure> failures) {
    this.spectrumName = spectrumName;
    this.results = Collections.unmodifiableList(new ArrayList<>(results));
    this.groupFits = Collections.unmodifiableList(new ArrayList<>(groupFits));
    this.failures = Collections.unmodifiableList(new ArrayList<>(failures));
  }

  public String getSpectrumName() {
    return spectrumName;
  }

  public List<PeakFitResult> getResults() {
    return results;
  }

  public List<GroupFit> getGroupFits() {
    return groupFits;
  }

  public List<GroupFailure> getFailures() {
    return failures;
  }

  public long validCount() {
    return results.stream().filter(PeakFitResult::isValid).count();
  }

  /**
   * @return The lowest r-squared among valid results, empty if there are none.
   */
  public OptionalDouble minimumRSquared() {
    return results.stream().filter(PeakFitResult::isValid).mapToDouble(PeakFitResult::getRSquared).min();
  }
}
