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

package com.twentyn.peakfitting.grouping;

import com.twentyn.peakfitting.detection.PeakCandidate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Partitions peak candidates into groups of overlapping peaks.  After sorting by position, a peak joins the group of
 * its left neighbour when the two are closer than threshold times the larger of their FWHMs.  Raising the threshold
 * can only merge groups, never split them.
 */
public class OverlapGrouper {
  private static final Logger LOGGER = LogManager.getFormatterLogger(OverlapGrouper.class);

  public static final double DEFAULT_THRESHOLD = 1.5;
  public static final double DEFAULT_OVERLAP_THRESHOLD = 5.0;

  private final double threshold;

  public OverlapGrouper(double threshold) {
    if (!(threshold > 0.0)) {
      throw new IllegalArgumentException(String.format("Grouping threshold must be positive, got %f", threshold));
    }
    this.threshold = threshold;
  }

  public double getThreshold() {
    return threshold;
  }

  /**
   * @param candidates Candidates with FWHM estimates.  Order does not matter.
   * @return Groups ordered by position; every candidate appears in exactly one group.
   */
  public List<PeakGroup> group(List<PeakCandidate> candidates) {
    List<PeakGroup> groups = new ArrayList<>();
    if (candidates.isEmpty()) {
      return groups;
    }

    List<PeakCandidate> sorted = new ArrayList<>(candidates);
    sorted.sort(PeakCandidate.BY_POSITION);
    for (PeakCandidate c : sorted) {
      if (!c.hasFwhm()) {
        throw new IllegalArgumentException(String.format("Candidate %s has no FWHM estimate", c));
      }
    }

    List<PeakCandidate> current = new ArrayList<>();
    current.add(sorted.get(0));
    for (int i = 1; i < sorted.size(); i++) {
      PeakCandidate previous = sorted.get(i - 1);
      PeakCandidate next = sorted.get(i);
      double distance = next.getPosition() - previous.getPosition();
      double limit = threshold * Math.max(previous.getFwhm(), next.getFwhm());
      if (distance < limit) {
        current.add(next);
      } else {
        groups.add(new PeakGroup(current));
        current = new ArrayList<>();
        current.add(next);
      }
    }
    groups.add(new PeakGroup(current));

    LOGGER.debug("Grouped %d peaks into %d groups (threshold %.2f)", sorted.size(), groups.size(), threshold);
    return groups;
  }
}
