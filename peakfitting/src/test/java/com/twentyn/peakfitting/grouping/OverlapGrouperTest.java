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
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class OverlapGrouperTest {

  // Positions 10.0, 10.2, 11.0, 14.0, 14.1 with FWHM 0.1 (0.3 for the fourth).
  private static final List<PeakCandidate> CANDIDATES = new ArrayList<PeakCandidate>() {{
    add(new PeakCandidate(100, 10.0, 500.0, 0.1));
    add(new PeakCandidate(120, 10.2, 400.0, 0.1));
    add(new PeakCandidate(200, 11.0, 300.0, 0.1));
    add(new PeakCandidate(500, 14.0, 200.0, 0.3));
    add(new PeakCandidate(510, 14.1, 100.0, 0.1));
  }};

  @Test
  public void testGroupsByDistanceAgainstLargerWidth() {
    List<PeakGroup> groups = new OverlapGrouper(1.5).group(CANDIDATES);
    assertEquals(4, groups.size());
    assertEquals(1, groups.get(0).size());
    assertEquals(1, groups.get(1).size());
    assertEquals(1, groups.get(2).size());
    // 0.1 apart, limit 1.5 * 0.3.
    assertEquals(2, groups.get(3).size());
    assertEquals(14.0, groups.get(3).first().getPosition(), 0.0);
  }

  @Test
  public void testLargerThresholdOnlyMerges() {
    List<PeakGroup> narrow = new OverlapGrouper(1.5).group(CANDIDATES);
    List<PeakGroup> wide = new OverlapGrouper(5.0).group(CANDIDATES);
    assertEquals(3, wide.size());
    assertEquals(2, wide.get(0).size());
    assertTrue(wide.size() <= narrow.size());

    // Every narrow group must be contained in exactly one wide group.
    for (PeakGroup g : narrow) {
      int containing = 0;
      for (PeakGroup w : wide) {
        if (w.getMembers().containsAll(g.getMembers())) {
          containing++;
        }
      }
      assertEquals(1, containing);
    }
  }

  @Test
  public void testEveryCandidateAppearsExactlyOnceRegardlessOfInputOrder() {
    List<PeakCandidate> shuffled = new ArrayList<>(CANDIDATES);
    Collections.reverse(shuffled);
    List<PeakGroup> groups = new OverlapGrouper(5.0).group(shuffled);

    List<PeakCandidate> flattened = new ArrayList<>();
    for (PeakGroup g : groups) {
      flattened.addAll(g.getMembers());
    }
    assertEquals(CANDIDATES, flattened);
    assertEquals(new OverlapGrouper(5.0).group(CANDIDATES), groups);
  }

  @Test
  public void testGroupingIsIdempotent() {
    OverlapGrouper grouper = new OverlapGrouper(1.5);
    List<PeakGroup> once = grouper.group(CANDIDATES);
    List<PeakCandidate> flattened = new ArrayList<>();
    for (PeakGroup g : once) {
      flattened.addAll(g.getMembers());
    }
    assertEquals(once, grouper.group(flattened));
  }

  @Test
  public void testEmptyInputGivesNoGroups() {
    assertTrue(new OverlapGrouper(1.5).group(Collections.emptyList()).isEmpty());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testCandidatesNeedWidths() {
    new OverlapGrouper(1.5).group(Collections.singletonList(new PeakCandidate(1, 1.0, 1.0, Double.NaN)));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testThresholdMustBePositive() {
    new OverlapGrouper(0.0);
  }
}
