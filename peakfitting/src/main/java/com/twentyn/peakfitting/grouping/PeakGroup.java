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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Peaks close enough that their profiles overlap and must be fitted together.  Members are ordered by position.
 */
public class PeakGroup {
  private final List<PeakCandidate> members;

  public PeakGroup(List<PeakCandidate> members) {
    if (members.isEmpty()) {
      throw new IllegalArgumentException("A peak group needs at least one member");
    }
    List<PeakCandidate> sorted = new ArrayList<>(members);
    sorted.sort(PeakCandidate.BY_POSITION);
    this.members = Collections.unmodifiableList(sorted);
  }

  public List<PeakCandidate> getMembers() {
    return members;
  }

  public int size() {
    return members.size();
  }

  public boolean isSingleton() {
    return members.size() == 1;
  }

  public PeakCandidate first() {
    return members.get(0);
  }

  public PeakCandidate last() {
    return members.get(members.size() - 1);
  }

  public int minIndex() {
    return members.stream().mapToInt(PeakCandidate::getIndex).min().getAsInt();
  }

  public int maxIndex() {
    return members.stream().mapToInt(PeakCandidate::getIndex).max().getAsInt();
  }

  public double meanFwhm() {
    return members.stream().mapToDouble(PeakCandidate::getFwhm).average().getAsDouble();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return members.equals(((PeakGroup) o).members);
  }

  @Override
  public int hashCode() {
    return members.hashCode();
  }

  @Override
  public String toString() {
    return String.format("PeakGroup[%d peaks, %.4f..%.4f]", members.size(), first().getPosition(),
        last().getPosition());
  }
}
