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

package com.twentyn.peakfitting.session;

import com.twentyn.peakfitting.detection.PeakCandidate;
import com.twentyn.peakfitting.spectrum.XY;

/**
 * One reversible edit of a session's selections.  Records the list slot that was touched so that reverting puts an
 * entry back exactly where it was.
 */
public class UndoAction {

  public enum Kind {
    ADD_PEAK,
    REMOVE_PEAK,
    ADD_BACKGROUND_POINT,
    REMOVE_BACKGROUND_POINT,
    ;

    public boolean isPeakEdit() {
      return this == ADD_PEAK || this == REMOVE_PEAK;
    }
  }

  private final Kind kind;
  private final int slot;
  private final PeakCandidate peak;
  private final XY point;

  private UndoAction(Kind kind, int slot, PeakCandidate peak, XY point) {
    this.kind = kind;
    this.slot = slot;
    this.peak = peak;
    this.point = point;
  }

  public static UndoAction addedPeak(int slot, PeakCandidate peak) {
    return new UndoAction(Kind.ADD_PEAK, slot, peak, null);
  }

  public static UndoAction removedPeak(int slot, PeakCandidate peak) {
    return new UndoAction(Kind.REMOVE_PEAK, slot, peak, null);
  }

  public static UndoAction addedBackgroundPoint(int slot, XY point) {
    return new UndoAction(Kind.ADD_BACKGROUND_POINT, slot, null, point);
  }

  public static UndoAction removedBackgroundPoint(int slot, XY point) {
    return new UndoAction(Kind.REMOVE_BACKGROUND_POINT, slot, null, point);
  }

  public Kind getKind() {
    return kind;
  }

  public int getSlot() {
    return slot;
  }

  public PeakCandidate getPeak() {
    return peak;
  }

  public XY getPoint() {
    return point;
  }

  @Override
  public String toString() {
    return String.format("%s@%d %s", kind, slot, kind.isPeakEdit() ? peak : point);
  }
}
