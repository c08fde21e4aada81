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

package com.twentyn.peakfitting.spectrum;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * A single (position, intensity) sample.  Used for background control points and anywhere a lone point on a
 * diffraction trace needs to be passed around.
 */
public class XY implements Serializable {
  private static final long serialVersionUID = 3406418890012761284L;

  @JsonProperty("x")
  private final double x;

  @JsonProperty("y")
  private final double y;

  @JsonCreator
  public XY(@JsonProperty("x") double x, @JsonProperty("y") double y) {
    this.x = x;
    this.y = y;
  }

  public double getX() {
    return x;
  }

  public double getY() {
    return y;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    XY that = (XY) o;
    return Double.compare(that.x, x) == 0 && Double.compare(that.y, y) == 0;
  }

  @Override
  public int hashCode() {
    long temp = Double.doubleToLongBits(x);
    int result = (int) (temp ^ (temp >>> 32));
    temp = Double.doubleToLongBits(y);
    return 31 * result + (int) (temp ^ (temp >>> 32));
  }

  @Override
  public String toString() {
    return String.format("(%.5f, %.3f)", x, y);
  }
}
