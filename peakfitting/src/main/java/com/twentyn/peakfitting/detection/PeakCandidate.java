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

package com.twentyn.peakfitting.detection;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.twentyn.peakfitting.spectrum.Spectrum;

import java.io.Serializable;
import java.util.Comparator;

/**
 * A peak selected for fitting, either by the detector or by hand.  Holds the spectrum index of the apex and the
 * initial height and width estimates used to seed the fit.
 */
public class PeakCandidate implements Serializable {
  private static final long serialVersionUID = -7412330895716213377L;

  public static final Comparator<PeakCandidate> BY_POSITION =
      Comparator.comparingDouble(PeakCandidate::getPosition).thenComparingInt(PeakCandidate::getIndex);

  @JsonProperty("index")
  private final int index;

  @JsonProperty("position")
  private final double position;

  @JsonProperty("height")
  private final double height;

  @JsonProperty("fwhm")
  private final double fwhm;

  @JsonCreator
  public PeakCandidate(@JsonProperty("index") int index,
                       @JsonProperty("position") double position,
                       @JsonProperty("height") double height,
                       @JsonProperty("fwhm") double fwhm) {
    this.index = index;
    this.position = position;
    this.height = height;
    this.fwhm = fwhm;
  }

  /**
   * Builds a candidate at a sample of the spectrum's working trace, with no width estimate yet.
   * @throws IllegalArgumentException if the index is not a valid sample of the spectrum.
   */
  public static PeakCandidate at(Spectrum spectrum, int index) {
    return at(spectrum, index, Double.NaN);
  }

  public static PeakCandidate at(Spectrum spectrum, int index, double fwhm) {
    if (!spectrum.isValidIndex(index)) {
      throw new IllegalArgumentException(String.format(
          "Peak index %d is outside of spectrum %s with %d samples", index, spectrum.getName(), spectrum.size()));
    }
    return new PeakCandidate(index, spectrum.getPosition(index), spectrum.getIntensity(index), fwhm);
  }

  public int getIndex() {
    return index;
  }

  public double getPosition() {
    return position;
  }

  public double getHeight() {
    return height;
  }

  public double getFwhm() {
    return fwhm;
  }

  public boolean hasFwhm() {
    return !Double.isNaN(fwhm);
  }

  public PeakCandidate withFwhm(double newFwhm) {
    return new PeakCandidate(index, position, height, newFwhm);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    PeakCandidate that = (PeakCandidate) o;
    return index == that.index && Double.compare(that.position, position) == 0;
  }

  @Override
  public int hashCode() {
    long temp = Double.doubleToLongBits(position);
    return 31 * index + (int) (temp ^ (temp >>> 32));
  }

  @Override
  public String toString() {
    return String.format("PeakCandidate[%d @ %.4f, h=%.2f, fwhm=%.4f]", index, position, height, fwhm);
  }
}
