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

import java.io.File;
import java.util.Arrays;

/**
 * A one dimensional diffraction trace: intensity as a function of scattering angle.
 *
 * The intensities read from disk are kept as an immutable original copy.  All processing (background subtraction,
 * smoothing) happens on a separate working copy, so the original can always be restored bit for bit.
 */
public class Spectrum {
  private final String name;
  private final File source;
  private final double[] positions;
  private final double[] originalIntensities;
  private double[] intensities;

  public Spectrum(String name, File source, double[] positions, double[] intensities) {
    if (positions == null || intensities == null) {
      throw new IllegalArgumentException("Positions and intensities must not be null");
    }
    if (positions.length != intensities.length) {
      throw new IllegalArgumentException(String.format(
          "Position and intensity columns differ in length: %d vs. %d", positions.length, intensities.length));
    }
    this.name = name;
    this.source = source;
    this.positions = Arrays.copyOf(positions, positions.length);
    this.originalIntensities = Arrays.copyOf(intensities, intensities.length);
    this.intensities = Arrays.copyOf(intensities, intensities.length);
  }

  public Spectrum(String name, double[] positions, double[] intensities) {
    this(name, null, positions, intensities);
  }

  public String getName() {
    return name;
  }

  public File getSource() {
    return source;
  }

  public int size() {
    return positions.length;
  }

  public double getPosition(int index) {
    return positions[index];
  }

  public double getIntensity(int index) {
    return intensities[index];
  }

  public double[] getPositions() {
    return Arrays.copyOf(positions, positions.length);
  }

  public double[] getIntensities() {
    return Arrays.copyOf(intensities, intensities.length);
  }

  public double[] getOriginalIntensities() {
    return Arrays.copyOf(originalIntensities, originalIntensities.length);
  }

  /**
   * Replaces the working intensities.  The original copy is never touched.
   * @param newIntensities The new working intensities; must match the spectrum length.
   */
  public void setIntensities(double[] newIntensities) {
    if (newIntensities.length != positions.length) {
      throw new IllegalArgumentException(String.format(
          "Working intensities must have %d entries, got %d", positions.length, newIntensities.length));
    }
    this.intensities = Arrays.copyOf(newIntensities, newIntensities.length);
  }

  public void restoreOriginal() {
    this.intensities = Arrays.copyOf(originalIntensities, originalIntensities.length);
  }

  public boolean isModified() {
    return !Arrays.equals(intensities, originalIntensities);
  }

  public boolean isValidIndex(int index) {
    return index >= 0 && index < positions.length;
  }

  /**
   * @return The mean spacing between consecutive positions, or 0 for spectra with fewer than two points.
   */
  public double meanSpacing() {
    if (positions.length < 2) {
      return 0.0;
    }
    return (positions[positions.length - 1] - positions[0]) / (positions.length - 1);
  }

  /**
   * Finds the sample whose position is closest to the given one.  Ties go to the lower index.
   */
  public int nearestIndex(double x) {
    int best = 0;
    double bestDistance = Double.MAX_VALUE;
    for (int i = 0; i < positions.length; i++) {
      double d = Math.abs(positions[i] - x);
      if (d < bestDistance) {
        bestDistance = d;
        best = i;
      }
    }
    return best;
  }

  /**
   * Creates a fresh spectrum whose original and working intensities are both this spectrum's original values.
   */
  public Spectrum copyOfOriginal() {
    return new Spectrum(name, source, positions, originalIntensities);
  }

  /**
   * Creates an independent deep copy preserving both the original and the current working intensities.
   */
  public Spectrum copy() {
    Spectrum copy = new Spectrum(name, source, positions, originalIntensities);
    copy.intensities = Arrays.copyOf(intensities, intensities.length);
    return copy;
  }
}
