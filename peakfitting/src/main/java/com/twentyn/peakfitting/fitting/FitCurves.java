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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Display curves for one fitted group over its window.  Components and the total exclude the window's edge
 * background, which is held separately so plots can add it back.
 */
public class FitCurves {
  private final double[] x;
  private final double[] background;
  private final List<double[]> components;
  private final List<double[]> stageAComponents;
  private final double[] total;

  public FitCurves(double[] x, double[] background, List<double[]> components, List<double[]> stageAComponents) {
    this.x = x;
    this.background = background;
    this.components = Collections.unmodifiableList(new ArrayList<>(components));
    this.stageAComponents = Collections.unmodifiableList(new ArrayList<>(stageAComponents));
    this.total = new double[x.length];
    for (double[] c : components) {
      for (int i = 0; i < total.length; i++) {
        total[i] += c[i];
      }
    }
  }

  public static FitCurves of(FitWindow window, ProfileParameters[] fitted, ProfileParameters[] stageA) {
    List<double[]> components = new ArrayList<>(fitted.length);
    for (ProfileParameters p : fitted) {
      components.add(p.curve(window.getX()));
    }
    List<double[]> reference = new ArrayList<>();
    if (stageA != null) {
      for (ProfileParameters p : stageA) {
        if (p != null) {
          reference.add(p.curve(window.getX()));
        }
      }
    }
    return new FitCurves(window.getX(), window.getBackground().values(window.getX()), components, reference);
  }

  public double[] getX() {
    return x;
  }

  public double[] getBackground() {
    return background;
  }

  public List<double[]> getComponents() {
    return components;
  }

  public List<double[]> getStageAComponents() {
    return stageAComponents;
  }

  /**
   * @return The pointwise sum of the components.
   */
  public double[] getTotal() {
    return total;
  }
}
