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

import com.twentyn.peakfitting.background.BackgroundModel;
import com.twentyn.peakfitting.detection.PeakCandidate;
import com.twentyn.peakfitting.fitting.FitReport;
import com.twentyn.peakfitting.spectrum.XY;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What a session remembers about a file it navigated away from, so coming back restores the work in progress.  Kept
 * in memory only.
 */
class FileState {
  private final List<PeakCandidate> peaks;
  private final List<XY> backgroundPoints;
  private final BackgroundModel background;
  private final double[] workingIntensities;
  private final FitReport report;

  FileState(List<PeakCandidate> peaks, List<XY> backgroundPoints, BackgroundModel background,
            double[] workingIntensities, FitReport report) {
    this.peaks = Collections.unmodifiableList(new ArrayList<>(peaks));
    this.backgroundPoints = Collections.unmodifiableList(new ArrayList<>(backgroundPoints));
    this.background = background;
    this.workingIntensities = workingIntensities.clone();
    this.report = report;
  }

  List<PeakCandidate> getPeaks() {
    return peaks;
  }

  List<XY> getBackgroundPoints() {
    return backgroundPoints;
  }

  BackgroundModel getBackground() {
    return background;
  }

  double[] getWorkingIntensities() {
    return workingIntensities.clone();
  }

  FitReport getReport() {
    return report;
  }
}
