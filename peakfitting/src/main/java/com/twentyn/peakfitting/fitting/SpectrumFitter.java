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

import com.twentyn.peakfitting.detection.FwhmEstimator;
import com.twentyn.peakfitting.detection.PeakCandidate;
import com.twentyn.peakfitting.grouping.OverlapGrouper;
import com.twentyn.peakfitting.grouping.PeakGroup;
import com.twentyn.peakfitting.spectrum.Spectrum;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Fits every selected peak of a spectrum: re-estimates widths on the current working trace, groups overlapping
 * peaks and sends each group down the single or joint path.  A failing group is logged and recorded; the remaining
 * groups are still fitted.
 */
public class SpectrumFitter {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SpectrumFitter.class);

  private final FwhmEstimator fwhmEstimator;
  private final MultiPeakFitter multiPeakFitter;

  public SpectrumFitter() {
    this(new FwhmEstimator(), new MultiPeakFitter());
  }

  public SpectrumFitter(FwhmEstimator fwhmEstimator, MultiPeakFitter multiPeakFitter) {
    this.fwhmEstimator = fwhmEstimator;
    this.multiPeakFitter = multiPeakFitter;
  }

  /**
   * Estimates an FWHM for each candidate from the spectrum's working intensities.
   */
  public List<PeakCandidate> withFwhmEstimates(Spectrum spectrum, List<PeakCandidate> candidates) {
    double[] x = spectrum.getPositions();
    double[] y = spectrum.getIntensities();
    List<PeakCandidate> out = new ArrayList<>(candidates.size());
    for (PeakCandidate c : candidates) {
      out.add(c.withFwhm(fwhmEstimator.estimate(x, y, c.getIndex())));
    }
    return out;
  }

  public List<PeakGroup> group(Spectrum spectrum, List<PeakCandidate> candidates, FitSettings settings) {
    return new OverlapGrouper(settings.getGroupingThreshold()).group(withFwhmEstimates(spectrum, candidates));
  }

  public FitReport fit(Spectrum spectrum, List<PeakCandidate> candidates, FitSettings settings) {
    return fit(spectrum, candidates, settings, GroupFitListener.NONE);
  }

  public FitReport fit(Spectrum spectrum, List<PeakCandidate> candidates, FitSettings settings,
                       GroupFitListener listener) {
    double[] x = spectrum.getPositions();
    double[] y = spectrum.getIntensities();
    List<PeakGroup> groups = group(spectrum, candidates, settings);
    LOGGER.info("Fitting %d peaks in %d groups of %s with %s", candidates.size(), groups.size(),
        spectrum.getName(), settings);

    List<PeakFitResult> results = new ArrayList<>();
    List<GroupFit> groupFits = new ArrayList<>();
    List<FitReport.GroupFailure> failures = new ArrayList<>();
    for (int g = 0; g < groups.size(); g++) {
      PeakGroup group = groups.get(g);
      try {
        GroupFit fit = multiPeakFitter.fit(x, y, group, settings);
        groupFits.add(fit);
        results.addAll(fit.getResults());
        listener.groupFitted(g, groups.size(), fit);
      } catch (PeakFitException e) {
        LOGGER.error("%s: fit of %d peak(s) at %.4f failed: %s", spectrum.getName(), group.size(),
            e.getPosition(), e.getMessage());
        failures.add(new FitReport.GroupFailure(group, e));
        for (PeakCandidate c : group.getMembers()) {
          results.add(PeakFitResult.failed(c, group.size(), e.getMessage()));
        }
        listener.groupFailed(g, groups.size(), group, e);
      }
    }

    results.sort((a, b) -> PeakCandidate.BY_POSITION.compare(a.getCandidate(), b.getCandidate()));
    return new FitReport(spectrum.getName(), results, groupFits, failures);
  }
}
