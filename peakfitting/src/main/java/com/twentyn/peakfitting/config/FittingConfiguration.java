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

package com.twentyn.peakfitting.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.twentyn.peakfitting.background.BackgroundEstimator;
import com.twentyn.peakfitting.background.BackgroundMethod;
import com.twentyn.peakfitting.detection.FwhmEstimator;
import com.twentyn.peakfitting.detection.PeakDetector;
import com.twentyn.peakfitting.fitting.FitSettings;
import com.twentyn.peakfitting.grouping.OverlapGrouper;
import com.twentyn.peakfitting.profile.ProfileType;

/**
 * Detection, background and fitting parameters shared by interactive sessions and batch runs.
 */
public class FittingConfiguration {

  @JsonProperty("profile")
  private ProfileType profile = ProfileType.PSEUDO_VOIGT;

  @JsonProperty("overlap_mode")
  private Boolean overlapMode = false;

  @JsonProperty("window_multiplier")
  private Double windowMultiplier = FitSettings.DEFAULT_WINDOW_MULTIPLIER;

  @JsonProperty("grouping_threshold")
  private Double groupingThreshold = OverlapGrouper.DEFAULT_THRESHOLD;

  @JsonProperty("overlap_grouping_threshold")
  private Double overlapGroupingThreshold = OverlapGrouper.DEFAULT_OVERLAP_THRESHOLD;

  @JsonProperty("detection_height_fraction")
  private Double detectionHeightFraction = PeakDetector.DEFAULT_HEIGHT_FRACTION;

  @JsonProperty("detection_prominence_fraction")
  private Double detectionProminenceFraction = PeakDetector.DEFAULT_PROMINENCE_FRACTION;

  @JsonProperty("fallback_fwhm")
  private Double fallbackFwhm = FwhmEstimator.DEFAULT_FALLBACK_FWHM;

  @JsonProperty("background_method")
  private BackgroundMethod backgroundMethod = BackgroundMethod.SPLINE;

  @JsonProperty("spline_smoothing")
  private Double splineSmoothing = BackgroundEstimator.DEFAULT_SPLINE_SMOOTHING;

  @JsonProperty("polynomial_order")
  private Integer polynomialOrder = BackgroundEstimator.DEFAULT_POLYNOMIAL_ORDER;

  public FittingConfiguration() {
  }

  public ProfileType getProfile() {
    return profile;
  }

  public void setProfile(ProfileType profile) {
    this.profile = profile;
  }

  public Boolean getOverlapMode() {
    return overlapMode;
  }

  public void setOverlapMode(Boolean overlapMode) {
    this.overlapMode = overlapMode;
  }

  public Double getWindowMultiplier() {
    return windowMultiplier;
  }

  public void setWindowMultiplier(Double windowMultiplier) {
    this.windowMultiplier = windowMultiplier;
  }

  public Double getGroupingThreshold() {
    return groupingThreshold;
  }

  public void setGroupingThreshold(Double groupingThreshold) {
    this.groupingThreshold = groupingThreshold;
  }

  public Double getOverlapGroupingThreshold() {
    return overlapGroupingThreshold;
  }

  public void setOverlapGroupingThreshold(Double overlapGroupingThreshold) {
    this.overlapGroupingThreshold = overlapGroupingThreshold;
  }

  public Double getDetectionHeightFraction() {
    return detectionHeightFraction;
  }

  public void setDetectionHeightFraction(Double detectionHeightFraction) {
    this.detectionHeightFraction = detectionHeightFraction;
  }

  public Double getDetectionProminenceFraction() {
    return detectionProminenceFraction;
  }

  public void setDetectionProminenceFraction(Double detectionProminenceFraction) {
    this.detectionProminenceFraction = detectionProminenceFraction;
  }

  public Double getFallbackFwhm() {
    return fallbackFwhm;
  }

  public void setFallbackFwhm(Double fallbackFwhm) {
    this.fallbackFwhm = fallbackFwhm;
  }

  public BackgroundMethod getBackgroundMethod() {
    return backgroundMethod;
  }

  public void setBackgroundMethod(BackgroundMethod backgroundMethod) {
    this.backgroundMethod = backgroundMethod;
  }

  public Double getSplineSmoothing() {
    return splineSmoothing;
  }

  public void setSplineSmoothing(Double splineSmoothing) {
    this.splineSmoothing = splineSmoothing;
  }

  public Integer getPolynomialOrder() {
    return polynomialOrder;
  }

  public void setPolynomialOrder(Integer polynomialOrder) {
    this.polynomialOrder = polynomialOrder;
  }

  @JsonIgnore
  public FitSettings toFitSettings() {
    return toFitSettings(profile, overlapMode);
  }

  /**
   * Fit settings for a profile and overlap mode chosen at run time, with the configured multiplier and thresholds.
   */
  public FitSettings toFitSettings(ProfileType chosenProfile, boolean chosenOverlapMode) {
    return new FitSettings(chosenProfile, chosenOverlapMode, windowMultiplier,
        chosenOverlapMode ? overlapGroupingThreshold : groupingThreshold);
  }

  @JsonIgnore
  public FwhmEstimator buildFwhmEstimator() {
    return new FwhmEstimator(FwhmEstimator.DEFAULT_HALF_WINDOW, fallbackFwhm);
  }

  @JsonIgnore
  public PeakDetector buildDetector() {
    return new PeakDetector(detectionHeightFraction, detectionProminenceFraction, buildFwhmEstimator());
  }

  @JsonIgnore
  public BackgroundEstimator buildBackgroundEstimator() {
    return new BackgroundEstimator(splineSmoothing, polynomialOrder);
  }
}
