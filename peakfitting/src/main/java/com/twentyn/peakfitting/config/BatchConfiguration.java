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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.twentyn.peakfitting.background.BackgroundEstimator;
import com.twentyn.peakfitting.batch.FailurePolicy;
import com.twentyn.peakfitting.io.SpectrumDirectory;

import java.util.ArrayList;
import java.util.List;

/**
 * Options of an automated run over a folder of spectra.
 */
public class BatchConfiguration {
  public static final double DEFAULT_QUALITY_THRESHOLD = 0.92;

  @JsonProperty("failure_policy")
  private FailurePolicy failurePolicy = FailurePolicy.PAUSE;

  // Minimum r-squared every valid peak of a file must reach for the file to pass.
  @JsonProperty("quality_threshold")
  private Double qualityThreshold = DEFAULT_QUALITY_THRESHOLD;

  @JsonProperty("auto_background")
  private Boolean autoBackground = true;

  // Reuse the x positions of the first file's background points on every later file.
  @JsonProperty("reuse_background_template")
  private Boolean reuseBackgroundTemplate = false;

  @JsonProperty("background_segments")
  private Integer backgroundSegments = BackgroundEstimator.DEFAULT_SEGMENT_COUNT;

  @JsonProperty("save_results")
  private Boolean saveResults = true;

  @JsonProperty("save_plots")
  private Boolean savePlots = true;

  @JsonProperty("render_plots")
  private Boolean renderPlots = false;

  @JsonProperty("display_delay_ms")
  private Long displayDelayMillis = 0L;

  // Null means next to the input files.
  @JsonProperty("output_dir")
  private String outputDir;

  @JsonProperty("extensions")
  private List<String> extensions = new ArrayList<>(SpectrumDirectory.DEFAULT_EXTENSIONS);

  public BatchConfiguration() {
  }

  public FailurePolicy getFailurePolicy() {
    return failurePolicy;
  }

  public void setFailurePolicy(FailurePolicy failurePolicy) {
    this.failurePolicy = failurePolicy;
  }

  public Double getQualityThreshold() {
    return qualityThreshold;
  }

  public void setQualityThreshold(Double qualityThreshold) {
    this.qualityThreshold = qualityThreshold;
  }

  public Boolean getAutoBackground() {
    return autoBackground;
  }

  public void setAutoBackground(Boolean autoBackground) {
    this.autoBackground = autoBackground;
  }

  public Boolean getReuseBackgroundTemplate() {
    return reuseBackgroundTemplate;
  }

  public void setReuseBackgroundTemplate(Boolean reuseBackgroundTemplate) {
    this.reuseBackgroundTemplate = reuseBackgroundTemplate;
  }

  public Integer getBackgroundSegments() {
    return backgroundSegments;
  }

  public void setBackgroundSegments(Integer backgroundSegments) {
    this.backgroundSegments = backgroundSegments;
  }

  public Boolean getSaveResults() {
    return saveResults;
  }

  public void setSaveResults(Boolean saveResults) {
    this.saveResults = saveResults;
  }

  public Boolean getSavePlots() {
    return savePlots;
  }

  public void setSavePlots(Boolean savePlots) {
    this.savePlots = savePlots;
  }

  public Boolean getRenderPlots() {
    return renderPlots;
  }

  public void setRenderPlots(Boolean renderPlots) {
    this.renderPlots = renderPlots;
  }

  public Long getDisplayDelayMillis() {
    return displayDelayMillis;
  }

  public void setDisplayDelayMillis(Long displayDelayMillis) {
    this.displayDelayMillis = displayDelayMillis;
  }

  public String getOutputDir() {
    return outputDir;
  }

  public void setOutputDir(String outputDir) {
    this.outputDir = outputDir;
  }

  public List<String> getExtensions() {
    return extensions;
  }

  public void setExtensions(List<String> extensions) {
    this.extensions = extensions;
  }
}
