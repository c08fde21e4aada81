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

import com.twentyn.peakfitting.background.BackgroundEstimator;
import com.twentyn.peakfitting.background.BackgroundMethod;
import com.twentyn.peakfitting.background.BackgroundModel;
import com.twentyn.peakfitting.config.FittingConfiguration;
import com.twentyn.peakfitting.detection.PeakCandidate;
import com.twentyn.peakfitting.detection.PeakDetector;
import com.twentyn.peakfitting.fitting.FitReport;
import com.twentyn.peakfitting.fitting.FitSettings;
import com.twentyn.peakfitting.fitting.GroupFitListener;
import com.twentyn.peakfitting.fitting.MultiPeakFitter;
import com.twentyn.peakfitting.fitting.SpectrumFitter;
import com.twentyn.peakfitting.grouping.PeakGroup;
import com.twentyn.peakfitting.io.SpectrumDirectory;
import com.twentyn.peakfitting.io.SpectrumParser;
import com.twentyn.peakfitting.profile.ProfileType;
import com.twentyn.peakfitting.spectrum.Spectrum;
import com.twentyn.peakfitting.spectrum.SpectrumSmoother;
import com.twentyn.peakfitting.spectrum.XY;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The working state of one spectrum under analysis: the selected peaks, the background control points and curve,
 * the latest fit, and an undo history of selection edits.
 *
 * A session is not thread safe.  While a {@link FittingWorker} job runs, only the worker touches it.
 */
public class Session implements PointSelectionListener {
  private static final Logger LOGGER = LogManager.getFormatterLogger(Session.class);

  // Snap-to-maximum search radius in samples is n / SNAP_DIVISOR, clipped to [MIN_SNAP_WINDOW, MAX_SNAP_WINDOW].
  public static final int MIN_SNAP_WINDOW = 5;
  public static final int MAX_SNAP_WINDOW = 10;
  public static final int SNAP_DIVISOR = 20;
  // The local maximum is only used if it lies within this fraction of the search radius from the click.
  public static final double SNAP_REACH = 0.7;

  private final FittingConfiguration configuration;
  private final SpectrumParser parser;
  private final SpectrumDirectory directory;
  private final PeakDetector detector;
  private final BackgroundEstimator backgroundEstimator;
  private final SpectrumFitter fitter;

  private Spectrum spectrum;
  private final List<PeakCandidate> peaks = new ArrayList<>();
  private final List<XY> backgroundPoints = new ArrayList<>();
  private BackgroundModel background;
  private FitReport report;
  private final Deque<UndoAction> undoStack = new ArrayDeque<>();

  private SelectionMode mode = SelectionMode.PEAK;
  private ProfileType profile;
  private boolean overlapMode;

  private List<File> navigation = Collections.emptyList();
  private int navigationIndex = -1;
  private final Map<File, FileState> visited = new HashMap<>();

  public Session(FittingConfiguration configuration) {
    this(configuration, new SpectrumParser(), new SpectrumDirectory());
  }

  public Session(FittingConfiguration configuration, SpectrumParser parser, SpectrumDirectory directory) {
    this(configuration, parser, directory, configuration.buildDetector(), configuration.buildBackgroundEstimator(),
        new SpectrumFitter(configuration.buildFwhmEstimator(), new MultiPeakFitter()));
  }

  public Session(FittingConfiguration configuration, SpectrumParser parser, SpectrumDirectory directory,
                 PeakDetector detector, BackgroundEstimator backgroundEstimator, SpectrumFitter fitter) {
    this.configuration = configuration;
    this.parser = parser;
    this.directory = directory;
    this.detector = detector;
    this.backgroundEstimator = backgroundEstimator;
    this.fitter = fitter;
    this.profile = configuration.getProfile();
    this.overlapMode = configuration.getOverlapMode();
  }

  /* ----------------------------------------
   * Loading and navigation
   */

  /**
   * Loads a file, making its folder (files with the same extension) the navigation list.  Returning to a file
   * visited earlier in this session restores its selections and results.
   * @throws IOException if the file cannot be read or parsed; the current spectrum is kept in that case.
   */
  public Spectrum load(File file) throws IOException {
    Spectrum loaded = parser.parse(file);
    List<File> siblings = directory.siblings(file);
    File key = file.getAbsoluteFile();
    int index = -1;
    for (int i = 0; i < siblings.size(); i++) {
      if (siblings.get(i).getAbsoluteFile().equals(key)) {
        index = i;
        break;
      }
    }
    if (index < 0) {
      siblings = Collections.singletonList(file);
      index = 0;
    }

    stashCurrent();
    replace(loaded);
    navigation = siblings;
    navigationIndex = index;
    forgetOtherFolders();

    FileState saved = visited.get(key);
    if (saved != null) {
      restore(saved);
      LOGGER.info("Restored %d peaks and %d background points for %s", peaks.size(), backgroundPoints.size(),
          spectrum.getName());
    }
    LOGGER.info("Loaded %s (%d/%d, %d points)", spectrum.getName(), navigationIndex + 1, navigation.size(),
        spectrum.size());
    return spectrum;
  }

  /**
   * Makes an in-memory spectrum current, discarding all selections and the per-file cache.  Used for batch runs,
   * which visit every file once and never navigate back.
   */
  public void load(Spectrum newSpectrum) {
    visited.clear();
    replace(newSpectrum);
    navigation = Collections.emptyList();
    navigationIndex = -1;
  }

  public boolean hasNext() {
    return navigationIndex >= 0 && navigationIndex < navigation.size() - 1;
  }

  public boolean hasPrevious() {
    return navigationIndex > 0;
  }

  public Spectrum next() throws IOException {
    if (!hasNext()) {
      throw new IllegalStateException("Already at the last file");
    }
    return load(navigation.get(navigationIndex + 1));
  }

  public Spectrum previous() throws IOException {
    if (!hasPrevious()) {
      throw new IllegalStateException("Already at the first file");
    }
    return load(navigation.get(navigationIndex - 1));
  }

  public List<File> getNavigation() {
    return Collections.unmodifiableList(navigation);
  }

  public int getNavigationIndex() {
    return navigationIndex;
  }

  private void replace(Spectrum newSpectrum) {
    spectrum = newSpectrum;
    peaks.clear();
    backgroundPoints.clear();
    background = null;
    report = null;
    undoStack.clear();
  }

  private void stashCurrent() {
    if (spectrum != null && spectrum.getSource() != null) {
      visited.put(spectrum.getSource().getAbsoluteFile(),
          new FileState(peaks, backgroundPoints, background, spectrum.getIntensities(), report));
    }
  }

  /**
   * Keeps cached state only for the files of the current navigation list.
   */
  private void forgetOtherFolders() {
    Set<File> keep = new HashSet<>();
    for (File f : navigation) {
      keep.add(f.getAbsoluteFile());
    }
    visited.keySet().retainAll(keep);
  }

  /**
   * @return How many files have cached selections and results.
   */
  public int cachedFileCount() {
    return visited.size();
  }

  private void restore(FileState state) {
    peaks.addAll(state.getPeaks());
    backgroundPoints.addAll(state.getBackgroundPoints());
    background = state.getBackground();
    spectrum.setIntensities(state.getWorkingIntensities());
    report = state.getReport();
  }

  /* ----------------------------------------
   * Point selection and undo
   */

  @Override
  public boolean onPointSelected(double x, double y, MouseButton button) {
    requireSpectrum();
    if (mode == SelectionMode.PEAK) {
      return button == MouseButton.PRIMARY ? addPeakNear(x) != null : removePeakNear(x) != null;
    }
    return button == MouseButton.PRIMARY ? addBackgroundPointNear(x) != null : removeBackgroundPointNear(x) != null;
  }

  /**
   * Adds a peak at the highest sample near the given position, or at the nearest sample if that maximum is too far
   * from the position to be what was meant.
   * @return The new peak, or null if a peak already sits on that sample.
   */
  public PeakCandidate addPeakNear(double x) {
    requireSpectrum();
    return addPeak(snapToMaximum(x));
  }

  /**
   * @return The new peak, or null if a peak already sits on that sample.
   * @throws IllegalArgumentException if the index is not a sample of the spectrum.
   */
  public PeakCandidate addPeak(int index) {
    requireSpectrum();
    for (PeakCandidate p : peaks) {
      if (p.getIndex() == index) {
        return null;
      }
    }
    PeakCandidate peak = PeakCandidate.at(spectrum, index);
    peaks.add(peak);
    undoStack.push(UndoAction.addedPeak(peaks.size() - 1, peak));
    LOGGER.debug("Peak %d at %.4f", peaks.size(), peak.getPosition());
    return peak;
  }

  /**
   * @return The removed peak, or null if there are no peaks.
   */
  public PeakCandidate removePeakNear(double x) {
    int slot = nearestPeakSlot(x);
    if (slot < 0) {
      return null;
    }
    PeakCandidate removed = peaks.remove(slot);
    undoStack.push(UndoAction.removedPeak(slot, removed));
    LOGGER.debug("Peak removed at %.4f", removed.getPosition());
    return removed;
  }

  /**
   * Adds the sample nearest to the position as a background control point.  Control points take the raw intensity,
   * since the background is always subtracted from the raw trace.
   */
  public XY addBackgroundPointNear(double x) {
    requireSpectrum();
    int idx = spectrum.nearestIndex(x);
    XY point = new XY(spectrum.getPosition(idx), spectrum.getOriginalIntensities()[idx]);
    backgroundPoints.add(point);
    undoStack.push(UndoAction.addedBackgroundPoint(backgroundPoints.size() - 1, point));
    LOGGER.debug("Background point %d at %.4f", backgroundPoints.size(), point.getX());
    return point;
  }

  /**
   * @return The removed point, or null if there are no background points.
   */
  public XY removeBackgroundPointNear(double x) {
    if (backgroundPoints.isEmpty()) {
      return null;
    }
    int slot = 0;
    for (int i = 1; i < backgroundPoints.size(); i++) {
      if (Math.abs(backgroundPoints.get(i).getX() - x) < Math.abs(backgroundPoints.get(slot).getX() - x)) {
        slot = i;
      }
    }
    XY removed = backgroundPoints.remove(slot);
    undoStack.push(UndoAction.removedBackgroundPoint(slot, removed));
    return removed;
  }

  /**
   * Reverts the most recent peak or background point edit.
   * @return The reverted action, or null if there is nothing to undo.
   */
  public UndoAction undo() {
    UndoAction action = undoStack.poll();
    if (action == null) {
      return null;
    }
    switch (action.getKind()) {
      case ADD_PEAK:
        peaks.remove(action.getSlot());
        break;
      case REMOVE_PEAK:
        peaks.add(action.getSlot(), action.getPeak());
        break;
      case ADD_BACKGROUND_POINT:
        backgroundPoints.remove(action.getSlot());
        break;
      case REMOVE_BACKGROUND_POINT:
        backgroundPoints.add(action.getSlot(), action.getPoint());
        break;
      default:
        throw new IllegalStateException(String.format("Unknown undo action %s", action.getKind()));
    }
    LOGGER.debug("Undid %s", action);
    return action;
  }

  public boolean canUndo() {
    return !undoStack.isEmpty();
  }

  public int undoDepth() {
    return undoStack.size();
  }

  int snapToMaximum(double x) {
    int n = spectrum.size();
    int idx = spectrum.nearestIndex(x);
    int window = Math.max(MIN_SNAP_WINDOW, Math.min(MAX_SNAP_WINDOW, n / SNAP_DIVISOR));
    int from = Math.max(0, idx - window);
    int to = Math.min(n - 1, idx + window);
    int best = from;
    for (int i = from + 1; i <= to; i++) {
      if (spectrum.getIntensity(i) > spectrum.getIntensity(best)) {
        best = i;
      }
    }
    double reach = spectrum.meanSpacing() * window * SNAP_REACH;
    return Math.abs(spectrum.getPosition(best) - x) > reach ? idx : best;
  }

  private int nearestPeakSlot(double x) {
    int slot = -1;
    for (int i = 0; i < peaks.size(); i++) {
      if (slot < 0 || Math.abs(peaks.get(i).getPosition() - x) < Math.abs(peaks.get(slot).getPosition() - x)) {
        slot = i;
      }
    }
    return slot;
  }

  // Bulk replacements make earlier slot numbers meaningless, so they drop the matching history.
  private void forgetEdits(boolean peakEdits) {
    Iterator<UndoAction> it = undoStack.iterator();
    while (it.hasNext()) {
      if (it.next().getKind().isPeakEdit() == peakEdits) {
        it.remove();
      }
    }
  }

  /* ----------------------------------------
   * Peaks
   */

  /**
   * Replaces the peak selection with automatically detected peaks.
   */
  public List<PeakCandidate> autoDetect() {
    requireSpectrum();
    List<PeakCandidate> detected = detector.detect(spectrum);
    peaks.clear();
    peaks.addAll(detected);
    forgetEdits(true);
    LOGGER.info("Detected %d peaks in %s", detected.size(), spectrum.getName());
    return getPeaks();
  }

  /**
   * Clears the peak selection and any fit.
   */
  public void resetPeaks() {
    peaks.clear();
    report = null;
    forgetEdits(true);
  }

  public List<PeakCandidate> getPeaks() {
    return Collections.unmodifiableList(new ArrayList<>(peaks));
  }

  /* ----------------------------------------
   * Background
   */

  /**
   * Replaces the control points with the lowest point of each of the configured number of equal segments.
   */
  public List<XY> autoSelectBackground(int segmentCount) {
    requireSpectrum();
    return replaceBackgroundPoints(backgroundEstimator.selectSegmentMinima(spectrum.copyOfOriginal(), segmentCount));
  }

  /**
   * Places control points at the given positions, taking each nearest sample's raw intensity.
   */
  public List<XY> applyBackgroundTemplate(double[] positions) {
    requireSpectrum();
    return replaceBackgroundPoints(backgroundEstimator.applyTemplate(spectrum.copyOfOriginal(), positions));
  }

  public List<XY> replaceBackgroundPoints(List<XY> points) {
    backgroundPoints.clear();
    backgroundPoints.addAll(points);
    forgetEdits(false);
    return getBackgroundPoints();
  }

  /**
   * Builds the background from the control points and subtracts it from the raw trace.
   * @throws IllegalStateException if there are fewer than two control points.
   */
  public BackgroundModel subtractBackground() {
    requireSpectrum();
    if (backgroundPoints.size() < 2) {
      throw new IllegalStateException(String.format(
          "At least 2 background points are needed, %d selected", backgroundPoints.size()));
    }
    return subtract(backgroundEstimator.fromControlPoints(spectrum, backgroundPoints));
  }

  /**
   * Estimates the background with the configured method and subtracts it from the raw trace.
   */
  public BackgroundModel subtractEstimatedBackground() {
    return subtractEstimatedBackground(configuration.getBackgroundMethod());
  }

  /**
   * Estimates the background from the valleys around the selected peaks and subtracts it from the raw trace.
   */
  public BackgroundModel subtractEstimatedBackground(BackgroundMethod method) {
    requireSpectrum();
    int[] indices = new int[peaks.size()];
    for (int i = 0; i < indices.length; i++) {
      indices[i] = peaks.get(i).getIndex();
    }
    return subtract(backgroundEstimator.estimate(spectrum.copyOfOriginal(), indices, method));
  }

  private BackgroundModel subtract(BackgroundModel model) {
    model.subtractFrom(spectrum);
    background = model;
    LOGGER.info("Subtracted %s background (%d control points) from %s", model.getMethod(),
        model.getControlPoints().size(), spectrum.getName());
    return model;
  }

  /**
   * Drops the control points and the background, restoring the raw trace.
   */
  public void clearBackground() {
    backgroundPoints.clear();
    background = null;
    forgetEdits(false);
    if (spectrum != null) {
      spectrum.restoreOriginal();
    }
  }

  public List<XY> getBackgroundPoints() {
    return Collections.unmodifiableList(new ArrayList<>(backgroundPoints));
  }

  public BackgroundModel getBackground() {
    return background;
  }

  /* ----------------------------------------
   * Smoothing
   */

  /**
   * Replaces the working trace with a smoothed copy of the raw trace.  Any subtracted background is dropped.
   */
  public void smooth(SpectrumSmoother.Method method, double parameter) {
    requireSpectrum();
    spectrum.setIntensities(SpectrumSmoother.smooth(spectrum.getOriginalIntensities(), method, parameter));
    background = null;
    LOGGER.info("Smoothed %s with %s (%.2f)", spectrum.getName(), method, parameter);
  }

  public void resetToOriginal() {
    requireSpectrum();
    spectrum.restoreOriginal();
    background = null;
  }

  /* ----------------------------------------
   * Fitting
   */

  public FitSettings currentSettings() {
    return configuration.toFitSettings(profile, overlapMode);
  }

  /**
   * The overlap groups the selected peaks currently form.
   */
  public List<PeakGroup> groups() {
    requireSpectrum();
    return fitter.group(spectrum, peaks, currentSettings());
  }

  public FitReport fit() {
    return fit(GroupFitListener.NONE);
  }

  /**
   * Fits all selected peaks on the working trace, replacing any earlier fit.
   * @throws IllegalStateException if no peaks are selected.
   */
  public FitReport fit(GroupFitListener listener) {
    requireSpectrum();
    if (peaks.isEmpty()) {
      throw new IllegalStateException(String.format("No peaks selected in %s", spectrum.getName()));
    }
    report = fitter.fit(spectrum, peaks, currentSettings(), listener);
    return report;
  }

  /**
   * Drops the fit but keeps the selections.
   */
  public void clearFit() {
    report = null;
  }

  public FitReport getReport() {
    return report;
  }

  public boolean toggleOverlapMode() {
    overlapMode = !overlapMode;
    LOGGER.info("Overlap mode %s", overlapMode ? "on" : "off");
    return overlapMode;
  }

  public boolean isOverlapMode() {
    return overlapMode;
  }

  public void setOverlapMode(boolean overlapMode) {
    this.overlapMode = overlapMode;
  }

  public ProfileType getProfile() {
    return profile;
  }

  public void setProfile(ProfileType profile) {
    this.profile = profile;
  }

  public SelectionMode getMode() {
    return mode;
  }

  public void setMode(SelectionMode mode) {
    this.mode = mode;
  }

  public Spectrum getSpectrum() {
    return spectrum;
  }

  private void requireSpectrum() {
    if (spectrum == null) {
      throw new IllegalStateException("No spectrum loaded");
    }
  }
}
