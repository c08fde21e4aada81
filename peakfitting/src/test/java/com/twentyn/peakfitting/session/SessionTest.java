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

import com.twentyn.peakfitting.SyntheticSpectra;
import com.twentyn.peakfitting.background.BackgroundMethod;
import com.twentyn.peakfitting.config.FittingConfiguration;
import com.twentyn.peakfitting.detection.PeakCandidate;
import com.twentyn.peakfitting.fitting.FitReport;
import com.twentyn.peakfitting.profile.ProfileType;
import com.twentyn.peakfitting.spectrum.Spectrum;
import com.twentyn.peakfitting.spectrum.SpectrumSmoother;
import com.twentyn.peakfitting.spectrum.XY;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class SessionTest {

  @Rule
  public TemporaryFolder tempFolder = new TemporaryFolder();

  private Session session;
  private Spectrum spectrum;

  private static SyntheticSpectra twoPeaks() {
    return new SyntheticSpectra(18.0, 22.0, 0.01)
        .peak(300.0, 19.0, 0.2)
        .peak(500.0, 21.0, 0.2)
        .background(100.0, 0.0);
  }

  @Before
  public void setUp() {
    session = new Session(new FittingConfiguration());
    spectrum = twoPeaks().build("two");
    session.load(spectrum);
  }

  @Test
  public void testClickSnapsToNearbyMaximum() {
    PeakCandidate peak = session.addPeakNear(21.05);
    assertNotNull(peak);
    assertEquals(21.0, peak.getPosition(), 1e-9);
  }

  @Test
  public void testClickFarFromMaximumStaysWhereClicked() {
    // 401 samples: a radius of 10 samples, of which only 7 (0.07) may be used to snap.
    PeakCandidate peak = session.addPeakNear(21.09);
    assertEquals(21.09, peak.getPosition(), 1e-9);
  }

  @Test
  public void testDuplicatePeakIsIgnored() {
    assertNotNull(session.addPeakNear(19.0));
    assertNull(session.addPeakNear(19.01));
    assertEquals(1, session.getPeaks().size());
    assertEquals(1, session.undoDepth());
  }

  @Test
  public void testUndoRevertsEditsInReverseOrder() {
    PeakCandidate first = session.addPeak(spectrum.nearestIndex(19.0));
    PeakCandidate second = session.addPeak(spectrum.nearestIndex(21.0));
    XY point = session.addBackgroundPointNear(18.5);
    assertSame(first, session.removePeakNear(18.9));
    assertEquals(4, session.undoDepth());

    assertEquals(UndoAction.Kind.REMOVE_PEAK, session.undo().getKind());
    assertEquals(first, session.getPeaks().get(0));
    assertEquals(second, session.getPeaks().get(1));

    assertEquals(UndoAction.Kind.ADD_BACKGROUND_POINT, session.undo().getKind());
    assertTrue(session.getBackgroundPoints().isEmpty());

    UndoAction action = session.undo();
    assertEquals(UndoAction.Kind.ADD_PEAK, action.getKind());
    assertEquals(second, action.getPeak());
    assertEquals(1, session.getPeaks().size());

    session.undo();
    assertTrue(session.getPeaks().isEmpty());
    assertFalse(session.canUndo());
    assertNull(session.undo());
    assertNotNull(point);
  }

  @Test
  public void testBackgroundPointsTakeRawIntensity() {
    session.addBackgroundPointNear(18.2);
    session.addBackgroundPointNear(21.8);
    session.subtractBackground();
    XY later = session.addBackgroundPointNear(20.0);
    assertEquals(spectrum.getOriginalIntensities()[spectrum.nearestIndex(20.0)], later.getY(), 0.0);
  }

  @Test
  public void testPointSelectionFollowsMode() {
    assertTrue(session.onPointSelected(21.0, 0.0, MouseButton.PRIMARY));
    assertEquals(1, session.getPeaks().size());

    session.setMode(SelectionMode.BACKGROUND);
    assertTrue(session.onPointSelected(18.5, 0.0, MouseButton.PRIMARY));
    assertTrue(session.onPointSelected(18.5, 0.0, MouseButton.SECONDARY));
    assertFalse(session.onPointSelected(18.5, 0.0, MouseButton.SECONDARY));
    assertEquals(1, session.getPeaks().size());

    session.setMode(SelectionMode.PEAK);
    assertTrue(session.onPointSelected(20.0, 0.0, MouseButton.SECONDARY));
    assertTrue(session.getPeaks().isEmpty());
  }

  @Test
  public void testAutoDetectDropsOnlyPeakHistory() {
    session.addPeakNear(19.0);
    session.addBackgroundPointNear(18.5);
    List<PeakCandidate> detected = session.autoDetect();
    assertEquals(2, detected.size());
    assertEquals(1, session.undoDepth());
    assertEquals(UndoAction.Kind.ADD_BACKGROUND_POINT, session.undo().getKind());
    assertEquals(2, session.getPeaks().size());
  }

  @Test(expected = IllegalStateException.class)
  public void testSubtractNeedsTwoPoints() {
    session.addBackgroundPointNear(18.5);
    session.subtractBackground();
  }

  @Test
  public void testSubtractAndClearBackground() {
    session.addBackgroundPointNear(18.1);
    session.addBackgroundPointNear(21.9);
    session.subtractBackground();
    assertNotNull(session.getBackground());
    assertEquals(0.0, spectrum.getIntensity(spectrum.nearestIndex(18.1)), 1e-9);
    assertTrue(spectrum.isModified());

    session.clearBackground();
    assertNull(session.getBackground());
    assertTrue(session.getBackgroundPoints().isEmpty());
    assertArrayEquals(spectrum.getOriginalIntensities(), spectrum.getIntensities(), 0.0);
  }

  @Test
  public void testEstimatedBackgroundUsesSelectedPeaks() {
    session.autoDetect();
    session.subtractEstimatedBackground(BackgroundMethod.VALLEY);
    assertEquals(BackgroundMethod.VALLEY, session.getBackground().getMethod());
    assertEquals(0.0, spectrum.getIntensity(spectrum.nearestIndex(20.0)), 10.0);
  }

  @Test
  public void testEstimatedBackgroundDefaultsToConfiguredMethod() {
    FittingConfiguration configuration = new FittingConfiguration();
    configuration.setBackgroundMethod(BackgroundMethod.POLYNOMIAL);
    Session configured = new Session(configuration);
    configured.load(twoPeaks().build("configured"));
    configured.autoDetect();
    assertEquals(BackgroundMethod.POLYNOMIAL, configured.subtractEstimatedBackground().getMethod());
    assertEquals(BackgroundMethod.POLYNOMIAL, configured.getBackground().getMethod());
  }

  @Test
  public void testCurrentSettingsFollowConfiguration() {
    FittingConfiguration configuration = new FittingConfiguration();
    configuration.setWindowMultiplier(4.5);
    Session configured = new Session(configuration);
    configured.setProfile(ProfileType.VOIGT);
    assertEquals(4.5, configured.currentSettings().getWindowMultiplier(), 0.0);
    assertEquals(ProfileType.VOIGT, configured.currentSettings().getProfile());
  }

  @Test
  public void testAutoSelectBackgroundReplacesPoints() {
    session.addBackgroundPointNear(20.0);
    List<XY> points = session.autoSelectBackground(10);
    assertEquals(10, points.size());
    assertEquals(10, session.getBackgroundPoints().size());
    assertFalse(session.canUndo());
  }

  @Test
  public void testSmoothingWorksFromRawDataAndDropsBackground() {
    session.addBackgroundPointNear(18.1);
    session.addBackgroundPointNear(21.9);
    session.subtractBackground();
    session.smooth(SpectrumSmoother.Method.MOVING_AVERAGE, 3);
    assertNull(session.getBackground());
    assertArrayEquals(SpectrumSmoother.movingAverage(spectrum.getOriginalIntensities(), 3),
        spectrum.getIntensities(), 1e-9);

    session.resetToOriginal();
    assertFalse(spectrum.isModified());
  }

  @Test
  public void testFitNeedsPeaks() {
    try {
      session.fit();
      fail("Fitting without peaks should fail");
    } catch (IllegalStateException e) {
      assertNull(session.getReport());
    }
  }

  @Test
  public void testFitUsesSessionProfileAndOverlapMode() {
    session.autoDetect();
    session.setProfile(ProfileType.VOIGT);
    assertTrue(session.toggleOverlapMode());
    assertEquals(5.0, session.currentSettings().getGroupingThreshold(), 0.0);
    assertEquals(2, session.groups().size());

    FitReport report = session.fit();
    assertSame(report, session.getReport());
    assertEquals(2, report.validCount());
    assertTrue(Double.isNaN(report.getResults().get(0).getEta()));

    session.clearFit();
    assertNull(session.getReport());
    assertEquals(2, session.getPeaks().size());
  }

  @Test
  public void testResetPeaksClearsSelectionAndFit() {
    session.autoDetect();
    session.addBackgroundPointNear(18.5);
    session.fit();
    session.resetPeaks();
    assertTrue(session.getPeaks().isEmpty());
    assertNull(session.getReport());
    assertEquals(1, session.getBackgroundPoints().size());
  }

  @Test
  public void testBackgroundTemplateSnapsToSamples() {
    List<XY> points = session.applyBackgroundTemplate(new double[]{18.504, 21.496});
    assertEquals(2, points.size());
    assertEquals(18.5, points.get(0).getX(), 1e-9);
    assertEquals(spectrum.getOriginalIntensities()[spectrum.nearestIndex(21.5)], points.get(1).getY(), 0.0);
  }

  @Test
  public void testNavigationRestoresVisitedFiles() throws Exception {
    File dir = tempFolder.getRoot();
    File a = twoPeaks().write(dir, "a.xy");
    twoPeaks().write(dir, "b.xy");
    twoPeaks().write(dir, "c.xy");
    tempFolder.newFile("notes.txt");

    session.load(new File(dir, "b.xy"));
    assertEquals(3, session.getNavigation().size());
    assertEquals(1, session.getNavigationIndex());
    assertTrue(session.hasNext());
    assertTrue(session.hasPrevious());

    session.addPeakNear(21.0);
    session.next();
    assertEquals("c", session.getSpectrum().getName());
    assertTrue(session.getPeaks().isEmpty());
    assertFalse(session.hasNext());

    session.previous();
    assertEquals("b", session.getSpectrum().getName());
    assertEquals(1, session.getPeaks().size());
    assertFalse("undo history is not restored", session.canUndo());

    session.load(a);
    assertFalse(session.hasPrevious());
  }

  @Test
  public void testOpeningAnotherFolderDropsCachedFiles() throws Exception {
    File first = tempFolder.newFolder("first");
    File second = tempFolder.newFolder("second");
    File a = twoPeaks().write(first, "a.xy");
    twoPeaks().write(first, "b.xy");
    File other = twoPeaks().write(second, "other.xy");

    session.load(a);
    session.addPeakNear(21.0);
    session.next();
    assertEquals(1, session.cachedFileCount());

    session.load(other);
    assertEquals(0, session.cachedFileCount());
    session.load(a);
    assertTrue(session.getPeaks().isEmpty());

    session.load(twoPeaks().build("in memory"));
    assertEquals(0, session.cachedFileCount());
  }

  @Test
  public void testFailedLoadKeepsCurrentSpectrum() throws Exception {
    File broken = tempFolder.newFile("broken.xy");
    try {
      session.load(broken);
      fail("An empty file should not load");
    } catch (IOException e) {
      assertSame(spectrum, session.getSpectrum());
    }
  }
}
