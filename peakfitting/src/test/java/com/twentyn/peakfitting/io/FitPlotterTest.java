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

package com.twentyn.peakfitting.io;

import com.twentyn.peakfitting.SyntheticSpectra;
import com.twentyn.peakfitting.detection.PeakCandidate;
import com.twentyn.peakfitting.detection.PeakDetector;
import com.twentyn.peakfitting.fitting.FitCurves;
import com.twentyn.peakfitting.fitting.FitReport;
import com.twentyn.peakfitting.fitting.FitSettings;
import com.twentyn.peakfitting.fitting.GroupFit;
import com.twentyn.peakfitting.fitting.PeakFitResult;
import com.twentyn.peakfitting.fitting.ProfileParameters;
import com.twentyn.peakfitting.fitting.SpectrumFitter;
import com.twentyn.peakfitting.grouping.PeakGroup;
import com.twentyn.peakfitting.profile.ProfileType;
import com.twentyn.peakfitting.spectrum.Spectrum;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class FitPlotterTest {

  @Rule
  public TemporaryFolder tempFolder = new TemporaryFolder();

  @Test
  public void testWritesDataAndScript() throws Exception {
    Spectrum spectrum = new SyntheticSpectra(18.0, 22.0, 0.01)
        .peak(500.0, 20.0, 0.2)
        .background(100.0, 0.0)
        .build("plotme");
    FitReport report = new SpectrumFitter().fit(spectrum, new PeakDetector().detect(spectrum),
        FitSettings.defaults(ProfileType.PSEUDO_VOIGT, false));

    File script = new FitPlotter().writePlot(tempFolder.getRoot(), spectrum, null, report);
    assertEquals("plotme" + FitPlotter.SCRIPT_SUFFIX, script.getName());
    assertTrue(new File(tempFolder.getRoot(), "plotme" + FitPlotter.DATA_SUFFIX).isFile());

    String text = new String(Files.readAllBytes(script.toPath()), StandardCharsets.UTF_8);
    assertTrue(text.contains("set output \"plotme" + FitPlotter.IMAGE_SUFFIX + "\""));
    // data, fit total, one component and the peak markers
    assertEquals(4, text.split("index ").length - 1);
  }

  @Test
  public void testJointGroupShowsSingleFitReferences() throws Exception {
    Spectrum spectrum = new SyntheticSpectra(9.0, 11.0, 0.01)
        .peak(177.0, 10.0, 0.15)
        .peak(177.0, 10.3, 0.15)
        .build("pair");
    PeakCandidate left = new PeakCandidate(100, 10.0, 500.0, 0.15);
    PeakCandidate right = new PeakCandidate(130, 10.3, 500.0, 0.15);
    ProfileParameters leftFit = new ProfileParameters(ProfileType.PSEUDO_VOIGT,
        SyntheticSpectra.pseudoVoigtParameters(177.0, 10.0, 0.15, 0.3));
    ProfileParameters rightFit = new ProfileParameters(ProfileType.PSEUDO_VOIGT,
        SyntheticSpectra.pseudoVoigtParameters(177.0, 10.3, 0.15, 0.3));
    List<PeakFitResult> results = new ArrayList<PeakFitResult>() {{
      add(PeakFitResult.single(left, leftFit, 0.99));
      add(PeakFitResult.single(right, rightFit, 0.99));
    }};

    double[] window = {9.9, 10.0, 10.1, 10.2, 10.3, 10.4};
    List<double[]> components = new ArrayList<double[]>() {{
      add(leftFit.curve(window));
      add(rightFit.curve(window));
    }};
    List<double[]> references = new ArrayList<double[]>() {{
      add(new double[]{1, 2, 3, 2, 1, 0});
      add(new double[]{0, 1, 2, 3, 2, 1});
    }};
    FitCurves curves = new FitCurves(window, new double[window.length], components, references);
    GroupFit joint = new GroupFit(new PeakGroup(Arrays.asList(left, right)), results, 0.99, curves, false);
    FitReport report = new FitReport("pair", results, Collections.singletonList(joint), Collections.emptyList());

    File script = new FitPlotter().writePlot(tempFolder.getRoot(), spectrum, null, report);
    String text = new String(Files.readAllBytes(script.toPath()), StandardCharsets.UTF_8);
    // data, two single-fit references, fit total, two components and the peak markers
    assertEquals(7, text.split("index ").length - 1);
    assertEquals(2, text.split("#FFB6C1").length - 1);

    String data = new String(Files.readAllBytes(
        new File(tempFolder.getRoot(), "pair" + FitPlotter.DATA_SUFFIX).toPath()), StandardCharsets.UTF_8);
    assertEquals(7, data.split("\n\n\n").length);
  }

  @Test
  public void testRenderRunsGnuplotInScriptDirectory() throws Exception {
    ProcessRunner runner = mock(ProcessRunner.class);
    File script = tempFolder.newFile("x" + FitPlotter.SCRIPT_SUFFIX);
    when(runner.run(eq("gnuplot"), eq(Collections.singletonList(script.getName())),
        eq(tempFolder.getRoot().getAbsoluteFile()), anyLong())).thenReturn(0);

    assertTrue(new FitPlotter(runner).render(script));
    verify(runner).run(eq("gnuplot"), eq(Collections.singletonList(script.getName())),
        eq(tempFolder.getRoot().getAbsoluteFile()), anyLong());
  }

  @Test
  public void testRenderFailureIsReportedNotThrown() throws Exception {
    ProcessRunner runner = mock(ProcessRunner.class);
    File script = tempFolder.newFile("y" + FitPlotter.SCRIPT_SUFFIX);
    when(runner.run(eq("gnuplot"), eq(Collections.singletonList(script.getName())),
        eq(tempFolder.getRoot().getAbsoluteFile()), anyLong())).thenThrow(new IOException("no gnuplot"));
    assertFalse(new FitPlotter(runner).render(script));
  }
}
