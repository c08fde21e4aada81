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

package com.twentyn.peakfitting.batch;

import com.twentyn.peakfitting.background.BackgroundMethod;
import com.twentyn.peakfitting.config.BatchConfiguration;
import com.twentyn.peakfitting.config.PeakFittingConfiguration;
import com.twentyn.peakfitting.profile.ProfileType;
import com.twentyn.peakfitting.util.CLIUtil;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.ParseException;
import org.junit.Before;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class BatchFitRunnerTest {

  private CLIUtil cliUtil;
  private BatchJob job;

  @Before
  public void setUp() {
    cliUtil = new CLIUtil(BatchFitRunner.class, BatchFitRunner.HELP_MESSAGE, BatchFitRunner.OPTION_BUILDERS);
    job = new BatchJob(Collections.singletonList(new File("a.xy")), FailurePolicy.PAUSE);
  }

  @Test
  public void testOverridesReplaceConfiguredValues() throws Exception {
    CommandLine cl = cliUtil.parse(new String[]{
        "-i", "spectra", "-o", "results", "--on-failure", "skip", "-q", "0.85", "-f", "voigt", "-m", "-n", "-x",
        "-d", "100", "--background-method", "polynomial"
    });
    PeakFittingConfiguration configuration = new PeakFittingConfiguration();
    BatchFitRunner.applyOverrides(cliUtil, cl, configuration);

    BatchConfiguration batch = configuration.getBatch();
    assertEquals("results", batch.getOutputDir());
    assertEquals(FailurePolicy.SKIP, batch.getFailurePolicy());
    assertEquals(0.85, batch.getQualityThreshold(), 0.0);
    assertEquals(Long.valueOf(100L), batch.getDisplayDelayMillis());
    assertFalse(batch.getAutoBackground());
    assertFalse(batch.getSavePlots());
    assertFalse(batch.getRenderPlots());
    assertEquals(ProfileType.VOIGT, configuration.getFitting().getProfile());
    assertTrue(configuration.getFitting().getOverlapMode());
    assertEquals(BackgroundMethod.POLYNOMIAL, configuration.getFitting().getBackgroundMethod());
  }

  @Test
  public void testMissingOptionsKeepConfiguredValues() throws Exception {
    CommandLine cl = cliUtil.parse(new String[]{"-i", "spectra"});
    PeakFittingConfiguration configuration = new PeakFittingConfiguration();
    configuration.getBatch().setFailurePolicy(FailurePolicy.STOP);
    BatchFitRunner.applyOverrides(cliUtil, cl, configuration);

    assertEquals(FailurePolicy.STOP, configuration.getBatch().getFailurePolicy());
    assertEquals(BatchConfiguration.DEFAULT_QUALITY_THRESHOLD, configuration.getBatch().getQualityThreshold(), 0.0);
    assertEquals(ProfileType.PSEUDO_VOIGT, configuration.getFitting().getProfile());
    assertFalse(configuration.getFitting().getOverlapMode());
    assertTrue(configuration.getBatch().getAutoBackground());
    assertEquals(BackgroundMethod.SPLINE, configuration.getFitting().getBackgroundMethod());
  }

  @Test(expected = ParseException.class)
  public void testInputDirIsRequired() throws Exception {
    cliUtil.parse(new String[]{"-q", "0.9"});
  }

  @Test
  public void testConsoleCommands() {
    assertTrue(BatchFitRunner.applyCommand(job, "p"));
    assertTrue(job.isPauseRequested());
    assertTrue(BatchFitRunner.applyCommand(job, "  R "));
    assertFalse(job.isPauseRequested());

    assertFalse(BatchFitRunner.applyCommand(job, ""));
    assertFalse(BatchFitRunner.applyCommand(job, "x"));
    assertFalse(job.isAbortRequested());

    assertTrue(BatchFitRunner.applyCommand(job, "abort"));
    assertTrue(job.isAbortRequested());
  }

  @Test
  public void testSkipCommandEndsPause() throws Exception {
    job.pause();
    BatchFitRunner.applyCommand(job, "s");
    assertFalse(job.isPauseRequested());
    assertEquals(BatchJob.Decision.SKIP, job.awaitDecision());
    assertEquals(BatchJob.Decision.RESUME, job.awaitDecision());
  }

  @Test
  public void testConsoleReaderAppliesEveryLine() throws Exception {
    Thread reader = BatchFitRunner.startConsoleControl(job,
        new ByteArrayInputStream("p\nbogus\na\n".getBytes(StandardCharsets.UTF_8)));
    reader.join(10000L);
    assertFalse(reader.isAlive());
    assertTrue(job.isPauseRequested());
    assertTrue(job.isAbortRequested());
    assertEquals(BatchJob.Decision.ABORT, job.awaitDecision());
  }
}
