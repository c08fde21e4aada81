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
import com.twentyn.peakfitting.config.FittingConfiguration;
import com.twentyn.peakfitting.config.PeakFittingConfiguration;
import com.twentyn.peakfitting.io.SpectrumDirectory;
import com.twentyn.peakfitting.profile.ProfileType;
import com.twentyn.peakfitting.session.Session;
import com.twentyn.peakfitting.util.CLIUtil;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line entry point: fits every spectrum in a folder and writes per-file and combined result tables.
 *
 * While the run is going, single letter commands on standard input control it: p(ause), r(esume), s(kip) and
 * a(bort).  With the PAUSE failure policy a failed file waits for one of them.
 */
public class BatchFitRunner {
  private static final Logger LOGGER = LogManager.getFormatterLogger(BatchFitRunner.class);

  public static final String OPTION_INPUT_DIR = "i";
  public static final String OPTION_CONFIG = "c";
  public static final String OPTION_OUTPUT_DIR = "o";
  public static final String OPTION_FAILURE_POLICY = "p";
  public static final String OPTION_QUALITY_THRESHOLD = "q";
  public static final String OPTION_PROFILE = "f";
  public static final String OPTION_OVERLAP_MODE = "m";
  public static final String OPTION_NO_BACKGROUND = "n";
  public static final String OPTION_REUSE_BACKGROUND = "t";
  public static final String OPTION_NO_PLOTS = "x";
  public static final String OPTION_RENDER_PLOTS = "r";
  public static final String OPTION_DISPLAY_DELAY = "d";
  public static final String OPTION_BACKGROUND_METHOD = "b";

  public static final String HELP_MESSAGE = StringUtils.join(new String[]{
      "Detects, groups and fits the diffraction peaks of every spectrum file in a directory. ",
      "Results are written as <name>_fit_results.csv per file plus a combined table. ",
      "While running, type p, r, s or a followed by enter to pause, resume, skip or abort."
  }, "");

  public static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {{
    add(Option.builder(OPTION_INPUT_DIR)
        .argName("directory")
        .desc("Directory of spectrum files to fit")
        .hasArg().required()
        .longOpt("input-dir")
    );
    add(Option.builder(OPTION_CONFIG)
        .argName("json file")
        .desc("Configuration file; bundled defaults are used for anything it leaves out")
        .hasArg()
        .longOpt("config")
    );
    add(Option.builder(OPTION_OUTPUT_DIR)
        .argName("directory")
        .desc("Where to write results (default: next to the input files)")
        .hasArg()
        .longOpt("output-dir")
    );
    add(Option.builder(OPTION_FAILURE_POLICY)
        .argName("policy")
        .desc("What to do when a file fails: PAUSE, SKIP or STOP")
        .hasArg()
        .longOpt("on-failure")
    );
    add(Option.builder(OPTION_QUALITY_THRESHOLD)
        .argName("r squared")
        .desc("Minimum r-squared every fitted peak of a file must reach")
        .hasArg()
        .longOpt("quality-threshold")
    );
    add(Option.builder(OPTION_PROFILE)
        .argName("profile")
        .desc("Line shape: PSEUDO_VOIGT or VOIGT")
        .hasArg()
        .longOpt("profile")
    );
    add(Option.builder(OPTION_OVERLAP_MODE)
        .desc("Fit in overlap mode (wider windows, looser grouping)")
        .longOpt("overlap")
    );
    add(Option.builder(OPTION_NO_BACKGROUND)
        .desc("Do not subtract an automatic background")
        .longOpt("no-background")
    );
    add(Option.builder(OPTION_REUSE_BACKGROUND)
        .desc("Reuse the first file's background positions on all other files")
        .longOpt("reuse-background")
    );
    add(Option.builder(OPTION_NO_PLOTS)
        .desc("Do not write gnuplot files")
        .longOpt("no-plots")
    );
    add(Option.builder(OPTION_RENDER_PLOTS)
        .desc("Render plots to PNG with gnuplot")
        .longOpt("render")
    );
    add(Option.builder(OPTION_BACKGROUND_METHOD)
        .argName("method")
        .desc("Background estimate used when too few background points are found: VALLEY, SPLINE or POLYNOMIAL")
        .hasArg()
        .longOpt("background-method")
    );
    add(Option.builder(OPTION_DISPLAY_DELAY)
        .argName("milliseconds")
        .desc("Delay between files")
        .hasArg()
        .longOpt("delay")
    );
  }};

  public static void main(String[] args) throws Exception {
    CLIUtil cliUtil = new CLIUtil(BatchFitRunner.class, HELP_MESSAGE, OPTION_BUILDERS);
    CommandLine cl = cliUtil.parseCommandLine(args);

    File inputDir = new File(cl.getOptionValue(OPTION_INPUT_DIR));
    if (!inputDir.isDirectory()) {
      cliUtil.failWithMessage("Input directory %s does not exist", inputDir.getAbsolutePath());
    }

    PeakFittingConfiguration configuration = cl.hasOption(OPTION_CONFIG) ?
        PeakFittingConfiguration.load(new File(cl.getOptionValue(OPTION_CONFIG))) :
        PeakFittingConfiguration.defaults();
    applyOverrides(cliUtil, cl, configuration);

    BatchConfiguration batchConfiguration = configuration.getBatch();
    List<File> files = new SpectrumDirectory(batchConfiguration.getExtensions()).list(inputDir);
    if (files.isEmpty()) {
      cliUtil.failWithMessage("No spectrum files with extensions %s in %s",
          StringUtils.join(batchConfiguration.getExtensions(), ", "), inputDir.getAbsolutePath());
    }

    Session session = new Session(configuration.getFitting());
    BatchOrchestrator orchestrator = new BatchOrchestrator(batchConfiguration, session, new ConsoleProgress());
    BatchJob job = orchestrator.createJob(files);
    startConsoleControl(job, System.in);

    BatchState finalState = orchestrator.run(job);
    for (FileOutcome outcome : job.getOutcomes()) {
      LOGGER.info("%s", outcome);
    }
    System.exit(finalState == BatchState.DONE ? 0 : 2);
  }

  static void applyOverrides(CLIUtil cliUtil, CommandLine cl, PeakFittingConfiguration configuration) {
    FittingConfiguration fitting = configuration.getFitting();
    BatchConfiguration batch = configuration.getBatch();

    if (cl.hasOption(OPTION_OUTPUT_DIR)) {
      batch.setOutputDir(cl.getOptionValue(OPTION_OUTPUT_DIR));
    }
    batch.setFailurePolicy(cliUtil.getEnum(OPTION_FAILURE_POLICY, FailurePolicy.class, batch.getFailurePolicy()));
    batch.setQualityThreshold(cliUtil.getDouble(OPTION_QUALITY_THRESHOLD, batch.getQualityThreshold()));
    batch.setDisplayDelayMillis(cliUtil.getLong(OPTION_DISPLAY_DELAY, batch.getDisplayDelayMillis()));
    fitting.setProfile(cliUtil.getEnum(OPTION_PROFILE, ProfileType.class, fitting.getProfile()));
    fitting.setBackgroundMethod(
        cliUtil.getEnum(OPTION_BACKGROUND_METHOD, BackgroundMethod.class, fitting.getBackgroundMethod()));

    if (cl.hasOption(OPTION_OVERLAP_MODE)) {
      fitting.setOverlapMode(true);
    }
    if (cl.hasOption(OPTION_NO_BACKGROUND)) {
      batch.setAutoBackground(false);
    }
    if (cl.hasOption(OPTION_REUSE_BACKGROUND)) {
      batch.setReuseBackgroundTemplate(true);
    }
    if (cl.hasOption(OPTION_NO_PLOTS)) {
      batch.setSavePlots(false);
    }
    if (cl.hasOption(OPTION_RENDER_PLOTS)) {
      batch.setRenderPlots(true);
    }
  }

  /**
   * Reads control commands from the stream on a daemon thread until the stream ends.
   */
  static Thread startConsoleControl(BatchJob job, InputStream in) {
    Thread reader = new Thread(() -> {
      try (BufferedReader lines = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
        String line;
        while ((line = lines.readLine()) != null) {
          applyCommand(job, line);
        }
      } catch (IOException e) {
        LOGGER.warn("Stopped reading batch commands: %s", e.getMessage());
      }
    }, "peakfitting-console");
    reader.setDaemon(true);
    reader.start();
    return reader;
  }

  /**
   * @return True if the line was a known command.
   */
  static boolean applyCommand(BatchJob job, String line) {
    String command = StringUtils.trimToEmpty(line).toLowerCase();
    if (command.isEmpty()) {
      return false;
    }
    switch (command.charAt(0)) {
      case 'p':
        LOGGER.info("Pausing after the current file");
        job.pause();
        return true;
      case 'r':
        job.resume();
        return true;
      case 's':
        job.skip();
        return true;
      case 'a':
        LOGGER.info("Aborting after the current file");
        job.abort();
        return true;
      default:
        LOGGER.warn("Unknown command '%s', expected p, r, s or a", command);
        return false;
    }
  }

  private static class ConsoleProgress implements BatchProgressListener {
    @Override
    public void progress(int current, int total, BatchState state, String status) {
      if (state == BatchState.PAUSED) {
        LOGGER.warn("[%d/%d] %s. Type r to resume, s to skip or a to abort.", current + 1, total, status);
      } else {
        LOGGER.info("[%d/%d] %s: %s", current + 1, total, state, status);
      }
    }

    @Override
    public void batchFinished(BatchState finalState, List<FileOutcome> outcomes) {
      LOGGER.info("Batch finished in state %s after %d files", finalState, outcomes.size());
    }
  }
}
