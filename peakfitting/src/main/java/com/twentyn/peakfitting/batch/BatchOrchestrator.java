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

import com.twentyn.peakfitting.background.BackgroundModel;
import com.twentyn.peakfitting.config.BatchConfiguration;
import com.twentyn.peakfitting.fitting.FitReport;
import com.twentyn.peakfitting.fitting.GroupFit;
import com.twentyn.peakfitting.fitting.GroupFitListener;
import com.twentyn.peakfitting.fitting.PeakFitException;
import com.twentyn.peakfitting.fitting.PeakFitResult;
import com.twentyn.peakfitting.grouping.PeakGroup;
import com.twentyn.peakfitting.io.FitPlotter;
import com.twentyn.peakfitting.io.ResultsWriter;
import com.twentyn.peakfitting.io.SpectrumLoadException;
import com.twentyn.peakfitting.io.SpectrumParser;
import com.twentyn.peakfitting.session.Session;
import com.twentyn.peakfitting.spectrum.Spectrum;
import com.twentyn.peakfitting.spectrum.XY;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.io.File;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Drives a {@link BatchJob} through every file: load, detect peaks, pick and subtract a background, fit, check the
 * fit quality and save the results.  A file that fails any of these steps is handled according to the job's
 * {@link FailurePolicy}.
 *
 * The orchestrator runs on the caller's thread; wrap {@link #run(BatchJob)} in a worker to keep it off a UI thread.
 * Progress events go out on a separate dispatch thread so a slow listener never holds up fitting.
 */
public class BatchOrchestrator {
  private static final Logger LOGGER = LogManager.getFormatterLogger(BatchOrchestrator.class);

  public static final String FILE_CONTEXT_KEY = "file";
  private static final long DISPATCH_DRAIN_SECONDS = 10L;

  private final BatchConfiguration configuration;
  private final Session session;
  private final SpectrumParser parser;
  private final ResultsWriter resultsWriter;
  private final FitPlotter plotter;
  private final BatchProgressListener listener;

  // X positions of the first file's background points, reused on later files when configured.
  private double[] backgroundTemplate;

  public BatchOrchestrator(BatchConfiguration configuration, Session session, BatchProgressListener listener) {
    this(configuration, session, new SpectrumParser(), new ResultsWriter(), new FitPlotter(), listener);
  }

  public BatchOrchestrator(BatchConfiguration configuration, Session session, SpectrumParser parser,
                           ResultsWriter resultsWriter, FitPlotter plotter, BatchProgressListener listener) {
    this.configuration = configuration;
    this.session = session;
    this.parser = parser;
    this.resultsWriter = resultsWriter;
    this.plotter = plotter;
    this.listener = listener;
  }

  public BatchJob createJob(List<File> files) {
    return new BatchJob(files, configuration.getFailurePolicy());
  }

  /**
   * Processes the job's files in order.
   * @return The final state, {@link BatchState#DONE} or {@link BatchState#ABORTED}.
   */
  public BatchState run(BatchJob job) {
    ExecutorService dispatch = Executors.newSingleThreadExecutor(new BasicThreadFactory.Builder()
        .namingPattern("peakfitting-batch-events-%d")
        .daemon(true)
        .build());
    backgroundTemplate = null;
    int total = job.getFiles().size();
    LOGGER.info("Starting batch of %d files, failure policy %s", total, job.getFailurePolicy());

    BatchState finalState = BatchState.DONE;
    try {
      for (int i = 0; i < total; i++) {
        File file = job.getFiles().get(i);
        BatchJob.Decision decision = checkpoint(job, i, total, dispatch);
        if (decision == BatchJob.Decision.ABORT) {
          finalState = BatchState.ABORTED;
          break;
        }
        job.setCursor(i);
        if (decision == BatchJob.Decision.SKIP) {
          FileOutcome skipped = FileOutcome.skipped(file, "skipped while paused");
          job.addOutcome(skipped);
          emitFileFinished(dispatch, i, total, skipped);
          continue;
        }

        ThreadContext.put(FILE_CONTEXT_KEY, file.getName());
        FileOutcome outcome;
        try {
          outcome = FileOutcome.succeeded(file, processFile(job, file, i, total, dispatch));
          LOGGER.info("Finished %s", file.getName());
        } catch (BatchFileException e) {
          LOGGER.error("Batch file %s failed while %s: %s", file.getName(), e.getStage(), e.getMessage());
          outcome = FileOutcome.failed(e);
        } finally {
          ThreadContext.remove(FILE_CONTEXT_KEY);
        }
        job.addOutcome(outcome);
        emitFileFinished(dispatch, i, total, outcome);

        if (!outcome.isSucceeded() && !handleFailure(job, outcome, i, total, dispatch)) {
          finalState = BatchState.ABORTED;
          break;
        }

        if (i < total - 1) {
          transition(job, BatchState.NEXT_FILE, i, total, dispatch, "Moving to next file");
          if (!displayDelay()) {
            finalState = BatchState.ABORTED;
            break;
          }
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warn("Batch interrupted");
      finalState = BatchState.ABORTED;
    }

    if (configuration.getSaveResults()) {
      writeCombined(job);
    }

    transition(job, finalState, Math.max(job.getCursor(), 0), total, dispatch,
        String.format("Batch %s: %d of %d files succeeded", finalState == BatchState.DONE ? "complete" : "aborted",
            countSucceeded(job), total));
    List<FileOutcome> outcomes = job.getOutcomes();
    BatchState reported = finalState;
    dispatch.execute(() -> listener.batchFinished(reported, outcomes));
    drain(dispatch);
    return finalState;
  }

  /**
   * Honours abort and pause requests before a file is started.
   */
  private BatchJob.Decision checkpoint(BatchJob job, int index, int total, ExecutorService dispatch)
      throws InterruptedException {
    if (job.isAbortRequested()) {
      LOGGER.info("Batch aborted before file %d", index + 1);
      return BatchJob.Decision.ABORT;
    }
    if (job.isPauseRequested()) {
      transition(job, BatchState.PAUSED, index, total, dispatch, "Paused");
      BatchJob.Decision decision = job.awaitDecision();
      LOGGER.info("Batch pause ended with %s", decision);
      return decision;
    }
    return BatchJob.Decision.RESUME;
  }

  /**
   * @return False if the run should end.
   */
  private boolean handleFailure(BatchJob job, FileOutcome outcome, int index, int total, ExecutorService dispatch)
      throws InterruptedException {
    switch (job.getFailurePolicy()) {
      case STOP:
        LOGGER.warn("Stopping batch after failure of %s", outcome.getFile().getName());
        return false;
      case SKIP:
        LOGGER.info("Skipping %s", outcome.getFile().getName());
        return true;
      case PAUSE:
        job.holdAfterFailure();
        transition(job, BatchState.PAUSED, index, total, dispatch,
            String.format("Paused on %s: %s", outcome.getFile().getName(), outcome.getReason()));
        BatchJob.Decision decision = job.awaitDecision();
        if (decision == BatchJob.Decision.SKIP) {
          job.replaceLastOutcome(outcome.asSkipped());
        }
        LOGGER.info("Pause on %s ended with %s", outcome.getFile().getName(), decision);
        return decision != BatchJob.Decision.ABORT;
      default:
        throw new IllegalStateException(String.format("Unknown failure policy %s", job.getFailurePolicy()));
    }
  }

  private FitReport processFile(BatchJob job, File file, int index, int total, ExecutorService dispatch)
      throws BatchFileException {
    transition(job, BatchState.LOADING, index, total, dispatch, "Loading " + file.getName());
    Spectrum spectrum;
    try {
      spectrum = parser.parse(file);
    } catch (SpectrumLoadException e) {
      throw new BatchFileException(file, BatchState.LOADING, e.getMessage(), e);
    }
    session.load(spectrum);

    transition(job, BatchState.DETECTING, index, total, dispatch, "Detecting peaks");
    if (session.autoDetect().isEmpty()) {
      throw new BatchFileException(file, BatchState.DETECTING, "no peaks found");
    }

    if (configuration.getAutoBackground()) {
      transition(job, BatchState.BACKGROUND_FITTING, index, total, dispatch, "Selecting background");
      selectBackground();
      if (session.getBackgroundPoints().size() >= 2) {
        session.subtractBackground();
      } else {
        BackgroundModel estimated = session.subtractEstimatedBackground();
        LOGGER.warn("Only %d background points found in %s, using a %s background from the detected peaks",
            session.getBackgroundPoints().size(), spectrum.getName(), estimated.getMethod());
      }
    }

    transition(job, BatchState.FITTING, index, total, dispatch,
        String.format("Fitting %d peaks", session.getPeaks().size()));
    FitReport report = session.fit(new GroupFitListener() {
      @Override
      public void groupFitted(int groupIndex, int groupCount, GroupFit fit) {
        emit(dispatch, index, total, BatchState.FITTING,
            String.format("Fitted group %d/%d", groupIndex + 1, groupCount));
      }

      @Override
      public void groupFailed(int groupIndex, int groupCount, PeakGroup group, PeakFitException cause) {
        emit(dispatch, index, total, BatchState.FITTING,
            String.format("Group %d/%d failed at %.4f", groupIndex + 1, groupCount, cause.getPosition()));
      }
    });
    checkQuality(file, report);

    transition(job, BatchState.SAVING, index, total, dispatch, "Saving results");
    save(file, spectrum, report);
    return report;
  }

  private void selectBackground() {
    if (configuration.getReuseBackgroundTemplate() && backgroundTemplate != null) {
      session.applyBackgroundTemplate(backgroundTemplate);
      return;
    }
    List<XY> points = session.autoSelectBackground(configuration.getBackgroundSegments());
    if (configuration.getReuseBackgroundTemplate() && points.size() >= 2) {
      backgroundTemplate = new double[points.size()];
      for (int i = 0; i < points.size(); i++) {
        backgroundTemplate[i] = points.get(i).getX();
      }
      LOGGER.info("Using %d background positions as template for the remaining files", points.size());
    }
  }

  /**
   * A file passes when it has at least one valid peak and every valid peak reaches the quality threshold.
   */
  void checkQuality(File file, FitReport report) throws BatchFileException {
    OptionalDouble minimum = report.minimumRSquared();
    if (!minimum.isPresent()) {
      throw new BatchFileException(file, BatchState.FITTING, "no valid fit");
    }
    if (minimum.getAsDouble() < configuration.getQualityThreshold()) {
      throw new BatchFileException(file, BatchState.FITTING, String.format(
          "fit quality %.4f below threshold %.4f", minimum.getAsDouble(), configuration.getQualityThreshold()));
    }
  }

  private void save(File file, Spectrum spectrum, FitReport report) throws BatchFileException {
    File outputDir = outputDirFor(file);
    try {
      if (configuration.getSaveResults()) {
        resultsWriter.writeResults(outputDir, spectrum.getName(), report.getResults());
      }
      if (configuration.getSavePlots()) {
        File script = plotter.writePlot(outputDir, spectrum, session.getBackground(), report);
        if (configuration.getRenderPlots() && !plotter.render(script)) {
          LOGGER.warn("Plot for %s was written but not rendered", spectrum.getName());
        }
      }
    } catch (IOException e) {
      throw new BatchFileException(file, BatchState.SAVING, e.getMessage(), e);
    }
  }

  private void writeCombined(BatchJob job) {
    Map<String, List<PeakFitResult>> byFile = new LinkedHashMap<>();
    File outputDir = null;
    for (FileOutcome outcome : job.getOutcomes()) {
      if (outcome.isSucceeded()) {
        byFile.put(outcome.getReport().getSpectrumName(), outcome.getReport().getResults());
        if (outputDir == null) {
          outputDir = outputDirFor(outcome.getFile());
        }
      }
    }
    if (byFile.isEmpty()) {
      LOGGER.info("No successful files, not writing a combined table");
      return;
    }
    try {
      resultsWriter.writeCombined(outputDir, byFile);
    } catch (IOException e) {
      LOGGER.error("Could not write combined results to %s: %s", outputDir.getAbsolutePath(), e.getMessage());
    }
  }

  File outputDirFor(File input) {
    if (configuration.getOutputDir() != null) {
      File dir = new File(configuration.getOutputDir());
      if (!dir.isDirectory() && !dir.mkdirs()) {
        LOGGER.warn("Could not create output directory %s", dir.getAbsolutePath());
      }
      return dir;
    }
    return input.getAbsoluteFile().getParentFile();
  }

  /**
   * @return False if interrupted while waiting.
   */
  private boolean displayDelay() {
    long delay = configuration.getDisplayDelayMillis();
    if (delay <= 0) {
      return true;
    }
    try {
      Thread.sleep(delay);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warn("Batch interrupted during display delay");
      return false;
    }
  }

  private void transition(BatchJob job, BatchState state, int index, int total, ExecutorService dispatch,
                          String status) {
    job.setState(state);
    LOGGER.debug("[%d/%d] %s: %s", index + 1, total, state, status);
    emit(dispatch, index, total, state, status);
  }

  private void emit(ExecutorService dispatch, int index, int total, BatchState state, String status) {
    dispatch.execute(() -> listener.progress(index, total, state, status));
  }

  private void emitFileFinished(ExecutorService dispatch, int index, int total, FileOutcome outcome) {
    dispatch.execute(() -> listener.fileFinished(index, total, outcome));
  }

  private void drain(ExecutorService dispatch) {
    dispatch.shutdown();
    try {
      if (!dispatch.awaitTermination(DISPATCH_DRAIN_SECONDS, TimeUnit.SECONDS)) {
        LOGGER.warn("Progress listener did not keep up, dropping remaining events");
        dispatch.shutdownNow();
      }
    } catch (InterruptedException e) {
      dispatch.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private static long countSucceeded(BatchJob job) {
    return job.getOutcomes().stream().filter(FileOutcome::isSucceeded).count();
  }
}
