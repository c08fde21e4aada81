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

import com.twentyn.peakfitting.background.BackgroundModel;
import com.twentyn.peakfitting.fitting.FitCurves;
import com.twentyn.peakfitting.fitting.FitReport;
import com.twentyn.peakfitting.fitting.GroupFit;
import com.twentyn.peakfitting.fitting.PeakFitResult;
import com.twentyn.peakfitting.spectrum.Spectrum;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Writes a gnuplot data file and script showing a fitted spectrum, and optionally renders it to PNG.
 *
 * The data file holds one gnuplot index block per series: the trace, the global background (if any), then for every
 * fitted group its single-fit reference curves (joint groups only), its summed fit and its components, and finally
 * the fitted peak centres.  Fitted curves have
 * their window's edge background added back so they sit on the trace.
 */
public class FitPlotter {
  private static final Logger LOGGER = LogManager.getFormatterLogger(FitPlotter.class);

  public static final String DATA_SUFFIX = "_fit_plot.dat";
  public static final String SCRIPT_SUFFIX = "_fit_plot.gp";
  public static final String IMAGE_SUFFIX = "_fit_plot.png";
  private static final String GNUPLOT = "gnuplot";
  private static final long GNUPLOT_TIMEOUT_SECONDS = 60L;

  // Size in pixels of the rendered image.
  private static final int WIDTH = 1400;
  private static final int HEIGHT = 800;

  private final ProcessRunner processRunner;

  public FitPlotter() {
    this(new ProcessRunner());
  }

  public FitPlotter(ProcessRunner processRunner) {
    this.processRunner = processRunner;
  }

  /**
   * @return The script file written.
   */
  public File writePlot(File outputDir, Spectrum spectrum, BackgroundModel background, FitReport report)
      throws IOException {
    String name = spectrum.getName();
    File dataFile = new File(outputDir, name + DATA_SUFFIX);
    File scriptFile = new File(outputDir, name + SCRIPT_SUFFIX);
    File imageFile = new File(outputDir, name + IMAGE_SUFFIX);

    List<String> series = new ArrayList<>();
    try (PrintWriter out = new PrintWriter(new OutputStreamWriter(new FileOutputStream(dataFile),
        StandardCharsets.UTF_8))) {
      double[] x = spectrum.getPositions();

      writeBlock(out, x, spectrum.getIntensities());
      series.add("with lines lc rgb \"#404040\" lw 1 title \"data\"");

      if (spectrum.isModified()) {
        // The background refers to the raw trace, so show that too.
        writeBlock(out, x, spectrum.getOriginalIntensities());
        series.add("with lines lc rgb \"#A0A0A0\" lw 1 title \"original\"");
      }
      if (background != null) {
        writeBlock(out, x, background.getCurve());
        series.add("with lines lc rgb \"#4169E1\" dt 2 title \"background\"");
      }

      int groupNumber = 0;
      for (GroupFit fit : report.getGroupFits()) {
        FitCurves curves = fit.getCurves();
        if (curves == null) {
          continue;
        }
        groupNumber++;
        // Single-fit references first so the joint fit draws over them.
        for (double[] reference : curves.getStageAComponents()) {
          writeBlock(out, curves.getX(), plus(reference, curves.getBackground()));
          series.add("with lines lc rgb \"#FFB6C1\" dt 2 lw 1 notitle");
        }
        writeBlock(out, curves.getX(), plus(curves.getTotal(), curves.getBackground()));
        series.add(String.format("with lines lc rgb \"#DC143C\" lw 2 title \"%s\"",
            groupNumber == 1 ? "fit" : ""));
        for (double[] component : curves.getComponents()) {
          writeBlock(out, curves.getX(), plus(component, curves.getBackground()));
          series.add("with lines lc rgb \"#2E8B57\" dt 3 notitle");
        }
      }

      List<double[]> markers = new ArrayList<>();
      for (PeakFitResult r : report.getResults()) {
        if (r.isValid()) {
          markers.add(new double[]{r.getCenter(), spectrum.getIntensity(spectrum.nearestIndex(r.getCenter()))});
        }
      }
      if (!markers.isEmpty()) {
        for (double[] m : markers) {
          out.format("%.6f\t%.6f%n", m[0], m[1]);
        }
        out.print("\n\n");
        series.add("with points pt 3 ps 1.5 lc rgb \"#FF1493\" title \"peaks\"");
      }
    }

    try (PrintWriter out = new PrintWriter(new OutputStreamWriter(new FileOutputStream(scriptFile),
        StandardCharsets.UTF_8))) {
      out.format("set terminal png size %d,%d%n", WIDTH, HEIGHT);
      out.format("set output \"%s\"%n", imageFile.getName());
      out.format("set title \"%s\" noenhanced%n", name);
      out.println("set xlabel \"2theta (degree)\"");
      out.println("set ylabel \"Intensity\"");
      out.println("set grid");
      List<String> clauses = new ArrayList<>(series.size());
      for (int i = 0; i < series.size(); i++) {
        clauses.add(String.format("\"%s\" index %d using 1:2 %s", dataFile.getName(), i, series.get(i)));
      }
      out.println("plot " + String.join(", \\\n     ", clauses));
    }

    LOGGER.debug("Wrote plot script %s with %d series", scriptFile.getAbsolutePath(), series.size());
    return scriptFile;
  }

  /**
   * Runs gnuplot on a script in the script's directory.
   * @return True if gnuplot ran and exited cleanly.
   */
  public boolean render(File scriptFile) {
    try {
      int exit = processRunner.run(GNUPLOT, Collections.singletonList(scriptFile.getName()),
          scriptFile.getAbsoluteFile().getParentFile(), GNUPLOT_TIMEOUT_SECONDS);
      return exit == 0;
    } catch (IOException e) {
      LOGGER.warn("Could not run %s to render %s: %s", GNUPLOT, scriptFile.getName(), e.getMessage());
      return false;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warn("Interrupted while rendering %s", scriptFile.getName());
      return false;
    }
  }

  private static void writeBlock(PrintWriter out, double[] x, double[] y) {
    for (int i = 0; i < x.length; i++) {
      out.format("%.6f\t%.6f%n", x[i], y[i]);
    }
    // Two blank lines end a gnuplot index block.
    out.print("\n\n");
  }

  private static double[] plus(double[] a, double[] b) {
    double[] out = new double[a.length];
    for (int i = 0; i < a.length; i++) {
      out[i] = a[i] + b[i];
    }
    return out;
  }
}
