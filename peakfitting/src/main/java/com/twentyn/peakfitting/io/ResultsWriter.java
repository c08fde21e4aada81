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

import com.twentyn.peakfitting.fitting.PeakFitResult;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Writes fit results as comma separated tables: one per spectrum, and a combined table for a batch.
 */
public class ResultsWriter {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ResultsWriter.class);

  public static final String FILE_SUFFIX = "_fit_results.csv";
  public static final String COMBINED_FILE_NAME = "batch_fit_results_combined.csv";
  public static final String NOT_APPLICABLE = "N/A";

  public enum Column {
    PEAK("Peak"),
    CENTER("Center"),
    FWHM("FWHM"),
    AREA("Area"),
    AMPLITUDE("Amplitude"),
    SIGMA("Sigma"),
    GAMMA("Gamma"),
    ETA("Eta"),
    R_SQUARED("R_squared"),
    ;

    private final String header;

    Column(String header) {
      this.header = header;
    }

    @Override
    public String toString() {
      return header;
    }
  }

  public static final String FILE_COLUMN = "File";
  public static final List<Column> COLUMNS = Collections.unmodifiableList(Arrays.asList(Column.values()));

  public File resultsFileFor(File outputDir, String spectrumName) {
    return new File(outputDir, spectrumName + FILE_SUFFIX);
  }

  /**
   * Writes the valid results of one spectrum, numbered from 1 in position order.
   * @return The file written.
   */
  public File writeResults(File outputDir, String spectrumName, List<PeakFitResult> results) throws IOException {
    File out = resultsFileFor(outputDir, spectrumName);
    try (CSVPrinter printer = openPrinter(out, headers(false))) {
      for (List<Object> row : rows(results)) {
        printer.printRecord(row);
      }
    }
    LOGGER.info("Wrote %d results for %s to %s", countValid(results), spectrumName, out.getAbsolutePath());
    return out;
  }

  /**
   * Writes every spectrum's valid results into a single table with a leading file column.  Blocks for consecutive
   * spectra are separated by an empty line.
   * @param resultsBySpectrum Results in the order the blocks should appear.
   */
  public File writeCombined(File outputDir, Map<String, List<PeakFitResult>> resultsBySpectrum) throws IOException {
    File out = new File(outputDir, COMBINED_FILE_NAME);
    try (CSVPrinter printer = openPrinter(out, headers(true))) {
      boolean first = true;
      for (Map.Entry<String, List<PeakFitResult>> entry : resultsBySpectrum.entrySet()) {
        if (!first) {
          printer.println();
        }
        first = false;
        for (List<Object> row : rows(entry.getValue())) {
          List<Object> withFile = new ArrayList<>(row.size() + 1);
          withFile.add(entry.getKey());
          withFile.addAll(row);
          printer.printRecord(withFile);
        }
      }
    }
    LOGGER.info("Wrote combined results for %d spectra to %s", resultsBySpectrum.size(), out.getAbsolutePath());
    return out;
  }

  private CSVPrinter openPrinter(File out, String[] headers) throws IOException {
    Writer writer = new OutputStreamWriter(new FileOutputStream(out), StandardCharsets.UTF_8);
    return new CSVPrinter(writer, CSVFormat.DEFAULT.withHeader(headers).withRecordSeparator("\n"));
  }

  private String[] headers(boolean withFile) {
    List<String> headers = new ArrayList<>();
    if (withFile) {
      headers.add(FILE_COLUMN);
    }
    for (Column c : COLUMNS) {
      headers.add(c.toString());
    }
    return headers.toArray(new String[headers.size()]);
  }

  private List<List<Object>> rows(List<PeakFitResult> results) {
    List<List<Object>> rows = new ArrayList<>();
    int peakNumber = 0;
    for (PeakFitResult r : results) {
      if (!r.isValid()) {
        continue;
      }
      peakNumber++;
      double eta = r.getEta();
      rows.add(Arrays.<Object>asList(
          peakNumber,
          r.getCenter(),
          r.getFwhm(),
          r.getArea(),
          r.getAmplitude(),
          r.getSigma(),
          r.getGamma(),
          Double.isNaN(eta) ? NOT_APPLICABLE : eta,
          r.getRSquared()
      ));
    }
    return rows;
  }

  private static long countValid(List<PeakFitResult> results) {
    return results.stream().filter(PeakFitResult::isValid).count();
  }
}
