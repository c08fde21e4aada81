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

import com.twentyn.peakfitting.spectrum.Spectrum;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reads two-or-more column text spectra (.xy, .dat, .txt, .chi).  The first column is the scattering angle, the
 * second the intensity; any further columns (e.g. errors) are ignored.  Lines starting with a comment marker and
 * blank lines are skipped.  Rows are kept in file order.
 */
public class SpectrumParser {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SpectrumParser.class);

  // Integration software writes headers with any of these.
  private static final String[] COMMENT_PREFIXES = new String[]{"#", "%", ";", "!", "//"};
  private static final Pattern DELIMITERS = Pattern.compile("[\\s,;]+");
  // Diffraction exports are frequently produced on Windows machines with non-UTF8 headers.
  private static final Charset FILE_CHARSET = StandardCharsets.ISO_8859_1;
  public static final int MINIMUM_ROWS = 3;

  public Spectrum parse(File file) throws SpectrumLoadException {
    if (!file.isFile()) {
      throw new SpectrumLoadException(file.getName(), null, "file does not exist or is not a regular file");
    }
    try (InputStream is = new FileInputStream(file)) {
      return parse(is, FilenameUtils.getBaseName(file.getName()), file);
    } catch (SpectrumLoadException e) {
      throw e;
    } catch (IOException e) {
      throw new SpectrumLoadException(file.getName(), "unable to read file", e);
    }
  }

  public Spectrum parse(InputStream inStream, String name) throws SpectrumLoadException {
    return parse(inStream, name, null);
  }

  private Spectrum parse(InputStream inStream, String name, File source) throws SpectrumLoadException {
    List<double[]> rows = new ArrayList<>();
    int lineNumber = 0;
    try (BufferedReader reader = new BufferedReader(new InputStreamReader(inStream, FILE_CHARSET))) {
      String line;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        String trimmed = line.trim();
        if (trimmed.isEmpty() || isComment(trimmed)) {
          continue;
        }

        String[] fields = DELIMITERS.split(trimmed);
        if (fields.length < 2) {
          throw new SpectrumLoadException(name, lineNumber,
              String.format("expected at least 2 columns, found %d", fields.length));
        }

        double position = parseField(name, lineNumber, fields[0]);
        double intensity = parseField(name, lineNumber, fields[1]);
        rows.add(new double[]{position, intensity});
      }
    } catch (SpectrumLoadException e) {
      throw e;
    } catch (IOException e) {
      throw new SpectrumLoadException(name, "unable to read data", e);
    }

    if (rows.size() < MINIMUM_ROWS) {
      throw new SpectrumLoadException(name, null,
          String.format("need at least %d data rows, found %d", MINIMUM_ROWS, rows.size()));
    }

    double[] positions = new double[rows.size()];
    double[] intensities = new double[rows.size()];
    for (int i = 0; i < rows.size(); i++) {
      positions[i] = rows.get(i)[0];
      intensities[i] = rows.get(i)[1];
    }

    LOGGER.debug("Read %d rows from %s", rows.size(), name);
    return new Spectrum(name, source, positions, intensities);
  }

  private boolean isComment(String trimmedLine) {
    return StringUtils.startsWithAny(trimmedLine, COMMENT_PREFIXES);
  }

  private double parseField(String name, int lineNumber, String field) throws SpectrumLoadException {
    try {
      double value = Double.parseDouble(field);
      if (Double.isNaN(value) || Double.isInfinite(value)) {
        throw new SpectrumLoadException(name, lineNumber, String.format("non-finite value '%s'", field));
      }
      return value;
    } catch (NumberFormatException e) {
      throw new SpectrumLoadException(name, lineNumber, String.format("could not parse '%s' as a number", field));
    }
  }
}
