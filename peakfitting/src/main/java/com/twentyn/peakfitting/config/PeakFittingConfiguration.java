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
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

/**
 * Top level configuration document: a fitting section and a batch section.  Missing keys keep their defaults, so a
 * file only needs to name what it changes.
 */
public class PeakFittingConfiguration {
  private static final Logger LOGGER = LogManager.getFormatterLogger(PeakFittingConfiguration.class);

  public static final String DEFAULTS_RESOURCE = "peakfitting-defaults.json";

  // An explicit null in a file keeps the default for that key.
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true)
      .enable(SerializationFeature.INDENT_OUTPUT)
      .setDefaultSetterInfo(JsonSetter.Value.forValueNulls(Nulls.SKIP));

  @JsonProperty("fitting")
  private FittingConfiguration fitting = new FittingConfiguration();

  @JsonProperty("batch")
  private BatchConfiguration batch = new BatchConfiguration();

  public PeakFittingConfiguration() {
  }

  public FittingConfiguration getFitting() {
    return fitting;
  }

  public void setFitting(FittingConfiguration fitting) {
    this.fitting = fitting;
  }

  public BatchConfiguration getBatch() {
    return batch;
  }

  public void setBatch(BatchConfiguration batch) {
    this.batch = batch;
  }

  public static PeakFittingConfiguration load(File file) throws IOException {
    LOGGER.info("Reading configuration from %s", file.getAbsolutePath());
    return OBJECT_MAPPER.readValue(file, PeakFittingConfiguration.class);
  }

  /**
   * Reads the configuration bundled with the library.
   */
  public static PeakFittingConfiguration defaults() throws IOException {
    try (InputStream in = PeakFittingConfiguration.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
      if (in == null) {
        throw new IOException(String.format("Missing classpath resource %s", DEFAULTS_RESOURCE));
      }
      return OBJECT_MAPPER.readValue(in, PeakFittingConfiguration.class);
    }
  }

  public void write(File file) throws IOException {
    OBJECT_MAPPER.writeValue(file, this);
  }
}
