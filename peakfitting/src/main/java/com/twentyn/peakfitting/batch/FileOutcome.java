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

import com.twentyn.peakfitting.fitting.FitReport;

import java.io.File;

/**
 * The record a batch run keeps for every file it visited.
 */
public class FileOutcome {

  public enum Status {
    SUCCEEDED,
    FAILED,
    SKIPPED,
  }

  private final File file;
  private final Status status;
  private final FitReport report;
  private final BatchState failedStage;
  private final String reason;

  private FileOutcome(File file, Status status, FitReport report, BatchState failedStage, String reason) {
    this.file = file;
    this.status = status;
    this.report = report;
    this.failedStage = failedStage;
    this.reason = reason;
  }

  public static FileOutcome succeeded(File file, FitReport report) {
    return new FileOutcome(file, Status.SUCCEEDED, report, null, null);
  }

  public static FileOutcome failed(BatchFileException e) {
    return new FileOutcome(e.getFile(), Status.FAILED, null, e.getStage(), e.getMessage());
  }

  public static FileOutcome skipped(File file, String reason) {
    return new FileOutcome(file, Status.SKIPPED, null, null, reason);
  }

  /**
   * A failed file that the controlling context chose to skip while the run was paused on it.
   */
  public FileOutcome asSkipped() {
    return new FileOutcome(file, Status.SKIPPED, report, failedStage, reason);
  }

  public File getFile() {
    return file;
  }

  public Status getStatus() {
    return status;
  }

  public boolean isSucceeded() {
    return status == Status.SUCCEEDED;
  }

  /**
   * @return The fit report, or null if the file did not succeed.
   */
  public FitReport getReport() {
    return report;
  }

  public BatchState getFailedStage() {
    return failedStage;
  }

  public String getReason() {
    return reason;
  }

  @Override
  public String toString() {
    return status == Status.SUCCEEDED ?
        String.format("%s: %s, %d peaks", file.getName(), status, report.validCount()) :
        String.format("%s: %s%s (%s)", file.getName(), status,
            failedStage == null ? "" : " at " + failedStage, reason);
  }
}
