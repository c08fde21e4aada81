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

import java.util.List;

/**
 * Progress of a batch run.  Events arrive on a dispatch thread owned by the orchestrator, never on the thread doing
 * the fitting, and in the order they were raised.
 */
public interface BatchProgressListener {
  BatchProgressListener NONE = (current, total, state, status) -> { };

  /**
   * @param current Zero based index of the file being processed.
   * @param total Number of files in the run.
   */
  void progress(int current, int total, BatchState state, String status);

  default void fileFinished(int current, int total, FileOutcome outcome) {
  }

  default void batchFinished(BatchState finalState, List<FileOutcome> outcomes) {
  }
}
