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

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One batch run: the files to process, where the run is, what happened to each file so far, and the pause / skip /
 * abort requests of the controlling context.
 *
 * Requests are cooperative.  The orchestrator looks at them between files, so a file that is being fitted always
 * runs to completion first.
 */
public class BatchJob {

  public enum Decision {
    RESUME,
    SKIP,
    ABORT,
  }

  private final List<File> files;
  private final FailurePolicy failurePolicy;
  private final List<FileOutcome> outcomes = new ArrayList<>();

  private volatile BatchState state = BatchState.IDLE;
  private volatile int cursor = -1;

  private final Object lock = new Object();
  private boolean pauseRequested = false;
  private boolean skipRequested = false;
  private boolean abortRequested = false;

  public BatchJob(List<File> files, FailurePolicy failurePolicy) {
    this.files = Collections.unmodifiableList(new ArrayList<>(files));
    this.failurePolicy = failurePolicy;
  }

  public List<File> getFiles() {
    return files;
  }

  public FailurePolicy getFailurePolicy() {
    return failurePolicy;
  }

  public BatchState getState() {
    return state;
  }

  void setState(BatchState state) {
    this.state = state;
  }

  /**
   * @return Index of the file being processed, or -1 before the first one.
   */
  public int getCursor() {
    return cursor;
  }

  void setCursor(int cursor) {
    this.cursor = cursor;
  }

  public List<FileOutcome> getOutcomes() {
    synchronized (outcomes) {
      return Collections.unmodifiableList(new ArrayList<>(outcomes));
    }
  }

  void addOutcome(FileOutcome outcome) {
    synchronized (outcomes) {
      outcomes.add(outcome);
    }
  }

  void replaceLastOutcome(FileOutcome outcome) {
    synchronized (outcomes) {
      outcomes.set(outcomes.size() - 1, outcome);
    }
  }

  /**
   * Asks the run to stop before the next file until {@link #resume()}, {@link #skip()} or {@link #abort()}.
   */
  public void pause() {
    synchronized (lock) {
      pauseRequested = true;
    }
  }

  public void resume() {
    synchronized (lock) {
      pauseRequested = false;
      lock.notifyAll();
    }
  }

  /**
   * Leaves the paused file behind and carries on with the next one.
   */
  public void skip() {
    synchronized (lock) {
      skipRequested = true;
      pauseRequested = false;
      lock.notifyAll();
    }
  }

  public void abort() {
    synchronized (lock) {
      abortRequested = true;
      lock.notifyAll();
    }
  }

  public boolean isPauseRequested() {
    synchronized (lock) {
      return pauseRequested;
    }
  }

  public boolean isAbortRequested() {
    synchronized (lock) {
      return abortRequested;
    }
  }

  /**
   * Puts the run on hold, as the PAUSE failure policy does after a failed file.
   */
  void holdAfterFailure() {
    synchronized (lock) {
      pauseRequested = true;
      skipRequested = false;
    }
  }

  /**
   * Blocks while a pause is in effect.
   * @return How the pause ended; {@link Decision#RESUME} straight away if the run is not paused.
   */
  Decision awaitDecision() throws InterruptedException {
    synchronized (lock) {
      while (pauseRequested && !abortRequested) {
        lock.wait();
      }
      if (abortRequested) {
        return Decision.ABORT;
      }
      if (skipRequested) {
        skipRequested = false;
        return Decision.SKIP;
      }
      return Decision.RESUME;
    }
  }
}
