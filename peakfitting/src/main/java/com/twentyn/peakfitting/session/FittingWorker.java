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

package com.twentyn.peakfitting.session;

import com.twentyn.peakfitting.fitting.FitReport;
import com.twentyn.peakfitting.fitting.GroupFitListener;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs fitting and batch jobs on a single background thread, one job at a time.  Log lines written while a job runs
 * carry the job name in the {@code job} thread context key.
 */
public class FittingWorker implements AutoCloseable {
  private static final Logger LOGGER = LogManager.getFormatterLogger(FittingWorker.class);

  public static final String JOB_CONTEXT_KEY = "job";
  private static final long SHUTDOWN_WAIT_SECONDS = 5L;

  private final ExecutorService executor;
  private final AtomicReference<Future<?>> active = new AtomicReference<>();

  public FittingWorker() {
    this.executor = Executors.newSingleThreadExecutor(new BasicThreadFactory.Builder()
        .namingPattern("peakfitting-worker-%d")
        .daemon(true)
        .build());
  }

  /**
   * The worker counts as busy until the returned future is done, whether the job completed, failed or was cancelled
   * before it started.
   *
   * @throws IllegalStateException if another job is still running.
   */
  public <T> Future<T> submit(String jobName, Callable<T> job) {
    JobTask<T> task = new JobTask<>(jobName, job);
    if (!active.compareAndSet(null, task)) {
      throw new IllegalStateException(String.format("Cannot start %s: another job is running", jobName));
    }
    try {
      executor.execute(task);
    } catch (RuntimeException e) {
      task.release();
      throw e;
    }
    return task;
  }

  /**
   * Fits the session's selected peaks in the background.  Per-group results reach the listener as they complete.
   */
  public Future<FitReport> submitFit(Session session, GroupFitListener listener) {
    String name = session.getSpectrum() == null ? "fit" : "fit " + session.getSpectrum().getName();
    return submit(name, () -> session.fit(listener));
  }

  public boolean isBusy() {
    return active.get() != null;
  }

  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
        LOGGER.warn("Worker did not finish within %d seconds, interrupting", SHUTDOWN_WAIT_SECONDS);
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Frees the worker before the outcome is published, so a caller woken by {@link Future#get()} can submit again.
   */
  private class JobTask<T> extends FutureTask<T> {
    private final String jobName;

    JobTask(String jobName, Callable<T> job) {
      super(() -> {
        ThreadContext.put(JOB_CONTEXT_KEY, jobName);
        try {
          LOGGER.debug("Starting job %s", jobName);
          return job.call();
        } catch (Exception e) {
          LOGGER.error("Job %s failed: %s", jobName, e.getMessage());
          throw e;
        } finally {
          ThreadContext.remove(JOB_CONTEXT_KEY);
        }
      });
      this.jobName = jobName;
    }

    void release() {
      active.compareAndSet(this, null);
    }

    @Override
    protected void set(T value) {
      release();
      super.set(value);
    }

    @Override
    protected void setException(Throwable t) {
      release();
      super.setException(t);
    }

    @Override
    protected void done() {
      if (isCancelled()) {
        LOGGER.info("Job %s was cancelled", jobName);
      }
      release();
    }
  }
}
