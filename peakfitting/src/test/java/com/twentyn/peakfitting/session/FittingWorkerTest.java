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

import com.twentyn.peakfitting.SyntheticSpectra;
import com.twentyn.peakfitting.config.FittingConfiguration;
import com.twentyn.peakfitting.fitting.FitReport;
import com.twentyn.peakfitting.fitting.GroupFitListener;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class FittingWorkerTest {

  private FittingWorker worker;

  @Before
  public void setUp() {
    worker = new FittingWorker();
  }

  @After
  public void tearDown() {
    worker.close();
  }

  @Test
  public void testRunsJobAndReturnsValue() throws Exception {
    Future<String> result = worker.submit("echo", () -> Thread.currentThread().getName());
    assertTrue(result.get(10, TimeUnit.SECONDS).startsWith("peakfitting-worker-"));
    assertFalse(worker.isBusy());
  }

  @Test
  public void testRejectsSecondJobWhileBusy() throws Exception {
    CountDownLatch started = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    Future<Integer> first = worker.submit("blocking", () -> {
      started.countDown();
      release.await();
      return 1;
    });
    assertTrue(started.await(10, TimeUnit.SECONDS));
    assertTrue(worker.isBusy());

    try {
      worker.submit("second", () -> 2);
      fail("A second job should be rejected while the first runs");
    } catch (IllegalStateException e) {
      assertTrue(e.getMessage().contains("second"));
    }

    release.countDown();
    assertEquals(Integer.valueOf(1), first.get(10, TimeUnit.SECONDS));
    assertEquals(Integer.valueOf(2), worker.submit("third", () -> 2).get(10, TimeUnit.SECONDS));
  }

  @Test
  public void testCancelledJobFreesTheWorker() throws Exception {
    CountDownLatch started = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    Future<Integer> blocked = worker.submit("blocking", () -> {
      started.countDown();
      release.await();
      return 1;
    });
    assertTrue(started.await(10, TimeUnit.SECONDS));
    assertTrue(blocked.cancel(true));
    assertTrue(blocked.isCancelled());
    assertFalse(worker.isBusy());

    assertEquals(Integer.valueOf(3), worker.submit("after cancel", () -> 3).get(10, TimeUnit.SECONDS));
    assertFalse(worker.isBusy());
  }

  @Test
  public void testJobFailureReachesTheFuture() throws Exception {
    Future<Object> result = worker.submit("broken", () -> {
      throw new IOException("disk gone");
    });
    try {
      result.get(10, TimeUnit.SECONDS);
      fail("Expected the job's exception");
    } catch (ExecutionException e) {
      assertTrue(e.getCause() instanceof IOException);
    }
    assertFalse(worker.isBusy());
  }

  @Test
  public void testFitsSessionInBackground() throws Exception {
    Session session = new Session(new FittingConfiguration());
    session.load(new SyntheticSpectra(18.0, 22.0, 0.01)
        .peak(500.0, 20.0, 0.2)
        .background(100.0, 0.0)
        .build("single"));
    assertEquals(1, session.autoDetect().size());

    FitReport report = worker.submitFit(session, GroupFitListener.NONE).get(30, TimeUnit.SECONDS);
    assertEquals(1, report.validCount());
    assertEquals(report, session.getReport());
  }
}
