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

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Runs external helper programs (gnuplot) and forwards their output to the log.
 */
public class ProcessRunner {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ProcessRunner.class);

  public static final int TIMED_OUT = -1;

  /**
   * Runs a child process, killing it if it has not finished after the timeout.
   * @param command The executable; never a shell string.
   * @param args Its arguments.
   * @param workingDir Directory to run in, or null for the current one.
   * @param timeoutInSeconds Upper bound on the run time.
   * @return The exit code of the child, or {@link #TIMED_OUT}.
   * @throws IOException if the executable cannot be started.
   */
  public int run(String command, List<String> args, File workingDir, long timeoutInSeconds)
      throws IOException, InterruptedException {
    List<String> commandAndArgs = new ArrayList<>(args.size() + 1);
    commandAndArgs.add(command);
    commandAndArgs.addAll(args);
    LOGGER.info("Running child process: %s", StringUtils.join(commandAndArgs, " "));

    Process p = new ProcessBuilder(commandAndArgs).directory(workingDir).redirectErrorStream(true).start();
    Thread drain = new Thread(() -> forwardLines(p.getInputStream(), l -> LOGGER.info("[%s]: %s", command, l)),
        command + "-output");
    drain.setDaemon(true);
    drain.start();

    if (!p.waitFor(timeoutInSeconds, TimeUnit.SECONDS)) {
      LOGGER.error("Child process %s did not finish within %d seconds, killing it", command, timeoutInSeconds);
      p.destroyForcibly();
      return TIMED_OUT;
    }
    drain.join(TimeUnit.SECONDS.toMillis(1));

    if (p.exitValue() != 0) {
      LOGGER.error("Child process %s exited with non-zero status code: %d", command, p.exitValue());
    }
    return p.exitValue();
  }

  private static void forwardLines(InputStream stream, Consumer<String> consumer) {
    try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
      reader.lines().forEach(consumer);
    } catch (IOException e) {
      LOGGER.warn("Lost child process output: %s", e.getMessage());
    }
  }
}
