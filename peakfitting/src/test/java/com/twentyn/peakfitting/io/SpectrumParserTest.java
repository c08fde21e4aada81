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
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.fail;

public class SpectrumParserTest {

  @Rule
  public TemporaryFolder tempFolder = new TemporaryFolder();

  private static InputStream text(String... lines) {
    return new ByteArrayInputStream(String.join("\n", lines).getBytes(StandardCharsets.ISO_8859_1));
  }

  @Test
  public void testParsesAllRowsInFileOrder() throws Exception {
    Spectrum s = new SpectrumParser().parse(text(
        "# 2theta intensity",
        "% exported by integration software",
        "",
        "10.00 100.0",
        "10.02\t105.5",
        "9.98, 99.0, 0.3",
        "; trailing comment",
        "10.04;110"
    ), "sample");

    assertEquals("sample", s.getName());
    assertArrayEquals(new double[]{10.00, 10.02, 9.98, 10.04}, s.getPositions(), 0.0);
    assertArrayEquals(new double[]{100.0, 105.5, 99.0, 110.0}, s.getIntensities(), 0.0);
  }

  @Test
  public void testRunsOfMixedDelimitersCountOnce() throws Exception {
    Spectrum s = new SpectrumParser().parse(text(
        "  10.00 ,\t100.0",
        "10.02 ; 105.5 ;",
        "10.04,,110"
    ), "runs");
    assertArrayEquals(new double[]{10.00, 10.02, 10.04}, s.getPositions(), 0.0);
    assertArrayEquals(new double[]{100.0, 105.5, 110.0}, s.getIntensities(), 0.0);
  }

  @Test
  public void testAcceptsScientificNotation() throws Exception {
    Spectrum s = new SpectrumParser().parse(text("1e1 2.5E3", "1.1e1 -3e-2", "12 0"), "sci");
    assertArrayEquals(new double[]{2500.0, -0.03, 0.0}, s.getIntensities(), 0.0);
  }

  @Test
  public void testBadNumberReportsLine() throws Exception {
    try {
      new SpectrumParser().parse(text("# header", "10.0 1.0", "10.1 abc", "10.2 3.0"), "bad");
      fail("Expected a load failure");
    } catch (SpectrumLoadException e) {
      assertEquals(Integer.valueOf(3), e.getLineNumber());
      assertEquals("bad", e.getFileName());
    }
  }

  @Test(expected = SpectrumLoadException.class)
  public void testSingleColumnIsRejected() throws Exception {
    new SpectrumParser().parse(text("10.0", "10.1", "10.2"), "one-column");
  }

  @Test(expected = SpectrumLoadException.class)
  public void testTooFewRowsAreRejected() throws Exception {
    new SpectrumParser().parse(text("10.0 1.0", "10.1 2.0"), "short");
  }

  @Test(expected = SpectrumLoadException.class)
  public void testNonFiniteValuesAreRejected() throws Exception {
    new SpectrumParser().parse(text("10.0 1.0", "10.1 NaN", "10.2 2.0"), "nan");
  }

  @Test(expected = SpectrumLoadException.class)
  public void testMissingFileIsRejected() throws Exception {
    new SpectrumParser().parse(new File(tempFolder.getRoot(), "missing.xy"));
  }

  @Test
  public void testFileNameWithoutExtensionBecomesSpectrumName() throws Exception {
    File f = tempFolder.newFile("run_042.xy");
    Files.write(f.toPath(), "1 2\n2 3\n3 4\n".getBytes(StandardCharsets.US_ASCII));
    Spectrum s = new SpectrumParser().parse(f);
    assertEquals("run_042", s.getName());
    assertNotNull(s.getSource());
    assertEquals(3, s.size());
  }
}
