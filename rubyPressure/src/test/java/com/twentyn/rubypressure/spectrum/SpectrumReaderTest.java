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

package com.twentyn.rubypressure.spectrum;

import com.twentyn.rubypressure.subset.IntervalSet;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.StringReader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class SpectrumReaderTest {
  private static final IntervalSet LIMITS = IntervalSet.of(690.0, 705.0);

  @Rule
  public TemporaryFolder temporaryFolder = new TemporaryFolder();

  @Test
  public void testRawSpectrumIsSortedAndLimited() throws Exception {
    SpectrumReader reader = new SpectrumReader(SpectrumFormat.RAW_TXT, LIMITS);
    Spectrum spectrum = reader.read(new StringReader("691.0 1.5\n690.5\t2.5\n\n710.0 9.0\n689.0,3.0\n"), "raw");
    assertArrayEquals("Wavelengths sorted and limited", new double[]{690.5, 691.0}, spectrum.getX(), 0.0);
    assertArrayEquals("Intensities follow their wavelengths", new double[]{2.5, 1.5}, spectrum.getY(), 0.0);
  }

  @Test(expected = IOException.class)
  public void testRawSpectrumRejectsHeaders() throws Exception {
    new SpectrumReader(SpectrumFormat.RAW_TXT, LIMITS).read(new StringReader("Wavelength Intensity\n691 1\n"), "raw");
  }

  @Test
  public void testMetadataLinesAreSkipped() throws Exception {
    String text = "Data from spectrometer\nIntegration time (ms): 100\n>>>>>Begin Spectral Data<<<<<\n" +
        "694.1 10\n694.2 20\n694.3 15\n>>>>>End Spectral Data<<<<<\n";
    Spectrum spectrum = new SpectrumReader(SpectrumFormat.METADATA_TXT, LIMITS).read(new StringReader(text), "meta");
    assertEquals("Only numeric lines are read", 3, spectrum.size());
    assertEquals("Tallest sample", 20.0, spectrum.maxY(), 0.0);
  }

  @Test
  public void testReadFromFile() throws Exception {
    File file = temporaryFolder.newFile("spectrum.txt");
    try (Writer writer = new OutputStreamWriter(new FileOutputStream(file), StandardCharsets.UTF_8)) {
      writer.write("692.0 1.0\n693.0 2.0\n694.0 3.0\n");
    }
    Spectrum spectrum = new SpectrumReader(SpectrumFormat.RAW_TXT, LIMITS).read(file);
    assertEquals("All samples read", 3, spectrum.size());
    assertEquals("Focused on the whole domain", IntervalSet.of(692.0, 694.0), spectrum.getFocus());
  }

  @Test
  public void testFormatNames() throws Exception {
    assertEquals(SpectrumFormat.RAW_TXT, SpectrumFormat.fromName("Raw txt"));
    assertEquals(SpectrumFormat.METADATA_TXT, SpectrumFormat.fromName("metadata TXT"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownFormatName() throws Exception {
    SpectrumFormat.fromName("Binary");
  }
}
