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
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Parses two-column text spectra into a {@link Spectrum}, sorted by wavelength and cut down to a wavelength range.
 */
public class SpectrumReader {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SpectrumReader.class);

  private static final String SEPARATORS = "[\\s,;]+";

  private final SpectrumFormat format;
  private final IntervalSet limits;

  public SpectrumReader(SpectrumFormat format, IntervalSet limits) {
    this.format = format;
    this.limits = limits;
  }

  public SpectrumFormat getFormat() {
    return format;
  }

  public IntervalSet getLimits() {
    return limits;
  }

  public Spectrum read(File file) throws IOException {
    LOGGER.info("Reading %s spectrum from %s", format.getName(), file.getAbsolutePath());
    try (InputStream in = new FileInputStream(file)) {
      return read(new InputStreamReader(in, StandardCharsets.UTF_8), file.getName());
    }
  }

  /**
   * @param source a name for the input, used in messages only
   * @throws IOException if reading fails, or a line of a raw spectrum is not two numbers
   */
  public Spectrum read(Reader reader, String source) throws IOException {
    List<Pair<Double, Double>> points = new ArrayList<>();
    BufferedReader lines = new BufferedReader(reader);
    String line;
    int lineNumber = 0;
    int skipped = 0;
    while ((line = lines.readLine()) != null) {
      lineNumber++;
      if (StringUtils.isBlank(line)) {
        continue;
      }
      Pair<Double, Double> point = parseLine(line);
      if (point == null) {
        if (!format.skipsUnparsableLines()) {
          throw new IOException(String.format(
              "Line %d of %s is not a pair of numbers: '%s'", lineNumber, source, line.trim()));
        }
        LOGGER.debug("Skipping line %d of %s: '%s'", lineNumber, source, line.trim());
        skipped++;
        continue;
      }
      if (limits.contains(point.getLeft())) {
        points.add(point);
      }
    }
    if (skipped > 0) {
      LOGGER.warn("Skipped %d non-numeric lines of %s", skipped, source);
    }

    points.sort(Comparator.comparingDouble(Pair::getLeft));
    double[] x = new double[points.size()], y = new double[points.size()];
    for (int i = 0; i < points.size(); i++) {
      x[i] = points.get(i).getLeft();
      y[i] = points.get(i).getRight();
    }
    LOGGER.info("Read %d samples within %s from %s", x.length, limits, source);
    return new Spectrum(x, y);
  }

  private static Pair<Double, Double> parseLine(String line) {
    String[] fields = line.trim().split(SEPARATORS);
    if (fields.length != 2) {
      return null;
    }
    try {
      double x = Double.parseDouble(fields[0]);
      double y = Double.parseDouble(fields[1]);
      if (Double.isNaN(x) || Double.isNaN(y)) {
        return null;
      }
      return Pair.of(x, y);
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
