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

package com.twentyn.rubypressure.settings;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.twentyn.rubypressure.calibration.PressureCalibration;
import com.twentyn.rubypressure.calibration.TemperatureCorrection;
import com.twentyn.rubypressure.fitting.FocusPolicy;
import com.twentyn.rubypressure.fitting.PeakShape;
import com.twentyn.rubypressure.spectrum.SpectrumFormat;
import com.twentyn.rubypressure.subset.IntervalSet;

import java.io.File;
import java.io.IOException;

/**
 * Strategy names and numeric options of a pressure calculator, as read from a JSON settings file.  Fields missing
 * from the file keep their defaults; unknown fields are an error.
 *
 * Example:
 * <pre>
 * {
 *   "reading": "Raw txt",
 *   "backfitting": "Linear Satelite",
 *   "peakfitting": "Camel",
 *   "correcting": "Ragan average",
 *   "translating": "Mao",
 *   "background_degree": 1,
 *   "min_wavelength": 690.0,
 *   "max_wavelength": 705.0
 * }
 * </pre>
 */
public class CalculatorSettings {
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
      .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  public static final String DEFAULT_READING = SpectrumFormat.METADATA_TXT.getName();
  public static final String DEFAULT_BACKFITTING = FocusPolicy.LINEAR_HUBER.getName();
  public static final String DEFAULT_PEAKFITTING = PeakShape.GAUSSIAN.getName();
  public static final String DEFAULT_CORRECTING = TemperatureCorrection.VOS_R1.getName();
  public static final String DEFAULT_TRANSLATING = PressureCalibration.RUBY2020.getName();
  public static final double DEFAULT_MIN_WAVELENGTH = 690.0;
  public static final double DEFAULT_MAX_WAVELENGTH = 705.0;

  @JsonProperty("reading")
  private String reading = DEFAULT_READING;

  @JsonProperty("backfitting")
  private String backfitting = DEFAULT_BACKFITTING;

  @JsonProperty("peakfitting")
  private String peakfitting = DEFAULT_PEAKFITTING;

  @JsonProperty("correcting")
  private String correcting = DEFAULT_CORRECTING;

  @JsonProperty("translating")
  private String translating = DEFAULT_TRANSLATING;

  @JsonProperty("background_degree")
  private int backgroundDegree = 1;

  @JsonProperty("min_wavelength")
  private double minWavelength = DEFAULT_MIN_WAVELENGTH;

  @JsonProperty("max_wavelength")
  private double maxWavelength = DEFAULT_MAX_WAVELENGTH;

  public CalculatorSettings() {
  }

  public static CalculatorSettings load(File file) throws IOException {
    return OBJECT_MAPPER.readValue(file, CalculatorSettings.class);
  }

  public static CalculatorSettings parse(String json) throws IOException {
    return OBJECT_MAPPER.readValue(json, CalculatorSettings.class);
  }

  public String getReading() {
    return reading;
  }

  public void setReading(String reading) {
    this.reading = reading;
  }

  public String getBackfitting() {
    return backfitting;
  }

  public void setBackfitting(String backfitting) {
    this.backfitting = backfitting;
  }

  public String getPeakfitting() {
    return peakfitting;
  }

  public void setPeakfitting(String peakfitting) {
    this.peakfitting = peakfitting;
  }

  public String getCorrecting() {
    return correcting;
  }

  public void setCorrecting(String correcting) {
    this.correcting = correcting;
  }

  public String getTranslating() {
    return translating;
  }

  public void setTranslating(String translating) {
    this.translating = translating;
  }

  public int getBackgroundDegree() {
    return backgroundDegree;
  }

  public void setBackgroundDegree(int backgroundDegree) {
    this.backgroundDegree = backgroundDegree;
  }

  public double getMinWavelength() {
    return minWavelength;
  }

  public void setMinWavelength(double minWavelength) {
    this.minWavelength = minWavelength;
  }

  public double getMaxWavelength() {
    return maxWavelength;
  }

  public void setMaxWavelength(double maxWavelength) {
    this.maxWavelength = maxWavelength;
  }

  // Resolution of the names into strategies; each throws IllegalArgumentException on an unknown name.

  public SpectrumFormat resolveReading() {
    return SpectrumFormat.fromName(reading);
  }

  public FocusPolicy resolveBackfitting() {
    return FocusPolicy.fromName(backfitting);
  }

  public PeakShape resolvePeakfitting() {
    return PeakShape.fromName(peakfitting);
  }

  public TemperatureCorrection resolveCorrecting() {
    return TemperatureCorrection.fromName(correcting);
  }

  public PressureCalibration resolveTranslating() {
    return PressureCalibration.fromName(translating);
  }

  /**
   * @throws com.twentyn.rubypressure.subset.InvalidBoundsException if the minimum exceeds the maximum
   */
  public IntervalSet resolveLimits() {
    return IntervalSet.of(minWavelength, maxWavelength);
  }
}
