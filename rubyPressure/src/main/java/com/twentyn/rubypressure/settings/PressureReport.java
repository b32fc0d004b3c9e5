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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.twentyn.rubypressure.uncertainty.UncertainValue;

import java.io.File;
import java.io.IOException;

/**
 * The outcome of one pressure calculation in a form that serializes to JSON.  Values with uncertainty are written
 * as nominal value and standard deviation.
 */
public class PressureReport {
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  public static class Measurement {
    @JsonProperty("value")
    private double value;

    @JsonProperty("std_dev")
    private double stdDev;

    // For Jackson.
    private Measurement() {
    }

    public Measurement(UncertainValue value) {
      this.value = value.getNominal();
      this.stdDev = value.getStdDev();
    }

    public double getValue() {
      return value;
    }

    public double getStdDev() {
      return stdDev;
    }
  }

  @JsonProperty("source")
  private String source;

  @JsonProperty("settings")
  private CalculatorSettings settings;

  @JsonProperty("r1")
  private Measurement r1;

  @JsonProperty("r2")
  private Measurement r2;

  @JsonProperty("offset")
  private Measurement offset;

  @JsonProperty("temperature")
  private Measurement temperature;

  @JsonProperty("pressure")
  private Measurement pressure;

  // For Jackson.
  private PressureReport() {
  }

  /**
   * @param r2 may be null when the position was entered by hand
   */
  public PressureReport(String source, CalculatorSettings settings, UncertainValue r1, UncertainValue r2,
                        UncertainValue offset, UncertainValue temperature, UncertainValue pressure) {
    this.source = source;
    this.settings = settings;
    this.r1 = new Measurement(r1);
    this.r2 = r2 == null ? null : new Measurement(r2);
    this.offset = new Measurement(offset);
    this.temperature = new Measurement(temperature);
    this.pressure = new Measurement(pressure);
  }

  public String getSource() {
    return source;
  }

  public CalculatorSettings getSettings() {
    return settings;
  }

  public Measurement getR1() {
    return r1;
  }

  public Measurement getR2() {
    return r2;
  }

  public Measurement getOffset() {
    return offset;
  }

  public Measurement getTemperature() {
    return temperature;
  }

  public Measurement getPressure() {
    return pressure;
  }

  public void write(File file) throws IOException {
    OBJECT_MAPPER.writeValue(file, this);
  }

  public String toJson() throws IOException {
    return OBJECT_MAPPER.writeValueAsString(this);
  }

  public static PressureReport read(File file) throws IOException {
    return OBJECT_MAPPER.readValue(file, PressureReport.class);
  }
}
