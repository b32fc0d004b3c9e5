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

package com.twentyn.rubypressure;

import com.twentyn.rubypressure.calibration.RubyConstants;
import com.twentyn.rubypressure.fitting.PeakFit;
import com.twentyn.rubypressure.settings.CalculatorSettings;
import com.twentyn.rubypressure.settings.PressureReport;
import com.twentyn.rubypressure.uncertainty.UncertainValue;
import com.twentyn.rubypressure.units.PressureUnit;
import com.twentyn.rubypressure.units.TemperatureUnit;
import com.twentyn.rubypressure.units.WavelengthUnit;
import com.twentyn.rubypressure.utils.CLIUtil;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Computes the pressure in a diamond anvil cell from a ruby fluorescence spectrum or a hand-read R1 position.
 */
public class RubyPressureAnalyzer {
  private static final Logger LOGGER = LogManager.getFormatterLogger(RubyPressureAnalyzer.class);

  private static final String OPTION_SPECTRUM = "f";
  private static final String OPTION_POSITION = "r";
  private static final String OPTION_TEMPERATURE = "t";
  private static final String OPTION_TEMPERATURE_UNIT = "u";
  private static final String OPTION_REFERENCE_POSITION = "R";
  private static final String OPTION_REFERENCE_TEMPERATURE = "T";
  private static final String OPTION_REFERENCE_PRESSURE = "P";
  private static final String OPTION_SETTINGS = "s";
  private static final String OPTION_READING = "reading";
  private static final String OPTION_BACKFITTING = "backfitting";
  private static final String OPTION_PEAKFITTING = "peakfitting";
  private static final String OPTION_CORRECTING = "correcting";
  private static final String OPTION_TRANSLATING = "translating";
  private static final String OPTION_PRESSURE_UNIT = "p";
  private static final String OPTION_WAVELENGTH_UNIT = "w";
  private static final String OPTION_OUTPUT = "o";

  private static final String DEFAULT_TEMPERATURE = "298.15";
  private static final String DEFAULT_TEMPERATURE_UNIT = TemperatureUnit.KELVIN.getSymbol();
  private static final String DEFAULT_PRESSURE_UNIT = PressureUnit.GPA.getSymbol();
  private static final String DEFAULT_WAVELENGTH_UNIT = WavelengthUnit.NANOMETER.getSymbol();

  public static final String HELP_MESSAGE = StringUtils.join(new String[]{
      "Fits the R1 and R2 lines of a ruby fluorescence spectrum and converts the R1 position to pressure. ",
      "Instead of a spectrum an R1 position may be given directly. Values may carry an uncertainty, e.g. 694.5+/-0.02. ",
      "When a reference R1 position is given, the offset between it and the calibration's expectation for the ",
      "reference pressure and temperature is subtracted from every position."
  }, "");

  public static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {{
    add(Option.builder(OPTION_SPECTRUM)
        .argName("file")
        .desc("A two-column text file with the spectrum to fit")
        .hasArg()
        .longOpt("spectrum")
    );
    add(Option.builder(OPTION_POSITION)
        .argName("position")
        .desc("An R1 position to use instead of fitting a spectrum")
        .hasArg()
        .longOpt("r1")
    );
    add(Option.builder(OPTION_TEMPERATURE)
        .argName("temperature")
        .desc(String.format("The sample temperature (default: %s)", DEFAULT_TEMPERATURE))
        .hasArg()
        .longOpt("temperature")
    );
    add(Option.builder(OPTION_TEMPERATURE_UNIT)
        .argName("K|C|F")
        .desc(String.format("The unit of all temperatures (default: %s)", DEFAULT_TEMPERATURE_UNIT))
        .hasArg()
        .longOpt("temperature-unit")
    );
    add(Option.builder(OPTION_REFERENCE_POSITION)
        .argName("position")
        .desc("The R1 position of a reference ruby at the reference pressure")
        .hasArg()
        .longOpt("reference-r1")
    );
    add(Option.builder(OPTION_REFERENCE_TEMPERATURE)
        .argName("temperature")
        .desc("The temperature of the reference ruby (default: the sample temperature)")
        .hasArg()
        .longOpt("reference-temperature")
    );
    add(Option.builder(OPTION_REFERENCE_PRESSURE)
        .argName("GPa")
        .desc(String.format("The pressure on the reference ruby (default: %s)", RubyConstants.P_0))
        .hasArg()
        .longOpt("reference-pressure")
    );
    add(Option.builder(OPTION_SETTINGS)
        .argName("file")
        .desc("A JSON file with calculator settings")
        .hasArg()
        .longOpt("settings")
    );
    add(Option.builder()
        .argName("name")
        .desc("The spectrum file format, overriding the settings file")
        .hasArg()
        .longOpt(OPTION_READING)
    );
    add(Option.builder()
        .argName("name")
        .desc("The background fitting strategy, overriding the settings file")
        .hasArg()
        .longOpt(OPTION_BACKFITTING)
    );
    add(Option.builder()
        .argName("name")
        .desc("The peak shape to fit, overriding the settings file")
        .hasArg()
        .longOpt(OPTION_PEAKFITTING)
    );
    add(Option.builder()
        .argName("name")
        .desc("The temperature correction, overriding the settings file")
        .hasArg()
        .longOpt(OPTION_CORRECTING)
    );
    add(Option.builder()
        .argName("name")
        .desc("The pressure calibration, overriding the settings file")
        .hasArg()
        .longOpt(OPTION_TRANSLATING)
    );
    add(Option.builder(OPTION_PRESSURE_UNIT)
        .argName("GPa|kbar")
        .desc(String.format("The unit pressures are printed in (default: %s)", DEFAULT_PRESSURE_UNIT))
        .hasArg()
        .longOpt("pressure-unit")
    );
    add(Option.builder(OPTION_WAVELENGTH_UNIT)
        .argName("nm|cm-1")
        .desc(String.format("The unit of R1 positions given on the command line (default: %s)",
            DEFAULT_WAVELENGTH_UNIT))
        .hasArg()
        .longOpt("wavelength-unit")
    );
    add(Option.builder(OPTION_OUTPUT)
        .argName("file")
        .desc("Write a JSON report of the calculation to this file")
        .hasArg()
        .longOpt("output")
    );
  }};

  static final CLIUtil CLI_UTIL = new CLIUtil(RubyPressureAnalyzer.class, HELP_MESSAGE, OPTION_BUILDERS);

  static CalculatorSettings settingsFrom(CommandLine cl) throws IOException {
    CalculatorSettings settings = cl.hasOption(OPTION_SETTINGS) ?
        CalculatorSettings.load(new File(cl.getOptionValue(OPTION_SETTINGS))) : new CalculatorSettings();
    if (cl.hasOption(OPTION_READING)) {
      settings.setReading(cl.getOptionValue(OPTION_READING));
    }
    if (cl.hasOption(OPTION_BACKFITTING)) {
      settings.setBackfitting(cl.getOptionValue(OPTION_BACKFITTING));
    }
    if (cl.hasOption(OPTION_PEAKFITTING)) {
      settings.setPeakfitting(cl.getOptionValue(OPTION_PEAKFITTING));
    }
    if (cl.hasOption(OPTION_CORRECTING)) {
      settings.setCorrecting(cl.getOptionValue(OPTION_CORRECTING));
    }
    if (cl.hasOption(OPTION_TRANSLATING)) {
      settings.setTranslating(cl.getOptionValue(OPTION_TRANSLATING));
    }
    return settings;
  }

  public static void main(String[] args) throws Exception {
    CommandLine cl = CLI_UTIL.parseCommandLine(args);

    if (cl.hasOption(OPTION_SPECTRUM) == cl.hasOption(OPTION_POSITION)) {
      CLI_UTIL.failWithMessage("Exactly one of a spectrum file or an R1 position must be given");
    }

    PressureCalculator calculator = null;
    TemperatureUnit temperatureUnit = null;
    PressureUnit pressureUnit = null;
    WavelengthUnit wavelengthUnit = null;
    UncertainValue temperature = null;
    try {
      calculator = new PressureCalculator(settingsFrom(cl));
      temperatureUnit = TemperatureUnit.fromSymbol(cl.getOptionValue(OPTION_TEMPERATURE_UNIT, DEFAULT_TEMPERATURE_UNIT));
      pressureUnit = PressureUnit.fromSymbol(cl.getOptionValue(OPTION_PRESSURE_UNIT, DEFAULT_PRESSURE_UNIT));
      wavelengthUnit = WavelengthUnit.fromSymbol(cl.getOptionValue(OPTION_WAVELENGTH_UNIT, DEFAULT_WAVELENGTH_UNIT));
      temperature =
          temperatureUnit.toKelvin(UncertainValue.parse(cl.getOptionValue(OPTION_TEMPERATURE, DEFAULT_TEMPERATURE)));
    } catch (IllegalArgumentException | IOException e) {
      // Also catches NumberFormatException from malformed values.
      CLI_UTIL.failWithMessage("Invalid settings: %s", e.getMessage());
    }

    try {
      if (cl.hasOption(OPTION_REFERENCE_POSITION)) {
        calculator.setCurrentPosition(
            wavelengthUnit.toNanometer(UncertainValue.parse(cl.getOptionValue(OPTION_REFERENCE_POSITION))));
        calculator.setCurrentTemperature(cl.hasOption(OPTION_REFERENCE_TEMPERATURE) ?
            temperatureUnit.toKelvin(UncertainValue.parse(cl.getOptionValue(OPTION_REFERENCE_TEMPERATURE))) :
            temperature);
        calculator.setCurrentPressure(cl.hasOption(OPTION_REFERENCE_PRESSURE) ?
            UncertainValue.parse(cl.getOptionValue(OPTION_REFERENCE_PRESSURE)) : RubyConstants.P_0);
        calculator.setCurrentAsReference();
        calculator.calculateOffsetFromReference();
      }

      String source;
      UncertainValue r2 = null;
      if (cl.hasOption(OPTION_SPECTRUM)) {
        File spectrumFile = new File(cl.getOptionValue(OPTION_SPECTRUM));
        PeakFit fit = calculator.readAndFit(spectrumFile);
        r2 = fit.getR2().getPosition();
        source = spectrumFile.getPath();
      } else {
        calculator.setCurrentPosition(
            wavelengthUnit.toNanometer(UncertainValue.parse(cl.getOptionValue(OPTION_POSITION))));
        source = "manual";
      }
      calculator.setCurrentTemperature(temperature);
      UncertainValue pressure = calculator.calculatePressure();

      System.out.format("R1:          %s nm%n", calculator.getCurrent().getPosition());
      if (r2 != null) {
        System.out.format("R2:          %s nm%n", r2);
      }
      System.out.format("Offset:      %s nm%n", calculator.getOffset());
      System.out.format("Temperature: %s %s%n", temperatureUnit.fromKelvin(temperature), temperatureUnit.getSymbol());
      System.out.format("Pressure:    %s %s (%s)%n",
          pressureUnit.fromGigapascal(pressure), pressureUnit.getSymbol(), calculator.getPressureModel().getName());

      if (cl.hasOption(OPTION_OUTPUT)) {
        PressureReport report = new PressureReport(source, calculator.getSettings(),
            calculator.getCurrent().getPosition(), r2, calculator.getOffset(), temperature, pressure);
        File outputFile = new File(cl.getOptionValue(OPTION_OUTPUT));
        report.write(outputFile);
        LOGGER.info("Wrote report to %s", outputFile.getAbsolutePath());
      }
    } catch (RubyPressureException e) {
      LOGGER.error("Pressure calculation failed in %s with %s: %s", e.getStage(), e.getStrategy(), e.getMessage());
      System.exit(2);
    } catch (IOException e) {
      LOGGER.error("Unable to read or write a file: %s", e.getMessage());
      System.exit(2);
    } catch (NumberFormatException e) {
      CLI_UTIL.failWithMessage("Invalid number: %s", e.getMessage());
    }
  }
}
