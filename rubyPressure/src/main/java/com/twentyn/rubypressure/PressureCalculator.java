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

import com.twentyn.rubypressure.calibration.CalibratedPressureModel;
import com.twentyn.rubypressure.calibration.CalibrationPoint;
import com.twentyn.rubypressure.calibration.InversionNonconvergentException;
import com.twentyn.rubypressure.calibration.PressureInverter;
import com.twentyn.rubypressure.calibration.PressureModel;
import com.twentyn.rubypressure.fitting.BackgroundEstimator;
import com.twentyn.rubypressure.fitting.BackgroundFit;
import com.twentyn.rubypressure.fitting.FitConvergenceException;
import com.twentyn.rubypressure.fitting.InsufficientDataException;
import com.twentyn.rubypressure.fitting.PeakFit;
import com.twentyn.rubypressure.fitting.PeakLocator;
import com.twentyn.rubypressure.settings.CalculatorSettings;
import com.twentyn.rubypressure.spectrum.Spectrum;
import com.twentyn.rubypressure.spectrum.SpectrumReader;
import com.twentyn.rubypressure.subset.IntervalSet;
import com.twentyn.rubypressure.uncertainty.UncertainValue;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;

/**
 * One pressure calculation session: a pipeline of reading, background fitting, peak fitting, temperature correction
 * and calibration resolved from a {@link CalculatorSettings}, together with the spectra and fits produced so far and
 * the current and reference {@link CalibrationPoint}s.
 *
 * The pipeline has to be run in order: a spectrum must be loaded before its background is estimated, and the
 * background before the peaks are located.  Locating the peaks sets the current position; {@link #calculatePressure}
 * then turns the current position and temperature into the current pressure.  Positions may also be entered by hand
 * with {@link #setCurrentPosition}.
 *
 * Pressures are computed from the position minus an offset.  The offset is zero until
 * {@link #calculateOffsetFromReference} derives it from a reference measurement at a known pressure, usually a ruby
 * outside the cell at ambient pressure: the offset is then the difference between the position observed and the
 * position the calibration expects for that pressure and temperature.
 *
 * Instances are not thread safe, and share no state with each other.
 */
public class PressureCalculator {
  private static final Logger LOGGER = LogManager.getFormatterLogger(PressureCalculator.class);

  private final CalculatorSettings settings;
  private final IntervalSet limits;
  private final SpectrumReader reader;
  private final BackgroundEstimator backgroundEstimator;
  private final PeakLocator peakLocator;
  private final PressureModel pressureModel;
  private final PressureInverter inverter;

  private Spectrum rawSpectrum;
  private BackgroundFit backgroundFit;
  private PeakFit peakFit;
  private CalibrationPoint current = new CalibrationPoint();
  private CalibrationPoint reference = new CalibrationPoint();
  private UncertainValue offset = UncertainValue.ZERO;

  public PressureCalculator() {
    this(new CalculatorSettings());
  }

  /**
   * @throws IllegalArgumentException if a strategy name is unknown or the wavelength limits are inverted
   */
  public PressureCalculator(CalculatorSettings settings) {
    this(settings, new CalibratedPressureModel(settings.resolveTranslating(), settings.resolveCorrecting()));
  }

  public PressureCalculator(CalculatorSettings settings, PressureModel pressureModel) {
    this.settings = settings;
    this.limits = settings.resolveLimits();
    this.reader = new SpectrumReader(settings.resolveReading(), limits);
    this.backgroundEstimator = new BackgroundEstimator(settings.resolveBackfitting(), settings.getBackgroundDegree());
    this.peakLocator = new PeakLocator(settings.resolvePeakfitting());
    this.pressureModel = pressureModel;
    this.inverter = new PressureInverter(pressureModel);
    LOGGER.debug("Calculator set up with %s background, %s peaks and %s",
        settings.getBackfitting(), settings.getPeakfitting(), pressureModel.getName());
  }

  public CalculatorSettings getSettings() {
    return settings;
  }

  public PressureModel getPressureModel() {
    return pressureModel;
  }

  /**
   * Takes already parsed samples as the raw spectrum, keeping those within the wavelength limits.
   */
  public Spectrum load(double[] x, double[] y) {
    rawSpectrum = new Spectrum(x, y).within(limits).focusOnWhole();
    backgroundFit = null;
    peakFit = null;
    LOGGER.debug("Loaded %d of %d samples within %s", rawSpectrum.size(), x.length, limits);
    return rawSpectrum;
  }

  public Spectrum read(File file) throws IOException {
    rawSpectrum = reader.read(file);
    backgroundFit = null;
    peakFit = null;
    return rawSpectrum;
  }

  public BackgroundFit estimateBackground() throws InsufficientDataException, FitConvergenceException {
    if (rawSpectrum == null) {
      throw new IllegalStateException("No spectrum has been loaded");
    }
    backgroundFit = backgroundEstimator.estimate(rawSpectrum);
    peakFit = null;
    return backgroundFit;
  }

  /**
   * Locates R1 and R2 on the background-free spectrum and makes R1 the current position.
   */
  public PeakFit locatePeaks() throws InsufficientDataException, FitConvergenceException {
    if (backgroundFit == null) {
      throw new IllegalStateException("The background has to be estimated before locating peaks");
    }
    peakFit = peakLocator.locate(backgroundFit.getSignal());
    current.setPosition(peakFit.getR1().getPosition());
    return peakFit;
  }

  public PeakFit readAndFit(File file) throws IOException, RubyPressureException {
    read(file);
    estimateBackground();
    return locatePeaks();
  }

  /**
   * Pressure of an R1 position observed at a temperature, after subtracting the current offset.
   */
  public UncertainValue translate(UncertainValue position, UncertainValue temperature) {
    return pressureModel.translate(position.minus(offset), temperature);
  }

  /**
   * The R1 position that would be observed at a pressure and temperature, including the current offset.
   */
  public UncertainValue invert(UncertainValue pressure, UncertainValue temperature)
      throws InversionNonconvergentException {
    return inverter.invert(pressure, temperature).plus(offset);
  }

  public UncertainValue calculatePressure() {
    UncertainValue pressure = translate(current.getPosition(), current.getTemperature());
    current.setPressure(pressure);
    LOGGER.info("R1 at %s nm and %s K: %s GPa (%s)",
        current.getPosition(), current.getTemperature(), pressure, pressureModel.getName());
    return pressure;
  }

  public UncertainValue calculatePositionFromPressure() throws InversionNonconvergentException {
    UncertainValue position = invert(current.getPressure(), current.getTemperature());
    current.setPosition(position);
    LOGGER.info("%s GPa at %s K: R1 at %s nm (%s)",
        current.getPressure(), current.getTemperature(), position, pressureModel.getName());
    return position;
  }

  public void setCurrentAsReference() {
    reference = new CalibrationPoint(current);
  }

  /**
   * Sets the offset to the reference position minus the position the calibration expects at the reference pressure
   * and temperature.
   */
  public UncertainValue calculateOffsetFromReference() throws InversionNonconvergentException {
    UncertainValue expected = inverter.invert(reference.getPressure(), reference.getTemperature());
    offset = reference.getPosition().minus(expected);
    LOGGER.info("Offset from reference %s: %s nm", reference, offset);
    return offset;
  }

  public void setCurrentPosition(UncertainValue position) {
    current.setPosition(position);
  }

  public void setCurrentTemperature(UncertainValue temperature) {
    current.setTemperature(temperature);
  }

  public void setCurrentPressure(UncertainValue pressure) {
    current.setPressure(pressure);
  }

  public CalibrationPoint getCurrent() {
    return current;
  }

  public CalibrationPoint getReference() {
    return reference;
  }

  public void setReference(CalibrationPoint reference) {
    this.reference = reference;
  }

  public UncertainValue getOffset() {
    return offset;
  }

  public void setOffset(UncertainValue offset) {
    this.offset = offset;
  }

  public Spectrum getRawSpectrum() {
    return rawSpectrum;
  }

  public BackgroundFit getBackgroundFit() {
    return backgroundFit;
  }

  public PeakFit getPeakFit() {
    return peakFit;
  }
}
