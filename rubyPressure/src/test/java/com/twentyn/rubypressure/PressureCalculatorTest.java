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

import com.twentyn.rubypressure.calibration.CalibrationPoint;
import com.twentyn.rubypressure.calibration.RubyConstants;
import com.twentyn.rubypressure.fitting.PeakFit;
import com.twentyn.rubypressure.settings.CalculatorSettings;
import com.twentyn.rubypressure.spectrum.Spectrum;
import com.twentyn.rubypressure.uncertainty.UncertainValue;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class PressureCalculatorTest {
  private static final UncertainValue AMBIENT = RubyConstants.T_0;

  @Rule
  public TemporaryFolder temporaryFolder = new TemporaryFolder();

  private double[] x;
  private double[] y;

  private static CalculatorSettings settings(String translating, String correcting) {
    CalculatorSettings settings = new CalculatorSettings();
    settings.setReading("Raw txt");
    settings.setBackfitting("Linear Huber");
    settings.setPeakfitting("Gaussian");
    settings.setTranslating(translating);
    settings.setCorrecting(correcting);
    return settings;
  }

  @Before
  public void setUp() throws Exception {
    x = SyntheticSpectra.grid(690.0, 700.0, SyntheticSpectra.STEP);
    y = SyntheticSpectra.doublet(x, 694.20, 1.0, 692.75, 0.6, SyntheticSpectra.SIGMA, 0.05, 0.002,
        SyntheticSpectra.NOISE, SyntheticSpectra.SEED);
  }

  @Test
  public void testAmbientSpectrumGivesNearZeroPressure() throws Exception {
    PressureCalculator calculator = new PressureCalculator(settings("Mao", "None"));
    calculator.load(x, y);
    calculator.estimateBackground();
    PeakFit fit = calculator.locatePeaks();
    assertEquals("R1", 694.20, fit.getR1().getPosition().getNominal(), 0.02);
    assertEquals("R2", 692.75, fit.getR2().getPosition().getNominal(), 0.02);
    assertEquals("R1 becomes the current position",
        fit.getR1().getPosition().getNominal(), calculator.getCurrent().getPosition().getNominal(), 0.0);

    UncertainValue pressure = calculator.calculatePressure();
    assertTrue("Near ambient pressure: " + pressure, Math.abs(pressure.getNominal()) < 0.3);
    assertTrue("Pressure carries an error", pressure.getStdDev() > 0.0);
    assertEquals("Stored on the current point", pressure, calculator.getCurrent().getPressure());
  }

  @Test
  public void testCalibrationsDiffer() throws Exception {
    // R1 shifted by about 4.8 nm, where the power law and the linear scale have drifted apart.
    double[] compressedX = SyntheticSpectra.grid(690.0, 705.0, SyntheticSpectra.STEP);
    double[] compressedY = SyntheticSpectra.doublet(compressedX, 699.0, 1.0, 697.5, 0.6, SyntheticSpectra.SIGMA,
        0.05, 0.002, SyntheticSpectra.NOISE, SyntheticSpectra.SEED);

    PressureCalculator mao = new PressureCalculator(settings("Mao", "None"));
    PressureCalculator piermarini = new PressureCalculator(settings("Piermarini", "None"));
    double[] pressures = new double[2];
    double[] positions = new double[2];
    PressureCalculator[] calculators = {mao, piermarini};
    for (int i = 0; i < calculators.length; i++) {
      calculators[i].load(compressedX, compressedY);
      calculators[i].estimateBackground();
      positions[i] = calculators[i].locatePeaks().getR1().getPosition().getNominal();
      pressures[i] = calculators[i].calculatePressure().getNominal();
    }

    assertEquals("Both fit the same R1", positions[0], positions[1], 1e-9);
    assertEquals("R1 found", 699.0, positions[0], 0.02);
    assertEquals("Mao", 13.357, pressures[0], 0.1);
    assertEquals("Piermarini", 13.042, pressures[1], 0.1);
    assertTrue(String.format("Mao %f should exceed Piermarini %f", pressures[0], pressures[1]),
        pressures[0] - pressures[1] > 0.2);
  }

  @Test
  public void testCorrectionsDifferWhenHot() throws Exception {
    PressureCalculator vos = new PressureCalculator(settings("Mao", "Vos R1"));
    PressureCalculator none = new PressureCalculator(settings("Mao", "None"));
    UncertainValue hot = UncertainValue.exact(400.0);
    double corrected = vos.translate(UncertainValue.exact(700.0), hot).getNominal();
    double uncorrected = none.translate(UncertainValue.exact(700.0), hot).getNominal();
    assertTrue(String.format("%f should be below %f", corrected, uncorrected), corrected < uncorrected - 1.0);
  }

  @Test
  public void testOffsetFromReference() throws Exception {
    PressureCalculator calculator = new PressureCalculator(settings("Mao", "None"));
    calculator.setCurrentPosition(UncertainValue.of(694.54, 0.01));
    calculator.setCurrentTemperature(AMBIENT);
    calculator.setCurrentPressure(RubyConstants.P_0);
    calculator.setCurrentAsReference();
    assertEquals("Reference is a copy", 694.54, calculator.getReference().getPosition().getNominal(), 0.0);

    UncertainValue offset = calculator.calculateOffsetFromReference();
    assertEquals("Offset from the ambient position", 0.30, offset.getNominal(), 1e-4);
    assertTrue("Offset carries the reference's error", offset.getStdDev() >= 0.01);

    calculator.setCurrentPosition(UncertainValue.exact(694.54));
    assertEquals("The reference itself reads as ambient", 0.0, calculator.calculatePressure().getNominal(), 1e-3);
  }

  @Test
  public void testReferenceAtPressure() throws Exception {
    PressureCalculator calculator = new PressureCalculator(settings("Piermarini", "None"));
    calculator.setReference(new CalibrationPoint(UncertainValue.exact(700.0), AMBIENT, UncertainValue.exact(10.0)));
    calculator.calculateOffsetFromReference();
    calculator.setCurrentPosition(UncertainValue.exact(700.0));
    calculator.setCurrentTemperature(AMBIENT);
    assertEquals(10.0, calculator.calculatePressure().getNominal(), 1e-3);
  }

  @Test
  public void testPositionFromPressureRoundTrip() throws Exception {
    PressureCalculator calculator = new PressureCalculator(settings("Ruby2020", "Ragan R1"));
    calculator.setOffset(UncertainValue.exact(0.1));
    calculator.setCurrentTemperature(UncertainValue.exact(350.0));
    calculator.setCurrentPressure(UncertainValue.exact(12.0));
    UncertainValue position = calculator.calculatePositionFromPressure();
    assertEquals("Position becomes current", position, calculator.getCurrent().getPosition());
    assertEquals("Round trip", 12.0, calculator.calculatePressure().getNominal(), 1e-3);
  }

  @Test(expected = IllegalStateException.class)
  public void testBackgroundNeedsSpectrum() throws Exception {
    new PressureCalculator(settings("Mao", "None")).estimateBackground();
  }

  @Test(expected = IllegalStateException.class)
  public void testPeaksNeedBackground() throws Exception {
    PressureCalculator calculator = new PressureCalculator(settings("Mao", "None"));
    calculator.load(x, y);
    calculator.locatePeaks();
  }

  @Test
  public void testLoadAppliesLimitsAndResetsFits() throws Exception {
    PressureCalculator calculator = new PressureCalculator(settings("Mao", "None"));
    double[] wide = SyntheticSpectra.grid(680.0, 710.0, 0.5);
    Spectrum loaded = calculator.load(wide, new double[wide.length]);
    assertEquals("Samples within 690-705 nm", 31, loaded.size());
    assertEquals(690.0, loaded.minX(), 1e-9);
    assertEquals(705.0, loaded.maxX(), 1e-9);

    calculator.load(x, y);
    assertNotNull(calculator.estimateBackground());
    calculator.load(x, y);
    assertNull("A new spectrum discards the old background", calculator.getBackgroundFit());
  }

  @Test
  public void testReadAndFit() throws Exception {
    File file = temporaryFolder.newFile("ruby.txt");
    try (PrintWriter writer = new PrintWriter(new OutputStreamWriter(new FileOutputStream(file), StandardCharsets.UTF_8))) {
      for (int i = 0; i < x.length; i++) {
        writer.format(Locale.ROOT, "%.4f\t%.6f%n", x[i], y[i]);
      }
    }
    PressureCalculator calculator = new PressureCalculator(settings("Mao", "None"));
    PeakFit fit = calculator.readAndFit(file);
    assertEquals("R1", 694.20, fit.getR1().getPosition().getNominal(), 0.02);
    assertEquals("Raw spectrum kept", x.length, calculator.getRawSpectrum().size());
    assertNotNull(calculator.getPeakFit());
  }

  @Test
  public void testDefaults() throws Exception {
    PressureCalculator calculator = new PressureCalculator();
    assertEquals("Ruby2020, Vos R1", calculator.getPressureModel().getName());
    assertEquals("No offset yet", 0.0, calculator.getOffset().getNominal(), 0.0);
    assertEquals(RubyConstants.R1_0, calculator.getCurrent().getPosition());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownStrategy() throws Exception {
    new PressureCalculator(settings("Nonexistent", "None"));
  }
}
