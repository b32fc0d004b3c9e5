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

package com.twentyn.rubypressure.calibration;

import com.twentyn.rubypressure.uncertainty.UncertainValue;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class CalibratedPressureModelTest {
  private static final UncertainValue HOT = UncertainValue.exact(400.0);

  @Test
  public void testCorrectionShiftsPosition() throws Exception {
    PressureModel corrected = new CalibratedPressureModel(PressureCalibration.MAO, TemperatureCorrection.VOS_R1);
    PressureModel uncorrected = new CalibratedPressureModel(PressureCalibration.MAO, TemperatureCorrection.NONE);
    UncertainValue position = UncertainValue.exact(700.0);
    double shift = TemperatureCorrection.VOS_R1.correction(HOT).getNominal();
    assertEquals("Hot lines are shifted back before translation",
        uncorrected.translate(position.plus(shift), HOT).getNominal(),
        corrected.translate(position, HOT).getNominal(), 1e-9);
    assertTrue("Heating alone reads as less pressure",
        corrected.translate(position, HOT).getNominal() < uncorrected.translate(position, HOT).getNominal());
  }

  @Test
  public void testZeroPressureAtCorrectedReference() throws Exception {
    for (PressureCalibration calibration : PressureCalibration.values()) {
      for (TemperatureCorrection correction : TemperatureCorrection.values()) {
        PressureModel model = new CalibratedPressureModel(calibration, correction);
        double pressure = model.translate(UncertainValue.exact(model.referencePosition(HOT).getNominal()), HOT)
            .getNominal();
        assertEquals(model.getName(), 0.0, pressure, 1e-9);
      }
    }
  }

  @Test
  public void testWeiIgnoresCorrection() throws Exception {
    PressureModel plain = new CalibratedPressureModel(PressureCalibration.WEI, TemperatureCorrection.NONE);
    PressureModel corrected = new CalibratedPressureModel(PressureCalibration.WEI, TemperatureCorrection.RAGAN_R1);
    UncertainValue position = UncertainValue.exact(700.0);
    assertEquals(plain.translate(position, HOT).getNominal(), corrected.translate(position, HOT).getNominal(), 0.0);
    assertEquals("Named after the calibration only", "Wei", corrected.getName());
  }

  @Test
  public void testName() throws Exception {
    assertEquals("Mao, Vos R1",
        new CalibratedPressureModel(PressureCalibration.MAO, TemperatureCorrection.VOS_R1).getName());
  }
}
