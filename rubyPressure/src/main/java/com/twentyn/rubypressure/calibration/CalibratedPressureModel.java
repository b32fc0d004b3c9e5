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

/**
 * A {@link PressureCalibration} applied to positions adjusted by a {@link TemperatureCorrection}.  Calibrations that
 * model the temperature dependence themselves receive the position unadjusted.
 */
public class CalibratedPressureModel implements PressureModel {
  private final PressureCalibration calibration;
  private final TemperatureCorrection correction;

  public CalibratedPressureModel(PressureCalibration calibration, TemperatureCorrection correction) {
    this.calibration = calibration;
    this.correction = correction;
  }

  public PressureCalibration getCalibration() {
    return calibration;
  }

  public TemperatureCorrection getCorrection() {
    return correction;
  }

  @Override
  public String getName() {
    return calibration.isTemperatureDependent() ?
        calibration.getName() : String.format("%s, %s", calibration.getName(), correction.getName());
  }

  UncertainValue temperatureCorrection(UncertainValue temperature) {
    return calibration.isTemperatureDependent() ? UncertainValue.ZERO : correction.correction(temperature);
  }

  @Override
  public UncertainValue translate(UncertainValue position, UncertainValue temperature) {
    return calibration.pressure(position.plus(temperatureCorrection(temperature)), temperature);
  }

  @Override
  public UncertainValue referencePosition(UncertainValue temperature) {
    return calibration.referencePosition(temperature).minus(temperatureCorrection(temperature));
  }

  @Override
  public String toString() {
    return getName();
  }
}
