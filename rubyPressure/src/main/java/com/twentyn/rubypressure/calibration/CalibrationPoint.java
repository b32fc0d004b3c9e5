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
 * An R1 position together with the temperature and pressure it was observed at.  A calculator keeps one for the
 * current measurement and one for the reference measurement.
 */
public class CalibrationPoint {
  private UncertainValue position;
  private UncertainValue temperature;
  private UncertainValue pressure;

  public CalibrationPoint() {
    this(RubyConstants.R1_0, RubyConstants.T_0, RubyConstants.P_0);
  }

  public CalibrationPoint(UncertainValue position, UncertainValue temperature, UncertainValue pressure) {
    this.position = position;
    this.temperature = temperature;
    this.pressure = pressure;
  }

  public CalibrationPoint(CalibrationPoint other) {
    this(other.position, other.temperature, other.pressure);
  }

  public UncertainValue getPosition() {
    return position;
  }

  public void setPosition(UncertainValue position) {
    this.position = position;
  }

  public UncertainValue getTemperature() {
    return temperature;
  }

  public void setTemperature(UncertainValue temperature) {
    this.temperature = temperature;
  }

  public UncertainValue getPressure() {
    return pressure;
  }

  public void setPressure(UncertainValue pressure) {
    this.pressure = pressure;
  }

  @Override
  public String toString() {
    return String.format("CalibrationPoint{position=%s nm, temperature=%s K, pressure=%s GPa}",
        position, temperature, pressure);
  }
}
