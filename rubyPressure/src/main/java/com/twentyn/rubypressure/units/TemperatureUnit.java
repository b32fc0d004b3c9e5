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

package com.twentyn.rubypressure.units;

import com.twentyn.rubypressure.uncertainty.UncertainValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Temperature scales a user may enter values in.  Calculations are done in kelvin.
 */
public enum TemperatureUnit {
  KELVIN("K", 1.0, 0.0),
  CELSIUS("C", 1.0, 273.15),
  FAHRENHEIT("F", 5.0 / 9.0, 273.15 - 32.0 * 5.0 / 9.0);

  private final String symbol;
  private final double scale;
  private final double offset;

  TemperatureUnit(String symbol, double scale, double offset) {
    this.symbol = symbol;
    this.scale = scale;
    this.offset = offset;
  }

  public String getSymbol() {
    return symbol;
  }

  public UncertainValue toKelvin(UncertainValue value) {
    return value.times(scale).plus(offset);
  }

  public UncertainValue fromKelvin(UncertainValue kelvin) {
    return kelvin.minus(offset).dividedBy(scale);
  }

  public static TemperatureUnit fromSymbol(String symbol) {
    List<String> symbols = new ArrayList<>();
    for (TemperatureUnit unit : values()) {
      if (unit.symbol.equalsIgnoreCase(symbol) || unit.name().equalsIgnoreCase(symbol)) {
        return unit;
      }
      symbols.add(unit.symbol);
    }
    throw new IllegalArgumentException(String.format(
        "Unknown temperature unit '%s', expected one of %s", symbol, symbols));
  }
}
