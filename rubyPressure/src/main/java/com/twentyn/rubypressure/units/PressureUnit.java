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
 * Pressure units.  Calculations are done in GPa.
 */
public enum PressureUnit {
  GPA("GPa", 1.0),
  KBAR("kbar", 10.0);

  private final String symbol;
  private final double perGigapascal;

  PressureUnit(String symbol, double perGigapascal) {
    this.symbol = symbol;
    this.perGigapascal = perGigapascal;
  }

  public String getSymbol() {
    return symbol;
  }

  public UncertainValue toGigapascal(UncertainValue value) {
    return value.dividedBy(perGigapascal);
  }

  public UncertainValue fromGigapascal(UncertainValue gigapascal) {
    return gigapascal.times(perGigapascal);
  }

  public static PressureUnit fromSymbol(String symbol) {
    List<String> symbols = new ArrayList<>();
    for (PressureUnit unit : values()) {
      if (unit.symbol.equalsIgnoreCase(symbol)) {
        return unit;
      }
      symbols.add(unit.symbol);
    }
    throw new IllegalArgumentException(String.format(
        "Unknown pressure unit '%s', expected one of %s", symbol, symbols));
  }
}
