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
 * Units of a line position.  Calculations are done in nm; wavenumbers convert through 1e7 / value.
 */
public enum WavelengthUnit {
  NANOMETER("nm") {
    @Override
    public UncertainValue toNanometer(UncertainValue value) {
      return value;
    }

    @Override
    public UncertainValue fromNanometer(UncertainValue nanometer) {
      return nanometer;
    }
  },
  WAVENUMBER("cm-1") {
    @Override
    public UncertainValue toNanometer(UncertainValue value) {
      return value.reciprocal().times(NM_CM);
    }

    @Override
    public UncertainValue fromNanometer(UncertainValue nanometer) {
      return nanometer.reciprocal().times(NM_CM);
    }
  };

  private static final double NM_CM = 1e7;

  private final String symbol;

  WavelengthUnit(String symbol) {
    this.symbol = symbol;
  }

  public String getSymbol() {
    return symbol;
  }

  public abstract UncertainValue toNanometer(UncertainValue value);

  public abstract UncertainValue fromNanometer(UncertainValue nanometer);

  public static WavelengthUnit fromSymbol(String symbol) {
    List<String> symbols = new ArrayList<>();
    for (WavelengthUnit unit : values()) {
      if (unit.symbol.equalsIgnoreCase(symbol)) {
        return unit;
      }
      symbols.add(unit.symbol);
    }
    throw new IllegalArgumentException(String.format(
        "Unknown wavelength unit '%s', expected one of %s", symbol, symbols));
  }
}
