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

import java.util.ArrayList;
import java.util.List;

/**
 * Temperature dependence of the unpressurized ruby lines.  The correction of a measured position is the line
 * position at {@link RubyConstants#T_0} minus the line position at the sample temperature; added to the measured
 * position it yields the position the line would have at ambient temperature.
 *
 * All temperatures are in kelvin, positions and corrections in nm.
 */
public enum TemperatureCorrection {
  NONE("None", 0, null) {
    @Override
    UncertainValue linePosition(UncertainValue temperature) {
      return UncertainValue.ZERO;
    }
  },
  VOS_R1("Vos R1", 1991, "https://doi.org/10.1063/1.348903") {
    @Override
    UncertainValue linePosition(UncertainValue temperature) {
      return vosShift(temperature, VOS_R1_COEFFICIENTS);
    }
  },
  VOS_R2("Vos R2", 1991, "https://doi.org/10.1063/1.348903") {
    @Override
    UncertainValue linePosition(UncertainValue temperature) {
      return vosShift(temperature, VOS_R2_COEFFICIENTS);
    }
  },
  VOS_AVERAGE("Vos average", 1991, "https://doi.org/10.1063/1.348903") {
    @Override
    UncertainValue linePosition(UncertainValue temperature) {
      return VOS_R1.linePosition(temperature).plus(VOS_R2.linePosition(temperature)).dividedBy(2.0);
    }
  },
  RAGAN_R1("Ragan R1", 1992, "https://doi.org/10.1063/1.351951") {
    @Override
    UncertainValue linePosition(UncertainValue temperature) {
      return raganPosition(temperature, RAGAN_R1_COEFFICIENTS);
    }
  },
  RAGAN_R2("Ragan R2", 1992, "https://doi.org/10.1063/1.351951") {
    @Override
    UncertainValue linePosition(UncertainValue temperature) {
      return raganPosition(temperature, RAGAN_R2_COEFFICIENTS);
    }
  },
  RAGAN_AVERAGE("Ragan average", 1992, "https://doi.org/10.1063/1.351951") {
    @Override
    UncertainValue linePosition(UncertainValue temperature) {
      return RAGAN_R1.linePosition(temperature).plus(RAGAN_R2.linePosition(temperature)).dividedBy(2.0);
    }
  };

  // Line shift in angstrom as a cubic in (T - 300 K).
  private static final double[] VOS_R1_COEFFICIENTS = {0.0, 6.591e-2, 7.624e-5, -1.733e-7};
  private static final double[] VOS_R2_COEFFICIENTS = {0.0, 6.554e-2, 8.670e-5, -1.099e-7};
  private static final double VOS_TEMPERATURE = 300.0;
  private static final double ANGSTROM_IN_NM = 0.1;

  // Line wavenumber in cm^-1 as a cubic in T.
  private static final double[] RAGAN_R1_COEFFICIENTS = {14423.0, 4.49e-2, -4.81e-4, 3.71e-7};
  private static final double[] RAGAN_R2_COEFFICIENTS = {14452.0, 3.00e-2, -3.88e-4, 2.55e-7};
  private static final double NM_CM = 1e7;

  private final String name;
  private final int year;
  private final String reference;

  TemperatureCorrection(String name, int year, String reference) {
    this.name = name;
    this.year = year;
    this.reference = reference;
  }

  public String getName() {
    return name;
  }

  /**
   * Publication year, or 0 for {@link #NONE}.
   */
  public int getYear() {
    return year;
  }

  /**
   * DOI link of the publication, or null for {@link #NONE}.
   */
  public String getReference() {
    return reference;
  }

  /**
   * Line position at the given temperature, up to a constant that cancels in {@link #correction}.
   */
  abstract UncertainValue linePosition(UncertainValue temperature);

  public UncertainValue correction(UncertainValue temperature) {
    return linePosition(RubyConstants.T_0).minus(linePosition(temperature));
  }

  static UncertainValue polynomial(UncertainValue variable, double[] coefficients) {
    UncertainValue result = UncertainValue.exact(coefficients[coefficients.length - 1]);
    for (int i = coefficients.length - 2; i >= 0; i--) {
      result = result.times(variable).plus(coefficients[i]);
    }
    return result;
  }

  private static UncertainValue vosShift(UncertainValue temperature, double[] coefficients) {
    return polynomial(temperature.minus(VOS_TEMPERATURE), coefficients).times(ANGSTROM_IN_NM);
  }

  private static UncertainValue raganPosition(UncertainValue temperature, double[] coefficients) {
    return polynomial(temperature, coefficients).reciprocal().times(NM_CM);
  }

  public static TemperatureCorrection fromName(String name) {
    List<String> names = new ArrayList<>();
    for (TemperatureCorrection correction : values()) {
      if (correction.name.equalsIgnoreCase(name)) {
        return correction;
      }
      names.add(correction.name);
    }
    throw new IllegalArgumentException(String.format(
        "Unknown correcting strategy '%s', expected one of %s", name, names));
  }
}
